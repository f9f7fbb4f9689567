package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.util.regex.Pattern;

/** Pulls the JSON object out of a model reply that may wrap it in a markdown fence or prose. */
public final class AgentResponseJsonExtractor {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");

    private AgentResponseJsonExtractor() {
        throw new AssertionError("インスタンス化できません");
    }

    public static String extract(String responseText) {
        if (responseText == null) {
            throw new FormSchemaException("No valid JSON object found in response");
        }
        String cleaned = FENCED_BLOCK.matcher(responseText.trim()).replaceFirst("$1");
        int first = cleaned.indexOf('{');
        int last = cleaned.lastIndexOf('}');
        if (first == -1 || last == -1 || last <= first) {
            throw new FormSchemaException("No valid JSON object found in response");
        }
        return cleaned.substring(first, last + 1);
    }
}
