package io.github.hide212131.langchain4j.formagent.runtime.generation;

import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskDefinition;
import io.github.hide212131.langchain4j.formagent.runtime.provisioning.ResourceConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** Task definition of the agent that turns a free-text description into a form definition. */
public final class FormGeneratorAgent {

    static final String PROMPT_RESOURCE = "/prompts/form-generator.md";

    /** cpu 1, 2 GB memory, 2 GB disk, stops itself after 15 minutes. */
    public static final ResourceConfig RESOURCE_CONFIG = new ResourceConfig(1, 2, 2, 15, null);

    private static final TaskDefinition DEFINITION = TaskDefinition.withResource(loadInstructions(),
            RESOURCE_CONFIG);

    private FormGeneratorAgent() {
    }

    public static TaskDefinition definition() {
        return DEFINITION;
    }

    private static String loadInstructions() {
        try (InputStream input = FormGeneratorAgent.class.getResourceAsStream(PROMPT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("プロンプトリソースが見つかりません: " + PROMPT_RESOURCE);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("プロンプトリソースを読み取れませんでした: " + PROMPT_RESOURCE, ex);
        }
    }
}
