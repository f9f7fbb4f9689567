package io.github.hide212131.langchain4j.formagent.runtime.form;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;

/** フォーム定義ファイル（JSON または YAML）を読み込む。 */
public final class FormDefinitionLoader {

    private final FormSchemaParser parser;
    private final Yaml yaml = new Yaml();

    public FormDefinitionLoader(FormSchemaParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public FormDefinition load(Path path) {
        Objects.requireNonNull(path, "path");
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("フォーム定義を読み取れませんでした: " + path, ex);
        }
        if (isYaml(path)) {
            return parser.parse(loadYaml(path, content));
        }
        return parser.parse(content);
    }

    private Map<String, Object> loadYaml(Path path, String content) {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (RuntimeException ex) {
            throw new FormSchemaException("フォーム定義を YAML として解釈できません: " + path, ex);
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new FormSchemaException("Invalid form data structure: " + path);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> typed = (Map<String, Object>) map;
        return typed;
    }

    private static boolean isYaml(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
