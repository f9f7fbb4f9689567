package io.github.hide212131.langchain4j.formagent.runtime.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックして値を解決する。
 */
public final class EnvironmentResolver {

    private final Map<String, String> environment;
    private final Map<String, String> dotenvEntries;

    public EnvironmentResolver(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        Objects.requireNonNull(dotenv, "dotenv");
        // only keys declared in the file; Dotenv#get would also consult the process environment
        Map<String, String> entries = new HashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            entries.put(entry.getKey(), entry.getValue());
        }
        this.dotenvEntries = Map.copyOf(entries);
    }

    public static EnvironmentResolver system() {
        return new EnvironmentResolver(System.getenv(), loadDotenvWithFallback());
    }

    /** Resolver backed by {@code environment} only. */
    public static EnvironmentResolver of(Map<String, String> environment) {
        return new EnvironmentResolver(environment, Map.of());
    }

    private EnvironmentResolver(Map<String, String> environment, Map<String, String> dotenvEntries) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenvEntries = dotenvEntries;
    }

    /** @return the trimmed value, or {@code null} when unset or blank */
    public String get(String key) {
        String raw = environment.containsKey(key) ? environment.get(key) : dotenvEntries.get(key);
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getOrDefault(String key, String defaultValue) {
        String value = get(key);
        return value == null ? defaultValue : value;
    }

    private static Dotenv loadDotenvWithFallback() {
        Path cwd = Path.of("").toAbsolutePath();
        if (Files.exists(cwd.resolve(".env"))) {
            return Dotenv.configure().directory(cwd.toString()).ignoreIfMalformed().ignoreIfMissing().load();
        }
        Path parent = cwd.getParent();
        if (parent != null && Files.exists(parent.resolve(".env"))) {
            return Dotenv.configure().directory(parent.toString()).ignoreIfMalformed().ignoreIfMissing().load();
        }
        return Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load();
    }
}
