package io.github.hide212131.langchain4j.formagent.runtime.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.formagent.runtime.config.ConfigurationException;
import io.github.hide212131.langchain4j.formagent.runtime.config.EnvironmentResolver;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ObservabilityConfigurationLoaderTest {

    @Test
    @DisplayName("未設定なら exporter=none でシンクは作られない")
    void disabledByDefault() {
        ObservabilityConfiguration config = new ObservabilityConfigurationLoader(EnvironmentResolver.of(Map.of()))
                .load(null, null, null);

        assertThat(config.exporter()).isEqualTo(ExporterType.NONE);
        assertThat(config.otlpEnabled()).isFalse();
        assertThat(ObservabilitySinkFactory.create(config)).isEmpty();
    }

    @Test
    @DisplayName("CLI 指定のエンドポイントとヘッダは環境変数より優先される")
    void cliOverridesEnvironment() {
        EnvironmentResolver env = EnvironmentResolver.of(Map.of(
                ObservabilityConfigurationLoader.ENV_EXPORTER, "otlp",
                ObservabilityConfigurationLoader.ENV_OTLP_ENDPOINT, "http://env:4318",
                ObservabilityConfigurationLoader.ENV_OTLP_HEADERS, "x-env=1"));

        ObservabilityConfiguration config = new ObservabilityConfigurationLoader(env)
                .load(null, "http://cli:4318", "x-cli=2, x-other = 3");

        assertThat(config.otlpEnabled()).isTrue();
        assertThat(config.otlpEndpoint()).isEqualTo("http://cli:4318");
        assertThat(config.otlpHeaders()).containsOnly(Map.entry("x-cli", "2"), Map.entry("x-other", "3"));
    }

    @Test
    @DisplayName("OTLP でもエンドポイントが無ければ無効")
    void otlpWithoutEndpointIsDisabled() {
        ObservabilityConfiguration config = new ObservabilityConfigurationLoader(EnvironmentResolver.of(Map.of()))
                .load(ExporterType.OTLP, null, null);

        assertThat(config.otlpEnabled()).isFalse();
    }

    @Test
    @DisplayName("Langfuse エンドポイントでは公開鍵/秘密鍵から Basic 認証ヘッダを補う")
    void derivesLangfuseAuthorization() {
        EnvironmentResolver env = EnvironmentResolver.of(Map.of(
                ObservabilityConfigurationLoader.ENV_LANGFUSE_PUBLIC_KEY, "pk-lf",
                ObservabilityConfigurationLoader.ENV_LANGFUSE_SECRET_KEY, "sk-lf"));

        ObservabilityConfiguration config = new ObservabilityConfigurationLoader(env)
                .load(ExporterType.OTLP, "http://localhost:3000/api/public/otel", null);

        String expected = "Basic " + Base64.getEncoder().encodeToString("pk-lf:sk-lf".getBytes(StandardCharsets.UTF_8));
        assertThat(config.otlpHeaders()).containsEntry("Authorization", expected);
    }

    @Test
    @DisplayName("明示した Authorization ヘッダは上書きしない")
    void keepsExplicitAuthorization() {
        EnvironmentResolver env = EnvironmentResolver.of(Map.of(
                ObservabilityConfigurationLoader.ENV_LANGFUSE_PUBLIC_KEY, "pk-lf",
                ObservabilityConfigurationLoader.ENV_LANGFUSE_SECRET_KEY, "sk-lf"));

        ObservabilityConfiguration config = new ObservabilityConfigurationLoader(env)
                .load(ExporterType.OTLP, "http://localhost:3000/api/public/otel", "authorization=Bearer abc");

        assertThat(config.otlpHeaders()).containsOnly(Map.entry("authorization", "Bearer abc"));
    }

    @Test
    @DisplayName("exporter=log ではログ出力シンクを作る")
    void logExporterCreatesLoggingSink() {
        ObservabilityConfiguration config = new ObservabilityConfigurationLoader(EnvironmentResolver.of(Map.of()))
                .load(ExporterType.LOG, null, null);

        assertThat(ObservabilitySinkFactory.create(config)).get().isInstanceOf(LoggingObservabilitySink.class);
    }

    @Test
    @DisplayName("不正な EXPORTER は ConfigurationException")
    void invalidExporterIsRejected() {
        EnvironmentResolver env = EnvironmentResolver.of(Map.of(ObservabilityConfigurationLoader.ENV_EXPORTER, "zipkin"));

        assertThatThrownBy(() -> new ObservabilityConfigurationLoader(env).load(null, null, null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("zipkin");
    }

    @Test
    @DisplayName("ヘッダ文字列の不完全なペアは無視する")
    void parseHeadersSkipsMalformedPairs() {
        assertThat(ObservabilityConfigurationLoader.parseHeaders("a=1,broken,=x,b=2=3"))
                .containsOnly(Map.entry("a", "1"), Map.entry("b", "2=3"));
        assertThat(ObservabilityConfigurationLoader.parseHeaders(null)).isEmpty();
    }
}
