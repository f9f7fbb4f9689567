package io.github.hide212131.langchain4j.formagent.runtime.observability;

import io.github.hide212131.langchain4j.formagent.runtime.agent.ObservabilitySink;
import java.util.Optional;

/** 設定に応じて実行記録の送信先を作成する。NONE のときはシンクなし。 */
public final class ObservabilitySinkFactory {

    private ObservabilitySinkFactory() {
    }

    public static Optional<ObservabilitySink> create(ObservabilityConfiguration configuration) {
        if (configuration == null) {
            return Optional.empty();
        }
        if (configuration.otlpEnabled()) {
            return Optional.of(new OtlpObservabilitySink(configuration.otlpEndpoint(), configuration.otlpHeaders()));
        }
        if (configuration.exporter() == ExporterType.LOG) {
            return Optional.of(new LoggingObservabilitySink());
        }
        return Optional.empty();
    }
}
