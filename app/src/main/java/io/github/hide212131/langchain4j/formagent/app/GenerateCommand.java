package io.github.hide212131.langchain4j.formagent.app;

import io.github.hide212131.langchain4j.formagent.infra.logging.RunLogger;
import io.github.hide212131.langchain4j.formagent.runtime.agent.AgentDependencies;
import io.github.hide212131.langchain4j.formagent.runtime.agent.AgentRunException;
import io.github.hide212131.langchain4j.formagent.runtime.agent.AgentRunner;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ObservabilitySink;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ResourceProvisioner;
import io.github.hide212131.langchain4j.formagent.runtime.config.ConfigurationException;
import io.github.hide212131.langchain4j.formagent.runtime.config.EnvironmentResolver;
import io.github.hide212131.langchain4j.formagent.runtime.config.LlmConfiguration;
import io.github.hide212131.langchain4j.formagent.runtime.config.LlmConfigurationLoader;
import io.github.hide212131.langchain4j.formagent.runtime.config.LlmProvider;
import io.github.hide212131.langchain4j.formagent.runtime.config.ProvisionerConfiguration;
import io.github.hide212131.langchain4j.formagent.runtime.config.ProvisionerType;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormSchemaException;
import io.github.hide212131.langchain4j.formagent.runtime.form.FormSchemaParser;
import io.github.hide212131.langchain4j.formagent.runtime.generation.FormGenerationService;
import io.github.hide212131.langchain4j.formagent.runtime.generation.GeneratedForm;
import io.github.hide212131.langchain4j.formagent.runtime.observability.ExporterType;
import io.github.hide212131.langchain4j.formagent.runtime.observability.ObservabilityConfiguration;
import io.github.hide212131.langchain4j.formagent.runtime.observability.ObservabilityConfigurationLoader;
import io.github.hide212131.langchain4j.formagent.runtime.observability.ObservabilitySinkFactory;
import io.github.hide212131.langchain4j.formagent.runtime.provider.LangChain4jExecutionBackend;
import io.github.hide212131.langchain4j.formagent.runtime.provisioning.DockerResourceProvisioner;
import io.github.hide212131.langchain4j.formagent.runtime.provisioning.LocalResourceProvisioner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * フォーム生成コマンド (generate).
 */
@Command(name = "generate", description = "説明文からフォーム定義を生成します。", mixinStandardHelpOptions = true)
@SuppressWarnings({ "PMD.ExcessiveImports", "checkstyle:LineLength" })
final class GenerateCommand implements Callable<Integer> {

    private static final RunLogger LOGGER = new RunLogger(GenerateCommand.class);

    @Spec
    private CommandSpec spec;

    // CHECKSTYLE:OFF: LineLength
    @Option(names = "--description", required = true, paramLabel = "TEXT", description = "生成したいフォームの説明")
    private String description;

    @Option(names = "--output", paramLabel = "FILE", description = "生成したフォーム定義の保存先（未指定時は標準出力）")
    private Path output;

    @Option(names = "--llm-provider", paramLabel = "PROVIDER", description = "LLM プロバイダ (mock|openai)。未指定時は環境変数/ .env を参照します。", converter = LlmProviderConverter.class)
    private LlmProvider llmProvider;

    @Option(names = "--provisioner", paramLabel = "TYPE", description = "リソースプロビジョナ (none|local|docker)。未指定時は RESOURCE_PROVISIONER を参照します。", converter = ProvisionerTypeConverter.class)
    private ProvisionerType provisionerType;

    @Option(names = "--exporter", paramLabel = "TYPE", description = "実行記録エクスポーター (none|otlp|log)", converter = ExporterTypeConverter.class)
    private ExporterType exporter;

    @Option(names = "--otlp-endpoint", paramLabel = "URL", description = "OTLP エンドポイント（未指定時は OTEL_EXPORTER_OTLP_ENDPOINT）")
    private String otlpEndpoint;

    @Option(names = "--otlp-headers", paramLabel = "KEY=VAL,...", description = "OTLP 追加ヘッダ（未指定時は OTEL_EXPORTER_OTLP_HEADERS）")
    private String otlpHeaders;
    // CHECKSTYLE:ON

    private final EnvironmentResolver environment;

    GenerateCommand(EnvironmentResolver environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    public Integer call() {
        LlmConfiguration llm;
        ProvisionerConfiguration provisioning;
        ObservabilityConfiguration observability;
        try {
            llm = new LlmConfigurationLoader(environment).load(llmProvider);
            provisioning = ProvisionerConfiguration.load(environment, provisionerType);
            observability = new ObservabilityConfigurationLoader(environment).load(exporter, otlpEndpoint, otlpHeaders);
        } catch (ConfigurationException ex) {
            return fail(ExitCodes.CONFIGURATION_ERROR, "設定エラー: " + ex.getMessage());
        }

        Optional<ObservabilitySink> sink = ObservabilitySinkFactory.create(observability);
        try {
            AgentRunner runner = new AgentRunner(new AgentDependencies(LangChain4jExecutionBackend.create(llm),
                    provisionerFor(provisioning), sink));
            FormSchemaParser parser = new FormSchemaParser();
            GeneratedForm generated = new FormGenerationService(runner, parser).generate(description);
            String json = parser.toJson(generated.form());
            if (output != null) {
                writeOutput(json);
                spec.commandLine().getOut().println("フォーム定義を保存しました: " + output);
            } else {
                spec.commandLine().getOut().println(json);
            }
            spec.commandLine().getOut().flush();
            return CommandLine.ExitCode.OK;
        } catch (FormSchemaException ex) {
            return fail(ExitCodes.SCHEMA_ERROR, "エージェントの応答からフォーム定義を解釈できません: " + ex.getMessage());
        } catch (AgentRunException ex) {
            return fail(ExitCodes.RUN_FAILED, "エージェント実行が失敗しました: " + ex.getMessage());
        } catch (IllegalArgumentException ex) {
            return fail(CommandLine.ExitCode.USAGE, ex.getMessage());
        } catch (RuntimeException ex) {
            return fail(ExitCodes.RUN_FAILED, "エージェント実行が失敗しました: " + ex.getMessage());
        } finally {
            sink.ifPresent(GenerateCommand::closeQuietly);
        }
    }

    static Optional<ResourceProvisioner> provisionerFor(ProvisionerConfiguration configuration) {
        return switch (configuration.type()) {
        case NONE -> Optional.empty();
        case LOCAL -> Optional.of(new LocalResourceProvisioner());
        case DOCKER -> Optional.of(new DockerResourceProvisioner(configuration.dockerImage()));
        };
    }

    private void writeOutput(String json) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("フォーム定義を書き込めませんでした: " + output, ex);
        }
    }

    private int fail(int exitCode, String message) {
        spec.commandLine().getErr().println(message);
        spec.commandLine().getErr().flush();
        return exitCode;
    }

    private static void closeQuietly(ObservabilitySink sink) {
        if (sink instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception ex) {
                LOGGER.warn(null, "secondary", "observability.close", "実行記録エクスポーターの終了に失敗しました", ex);
            }
        }
    }

    static final class LlmProviderConverter implements ITypeConverter<LlmProvider> {

        @Override
        public LlmProvider convert(String value) {
            return LlmProvider.from(value);
        }
    }

    static final class ProvisionerTypeConverter implements ITypeConverter<ProvisionerType> {

        @Override
        public ProvisionerType convert(String value) {
            return ProvisionerType.parse(value);
        }
    }

    static final class ExporterTypeConverter implements ITypeConverter<ExporterType> {

        @Override
        public ExporterType convert(String value) {
            return ExporterType.parse(value);
        }
    }
}
