package io.github.hide212131.langchain4j.formagent.runtime.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.github.hide212131.langchain4j.formagent.runtime.agent.BackendFailureException;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskInput;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskOutput;
import io.github.hide212131.langchain4j.formagent.runtime.config.LlmConfiguration;
import io.github.hide212131.langchain4j.formagent.runtime.config.LlmProvider;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LangChain4jExecutionBackendTest {

    @Test
    @DisplayName("指示文と入力を 1 つのプロンプトにまとめて ChatModel に渡し、トークン使用量をメタデータに載せる")
    void delegatesToChatModelAndReportsTokens() {
        RecordingChatModel chatModel = new RecordingChatModel();
        CapturingFactory factory = new CapturingFactory(chatModel);
        LlmConfiguration config = new LlmConfiguration(LlmProvider.OPENAI, "test-key", null, "gpt-4o-mini",
                Duration.ofSeconds(30));

        LangChain4jExecutionBackend backend = LangChain4jExecutionBackend.create(config, factory);
        TaskOutput output = backend.run("You are helpful.", TaskInput.of("Make a survey"));

        assertThat(factory.lastConfig).isSameAs(config);
        assertThat(chatModel.lastPrompt).isEqualTo("You are helpful.\n\nUser: Make a survey\n\nAssistant:");
        assertThat(output.text()).isEqualTo("assistant response");
        assertThat(output.rawBackendResponse()).isInstanceOf(ChatResponse.class);
        assertThat(output.metadata())
                .containsEntry("model", "gpt-4o-mini")
                .containsEntry(TaskOutput.TOKENS, Map.of("input", 1, "output", 2));
    }

    @Test
    @DisplayName("ChatModel の例外は BackendFailureException に包んで原因を保持する")
    void wrapsModelFailures() {
        IllegalStateException cause = new IllegalStateException("rate limited");
        LangChain4jExecutionBackend backend = LangChain4jExecutionBackend.usingChatModel(new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest request) {
                throw cause;
            }
        });

        assertThatThrownBy(() -> backend.run("i", TaskInput.of("t")))
                .isInstanceOf(BackendFailureException.class)
                .hasMessage("LLM backend error: rate limited")
                .hasCauseReference(cause);
    }

    @Test
    @DisplayName("mock プロバイダではファクトリを使わずフェイクモデルを返す")
    void mockProviderUsesFakeModel() {
        CapturingFactory factory = new CapturingFactory(new RecordingChatModel());

        LangChain4jExecutionBackend backend = LangChain4jExecutionBackend.create(LlmConfiguration.mock(), factory);

        assertThat(factory.lastConfig).isNull();
        assertThat(backend.modelName()).isEqualTo("mock");
        assertThat(backend.run("plain", TaskInput.of("hi")).text()).isEqualTo("dry-run-response");
    }

    @Test
    @DisplayName("フェイクモデルはフォーム生成プロンプトにサンプル定義を返す")
    void fakeModelAnswersFormPrompts() {
        TaskOutput output = LangChain4jExecutionBackend.fake()
                .run("# Form Generator Agent\nReturn JSON.", TaskInput.of("family form"));

        assertThat(output.text()).startsWith("```json").contains("\"formId\": \"personal-info-family-form\"");
    }

    private static final class RecordingChatModel implements ChatModel {
        String lastPrompt;

        @Override
        public ChatResponse doChat(ChatRequest request) {
            List<ChatMessage> messages = request.messages();
            if (!messages.isEmpty() && messages.get(0) instanceof UserMessage userMessage) {
                lastPrompt = userMessage.singleText();
            }
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from("assistant response"))
                    .tokenUsage(new TokenUsage(1, 2, 3))
                    .build();
        }
    }

    private static final class CapturingFactory implements LangChain4jExecutionBackend.ChatModelFactory {
        final ChatModel delegate;
        LlmConfiguration lastConfig;

        CapturingFactory(ChatModel delegate) {
            this.delegate = delegate;
        }

        @Override
        public ChatModel create(LlmConfiguration configuration) {
            this.lastConfig = configuration;
            return delegate;
        }
    }
}
