package io.github.hide212131.langchain4j.formagent.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import io.github.hide212131.langchain4j.formagent.runtime.agent.BackendFailureException;
import io.github.hide212131.langchain4j.formagent.runtime.agent.ExecutionBackend;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskInput;
import io.github.hide212131.langchain4j.formagent.runtime.agent.TaskOutput;
import io.github.hide212131.langchain4j.formagent.runtime.config.LlmConfiguration;
import io.github.hide212131.langchain4j.formagent.runtime.config.LlmProvider;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ExecutionBackend} backed by a LangChain4j {@link ChatModel}. Instructions and user text are sent as a
 * single prompt; token usage, when reported, lands in the output metadata under {@link TaskOutput#TOKENS}.
 */
public final class LangChain4jExecutionBackend implements ExecutionBackend {

    private final ChatModel chatModel;
    private final String modelName;

    LangChain4jExecutionBackend(ChatModel chatModel, String modelName) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.modelName = modelName;
    }

    public static LangChain4jExecutionBackend create(LlmConfiguration configuration) {
        return create(configuration, new OpenAiChatModelFactory());
    }

    static LangChain4jExecutionBackend create(LlmConfiguration configuration, ChatModelFactory factory) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.provider() == LlmProvider.MOCK) {
            return fake();
        }
        return new LangChain4jExecutionBackend(factory.create(configuration), configuration.openAiModel());
    }

    public static LangChain4jExecutionBackend usingChatModel(ChatModel chatModel) {
        return new LangChain4jExecutionBackend(chatModel, null);
    }

    public static LangChain4jExecutionBackend fake() {
        return new LangChain4jExecutionBackend(new FakeChatModel(), "mock");
    }

    @Override
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    public TaskOutput run(String instructions, TaskInput input) {
        Objects.requireNonNull(instructions, "instructions");
        Objects.requireNonNull(input, "input");
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(UserMessage.from(prompt(instructions, input))))
                .build();
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException ex) {
            throw new BackendFailureException("LLM backend error: " + ex.getMessage(), ex);
        }
        AiMessage aiMessage = response.aiMessage();
        String text = aiMessage != null && aiMessage.text() != null ? aiMessage.text() : "";
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (modelName != null) {
            metadata.put("model", modelName);
        }
        Map<String, Object> tokens = tokens(response.tokenUsage());
        if (!tokens.isEmpty()) {
            metadata.put(TaskOutput.TOKENS, tokens);
        }
        return new TaskOutput(text, response, metadata);
    }

    public String modelName() {
        return modelName;
    }

    static String prompt(String instructions, TaskInput input) {
        return instructions + "\n\nUser: " + input.text() + "\n\nAssistant:";
    }

    private static Map<String, Object> tokens(TokenUsage usage) {
        Map<String, Object> tokens = new LinkedHashMap<>();
        if (usage == null) {
            return tokens;
        }
        if (usage.inputTokenCount() != null) {
            tokens.put("input", usage.inputTokenCount());
        }
        if (usage.outputTokenCount() != null) {
            tokens.put("output", usage.outputTokenCount());
        }
        return tokens;
    }

    interface ChatModelFactory {
        ChatModel create(LlmConfiguration configuration);
    }

    private static final class OpenAiChatModelFactory implements ChatModelFactory {

        @Override
        public ChatModel create(LlmConfiguration configuration) {
            var builder = OpenAiChatModel.builder()
                    .apiKey(configuration.openAiApiKey())
                    .modelName(configuration.openAiModel())
                    .timeout(configuration.timeout());
            if (configuration.openAiBaseUrl() != null) {
                builder.baseUrl(configuration.openAiBaseUrl());
            }
            return builder.build();
        }
    }

    /** Offline model: answers form-generation prompts with a fixed definition wrapped in a markdown fence. */
    private static final class FakeChatModel implements ChatModel {

        private static final String SAMPLE_FORM = """
                ```json
                {
                  "formId": "personal-info-family-form",
                  "title": "Personal Information and Family Members",
                  "fields": [
                    {"id": "name", "type": "text", "label": "Full Name", "required": true, "order": 1},
                    {"id": "email", "type": "text", "label": "Email Address", "required": true, "order": 2},
                    {"id": "birthdate", "type": "date", "label": "Date of Birth", "required": true, "order": 3},
                    {"id": "familyMembers", "type": "dynamic", "label": "Family Members", "required": false,
                     "order": 4, "fields": [
                       {"id": "familyMemberName", "type": "text", "label": "Family Member Name", "required": true},
                       {"id": "familyMemberEmail", "type": "text", "label": "Family Member Email", "required": true}
                     ]}
                  ]
                }
                ```""";

        @Override
        public ChatResponse doChat(ChatRequest request) {
            boolean formPrompt = request.messages().stream()
                    .anyMatch(message -> message instanceof UserMessage user && user.hasSingleText()
                            && user.singleText().contains("Form Generator"));
            String reply = formPrompt ? SAMPLE_FORM : "dry-run-response";
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from(reply))
                    .tokenUsage(new TokenUsage(0, 0, 0))
                    .build();
        }
    }
}
