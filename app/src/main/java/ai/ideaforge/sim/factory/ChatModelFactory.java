package ai.ideaforge.sim.factory;

import ai.ideaforge.sim.config.ModelConfig;
import ai.ideaforge.sim.config.Secrets;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the chat model the production services talk to.
 */
public class ChatModelFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelFactory.class);
    private static final Duration TIMEOUT = Duration.ofMinutes(2);

    public ChatModel create(ModelConfig modelConfig, Secrets secrets) {
        return switch (modelConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(modelConfig);
            case GEMINI -> createGeminiChatModel(modelConfig, secrets);
        };
    }

    private ChatModel createOllamaChatModel(ModelConfig modelConfig) {
        String baseUrl = modelConfig.baseUrl()
                .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
        try {
            LOGGER.info("Using Ollama model '{}' via {}", modelConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(modelConfig.modelName())
                    .temperature(0.4)
                    .timeout(TIMEOUT)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(ModelConfig modelConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", modelConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelConfig.modelName())
                    .temperature(0.4)
                    .timeout(TIMEOUT)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
