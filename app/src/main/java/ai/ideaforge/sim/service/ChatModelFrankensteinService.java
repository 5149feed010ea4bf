package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.FrankensteinElement;
import ai.ideaforge.sim.model.FrankensteinIdea;
import ai.ideaforge.sim.model.FrankensteinMode;
import ai.ideaforge.sim.model.Language;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FrankensteinService} backed by a LangChain4j {@link ChatModel}.
 */
public class ChatModelFrankensteinService implements FrankensteinService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelFrankensteinService.class);
    private static final String OPERATION = "generateIdea";

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final FrankensteinIdeaMapper mapper = new FrankensteinIdeaMapper();

    public ChatModelFrankensteinService(ChatModel model, String providerName, String modelName) {
        this(model, providerName, modelName, new ObjectMapper(), ForkJoinPool.commonPool());
    }

    ChatModelFrankensteinService(ChatModel model, String providerName, String modelName, ObjectMapper objectMapper,
                                 Executor executor) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = Preconditions.requireText(providerName, "providerName");
        this.modelName = Preconditions.requireText(modelName, "modelName");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<ServiceResult<FrankensteinIdea>> generateIdea(List<FrankensteinElement> elements,
                                                                          FrankensteinMode mode,
                                                                          Language language) {
        List<FrankensteinElement> checked = Preconditions.requireElements(elements);
        FrankensteinMode effectiveMode = mode == null ? FrankensteinMode.COMPANIES : mode;
        Language effectiveLanguage = language == null ? Language.EN : language;
        String prompt = Prompts.frankenstein(checked, effectiveMode, effectiveLanguage);
        return CompletableFuture.supplyAsync(() -> {
            try {
                String reply = model.chat(prompt);
                return ServiceResult.ok(mapper.toIdea(ChatModelSupport.readJson(objectMapper, reply), effectiveLanguage));
            } catch (RuntimeException ex) {
                ServiceException error = ChatModelSupport.translate(OPERATION, providerName, modelName, ex);
                LOGGER.warn("{} via {} model '{}' failed with {}: {}", OPERATION, providerName, modelName,
                        error.code(), error.getMessage());
                return ServiceResult.<FrankensteinIdea>failure(error);
            }
        }, executor);
    }
}
