package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.AnalysisResult;
import ai.ideaforge.sim.model.CategoryRecommendation;
import ai.ideaforge.sim.model.HealthReport;
import ai.ideaforge.sim.model.HealthStatus;
import ai.ideaforge.sim.model.IdeaComparison;
import ai.ideaforge.sim.model.Language;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AIAnalysisService} backed by a LangChain4j {@link ChatModel}.
 */
public class ChatModelAnalysisService implements AIAnalysisService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelAnalysisService.class);

    static final long DEGRADED_LATENCY_MS = 5_000;

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final AnalysisResultMapper mapper = new AnalysisResultMapper();
    private final IdeaComparator comparator = new IdeaComparator();

    public ChatModelAnalysisService(ChatModel model, String providerName, String modelName) {
        this(model, providerName, modelName, new ObjectMapper(), ForkJoinPool.commonPool());
    }

    ChatModelAnalysisService(ChatModel model, String providerName, String modelName, ObjectMapper objectMapper, Executor executor) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = Preconditions.requireText(providerName, "providerName");
        this.modelName = Preconditions.requireText(modelName, "modelName");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<ServiceResult<AnalysisResult>> analyzeIdea(String idea, Language language) {
        return guarded(() -> Preconditions.requireText(idea, "idea"), () ->
                call("analyzeIdea", Prompts.analyzeIdea(idea, language), mapper::toAnalysisResult));
    }

    @Override
    public CompletableFuture<ServiceResult<AnalysisResult>> analyzeHackathonProject(String projectName,
                                                                                    String description,
                                                                                    String toolUsage,
                                                                                    Language language) {
        return guarded(() -> {
            Preconditions.requireText(projectName, "projectName");
            Preconditions.requireText(description, "description");
        }, () -> call("analyzeHackathonProject",
                Prompts.analyzeHackathonProject(projectName, description, toolUsage, language),
                mapper::toAnalysisResult));
    }

    @Override
    public CompletableFuture<ServiceResult<List<String>>> getImprovementSuggestions(String idea, int currentScore, Language language) {
        return guarded(() -> {
            Preconditions.requireText(idea, "idea");
            Preconditions.requireScore(currentScore, "currentScore");
        }, () -> call("getImprovementSuggestions", Prompts.improvementSuggestions(idea, currentScore, language), node -> {
            List<String> suggestions = mapper.toSuggestions(node);
            if (suggestions.isEmpty()) {
                throw new PayloadFormatException("Reply contains no improvement suggestions");
            }
            return suggestions;
        }));
    }

    @Override
    public CompletableFuture<ServiceResult<IdeaComparison>> compareIdeas(String idea1, String idea2, Language language) {
        return guarded(() -> {
            Preconditions.requireText(idea1, "idea1");
            Preconditions.requireText(idea2, "idea2");
        }, () -> analyzeIdea(idea1, language).thenCombine(analyzeIdea(idea2, language), (first, second) -> {
            if (!first.success()) {
                return ServiceResult.<IdeaComparison>failure(first.error().orElseThrow());
            }
            if (!second.success()) {
                return ServiceResult.<IdeaComparison>failure(second.error().orElseThrow());
            }
            return ServiceResult.ok(comparator.compare(first.orElseThrow(), second.orElseThrow(), language));
        }));
    }

    @Override
    public CompletableFuture<ServiceResult<CategoryRecommendation>> recommendHackathonCategory(String projectName,
                                                                                               String description,
                                                                                               String toolUsage) {
        return guarded(() -> {
            Preconditions.requireText(projectName, "projectName");
            Preconditions.requireText(description, "description");
        }, () -> call("recommendHackathonCategory", Prompts.recommendCategory(projectName, description, toolUsage),
                mapper::toCategoryRecommendation));
    }

    @Override
    public CompletableFuture<ServiceResult<HealthReport>> healthCheck() {
        return CompletableFuture.supplyAsync(() -> {
            long started = System.nanoTime();
            HealthStatus status;
            try {
                model.chat(Prompts.HEALTH_PING);
                status = elapsedMillis(started) > DEGRADED_LATENCY_MS ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
            } catch (RuntimeException ex) {
                boolean transientFailure = ChatModelSupport.isCausedBy(ex, RateLimitException.class)
                        || ChatModelSupport.isCausedBy(ex, TimeoutException.class);
                status = transientFailure ? HealthStatus.DEGRADED : HealthStatus.UNHEALTHY;
                LOGGER.warn("Health check against {} model '{}' failed: {}", providerName, modelName, ex.getMessage());
            }
            return ServiceResult.ok(new HealthReport(status, elapsedMillis(started)));
        }, executor);
    }

    private static <T> CompletableFuture<ServiceResult<T>> guarded(Runnable check,
                                                                  Supplier<CompletableFuture<ServiceResult<T>>> call) {
        try {
            check.run();
        } catch (ValidationException ex) {
            return CompletableFuture.completedFuture(ServiceResult.failure(ex));
        }
        return call.get();
    }

    private <T> CompletableFuture<ServiceResult<T>> call(String operation, String prompt, Function<JsonNode, T> mapping) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String reply = model.chat(prompt);
                return ServiceResult.ok(mapping.apply(ChatModelSupport.readJson(objectMapper, reply)));
            } catch (RuntimeException ex) {
                ServiceException error = ChatModelSupport.translate(operation, providerName, modelName, ex);
                LOGGER.warn("{} via {} model '{}' failed with {}: {}", operation, providerName, modelName,
                        error.code(), error.getMessage());
                return ServiceResult.<T>failure(error);
            }
        }, executor);
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
