package ai.ideaforge.sim.factory;

import ai.ideaforge.sim.config.Config;
import ai.ideaforge.sim.config.ModelConfig;
import ai.ideaforge.sim.fixture.FixtureType;
import ai.ideaforge.sim.fixture.TestDataManager;
import ai.ideaforge.sim.mock.MockAIAnalysisService;
import ai.ideaforge.sim.mock.MockFrankensteinService;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.service.AIAnalysisService;
import ai.ideaforge.sim.service.ChatModelAnalysisService;
import ai.ideaforge.sim.service.ChatModelFrankensteinService;
import ai.ideaforge.sim.service.FrankensteinService;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out the analysis and Frankenstein services for the configured mode, so callers never know
 * whether they talk to a model or to fixtures. Each service is created once and then reused.
 */
public class ServiceFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceFactory.class);

    enum ServiceMode {
        MOCK,
        PRODUCTION
    }

    private final Config config;
    private final TestDataManager dataManager;
    private final Supplier<ChatModel> chatModelSupplier;

    private ChatModel chatModel;
    private AIAnalysisService analysisService;
    private FrankensteinService frankensteinService;

    public ServiceFactory(Config config) {
        this(config, new TestDataManager(), () -> new ChatModelFactory().create(config.modelConfig(), config.secrets()));
    }

    public ServiceFactory(Config config, TestDataManager dataManager, Supplier<ChatModel> chatModelSupplier) {
        this.config = Objects.requireNonNull(config, "config");
        this.dataManager = Objects.requireNonNull(dataManager, "dataManager");
        this.chatModelSupplier = Objects.requireNonNull(chatModelSupplier, "chatModelSupplier");
    }

    public boolean isMockModeEnabled() {
        return config.mockMode();
    }

    public TestDataManager dataManager() {
        return dataManager;
    }

    public synchronized AIAnalysisService createAIAnalysisService() {
        if (analysisService == null) {
            analysisService = switch (mode()) {
                case MOCK -> {
                    requireMockReady();
                    LOGGER.info("Using mock analysis service (scenario={})", config.mockServiceConfig().defaultScenario());
                    yield new MockAIAnalysisService(dataManager, config.mockServiceConfig());
                }
                case PRODUCTION -> {
                    ModelConfig modelConfig = config.modelConfig();
                    yield new ChatModelAnalysisService(chatModel(), modelConfig.provider().name(), modelConfig.modelName());
                }
            };
        }
        return analysisService;
    }

    public synchronized FrankensteinService createFrankensteinService() {
        if (frankensteinService == null) {
            frankensteinService = switch (mode()) {
                case MOCK -> {
                    requireMockReady();
                    LOGGER.info("Using mock Frankenstein service (scenario={})", config.mockServiceConfig().defaultScenario());
                    yield new MockFrankensteinService(dataManager, config.mockServiceConfig());
                }
                case PRODUCTION -> {
                    ModelConfig modelConfig = config.modelConfig();
                    yield new ChatModelFrankensteinService(chatModel(), modelConfig.provider().name(), modelConfig.modelName());
                }
            };
        }
        return frankensteinService;
    }

    /**
     * Checks that every bundled fixture loads and validates. Returns one line per problem, empty when mock mode is usable.
     */
    public List<String> verifyMockConfiguration() {
        List<String> problems = new ArrayList<>();
        for (FixtureType type : FixtureType.values()) {
            for (Language language : Language.values()) {
                dataManager.validate(type, language)
                        .forEach(problem -> problems.add(type + "/" + language.code() + ": " + problem));
            }
        }
        return problems;
    }

    private ServiceMode mode() {
        return config.mockMode() ? ServiceMode.MOCK : ServiceMode.PRODUCTION;
    }

    private void requireMockReady() {
        List<String> problems = verifyMockConfiguration();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Mock mode is enabled but the fixture store is not usable: "
                    + String.join("; ", problems));
        }
    }

    private ChatModel chatModel() {
        if (chatModel == null) {
            chatModel = chatModelSupplier.get();
        }
        return chatModel;
    }
}
