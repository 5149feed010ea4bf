package ai.ideaforge.sim.factory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.ideaforge.sim.config.AppEnvironment;
import ai.ideaforge.sim.config.Config;
import ai.ideaforge.sim.config.LlmProvider;
import ai.ideaforge.sim.config.LogFormat;
import ai.ideaforge.sim.config.MockServiceConfig;
import ai.ideaforge.sim.config.ModelConfig;
import ai.ideaforge.sim.config.Secrets;
import ai.ideaforge.sim.fixture.FixtureType;
import ai.ideaforge.sim.fixture.TestDataManager;
import ai.ideaforge.sim.mock.MockAIAnalysisService;
import ai.ideaforge.sim.mock.MockFrankensteinService;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.scenario.TestScenario;
import ai.ideaforge.sim.service.AIAnalysisService;
import ai.ideaforge.sim.service.ChatModelAnalysisService;
import ai.ideaforge.sim.service.ChatModelFrankensteinService;
import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ServiceFactoryTest {

    private final AtomicInteger modelsCreated = new AtomicInteger();

    @Test
    void mockModeHandsOutCachedMockServices() {
        ServiceFactory factory = new ServiceFactory(config(true), new TestDataManager(), this::stubModel);

        AIAnalysisService analysis = factory.createAIAnalysisService();

        assertThat(factory.isMockModeEnabled()).isTrue();
        assertThat(analysis).isInstanceOf(MockAIAnalysisService.class).isSameAs(factory.createAIAnalysisService());
        assertThat(((MockAIAnalysisService) analysis).activeScenario()).isEqualTo(TestScenario.RATE_LIMIT);
        assertThat(factory.createFrankensteinService()).isInstanceOf(MockFrankensteinService.class);
        assertThat(modelsCreated).hasValue(0);
        assertThat(factory.verifyMockConfiguration()).isEmpty();
    }

    @Test
    void productionModeSharesOneChatModel() {
        ServiceFactory factory = new ServiceFactory(config(false), new TestDataManager(), this::stubModel);

        assertThat(factory.createAIAnalysisService()).isInstanceOf(ChatModelAnalysisService.class);
        assertThat(factory.createFrankensteinService()).isInstanceOf(ChatModelFrankensteinService.class);
        assertThat(modelsCreated).hasValue(1);
    }

    @Test
    void refusesMockModeWhenFixturesAreBroken() {
        TestDataManager broken = new TestDataManager() {
            @Override
            public List<String> validate(FixtureType type, Language language) {
                return type == FixtureType.HACKATHON ? List.of("missing required key 'title'") : List.of();
            }
        };
        ServiceFactory factory = new ServiceFactory(config(true), broken, this::stubModel);

        assertThat(factory.verifyMockConfiguration()).containsExactly(
                "hackathon/en: missing required key 'title'",
                "hackathon/es: missing required key 'title'");
        assertThatThrownBy(factory::createAIAnalysisService)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fixture store is not usable");
    }

    @Test
    void chatModelFactoryRequiresGeminiKey() {
        ModelConfig gemini = new ModelConfig(LlmProvider.GEMINI, "models/gemini-1.5-flash-latest", Optional.empty());

        assertThatThrownBy(() -> new ChatModelFactory().create(gemini, Secrets.none()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void chatModelFactoryBuildsOllamaModel() {
        ModelConfig ollama = new ModelConfig(LlmProvider.OLLAMA, "llama3.1:8b", Optional.of("http://localhost:11434"));

        assertThat(new ChatModelFactory().create(ollama, Secrets.none())).isNotNull();
        assertThatThrownBy(() -> new ChatModelFactory().create(
                new ModelConfig(LlmProvider.OLLAMA, "llama3.1:8b", Optional.empty()), Secrets.none()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OLLAMA_BASE_URL");
    }

    private ChatModel stubModel() {
        modelsCreated.incrementAndGet();
        return new ChatModel() {
            @Override
            public String chat(String prompt) {
                return "OK";
            }
        };
    }

    private static Config config(boolean mockMode) {
        return new Config(mockMode, AppEnvironment.TEST, MockServiceConfig.defaults().withScenario(TestScenario.RATE_LIMIT),
                LogFormat.TEXT, new ModelConfig(LlmProvider.OLLAMA, "llama3.1:8b", Optional.of("http://localhost:11434")),
                Secrets.none());
    }
}
