package ai.ideaforge.sim.mock;

import ai.ideaforge.sim.config.MockServiceConfig;
import ai.ideaforge.sim.fixture.CustomizationContext;
import ai.ideaforge.sim.fixture.Fixture;
import ai.ideaforge.sim.fixture.FixtureType;
import ai.ideaforge.sim.fixture.TestDataManager;
import ai.ideaforge.sim.model.FrankensteinElement;
import ai.ideaforge.sim.model.FrankensteinIdea;
import ai.ideaforge.sim.model.FrankensteinMode;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.scenario.TestScenario;
import ai.ideaforge.sim.service.FrankensteinIdeaMapper;
import ai.ideaforge.sim.service.FrankensteinService;
import ai.ideaforge.sim.service.Preconditions;
import ai.ideaforge.sim.service.ServiceResult;
import ai.ideaforge.sim.service.ValidationException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Fixture-backed stand-in for the Frankenstein idea generator.
 */
public class MockFrankensteinService extends AbstractMockService implements FrankensteinService {

    static final String OPERATION = "generateIdea";

    private final FrankensteinIdeaMapper mapper = new FrankensteinIdeaMapper();

    public MockFrankensteinService(TestDataManager dataManager, MockServiceConfig config) {
        this(dataManager, new MockCallPipeline(config), Optional.empty());
    }

    MockFrankensteinService(TestDataManager dataManager, MockCallPipeline pipeline, Optional<TestScenario> scenarioOverride) {
        super(dataManager, pipeline, scenarioOverride);
    }

    public MockFrankensteinService withScenario(TestScenario scenario) {
        return new MockFrankensteinService(dataManager, pipeline, Optional.of(scenario));
    }

    /**
     * @throws ValidationException when fewer than two elements are given; raised before any latency is simulated
     */
    @Override
    public CompletableFuture<ServiceResult<FrankensteinIdea>> generateIdea(List<FrankensteinElement> elements,
                                                                          FrankensteinMode mode,
                                                                          Language language) {
        TestScenario scenario = activeScenario();
        List<FrankensteinElement> checked;
        try {
            checked = Preconditions.requireElements(elements);
        } catch (ValidationException ex) {
            pipeline.recordRejected(OPERATION, scenario, ex);
            throw ex;
        }
        Language effectiveLanguage = languageOrDefault(language);
        FrankensteinMode effectiveMode = mode == null ? FrankensteinMode.COMPANIES : mode;
        return pipeline.execute(OPERATION, scenario, () -> {
            Fixture base = dataManager.getFixture(FixtureType.FRANKENSTEIN, effectiveLanguage);
            Fixture customized = dataManager.customizeFrankensteinResponse(base,
                    CustomizationContext.forElements(checked, effectiveMode, variability()));
            return respond(customized, scenario, node -> mapper.toIdea(node, effectiveLanguage));
        });
    }
}
