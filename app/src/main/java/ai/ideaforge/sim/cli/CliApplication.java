package ai.ideaforge.sim.cli;

import ai.ideaforge.sim.config.Config;
import ai.ideaforge.sim.config.ConfigLoader;
import ai.ideaforge.sim.config.SystemEnvironmentReader;
import ai.ideaforge.sim.fixture.FixtureType;
import ai.ideaforge.sim.fixture.TestDataManager;
import ai.ideaforge.sim.logging.LoggingConfigurator;
import ai.ideaforge.sim.mock.MockAIAnalysisService;
import ai.ideaforge.sim.mock.MockFrankensteinService;
import ai.ideaforge.sim.model.FrankensteinElement;
import ai.ideaforge.sim.model.FrankensteinMode;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.service.ServiceResult;
import ai.ideaforge.sim.telemetry.OperationMetrics;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point of the fixture validation tool.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PROBLEMS = 1;

    private static final String SAMPLE_IDEA = "A marketplace that matches retired engineers with student robotics teams";

    private final ConfigLoader configLoader;
    private final TestDataManager dataManager;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new TestDataManager(),
                new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, TestDataManager dataManager, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.dataManager = dataManager;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println("Invalid configuration: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());

        int problems = validateFixtures(cliArguments);
        if (problems > 0) {
            out.printf("%d fixture problem(s) found%n", problems);
            return EXIT_PROBLEMS;
        }
        if (cliArguments.smoke() && !smokeTest(config)) {
            return EXIT_PROBLEMS;
        }
        out.println("Mock fixtures are valid");
        return EXIT_OK;
    }

    private int validateFixtures(CliArguments arguments) {
        List<FixtureType> types = arguments.type() == null ? List.of(FixtureType.values()) : List.of(arguments.type());
        List<Language> languages = arguments.language() == null ? List.of(Language.values()) : List.of(arguments.language());
        int problems = 0;
        for (FixtureType type : types) {
            for (Language language : languages) {
                List<String> found = dataManager.validate(type, language);
                if (found.isEmpty()) {
                    out.printf("OK   %s/%s%n", type, language.code());
                    continue;
                }
                problems += found.size();
                out.printf("FAIL %s/%s%n", type, language.code());
                found.forEach(problem -> out.printf("     - %s%n", problem));
            }
        }
        return problems;
    }

    private boolean smokeTest(Config config) {
        LOGGER.info("Smoke testing mock services with scenario {}", config.mockServiceConfig().defaultScenario());
        MockAIAnalysisService analysis = new MockAIAnalysisService(dataManager, config.mockServiceConfig());
        MockFrankensteinService frankenstein = new MockFrankensteinService(dataManager, config.mockServiceConfig());
        List<FrankensteinElement> elements = List.of(FrankensteinElement.of("Spotify"), FrankensteinElement.of("Duolingo"));

        Map<String, CompletableFuture<? extends ServiceResult<?>>> calls = new LinkedHashMap<>();
        calls.put("analyzeIdea", analysis.analyzeIdea(SAMPLE_IDEA, Language.EN));
        calls.put("analyzeHackathonProject",
                analysis.analyzeHackathonProject("Smoke Test", SAMPLE_IDEA, "Spec-driven development", Language.EN));
        calls.put("getImprovementSuggestions", analysis.getImprovementSuggestions(SAMPLE_IDEA, 70, Language.EN));
        calls.put("compareIdeas", analysis.compareIdeas(SAMPLE_IDEA, "A recipe app for campers", Language.EN));
        calls.put("recommendHackathonCategory",
                analysis.recommendHackathonCategory("Smoke Test", SAMPLE_IDEA, "Agent hooks"));
        calls.put("healthCheck", analysis.healthCheck());
        calls.put("generateIdea", frankenstein.generateIdea(elements, FrankensteinMode.COMPANIES, Language.EN));

        boolean healthy = true;
        for (Map.Entry<String, CompletableFuture<? extends ServiceResult<?>>> call : calls.entrySet()) {
            try {
                ServiceResult<?> result = call.getValue().join();
                out.printf("%-27s %s (%d)%n", call.getKey(), result.success() ? "success" : "failure", result.status());
            } catch (CompletionException ex) {
                healthy = false;
                err.printf("%-27s crashed: %s%n", call.getKey(), ex.getCause());
                LOGGER.error("Smoke call {} crashed", call.getKey(), ex.getCause());
            }
        }

        LOGGER.info("Request log holds {} entries", analysis.getRequestLogs().size() + frankenstein.getRequestLogs().size());
        logMetrics(analysis.getPerformanceMetrics());
        logMetrics(frankenstein.getPerformanceMetrics());
        return healthy;
    }

    private void logMetrics(Map<String, OperationMetrics> metrics) {
        metrics.forEach((operation, stats) -> LOGGER.info("{}: {} request(s), avg {} ms, min {} ms, max {} ms",
                operation, stats.totalRequests(), String.format("%.1f", stats.averageDurationMs()),
                stats.minDurationMs(), stats.maxDurationMs()));
    }
}
