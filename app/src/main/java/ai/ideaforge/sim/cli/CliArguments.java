package ai.ideaforge.sim.cli;

import ai.ideaforge.sim.config.LogFormat;
import ai.ideaforge.sim.fixture.FixtureType;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.scenario.TestScenario;
import picocli.CommandLine;

@CommandLine.Command(name = "ideaforge-mocks", mixinStandardHelpOptions = true,
        description = "Validates the mock fixture store and optionally smoke-tests the mock services")
public class CliArguments {

    @CommandLine.Option(names = "--type", converter = FixtureTypeConverter.class,
            description = "Fixture type to validate: analyzer, hackathon or frankenstein (default: all)", paramLabel = "TYPE")
    private FixtureType type;

    @CommandLine.Option(names = "--language", converter = LanguageConverter.class,
            description = "Fixture language to validate: en or es (default: all)", paramLabel = "LANG")
    private Language language;

    @CommandLine.Option(names = "--smoke", description = "Run every mock operation once after validating")
    private boolean smoke;

    @CommandLine.Option(names = "--scenario", converter = ScenarioConverter.class,
            description = "Scenario for the smoke run, overriding FF_MOCK_SCENARIO", paramLabel = "SCENARIO")
    private TestScenario scenario;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log fixture loading and request details")
    private boolean verbose;

    public FixtureType type() {
        return type;
    }

    public Language language() {
        return language;
    }

    public boolean smoke() {
        return smoke;
    }

    public TestScenario scenario() {
        return scenario;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
