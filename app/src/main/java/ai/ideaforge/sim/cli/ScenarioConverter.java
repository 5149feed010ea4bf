package ai.ideaforge.sim.cli;

import ai.ideaforge.sim.scenario.TestScenario;
import picocli.CommandLine;

/**
 * Parses scenario wire names such as {@code rate_limit}.
 */
public class ScenarioConverter implements CommandLine.ITypeConverter<TestScenario> {
    @Override
    public TestScenario convert(String value) {
        return TestScenario.from(value);
    }
}
