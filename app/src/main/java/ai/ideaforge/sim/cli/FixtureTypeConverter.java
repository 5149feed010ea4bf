package ai.ideaforge.sim.cli;

import ai.ideaforge.sim.fixture.FixtureType;
import picocli.CommandLine;

public class FixtureTypeConverter implements CommandLine.ITypeConverter<FixtureType> {
    @Override
    public FixtureType convert(String value) {
        return FixtureType.from(value);
    }
}
