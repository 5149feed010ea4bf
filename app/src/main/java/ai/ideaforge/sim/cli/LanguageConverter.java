package ai.ideaforge.sim.cli;

import ai.ideaforge.sim.model.Language;
import picocli.CommandLine;

public class LanguageConverter implements CommandLine.ITypeConverter<Language> {
    @Override
    public Language convert(String value) {
        return Language.from(value);
    }
}
