package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.AnalysisResult;
import ai.ideaforge.sim.model.IdeaComparison;
import ai.ideaforge.sim.model.IdeaComparison.Factor;
import ai.ideaforge.sim.model.IdeaComparison.Winner;
import ai.ideaforge.sim.model.Language;
import java.util.List;

/**
 * Compares two analyses on market potential, technical feasibility and business viability.
 * A section missing from an analysis is scored with that analysis' final score.
 */
public class IdeaComparator {

    public IdeaComparison compare(AnalysisResult idea1, AnalysisResult idea2, Language language) {
        List<Factor> factors = List.of(
                factor("Market Potential",
                        idea1.marketPotential().map(AnalysisResult.MarketPotential::score).orElse(idea1.score()),
                        idea2.marketPotential().map(AnalysisResult.MarketPotential::score).orElse(idea2.score())),
                factor("Technical Feasibility",
                        idea1.technicalFeasibility().map(AnalysisResult.TechnicalFeasibility::score).orElse(idea1.score()),
                        idea2.technicalFeasibility().map(AnalysisResult.TechnicalFeasibility::score).orElse(idea2.score())),
                factor("Business Viability",
                        idea1.businessViability().map(AnalysisResult.BusinessViability::score).orElse(idea1.score()),
                        idea2.businessViability().map(AnalysisResult.BusinessViability::score).orElse(idea2.score())));
        Winner winner = Winner.of(idea1.score(), idea2.score());
        return new IdeaComparison(winner, Math.abs(idea1.score() - idea2.score()), factors,
                recommendation(winner, factors, language));
    }

    private static Factor factor(String name, int idea1Score, int idea2Score) {
        return new Factor(name, idea1Score, idea2Score, Winner.of(idea1Score, idea2Score));
    }

    private static String recommendation(Winner winner, List<Factor> factors, Language language) {
        long idea1Wins = factors.stream().filter(factor -> factor.winner() == Winner.IDEA1).count();
        long idea2Wins = factors.stream().filter(factor -> factor.winner() == Winner.IDEA2).count();
        boolean spanish = language == Language.ES;
        return switch (winner) {
            case IDEA1 -> spanish
                    ? "La idea 1 muestra mayor potencial global y gana en " + idea1Wins + " de " + factors.size() + " factores."
                    : "Idea 1 shows stronger overall potential and leads on " + idea1Wins + " of " + factors.size() + " factors.";
            case IDEA2 -> spanish
                    ? "La idea 2 muestra mayor potencial global y gana en " + idea2Wins + " de " + factors.size() + " factores."
                    : "Idea 2 shows stronger overall potential and leads on " + idea2Wins + " of " + factors.size() + " factors.";
            case TIE -> spanish
                    ? "Ambas ideas tienen un potencial comparable; la diferencia estará en la ejecución."
                    : "Both ideas show comparable potential; execution will decide between them.";
        };
    }
}
