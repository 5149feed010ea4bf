package ai.ideaforge.sim.model;

public record FrankensteinMetrics(int originality, int feasibility, int impact, int scalability, int wowFactor) {

    public FrankensteinMetrics {
        Scores.requireScore(originality, "originality");
        Scores.requireScore(feasibility, "feasibility");
        Scores.requireScore(impact, "impact");
        Scores.requireScore(scalability, "scalability");
        Scores.requireScore(wowFactor, "wowFactor");
    }
}
