package ai.ideaforge.sim.model;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
