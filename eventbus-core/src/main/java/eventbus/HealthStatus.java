package eventbus;

/** Coarse health classification reported by registries and publishers. */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
