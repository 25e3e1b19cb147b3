package fr.lapetina.llmrouter.domain.model;

/**
 * Health classification derived from a model's observed error rate.
 */
public enum HealthStatus {
    /** Error rate below the configured threshold */
    HEALTHY,

    /** Error rate at or above the configured threshold */
    UNHEALTHY,

    /** No completed request has been recorded for the model */
    UNKNOWN
}
