package fr.lapetina.llmrouter.domain.model;

import java.time.Instant;

/**
 * Point-in-time health of a model, derived from its recorded outcomes.
 */
public record HealthSnapshot(
        String modelId,
        HealthStatus status,
        long totalRequests,
        double errorRate,
        double averageResponseTimeMs,
        Instant lastActivity,
        Instant checkedAt
) {
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    public static HealthSnapshot unknown(String modelId, Instant checkedAt) {
        return new HealthSnapshot(modelId, HealthStatus.UNKNOWN, 0, 0.0, 0.0, null, checkedAt);
    }
}
