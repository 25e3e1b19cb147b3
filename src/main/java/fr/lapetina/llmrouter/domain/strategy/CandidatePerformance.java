package fr.lapetina.llmrouter.domain.strategy;

import fr.lapetina.llmrouter.domain.model.HealthStatus;

/**
 * Performance signal for one candidate, as observed by the metrics layer.
 *
 * @param health Error-rate based health
 * @param averageLatencyMs Average latency over the sample window, 0 without samples
 * @param sampleCount Number of latency samples backing the average
 */
public record CandidatePerformance(HealthStatus health, double averageLatencyMs, long sampleCount) {

    private static final CandidatePerformance UNKNOWN = new CandidatePerformance(HealthStatus.UNKNOWN, 0.0, 0);

    public CandidatePerformance {
        if (health == null) {
            health = HealthStatus.UNKNOWN;
        }
    }

    public static CandidatePerformance unknown() {
        return UNKNOWN;
    }
}
