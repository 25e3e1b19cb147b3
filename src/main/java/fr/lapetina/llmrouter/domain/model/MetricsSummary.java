package fr.lapetina.llmrouter.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Aggregated per-model metrics.
 *
 * <p>Latency figures come from the bounded sample window; counters cover the
 * lifetime of the collector.
 */
public record MetricsSummary(
        String modelId,
        Duration window,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double successRate,
        double averageResponseTimeMs,
        double p95ResponseTimeMs,
        long cacheHits,
        long cacheMisses,
        double cacheHitRate,
        long totalTokens,
        BigDecimal totalCost,
        Instant lastUpdated
) {
    public static MetricsSummary empty(String modelId, Duration window) {
        return new MetricsSummary(
                modelId, window, 0, 0, 0, 0.0, 0.0, 0.0, 0, 0, 0.0, 0, BigDecimal.ZERO, null
        );
    }
}
