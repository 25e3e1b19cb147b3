package fr.lapetina.llmrouter.infrastructure.metrics;

import fr.lapetina.llmrouter.domain.model.CacheTier;
import fr.lapetina.llmrouter.domain.model.ErrorKind;
import fr.lapetina.llmrouter.domain.model.HealthSnapshot;
import fr.lapetina.llmrouter.domain.model.HealthStatus;
import fr.lapetina.llmrouter.domain.model.MetricsSummary;
import fr.lapetina.llmrouter.domain.model.RequestKind;
import fr.lapetina.llmrouter.domain.model.UsageStatistics;
import fr.lapetina.llmrouter.domain.strategy.CandidatePerformance;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model request, latency, cache and error accounting.
 *
 * <p>A backend call is bracketed by {@link #startRequest} and {@link #endRequest}.
 * Whoever starts a request must end it, or {@link #discardRequest discard} it when
 * the call is abandoned; {@link #activeRequestCount()} exposes leaks. Ending an
 * unknown or already ended tracking id is logged and ignored, never thrown.
 *
 * <p>Health is derived from the lifetime error rate: a model is healthy while
 * {@code failed / completed} stays below the configured threshold (10% by default).
 * Models without any completed request are {@link HealthStatus#UNKNOWN}.
 *
 * <p>Thread-safe. Each model has its own {@link BackendMetrics} record.
 */
public final class MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    public static final int DEFAULT_SAMPLE_WINDOW = 1000;
    public static final double DEFAULT_UNHEALTHY_ERROR_RATE = 0.10;
    private static final double P95 = 0.95;

    private final ConcurrentHashMap<String, BackendMetrics> models = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TrackedRequest> activeRequests = new ConcurrentHashMap<>();
    private final MetricsRegistry metricsRegistry;
    private final int sampleWindow;
    private final double unhealthyErrorRate;
    private final Clock clock;

    public MetricsCollector(MetricsRegistry metricsRegistry, int sampleWindow, double unhealthyErrorRate, Clock clock) {
        if (sampleWindow <= 0) {
            throw new IllegalArgumentException("sampleWindow must be positive");
        }
        this.metricsRegistry = metricsRegistry;
        this.sampleWindow = sampleWindow;
        this.unhealthyErrorRate = unhealthyErrorRate;
        this.clock = clock;
        metricsRegistry.registerActiveRequests(activeRequests::size);
    }

    public MetricsCollector(MetricsRegistry metricsRegistry, int sampleWindow, double unhealthyErrorRate) {
        this(metricsRegistry, sampleWindow, unhealthyErrorRate, Clock.systemUTC());
    }

    /**
     * Creates a collector with default settings exporting to an in-memory registry.
     */
    public MetricsCollector() {
        this(new MetricsRegistry("llm_router", new SimpleMeterRegistry()),
                DEFAULT_SAMPLE_WINDOW, DEFAULT_UNHEALTHY_ERROR_RATE);
    }

    /**
     * Starts tracking a backend request.
     *
     * @return Tracking id to pass to {@link #endRequest} or {@link #discardRequest}
     */
    public String startRequest(String modelId, RequestKind kind) {
        String trackingId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        activeRequests.put(trackingId, new TrackedRequest(trackingId, modelId, kind, now, System.nanoTime()));
        metricsFor(modelId).recordStart(kind, now);
        metricsRegistry.incrementRequestCount(modelId, kind, "started");

        log.debug("Request tracking started: trackingId={}, model={}, kind={}", trackingId, modelId, kind);
        return trackingId;
    }

    /**
     * Ends a tracked request.
     *
     * @param duration Observed duration, or null to use the time elapsed since start
     * @param usage Token usage, may be null
     */
    public void endRequest(String trackingId, boolean success, Duration duration, UsageStatistics usage) {
        TrackedRequest tracked = trackingId != null ? activeRequests.remove(trackingId) : null;
        if (tracked == null) {
            log.warn("Ignoring end of unknown or already ended request: trackingId={}", trackingId);
            return;
        }

        Duration effective = duration != null ? duration : tracked.elapsed();
        metricsFor(tracked.modelId()).recordCompletion(success, effective, usage, clock.instant());
        metricsRegistry.incrementRequestCount(tracked.modelId(), tracked.kind(), success ? "success" : "failure");
        if (success) {
            metricsRegistry.recordLatency(tracked.modelId(), effective);
        }

        log.debug("Request tracking ended: trackingId={}, model={}, success={}, durationMs={}",
                trackingId, tracked.modelId(), success, effective.toMillis());
    }

    /**
     * Ends a tracked request, timed from its start.
     */
    public void endRequest(String trackingId, boolean success, UsageStatistics usage) {
        endRequest(trackingId, success, null, usage);
    }

    /**
     * Drops a tracked request without counting it, e.g. after cancellation.
     *
     * @return true if the tracking id was active
     */
    public boolean discardRequest(String trackingId) {
        TrackedRequest tracked = trackingId != null ? activeRequests.remove(trackingId) : null;
        if (tracked == null) {
            return false;
        }
        log.debug("Request tracking discarded: trackingId={}, model={}", trackingId, tracked.modelId());
        return true;
    }

    /**
     * Returns the number of requests started and neither ended nor discarded.
     */
    public int activeRequestCount() {
        return activeRequests.size();
    }

    public void recordCacheHit(String modelId, CacheTier tier) {
        metricsFor(modelId).recordCacheLookup(tier, true, clock.instant());
        metricsRegistry.incrementCacheCount(modelId, tier, true);
    }

    public void recordCacheMiss(String modelId, CacheTier tier) {
        metricsFor(modelId).recordCacheLookup(tier, false, clock.instant());
        metricsRegistry.incrementCacheCount(modelId, tier, false);
    }

    /**
     * Counts an error against a model.
     *
     * @param cause Originating exception, may be null
     */
    public void recordError(String modelId, ErrorKind errorKind, Throwable cause) {
        metricsFor(modelId).recordError(errorKind, clock.instant());
        metricsRegistry.incrementErrorCount(modelId, errorKind);
        log.debug("Error recorded: model={}, kind={}, cause={}",
                modelId, errorKind, cause != null ? cause.toString() : "none");
    }

    /**
     * Returns the number of errors of one kind recorded for a model.
     */
    public long getErrorCount(String modelId, ErrorKind errorKind) {
        BackendMetrics metrics = models.get(modelId);
        return metrics != null ? metrics.getErrors(errorKind) : 0;
    }

    /**
     * Returns the number of requests of one kind started for a model.
     */
    public long getStartedCount(String modelId, RequestKind kind) {
        BackendMetrics metrics = models.get(modelId);
        return metrics != null ? metrics.getStarted(kind) : 0;
    }

    /**
     * Summarizes a model's metrics.
     *
     * <p>The collector keeps lifetime counters and a bounded latency window only, it has
     * no time-partitioned rollups. {@code window} is echoed in the summary but does not
     * narrow the data.
     */
    public MetricsSummary getMetrics(String modelId, Duration window) {
        BackendMetrics metrics = models.get(modelId);
        if (metrics == null) {
            return MetricsSummary.empty(modelId, window);
        }

        long successful = metrics.getSuccessful();
        long failed = metrics.getFailed();
        long completed = successful + failed;
        long hits = metrics.getCacheHits();
        long misses = metrics.getCacheMisses();
        double[] samples = metrics.sortedSamples();

        return new MetricsSummary(
                modelId,
                window,
                completed,
                successful,
                failed,
                completed > 0 ? (double) successful / completed : 0.0,
                average(samples),
                percentile(samples, P95),
                hits,
                misses,
                hits + misses > 0 ? (double) hits / (hits + misses) : 0.0,
                metrics.getTotalTokens(),
                metrics.getTotalCost(),
                metrics.getLastActivity()
        );
    }

    /**
     * Returns the health of a model. Never fails, unknown models report {@link HealthStatus#UNKNOWN}.
     */
    public HealthSnapshot getHealth(String modelId) {
        Instant now = clock.instant();
        BackendMetrics metrics = models.get(modelId);
        if (metrics == null || metrics.getCompleted() == 0) {
            return HealthSnapshot.unknown(modelId, now);
        }

        long completed = metrics.getCompleted();
        double errorRate = (double) metrics.getFailed() / completed;
        HealthStatus status = errorRate < unhealthyErrorRate ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;

        return new HealthSnapshot(
                modelId,
                status,
                completed,
                errorRate,
                average(metrics.sortedSamples()),
                metrics.getLastActivity(),
                now
        );
    }

    /**
     * Returns the performance signal used by performance-aware strategies.
     */
    public CandidatePerformance getPerformance(String modelId) {
        BackendMetrics metrics = models.get(modelId);
        if (metrics == null) {
            return CandidatePerformance.unknown();
        }
        double[] samples = metrics.sortedSamples();
        return new CandidatePerformance(getHealth(modelId).status(), average(samples), samples.length);
    }

    /**
     * Returns the ids of all models with recorded metrics.
     */
    public Set<String> getModelIds() {
        return Set.copyOf(models.keySet());
    }

    public int getSampleWindow() {
        return sampleWindow;
    }

    private BackendMetrics metricsFor(String modelId) {
        return models.computeIfAbsent(modelId, id -> new BackendMetrics(id, sampleWindow));
    }

    private static double average(double[] sorted) {
        if (sorted.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double sample : sorted) {
            sum += sample;
        }
        return sum / sorted.length;
    }

    private static double percentile(double[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int index = Math.min((int) (sorted.length * quantile), sorted.length - 1);
        return sorted[index];
    }
}
