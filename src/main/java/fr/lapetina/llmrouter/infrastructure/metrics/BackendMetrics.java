package fr.lapetina.llmrouter.infrastructure.metrics;

import fr.lapetina.llmrouter.domain.model.CacheTier;
import fr.lapetina.llmrouter.domain.model.ErrorKind;
import fr.lapetina.llmrouter.domain.model.RequestKind;
import fr.lapetina.llmrouter.domain.model.UsageStatistics;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running metrics of one model.
 *
 * Counters are lock-free. The latency sample window is guarded by its own
 * monitor, so one busy model never contends with another.
 */
final class BackendMetrics {

    private final String modelId;
    private final int windowSize;

    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final Map<RequestKind, LongAdder> startedByKind = new EnumMap<>(RequestKind.class);
    private final Map<CacheTier, LongAdder> cacheHits = new EnumMap<>(CacheTier.class);
    private final Map<CacheTier, LongAdder> cacheMisses = new EnumMap<>(CacheTier.class);
    private final Map<ErrorKind, LongAdder> errors = new EnumMap<>(ErrorKind.class);
    private final LongAdder totalTokens = new LongAdder();
    private final AtomicReference<BigDecimal> totalCost = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<Instant> lastActivity = new AtomicReference<>();

    private final ArrayDeque<Double> latencySamplesMs;

    BackendMetrics(String modelId, int windowSize) {
        this.modelId = modelId;
        this.windowSize = windowSize;
        this.latencySamplesMs = new ArrayDeque<>(windowSize);
        // Maps are filled eagerly and never structurally modified afterwards
        for (RequestKind kind : RequestKind.values()) {
            startedByKind.put(kind, new LongAdder());
        }
        for (CacheTier tier : CacheTier.values()) {
            cacheHits.put(tier, new LongAdder());
            cacheMisses.put(tier, new LongAdder());
        }
        for (ErrorKind kind : ErrorKind.values()) {
            errors.put(kind, new LongAdder());
        }
    }

    String getModelId() {
        return modelId;
    }

    void recordStart(RequestKind kind, Instant now) {
        startedByKind.get(kind).increment();
        lastActivity.set(now);
    }

    void recordCompletion(boolean success, Duration duration, UsageStatistics usage, Instant now) {
        if (success) {
            successful.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
        // Failures are sampled too, a slow failing backend must not look fast
        addSample(duration.toNanos() / 1_000_000.0);
        if (usage != null) {
            totalTokens.add(usage.totalTokens());
            totalCost.accumulateAndGet(usage.cost(), BigDecimal::add);
        }
        lastActivity.set(now);
    }

    void recordCacheLookup(CacheTier tier, boolean hit, Instant now) {
        (hit ? cacheHits : cacheMisses).get(tier).increment();
        lastActivity.set(now);
    }

    void recordError(ErrorKind kind, Instant now) {
        errors.get(kind).increment();
        lastActivity.set(now);
    }

    private void addSample(double latencyMs) {
        synchronized (latencySamplesMs) {
            if (latencySamplesMs.size() == windowSize) {
                latencySamplesMs.removeFirst();
            }
            latencySamplesMs.addLast(latencyMs);
        }
    }

    /**
     * Returns a sorted copy of the latency window.
     */
    double[] sortedSamples() {
        double[] samples;
        synchronized (latencySamplesMs) {
            samples = latencySamplesMs.stream().mapToDouble(Double::doubleValue).toArray();
        }
        Arrays.sort(samples);
        return samples;
    }

    long getStarted(RequestKind kind) {
        return startedByKind.get(kind).sum();
    }

    long getSuccessful() {
        return successful.get();
    }

    long getFailed() {
        return failed.get();
    }

    long getCompleted() {
        return successful.get() + failed.get();
    }

    long getCacheHits() {
        return cacheHits.values().stream().mapToLong(LongAdder::sum).sum();
    }

    long getCacheMisses() {
        return cacheMisses.values().stream().mapToLong(LongAdder::sum).sum();
    }

    long getErrors(ErrorKind kind) {
        return errors.get(kind).sum();
    }

    long getTotalTokens() {
        return totalTokens.sum();
    }

    BigDecimal getTotalCost() {
        return totalCost.get();
    }

    Instant getLastActivity() {
        return lastActivity.get();
    }
}
