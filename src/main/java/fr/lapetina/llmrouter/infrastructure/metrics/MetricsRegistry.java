package fr.lapetina.llmrouter.infrastructure.metrics;

import fr.lapetina.llmrouter.domain.model.CacheTier;
import fr.lapetina.llmrouter.domain.model.ErrorKind;
import fr.lapetina.llmrouter.domain.model.RequestKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer export of router metrics.
 *
 * Provides:
 * - Request counters per model, kind and outcome
 * - Latency timers per model
 * - Cache hit/miss counters per model and tier
 * - Error counters by kind
 * - Tracked-request and model health gauges
 * - Prometheus exposition when backed by a Prometheus registry
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> cacheCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;
        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    /**
     * Creates a Prometheus-backed registry with JVM metrics bound.
     */
    public MetricsRegistry(String prefix) {
        this(prefix, new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
    }

    public MetricsRegistry() {
        this("llm_router");
    }

    /**
     * Increments the request counter for a model/kind/outcome combination.
     */
    public void incrementRequestCount(String model, RequestKind kind, String outcome) {
        String key = model + ":" + kind.name() + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of backend requests")
                        .tag("model", model)
                        .tag("kind", kind.name())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records request latency.
     */
    public void recordLatency(String model, Duration latency) {
        latencyTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Backend request latency")
                        .tag("model", model)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the cache hit or miss counter of a tier.
     */
    public void incrementCacheCount(String model, CacheTier tier, boolean hit) {
        String result = hit ? "hit" : "miss";
        String key = model + ":" + tier.getTag() + ":" + result;
        cacheCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_cache_lookups_total")
                        .description("Response cache lookups")
                        .tag("model", model)
                        .tag("tier", tier.getTag())
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String model, ErrorKind errorKind) {
        String key = model + ":" + errorKind.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("model", model)
                        .tag("type", errorKind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers the gauge of requests started but not yet ended.
     */
    public void registerActiveRequests(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_active_requests", valueSupplier, s -> s.get().doubleValue())
                .description("Tracked requests in flight")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers a gauge for model health status.
     */
    public void registerModelHealth(String modelId, Supplier<Number> healthValue) {
        Gauge.builder(prefix + "_model_health", healthValue, s -> s.get().doubleValue())
                .description("Model health status (0=UNHEALTHY, 1=UNKNOWN, 2=HEALTHY)")
                .tag("model", modelId)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output, empty when not backed by Prometheus.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry) {
            return ((PrometheusMeterRegistry) registry).scrape();
        }
        return "";
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
