package fr.lapetina.llmrouter.router;

import fr.lapetina.llmrouter.domain.model.ErrorKind;
import fr.lapetina.llmrouter.domain.model.GenerationRequest;
import fr.lapetina.llmrouter.domain.model.GenerationResponse;
import fr.lapetina.llmrouter.domain.model.HealthSnapshot;
import fr.lapetina.llmrouter.domain.model.MetricsSummary;
import fr.lapetina.llmrouter.domain.model.ModelDescriptor;
import fr.lapetina.llmrouter.domain.model.RequestKind;
import fr.lapetina.llmrouter.domain.model.RoutingHints;
import fr.lapetina.llmrouter.domain.model.StreamChunk;
import fr.lapetina.llmrouter.domain.model.UsageStatistics;
import fr.lapetina.llmrouter.domain.strategy.CandidatePerformance;
import fr.lapetina.llmrouter.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.llmrouter.domain.strategy.SelectionCriteria;
import fr.lapetina.llmrouter.infrastructure.cache.CacheKeyBuilder;
import fr.lapetina.llmrouter.infrastructure.cache.CacheResult;
import fr.lapetina.llmrouter.infrastructure.cache.ResponseCache;
import fr.lapetina.llmrouter.infrastructure.config.ModelRegistry;
import fr.lapetina.llmrouter.infrastructure.config.RouterConfig;
import fr.lapetina.llmrouter.infrastructure.metrics.MetricsCollector;
import fr.lapetina.llmrouter.infrastructure.pool.BackendCompletion;
import fr.lapetina.llmrouter.infrastructure.pool.InstanceCreationException;
import fr.lapetina.llmrouter.infrastructure.pool.InstancePool;
import fr.lapetina.llmrouter.infrastructure.pool.ModelBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Routes generation requests to model backends.
 *
 * <p>For every request the router:
 * <ol>
 *   <li>validates it and looks its cache key up; a hit is returned without any backend call</li>
 *   <li>derives the candidate models from the registry and the request's routing hints</li>
 *   <li>lets the load balancing strategy pick a candidate, unless the request names a model</li>
 *   <li>acquires that model's handle, tracks and invokes it, caches and returns the response</li>
 *   <li>on failure, retries the remaining candidates while failover allows it</li>
 * </ol>
 *
 * <p>Every call returns a {@link CompletableFuture}. Cancelling it abandons the in-flight
 * backend call, discards the tracked request and stops failover. Failures complete the
 * future with {@link RoutingException} or {@link BackendInvocationException}; a failed
 * request never yields a made-up response.
 */
public final class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final ModelRegistry modelRegistry;
    private final InstancePool instancePool;
    private final ResponseCache responseCache;
    private final CacheKeyBuilder keyBuilder;
    private final MetricsCollector metricsCollector;
    private final RequestValidator validator;
    private final AtomicReference<LoadBalancingStrategy<String>> strategyRef;
    private final boolean cacheEnabled;
    private final Duration defaultTtl;
    private final Map<String, Duration> modelTypeTtls;
    private final boolean failoverEnabled;
    private final int maxRetries;

    private RequestRouter(Builder builder) {
        this.modelRegistry = Objects.requireNonNull(builder.modelRegistry, "Model registry is required");
        this.instancePool = Objects.requireNonNull(builder.instancePool, "Instance pool is required");
        this.metricsCollector = Objects.requireNonNull(builder.metricsCollector, "Metrics collector is required");
        this.strategyRef = new AtomicReference<>(
                Objects.requireNonNull(builder.strategy, "Load balancing strategy is required"));
        this.cacheEnabled = builder.cacheEnabled;
        if (cacheEnabled) {
            Objects.requireNonNull(builder.responseCache, "Response cache is required when caching is enabled");
        }
        this.responseCache = builder.responseCache;
        this.keyBuilder = builder.keyBuilder != null ? builder.keyBuilder : new CacheKeyBuilder();
        this.validator = builder.validator != null ? builder.validator : RequestValidator.withDefaults();
        this.defaultTtl = builder.defaultTtl;
        this.modelTypeTtls = Map.copyOf(builder.modelTypeTtls);
        this.failoverEnabled = builder.failoverEnabled;
        this.maxRetries = Math.max(0, builder.maxRetries);
    }

    /**
     * Routes a request and completes with the generated, or cached, response.
     */
    public CompletableFuture<GenerationResponse> route(GenerationRequest request) {
        try {
            validator.validate(request);
        } catch (RoutingException e) {
            return reject(request, e);
        }

        RouteContext ctx = new RouteContext(request, RequestKind.TEXT_GENERATION, null);
        if (!cacheEnabled) {
            guarded(ctx, () -> selectCandidates(ctx));
            return ctx.result;
        }

        ctx.cacheKey = keyBuilder.build(request);
        ctx.track(responseCache.get(ctx.cacheKey, GenerationResponse.class))
                .thenAccept(lookup -> guarded(ctx, () -> onCacheLookup(ctx, lookup)));
        return ctx.result;
    }

    /**
     * Routes a request as a stream. Chunks are passed to {@code onChunk} in order; the last
     * one has {@code complete} set. Streams are never cached and only fail over while no
     * chunk has been delivered.
     *
     * @return The aggregated response once the stream ended
     */
    public CompletableFuture<GenerationResponse> routeStream(GenerationRequest request, Consumer<StreamChunk> onChunk) {
        Objects.requireNonNull(onChunk, "Chunk consumer is required");
        try {
            validator.validate(request);
        } catch (RoutingException e) {
            return reject(request, e);
        }

        RouteContext ctx = new RouteContext(request, RequestKind.STREAMING, onChunk);
        guarded(ctx, () -> selectCandidates(ctx));
        return ctx.result;
    }

    private CompletableFuture<GenerationResponse> reject(GenerationRequest request, RoutingException e) {
        String modelId = metricsModelId(request);
        metricsCollector.recordError(modelId, ErrorKind.VALIDATION_ERROR, e);
        log.warn("Request rejected: model={}, reason={}", modelId, e.getMessage());
        return CompletableFuture.failedFuture(e);
    }

    private void onCacheLookup(RouteContext ctx, CacheResult<GenerationResponse> lookup) {
        if (ctx.result.isDone()) {
            return;
        }
        String requestedModel = metricsModelId(ctx.request);

        if (lookup.isHit()) {
            metricsCollector.recordCacheHit(requestedModel, lookup.tier());
            GenerationResponse response = lookup.value().asCacheHit(ctx.responseId);
            log.debug("Cache hit: model={}, tier={}, key={}", requestedModel, lookup.tier(), ctx.cacheKey);
            ctx.result.complete(response);
            return;
        }

        if (lookup.isFailure()) {
            metricsCollector.recordError(requestedModel, ErrorKind.CACHE_FAILURE, lookup.failure());
        }
        metricsCollector.recordCacheMiss(requestedModel, lookup.tier());
        selectCandidates(ctx);
    }

    private void selectCandidates(RouteContext ctx) {
        GenerationRequest request = ctx.request;
        List<ModelDescriptor> enabled = modelRegistry.snapshot().stream()
                .filter(ModelDescriptor::enabled)
                .toList();

        if (enabled.isEmpty()) {
            fail(ctx, new RoutingException(RoutingException.Reason.NO_CANDIDATES));
            return;
        }

        List<String> candidates = enabled.stream()
                .filter(descriptor -> satisfies(descriptor, request.routingHints()))
                .map(ModelDescriptor::id)
                .toList();

        if (candidates.isEmpty()) {
            fail(ctx, new RoutingException(RoutingException.Reason.NO_CAPABLE_MODEL,
                    "hints=" + request.routingHints()));
            return;
        }

        if (!request.isAutomaticModel()) {
            if (candidates.contains(request.modelId())) {
                ctx.pinnedModel = request.modelId();
            } else {
                log.debug("Requested model not routable, letting strategy choose: model={}", request.modelId());
            }
        }

        ctx.remaining.addAll(candidates);
        attempt(ctx);
    }

    private boolean satisfies(ModelDescriptor descriptor, RoutingHints hints) {
        if (!descriptor.supports(hints.requiredCapabilities())) {
            return false;
        }
        if (hints.maxCostPerThousandTokens() != null && descriptor.costPerThousandTokens() != null
                && descriptor.costPerThousandTokens().compareTo(hints.maxCostPerThousandTokens()) > 0) {
            return false;
        }
        if (hints.maxAverageLatency() != null) {
            CandidatePerformance performance = metricsCollector.getPerformance(descriptor.id());
            return performance.sampleCount() == 0
                    || performance.averageLatencyMs() <= hints.maxAverageLatency().toMillis();
        }
        return true;
    }

    private void attempt(RouteContext ctx) {
        if (ctx.result.isDone()) {
            return;
        }

        String modelId;
        if (ctx.attempts == 0 && ctx.pinnedModel != null) {
            modelId = ctx.pinnedModel;
        } else {
            LoadBalancingStrategy<String> strategy = strategyRef.get();
            try {
                modelId = strategy.selectNext(
                        List.copyOf(ctx.remaining),
                        SelectionCriteria.withPerformance(metricsCollector::getPerformance));
            } catch (RuntimeException e) {
                fail(ctx, new RoutingException(RoutingException.Reason.SELECTION_FAILED, strategy.getName(), e));
                return;
            }
        }

        ctx.remaining.remove(modelId);
        ctx.attempts++;
        log.debug("Model selected: routeId={}, model={}, attempt={}, strategy={}, remaining={}",
                ctx.responseId, modelId, ctx.attempts, strategyRef.get().getName(), ctx.remaining.size());

        ctx.track(instancePool.acquire(modelId))
                .whenComplete((backend, error) -> guarded(ctx, () -> {
                    if (error != null) {
                        onAttemptFailed(ctx, modelId, unwrap(error));
                    } else {
                        invoke(ctx, modelId, backend);
                    }
                }));
    }

    private void invoke(RouteContext ctx, String modelId, ModelBackend backend) {
        if (ctx.result.isDone()) {
            return;
        }

        String trackingId = metricsCollector.startRequest(modelId, ctx.kind);
        if (!ctx.holdTracking(trackingId)) {
            // Cancelled between acquire and start
            metricsCollector.discardRequest(trackingId);
            return;
        }

        long startNanos = System.nanoTime();
        CompletableFuture<?> call;
        try {
            call = ctx.isStreaming()
                    ? backend.invokeStream(ctx.request, delta -> ctx.emit(modelId, delta))
                    : backend.invoke(ctx.request);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        ctx.track(call).whenComplete((value, error) -> guarded(ctx, () -> {
            String tracked = ctx.releaseTracking();
            if (tracked == null) {
                // Already discarded by cancellation
                return;
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (error != null) {
                metricsCollector.endRequest(tracked, false, elapsed, null);
                onAttemptFailed(ctx, modelId, unwrap(error));
            } else {
                onAttemptSucceeded(ctx, modelId, tracked, elapsed, value);
            }
        }));
    }

    private void onAttemptSucceeded(RouteContext ctx, String modelId, String trackingId, Duration elapsed, Object value) {
        String content;
        UsageStatistics usage;
        if (ctx.isStreaming()) {
            usage = (UsageStatistics) value;
            content = ctx.streamed.toString();
            ctx.emitLast(modelId);
        } else {
            BackendCompletion completion = (BackendCompletion) value;
            if (completion == null) {
                metricsCollector.endRequest(trackingId, false, elapsed, null);
                onAttemptFailed(ctx, modelId, new IllegalStateException("Backend returned no completion"));
                return;
            }
            usage = completion.usage();
            content = completion.content();
        }

        metricsCollector.endRequest(trackingId, true, elapsed, usage);
        GenerationResponse response = new GenerationResponse(
                ctx.responseId, modelId, content, usage, Instant.now(), elapsed, false);

        logOutcome(ctx, modelId, () -> log.info("Request routed: model={}, attempt={}, durationMs={}, streaming={}",
                modelId, ctx.attempts, elapsed.toMillis(), ctx.isStreaming()));

        if (ctx.cacheKey != null && !keyBuilder.isFallback(ctx.cacheKey)) {
            // Local tier is written synchronously, the shared write completes on its own
            responseCache.set(ctx.cacheKey, response, resolveTtl(modelId));
        }
        ctx.result.complete(response);
    }

    private void onAttemptFailed(RouteContext ctx, String modelId, Throwable cause) {
        if (ctx.result.isDone()) {
            return;
        }

        ErrorKind kind = classify(cause);
        metricsCollector.recordError(modelId, kind, cause);
        ctx.lastFailure = new BackendInvocationException(modelId, kind, ctx.attempts, cause);

        boolean retry = failoverEnabled
                && kind != ErrorKind.CANCELLED
                && ctx.attempts <= maxRetries
                && !ctx.remaining.isEmpty()
                && !ctx.hasEmitted();

        if (retry) {
            log.warn("Backend failed, failing over: model={}, kind={}, attempt={}, remaining={}, error={}",
                    modelId, kind, ctx.attempts, ctx.remaining.size(), cause.toString());
            attempt(ctx);
            return;
        }

        logOutcome(ctx, modelId, () -> log.error("Request failed: model={}, kind={}, attempts={}, error={}",
                modelId, kind, ctx.attempts, cause.toString()));
        ctx.result.completeExceptionally(ctx.lastFailure);
    }

    private void fail(RouteContext ctx, RoutingException e) {
        ErrorKind kind = e.getReason() == RoutingException.Reason.SELECTION_FAILED
                ? ErrorKind.INTERNAL_ERROR
                : ErrorKind.NO_AVAILABLE_MODEL;
        metricsCollector.recordError(metricsModelId(ctx.request), kind, e);
        log.error("Routing failed: model={}, reason={}", ctx.request.modelId(), e.getMessage());
        ctx.result.completeExceptionally(e);
    }

    private void guarded(RouteContext ctx, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.error("Unexpected routing error: routeId={}, model={}", ctx.responseId, ctx.request.modelId(), e);
            metricsCollector.recordError(metricsModelId(ctx.request), ErrorKind.INTERNAL_ERROR, e);
            ctx.result.completeExceptionally(e);
        }
    }

    /**
     * Returns the model id that request-level metrics are recorded under. Ids the
     * registry does not know are folded into {@link GenerationRequest#AUTO_MODEL}
     * so the per-model metrics stay bounded by the registry.
     */
    private String metricsModelId(GenerationRequest request) {
        String modelId = request != null ? request.modelId() : null;
        if (modelId != null && !request.isAutomaticModel() && modelRegistry.find(modelId).isPresent()) {
            return modelId;
        }
        return GenerationRequest.AUTO_MODEL;
    }

    private static void logOutcome(RouteContext ctx, String modelId, Runnable logStatement) {
        MDC.put("routeId", ctx.responseId);
        MDC.put("model", modelId);
        try {
            logStatement.run();
        } finally {
            MDC.remove("routeId");
            MDC.remove("model");
        }
    }

    /**
     * Returns the cache TTL for responses of a model: its own override, then its
     * model type's TTL, then the default.
     */
    Duration resolveTtl(String modelId) {
        Optional<ModelDescriptor> descriptor = modelRegistry.find(modelId);
        if (descriptor.isPresent()) {
            if (descriptor.get().cacheTtl() != null) {
                return descriptor.get().cacheTtl();
            }
            String modelType = descriptor.get().modelType();
            if (modelType != null && modelTypeTtls.containsKey(modelType)) {
                return modelTypeTtls.get(modelType);
            }
        }
        return defaultTtl;
    }

    private static ErrorKind classify(Throwable cause) {
        if (cause instanceof InstanceCreationException) {
            return ErrorKind.HANDLE_CREATION_FAILED;
        }
        if (cause instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (cause instanceof CancellationException) {
            return ErrorKind.CANCELLED;
        }
        return ErrorKind.BACKEND_ERROR;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Atomically updates the load balancing strategy.
     */
    public void setStrategy(LoadBalancingStrategy<String> strategy) {
        LoadBalancingStrategy<String> old = strategyRef.getAndSet(Objects.requireNonNull(strategy));
        log.info("Strategy changed from {} to {}", old.getName(), strategy.getName());
    }

    public LoadBalancingStrategy<String> getStrategy() {
        return strategyRef.get();
    }

    /**
     * Pushes model weights into the current strategy.
     */
    public void applyWeights(Collection<ModelDescriptor> descriptors) {
        LoadBalancingStrategy<String> strategy = strategyRef.get();
        for (ModelDescriptor descriptor : descriptors) {
            strategy.setWeight(descriptor.id(), descriptor.weight());
        }
    }

    public MetricsSummary getMetrics(String modelId, Duration window) {
        return metricsCollector.getMetrics(modelId, window);
    }

    public HealthSnapshot getHealth(String modelId) {
        return metricsCollector.getHealth(modelId);
    }

    /**
     * State of one routed request.
     */
    private final class RouteContext {
        private final GenerationRequest request;
        private final RequestKind kind;
        private final Consumer<StreamChunk> chunkConsumer;
        private final String responseId = UUID.randomUUID().toString();
        private final CompletableFuture<GenerationResponse> result = new CompletableFuture<>();
        private final List<String> remaining = new ArrayList<>();
        private final StringBuffer streamed = new StringBuffer();
        private final AtomicInteger sequence = new AtomicInteger();

        private volatile CompletableFuture<?> inFlight;
        private String trackingId;
        private String cacheKey;
        private String pinnedModel;
        private int attempts;
        private BackendInvocationException lastFailure;

        private RouteContext(GenerationRequest request, RequestKind kind, Consumer<StreamChunk> chunkConsumer) {
            this.request = request;
            this.kind = kind;
            this.chunkConsumer = chunkConsumer;
            // Runs on cancellation and on any completion that leaves a call behind
            result.whenComplete((response, error) -> abandon());
        }

        private boolean isStreaming() {
            return chunkConsumer != null;
        }

        private boolean hasEmitted() {
            return sequence.get() > 0;
        }

        private <T> CompletableFuture<T> track(CompletableFuture<T> future) {
            inFlight = future;
            if (result.isDone()) {
                future.cancel(false);
            }
            return future;
        }

        private synchronized boolean holdTracking(String id) {
            if (result.isDone()) {
                return false;
            }
            trackingId = id;
            return true;
        }

        private synchronized String releaseTracking() {
            String id = trackingId;
            trackingId = null;
            return id;
        }

        private void abandon() {
            String id = releaseTracking();
            CompletableFuture<?> call = inFlight;
            if (call != null) {
                call.cancel(false);
            }
            if (id != null) {
                metricsCollector.discardRequest(id);
            }
        }

        private void emit(String modelId, String delta) {
            if (result.isDone()) {
                return;
            }
            streamed.append(delta);
            StreamChunk chunk = StreamChunk.of(responseId, modelId, delta, sequence.getAndIncrement());
            try {
                chunkConsumer.accept(chunk);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }

        private void emitLast(String modelId) {
            try {
                chunkConsumer.accept(StreamChunk.last(responseId, modelId, sequence.getAndIncrement()));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ModelRegistry modelRegistry;
        private InstancePool instancePool;
        private ResponseCache responseCache;
        private CacheKeyBuilder keyBuilder;
        private MetricsCollector metricsCollector;
        private LoadBalancingStrategy<String> strategy;
        private RequestValidator validator;
        private boolean cacheEnabled = true;
        private Duration defaultTtl = Duration.ofMinutes(30);
        private Map<String, Duration> modelTypeTtls = new HashMap<>();
        private boolean failoverEnabled = true;
        private int maxRetries = 1;

        public Builder modelRegistry(ModelRegistry modelRegistry) {
            this.modelRegistry = modelRegistry;
            return this;
        }

        public Builder instancePool(InstancePool instancePool) {
            this.instancePool = instancePool;
            return this;
        }

        public Builder responseCache(ResponseCache responseCache) {
            this.responseCache = responseCache;
            return this;
        }

        public Builder keyBuilder(CacheKeyBuilder keyBuilder) {
            this.keyBuilder = keyBuilder;
            return this;
        }

        public Builder metricsCollector(MetricsCollector metricsCollector) {
            this.metricsCollector = metricsCollector;
            return this;
        }

        public Builder strategy(LoadBalancingStrategy<String> strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder validator(RequestValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder modelTypeTtl(String modelType, Duration ttl) {
            this.modelTypeTtls.put(modelType, ttl);
            return this;
        }

        public Builder failoverEnabled(boolean failoverEnabled) {
            this.failoverEnabled = failoverEnabled;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder fromConfig(RouterConfig config) {
            RouterConfig.CacheConfig cache = config.getCache();
            this.cacheEnabled = cache.isEnabled();
            this.keyBuilder = new CacheKeyBuilder(cache.getKeyPrefix());
            this.defaultTtl = Duration.ofSeconds(cache.getDefaultTtlSeconds());
            this.modelTypeTtls = new HashMap<>();
            Map<String, ?> typeTtls = cache.getModelTypeTtlSeconds();
            for (Map.Entry<String, ?> entry : typeTtls.entrySet()) {
                this.modelTypeTtls.put(entry.getKey(), Duration.ofSeconds(((Number) entry.getValue()).longValue()));
            }
            this.failoverEnabled = config.getFailover().isEnabled();
            this.maxRetries = config.getFailover().getMaxRetries();
            this.validator = new RequestValidator(config.getValidation().getMaxPromptLength());
            return this;
        }

        public RequestRouter build() {
            return new RequestRouter(this);
        }
    }
}
