package fr.lapetina.llmrouter.infrastructure.pool;

import fr.lapetina.llmrouter.domain.model.ModelDescriptor;
import fr.lapetina.llmrouter.infrastructure.config.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pool of backend handles, one per model id.
 *
 * <p>Handles are built lazily on first {@link #acquire}. The map holds a future per model,
 * inserted with {@code putIfAbsent}, so concurrent first accesses share one construction
 * while construction itself runs outside any lock, on the construction executor. A failed
 * construction is removed again and the next acquire retries.
 *
 * <p>Handles live until disposed: explicitly, after a configuration change touching their
 * model, when idle longer than the idle timeout, or when the pool closes.
 */
public final class InstancePool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InstancePool.class);

    private final ModelRegistry modelRegistry;
    private final ModelBackendFactory backendFactory;
    private final Executor constructionExecutor;
    private final ExecutorService ownedExecutor;
    private final Duration idleTimeout;
    private final Duration cleanupInterval;
    private final ConcurrentHashMap<String, PooledHandle> handles = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ScheduledExecutorService cleanupScheduler;

    public InstancePool(
            ModelRegistry modelRegistry,
            ModelBackendFactory backendFactory,
            Executor constructionExecutor,
            Duration idleTimeout,
            Duration cleanupInterval
    ) {
        this.modelRegistry = Objects.requireNonNull(modelRegistry, "Model registry is required");
        this.backendFactory = Objects.requireNonNull(backendFactory, "Backend factory is required");
        if (constructionExecutor != null) {
            this.constructionExecutor = constructionExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads("instance-pool-init"));
            this.constructionExecutor = ownedExecutor;
        }
        this.idleTimeout = idleTimeout;
        this.cleanupInterval = cleanupInterval;
    }

    public InstancePool(ModelRegistry modelRegistry, ModelBackendFactory backendFactory) {
        this(modelRegistry, backendFactory, null, Duration.ofMinutes(30), Duration.ofMinutes(5));
    }

    /**
     * Starts the periodic eviction of idle handles.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            cleanupScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("instance-pool-cleanup"));
            cleanupScheduler.scheduleWithFixedDelay(
                    this::evictIdleHandles,
                    cleanupInterval.toMillis(),
                    cleanupInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Instance pool cleanup started: interval={}, idleTimeout={}", cleanupInterval, idleTimeout);
        }
    }

    /**
     * Returns the handle of a model, constructing it on first use.
     *
     * <p>The returned future is private to the caller: cancelling it does not affect
     * the shared construction.
     *
     * @return Future of the handle, failed with {@link InstanceCreationException}
     *         if the model is unknown or its construction failed
     */
    public CompletableFuture<ModelBackend> acquire(String modelId) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Instance pool is closed"));
        }

        PooledHandle pooled = handles.get(modelId);
        if (pooled == null) {
            Optional<ModelDescriptor> descriptor = modelRegistry.find(modelId);
            if (descriptor.isEmpty()) {
                return CompletableFuture.failedFuture(
                        new InstanceCreationException(modelId, "model is not registered", null));
            }
            if (!descriptor.get().enabled()) {
                return CompletableFuture.failedFuture(
                        new InstanceCreationException(modelId, "model is disabled", null));
            }

            PooledHandle candidate = new PooledHandle(descriptor.get());
            pooled = handles.putIfAbsent(modelId, candidate);
            if (pooled == null) {
                pooled = candidate;
                scheduleConstruction(candidate);
            }
        }

        pooled.touch();
        return pooled.future.copy();
    }

    private void scheduleConstruction(PooledHandle pooled) {
        try {
            constructionExecutor.execute(() -> construct(pooled));
        } catch (RejectedExecutionException e) {
            handles.remove(pooled.descriptor.id(), pooled);
            pooled.future.completeExceptionally(
                    new InstanceCreationException(pooled.descriptor.id(), "construction rejected", e));
        }
    }

    private void construct(PooledHandle pooled) {
        String modelId = pooled.descriptor.id();
        long start = System.nanoTime();
        try {
            ModelBackend backend = backendFactory.create(pooled.descriptor);
            if (backend == null) {
                throw new IllegalStateException("Backend factory returned null");
            }
            pooled.future.complete(backend);
            log.info("Backend handle created: model={}, durationMs={}",
                    modelId, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        } catch (Exception e) {
            handles.remove(modelId, pooled);
            pooled.future.completeExceptionally(
                    new InstanceCreationException(modelId, e.getMessage() != null ? e.getMessage() : e.toString(), e));
            log.error("Backend handle creation failed: model={}", modelId, e);
        }
    }

    /**
     * Evicts and closes the handle of a model.
     * A handle still under construction is closed as soon as it is ready.
     *
     * @return true if a handle was pooled
     */
    public boolean dispose(String modelId) {
        PooledHandle removed = handles.remove(modelId);
        if (removed == null) {
            return false;
        }
        closeWhenReady(removed);
        log.info("Backend handle disposed: model={}", modelId);
        return true;
    }

    /**
     * Disposes handles whose model is no longer registered or whose descriptor changed.
     *
     * @param current The registry contents after a reconfiguration
     * @return Number of handles disposed
     */
    public int reconcile(Collection<ModelDescriptor> current) {
        Map<String, ModelDescriptor> byId = current.stream()
                .collect(Collectors.toMap(ModelDescriptor::id, Function.identity(), (first, second) -> second));

        int disposed = 0;
        for (Map.Entry<String, PooledHandle> entry : handles.entrySet()) {
            ModelDescriptor updated = byId.get(entry.getKey());
            boolean stale = updated == null || !updated.enabled() || !updated.equals(entry.getValue().descriptor);
            if (stale && handles.remove(entry.getKey(), entry.getValue())) {
                closeWhenReady(entry.getValue());
                disposed++;
                log.info("Backend handle disposed after reconfiguration: model={}", entry.getKey());
            }
        }
        return disposed;
    }

    /**
     * Disposes handles not acquired for at least {@code maxIdle}.
     *
     * @return Number of handles disposed
     */
    public int evictIdle(Duration maxIdle) {
        long now = System.nanoTime();
        long maxIdleNanos = maxIdle.toNanos();
        int evicted = 0;

        for (Map.Entry<String, PooledHandle> entry : handles.entrySet()) {
            PooledHandle pooled = entry.getValue();
            boolean ready = pooled.future.isDone() && !pooled.future.isCompletedExceptionally();
            if (ready && now - pooled.lastAccessNanos >= maxIdleNanos
                    && handles.remove(entry.getKey(), pooled)) {
                closeWhenReady(pooled);
                evicted++;
                log.info("Idle backend handle evicted: model={}", entry.getKey());
            }
        }
        return evicted;
    }

    private void evictIdleHandles() {
        try {
            int evicted = evictIdle(idleTimeout);
            log.debug("Idle handle cleanup finished: evicted={}, remaining={}", evicted, handles.size());
        } catch (Exception e) {
            log.error("Idle handle cleanup failed", e);
        }
    }

    private void closeWhenReady(PooledHandle pooled) {
        pooled.future.thenAccept(backend -> {
            try {
                backend.close();
            } catch (Exception e) {
                log.warn("Error closing backend handle: model={}", pooled.descriptor.id(), e);
            }
        });
    }

    /**
     * Returns true if a handle for the model is pooled or under construction.
     */
    public boolean contains(String modelId) {
        return handles.containsKey(modelId);
    }

    public int size() {
        return handles.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdown();
            try {
                cleanupScheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (String modelId : handles.keySet()) {
            dispose(modelId);
        }

        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        log.info("Instance pool closed");
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class PooledHandle {
        private final ModelDescriptor descriptor;
        private final CompletableFuture<ModelBackend> future = new CompletableFuture<>();
        private volatile long lastAccessNanos = System.nanoTime();

        private PooledHandle(ModelDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        private void touch() {
            lastAccessNanos = System.nanoTime();
        }
    }
}
