package fr.lapetina.llmrouter.infrastructure.pool;

import fr.lapetina.llmrouter.domain.model.ModelDescriptor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backend factory for tests. Hands out one {@link StubModelBackend} per model id,
 * counts constructions and can be told to fail or block them.
 */
public final class StubBackendFactory implements ModelBackendFactory {

    private final Map<String, StubModelBackend> backends = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> creations = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> pendingCreationFailures = new ConcurrentHashMap<>();
    private volatile CountDownLatch gate;

    @Override
    public ModelBackend create(ModelDescriptor descriptor) throws Exception {
        creations.computeIfAbsent(descriptor.id(), id -> new AtomicInteger()).incrementAndGet();

        CountDownLatch currentGate = gate;
        if (currentGate != null && !currentGate.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("Construction gate never opened");
        }

        AtomicInteger failures = pendingCreationFailures.get(descriptor.id());
        if (failures != null && failures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("Model weights not found for " + descriptor.id());
        }

        return backend(descriptor.id());
    }

    /**
     * Returns the stub serving a model, creating it on first use.
     */
    public StubModelBackend backend(String modelId) {
        return backends.computeIfAbsent(modelId, StubModelBackend::new);
    }

    public void failCreation(String modelId, int times) {
        pendingCreationFailures.computeIfAbsent(modelId, id -> new AtomicInteger()).set(times);
    }

    /**
     * Blocks every construction until the returned latch is counted down.
     */
    public CountDownLatch blockCreation() {
        CountDownLatch latch = new CountDownLatch(1);
        gate = latch;
        return latch;
    }

    public int getCreationCount(String modelId) {
        AtomicInteger count = creations.get(modelId);
        return count != null ? count.get() : 0;
    }
}
