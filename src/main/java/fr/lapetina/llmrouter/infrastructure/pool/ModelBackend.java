package fr.lapetina.llmrouter.infrastructure.pool;

import fr.lapetina.llmrouter.domain.model.GenerationRequest;
import fr.lapetina.llmrouter.domain.model.UsageStatistics;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Execution handle for one model, provided by a backend engine.
 *
 * <p>Handles are created once per model by {@link InstancePool} and shared by all
 * concurrent requests, so implementations must be thread-safe. Failures are reported
 * by completing the returned future exceptionally. Cancelling a returned future asks
 * the backend to abandon the call.
 */
public interface ModelBackend extends AutoCloseable {

    /**
     * Returns the id of the model this handle serves.
     */
    String modelId();

    /**
     * Generates a complete response.
     */
    CompletableFuture<BackendCompletion> invoke(GenerationRequest request);

    /**
     * Generates a response incrementally.
     *
     * @param onDelta Receives each text fragment in order
     * @return Usage once the stream ended, may complete with null
     */
    CompletableFuture<UsageStatistics> invokeStream(GenerationRequest request, Consumer<String> onDelta);

    /**
     * Releases the handle's resources. Called once, when the pool disposes it.
     */
    @Override
    default void close() {
        // Default no-op
    }
}
