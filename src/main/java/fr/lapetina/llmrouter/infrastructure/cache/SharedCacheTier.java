package fr.lapetina.llmrouter.infrastructure.cache;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Remote, shared key-value store backing the second cache tier.
 *
 * <p>All operations are asynchronous. Failures are reported by completing the
 * returned future exceptionally; {@link ResponseCache} recovers from them.
 */
public interface SharedCacheTier extends AutoCloseable {

    /**
     * Reads a payload.
     *
     * @return The payload, or null when the key is absent or expired
     */
    CompletableFuture<byte[]> get(String key);

    /**
     * Writes a payload that expires after {@code ttl}.
     */
    CompletableFuture<Void> set(String key, byte[] payload, Duration ttl);

    /**
     * Deletes a key; absent keys are not an error.
     */
    CompletableFuture<Void> remove(String key);

    @Override
    default void close() {
        // Default no-op
    }
}
