package fr.lapetina.llmrouter.infrastructure.cache;

/**
 * Raised by a {@link CacheSerializer} that cannot encode or decode a value.
 */
public final class CacheSerializationException extends RuntimeException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
