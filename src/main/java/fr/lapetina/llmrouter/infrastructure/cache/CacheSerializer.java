package fr.lapetina.llmrouter.infrastructure.cache;

/**
 * Byte encoding of cached values.
 *
 * <p>Implementations must round-trip: {@code deserialize(serialize(v), type)} equals {@code v}
 * for every value the cache stores.
 */
public interface CacheSerializer {

    /**
     * Encodes a value.
     *
     * @throws CacheSerializationException if the value cannot be encoded
     */
    byte[] serialize(Object value);

    /**
     * Decodes a value of the given type.
     *
     * @throws CacheSerializationException if the payload is corrupted or of another type
     */
    <T> T deserialize(byte[] payload, Class<T> type);
}
