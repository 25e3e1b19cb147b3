package fr.lapetina.llmrouter.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Compact UTF-8 JSON encoding: no indentation, nulls omitted, map keys sorted.
 */
public final class JsonCacheSerializer implements CacheSerializer {

    private final ObjectMapper objectMapper;

    public JsonCacheSerializer() {
        this(defaultObjectMapper());
    }

    public JsonCacheSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the mapper used for cache payloads and key fingerprints.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Override
    public byte[] serialize(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(
                    "Cannot serialize value of type " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] payload, Class<T> type) {
        try {
            T value = objectMapper.readValue(payload, type);
            if (value == null) {
                throw new CacheSerializationException("Payload decodes to null for " + type.getName(), null);
            }
            return value;
        } catch (IOException e) {
            throw new CacheSerializationException("Cannot deserialize payload as " + type.getName(), e);
        }
    }
}
