package fr.lapetina.llmrouter.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Local-tier entry: the serialized payload plus the type it was stored as.
 * Entries are immutable; a refresh replaces the entry.
 */
record CacheEntry(String key, byte[] payload, String valueType, Instant createdAt, Duration ttl) {

    CacheEntry {
        Objects.requireNonNull(key, "Key is required");
        Objects.requireNonNull(payload, "Payload is required");
        Objects.requireNonNull(ttl, "TTL is required");
    }

    boolean holds(Class<?> type) {
        return type.getName().equals(valueType);
    }
}
