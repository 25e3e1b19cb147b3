package fr.lapetina.llmrouter.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import fr.lapetina.llmrouter.domain.model.CacheTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Two-tier response cache.
 *
 * <p>The local tier is a bounded in-process Caffeine cache with a TTL per entry.
 * The optional shared tier is a remote store reached through {@link SharedCacheTier}.
 * Reads try the local tier first, then the shared tier, and copy shared hits into the
 * local tier. Writes go to both tiers; the local copy never outlives the requested TTL.
 *
 * <p>Caching is best-effort: no operation completes exceptionally. Tier errors and
 * unreadable payloads are logged and reported as {@link CacheResult.Outcome#FAILURE}.
 */
public final class ResponseCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final Cache<String, CacheEntry> localTier;
    private final SharedCacheTier sharedTier;
    private final CacheSerializer serializer;
    private final Duration localTtl;
    private final Duration sharedTtl;
    private final Clock clock;

    private ResponseCache(Builder builder) {
        this.serializer = Objects.requireNonNull(builder.serializer, "Serializer is required");
        this.sharedTier = builder.sharedTier;
        this.localTtl = builder.localTtl;
        this.sharedTtl = builder.sharedTtl;
        this.clock = builder.clock;
        this.localTier = Caffeine.newBuilder()
                .maximumSize(builder.maxLocalEntries)
                .expireAfter(new EntryExpiry())
                .ticker(builder.ticker)
                .build();

        log.info("Response cache initialized: maxLocalEntries={}, localTtl={}, sharedTier={}, sharedTtl={}",
                builder.maxLocalEntries, localTtl, sharedTier != null ? "enabled" : "disabled", sharedTtl);
    }

    /**
     * Looks up a value, local tier first.
     *
     * @return A future that always completes normally with the lookup outcome
     */
    public <T> CompletableFuture<CacheResult<T>> get(String key, Class<T> type) {
        if (isBlank(key) || type == null) {
            log.debug("Cache lookup skipped: key={}, type={}", key, type);
            return CompletableFuture.completedFuture(CacheResult.miss(CacheTier.LOCAL));
        }

        CacheEntry entry = localTier.getIfPresent(key);
        if (entry != null) {
            try {
                if (!entry.holds(type)) {
                    throw new CacheSerializationException(
                            "Entry holds " + entry.valueType() + ", requested " + type.getName(), null);
                }
                T value = serializer.deserialize(entry.payload(), type);
                log.debug("Cache hit: tier={}, key={}", CacheTier.LOCAL, key);
                return CompletableFuture.completedFuture(CacheResult.hit(value, CacheTier.LOCAL));
            } catch (CacheSerializationException e) {
                localTier.invalidate(key);
                log.warn("Dropping unreadable local cache entry: key={}, reason={}", key, e.getMessage());
                return CompletableFuture.completedFuture(CacheResult.failure(CacheTier.LOCAL, e));
            }
        }

        if (sharedTier == null) {
            log.debug("Cache miss: tier={}, key={}", CacheTier.LOCAL, key);
            return CompletableFuture.completedFuture(CacheResult.miss(CacheTier.LOCAL));
        }

        try {
            return sharedTier.get(key)
                    .handle((payload, error) -> onSharedRead(key, type, payload, error));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(onSharedRead(key, type, null, e));
        }
    }

    private <T> CacheResult<T> onSharedRead(String key, Class<T> type, byte[] payload, Throwable error) {
        if (error != null) {
            Throwable cause = unwrap(error);
            log.warn("Shared cache read failed: key={}, error={}", key, cause.toString());
            return CacheResult.failure(CacheTier.SHARED, cause);
        }
        if (payload == null) {
            log.debug("Cache miss: tier={}, key={}", CacheTier.SHARED, key);
            return CacheResult.miss(CacheTier.SHARED);
        }
        try {
            T value = serializer.deserialize(payload, type);
            localTier.put(key, new CacheEntry(key, payload, type.getName(), clock.instant(), localTtl));
            log.debug("Cache hit: tier={}, key={}", CacheTier.SHARED, key);
            return CacheResult.hit(value, CacheTier.SHARED);
        } catch (CacheSerializationException e) {
            log.warn("Unreadable shared cache payload treated as miss: key={}, reason={}", key, e.getMessage());
            return CacheResult.failure(CacheTier.SHARED, e);
        }
    }

    /**
     * Stores a value in both tiers.
     *
     * @param ttl Requested lifetime, or null for each tier's default
     * @return A future that completes, normally, once the shared write finished
     */
    public CompletableFuture<Void> set(String key, Object value, Duration ttl) {
        if (isBlank(key) || value == null) {
            log.debug("Skipping cache write without key or value: key={}", key);
            return CompletableFuture.completedFuture(null);
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            log.debug("Skipping cache write with non-positive TTL: key={}, ttl={}", key, ttl);
            return CompletableFuture.completedFuture(null);
        }

        byte[] payload;
        try {
            payload = serializer.serialize(value);
        } catch (CacheSerializationException e) {
            log.warn("Value not cached, serialization failed: key={}, reason={}", key, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }

        Duration localExpiry = ttl == null || ttl.compareTo(localTtl) > 0 ? localTtl : ttl;
        localTier.put(key, new CacheEntry(key, payload, value.getClass().getName(), clock.instant(), localExpiry));

        if (sharedTier == null) {
            return CompletableFuture.completedFuture(null);
        }

        Duration sharedExpiry = ttl != null ? ttl : sharedTtl;
        try {
            return sharedTier.set(key, payload, sharedExpiry)
                    .exceptionally(error -> {
                        log.warn("Shared cache write failed: key={}, error={}", key, unwrap(error).toString());
                        return null;
                    });
        } catch (RuntimeException e) {
            log.warn("Shared cache write failed: key={}, error={}", key, e.toString());
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Removes a key from both tiers.
     */
    public CompletableFuture<Void> remove(String key) {
        if (isBlank(key)) {
            return CompletableFuture.completedFuture(null);
        }
        localTier.invalidate(key);

        if (sharedTier == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return sharedTier.remove(key)
                    .exceptionally(error -> {
                        log.warn("Shared cache delete failed: key={}, error={}", key, unwrap(error).toString());
                        return null;
                    });
        } catch (RuntimeException e) {
            log.warn("Shared cache delete failed: key={}, error={}", key, e.toString());
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Empties the local tier. The shared tier is left untouched, other processes use it.
     */
    public void clear() {
        localTier.invalidateAll();
        localTier.cleanUp();
        log.info("Local cache tier cleared");
    }

    /**
     * Returns the approximate number of live local entries.
     */
    public long localSize() {
        localTier.cleanUp();
        return localTier.estimatedSize();
    }

    private static boolean isBlank(String key) {
        return key == null || key.isBlank();
    }

    public boolean hasSharedTier() {
        return sharedTier != null;
    }

    @Override
    public void close() {
        if (sharedTier != null) {
            try {
                sharedTier.close();
            } catch (Exception e) {
                log.warn("Error closing shared cache tier", e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Expires every entry after its own TTL; reads do not extend it.
     */
    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CacheSerializer serializer = new JsonCacheSerializer();
        private SharedCacheTier sharedTier;
        private long maxLocalEntries = 10_000;
        private Duration localTtl = Duration.ofMinutes(60);
        private Duration sharedTtl = Duration.ofHours(24);
        private Ticker ticker = Ticker.systemTicker();
        private Clock clock = Clock.systemUTC();

        public Builder serializer(CacheSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder sharedTier(SharedCacheTier sharedTier) {
            this.sharedTier = sharedTier;
            return this;
        }

        public Builder maxLocalEntries(long maxLocalEntries) {
            this.maxLocalEntries = maxLocalEntries;
            return this;
        }

        public Builder localTtl(Duration localTtl) {
            this.localTtl = localTtl;
            return this;
        }

        public Builder sharedTtl(Duration sharedTtl) {
            this.sharedTtl = sharedTtl;
            return this;
        }

        /**
         * Time source for local-tier expiry, replaceable in tests.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ResponseCache build() {
            if (maxLocalEntries <= 0) {
                throw new IllegalArgumentException("maxLocalEntries must be positive");
            }
            if (localTtl == null || localTtl.isZero() || localTtl.isNegative()) {
                throw new IllegalArgumentException("localTtl must be positive");
            }
            if (sharedTtl == null || sharedTtl.isZero() || sharedTtl.isNegative()) {
                throw new IllegalArgumentException("sharedTtl must be positive");
            }
            return new ResponseCache(this);
        }
    }
}
