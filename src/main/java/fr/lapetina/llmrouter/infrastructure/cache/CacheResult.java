package fr.lapetina.llmrouter.infrastructure.cache;

import fr.lapetina.llmrouter.domain.model.CacheTier;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a cache lookup.
 *
 * <p>Cache operations never complete exceptionally. A broken tier or an unreadable
 * payload is reported as {@link Outcome#FAILURE} with its cause, so callers can tell
 * "not cached" from "cache broken" while still treating both as a miss.
 *
 * @param outcome Hit, miss or failure
 * @param value The cached value, only for hits
 * @param tier Tier that answered a hit, or the last tier consulted otherwise
 * @param failure Cause of a failure, null otherwise
 */
public record CacheResult<T>(Outcome outcome, T value, CacheTier tier, Throwable failure) {

    public enum Outcome {
        HIT,
        MISS,
        FAILURE
    }

    public CacheResult {
        Objects.requireNonNull(outcome, "Outcome is required");
        Objects.requireNonNull(tier, "Tier is required");
        if (outcome == Outcome.HIT) {
            Objects.requireNonNull(value, "A hit carries a value");
        }
        if (outcome == Outcome.FAILURE) {
            Objects.requireNonNull(failure, "A failure carries its cause");
        }
    }

    public static <T> CacheResult<T> hit(T value, CacheTier tier) {
        return new CacheResult<>(Outcome.HIT, value, tier, null);
    }

    public static <T> CacheResult<T> miss(CacheTier tier) {
        return new CacheResult<>(Outcome.MISS, null, tier, null);
    }

    public static <T> CacheResult<T> failure(CacheTier tier, Throwable cause) {
        return new CacheResult<>(Outcome.FAILURE, null, tier, cause);
    }

    public boolean isHit() {
        return outcome == Outcome.HIT;
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILURE;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
