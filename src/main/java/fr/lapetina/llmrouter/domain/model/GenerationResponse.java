package fr.lapetina.llmrouter.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Response produced by a backend, or replayed from the response cache.
 * Immutable and thread-safe; serialized as-is into the cache tiers.
 */
public record GenerationResponse(
        String responseId,
        String modelId,
        String content,
        UsageStatistics usage,
        Instant createdAt,
        Duration duration,
        boolean fromCache
) {
    public GenerationResponse {
        Objects.requireNonNull(responseId, "Response ID is required");
        Objects.requireNonNull(modelId, "Model ID is required");
        if (content == null) {
            content = "";
        }
        if (usage == null) {
            usage = UsageStatistics.empty();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    /**
     * Returns a copy marked as served from cache under a fresh response id.
     */
    public GenerationResponse asCacheHit(String newResponseId) {
        return new GenerationResponse(newResponseId, modelId, content, usage, createdAt, duration, true);
    }
}
