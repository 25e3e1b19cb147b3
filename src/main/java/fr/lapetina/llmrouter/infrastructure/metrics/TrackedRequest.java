package fr.lapetina.llmrouter.infrastructure.metrics;

import fr.lapetina.llmrouter.domain.model.RequestKind;

import java.time.Duration;
import java.time.Instant;

/**
 * A backend request between {@code startRequest} and {@code endRequest}.
 *
 * @param trackingId Opaque id handed to the caller
 * @param startNanos {@link System#nanoTime()} at start, for elapsed time
 */
public record TrackedRequest(
        String trackingId,
        String modelId,
        RequestKind kind,
        Instant startedAt,
        long startNanos
) {
    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
