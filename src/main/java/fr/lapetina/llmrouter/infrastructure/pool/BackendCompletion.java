package fr.lapetina.llmrouter.infrastructure.pool;

import fr.lapetina.llmrouter.domain.model.UsageStatistics;

/**
 * Raw result of a non-streaming backend invocation.
 *
 * @param content Generated text
 * @param usage Token usage, may be null if the backend does not report it
 */
public record BackendCompletion(String content, UsageStatistics usage) {

    public BackendCompletion {
        if (content == null) {
            content = "";
        }
    }

    public static BackendCompletion of(String content) {
        return new BackendCompletion(content, null);
    }
}
