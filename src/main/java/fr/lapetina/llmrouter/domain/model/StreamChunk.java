package fr.lapetina.llmrouter.domain.model;

/**
 * One incremental piece of a streamed generation.
 * The last chunk of a stream has {@code complete} set and an empty delta.
 */
public record StreamChunk(
        String responseId,
        String modelId,
        String delta,
        int sequence,
        boolean complete
) {
    public static StreamChunk of(String responseId, String modelId, String delta, int sequence) {
        return new StreamChunk(responseId, modelId, delta, sequence, false);
    }

    public static StreamChunk last(String responseId, String modelId, int sequence) {
        return new StreamChunk(responseId, modelId, "", sequence, true);
    }
}
