package fr.lapetina.llmrouter.infrastructure.pool;

/**
 * Exception thrown when the pool cannot provide a handle for a model.
 */
public final class InstanceCreationException extends RuntimeException {

    private final String modelId;

    public InstanceCreationException(String modelId, String message, Throwable cause) {
        super("Cannot create backend for model " + modelId + ": " + message, cause);
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }
}
