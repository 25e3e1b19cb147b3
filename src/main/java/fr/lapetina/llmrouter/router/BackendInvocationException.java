package fr.lapetina.llmrouter.router;

import fr.lapetina.llmrouter.domain.model.ErrorKind;

/**
 * Exception thrown when the last attempted backend failed.
 * The cause is the exception raised by that backend.
 */
public final class BackendInvocationException extends RuntimeException {

    private final String modelId;
    private final ErrorKind errorKind;
    private final int attempts;

    public BackendInvocationException(String modelId, ErrorKind errorKind, int attempts, Throwable cause) {
        super("Backend invocation failed: model=" + modelId + ", kind=" + errorKind + ", attempts=" + attempts
                + (cause != null ? ", cause=" + cause.getMessage() : ""), cause);
        this.modelId = modelId;
        this.errorKind = errorKind;
        this.attempts = attempts;
    }

    public String getModelId() {
        return modelId;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /**
     * Returns the number of backends tried, failover included.
     */
    public int getAttempts() {
        return attempts;
    }
}
