package fr.lapetina.llmrouter.router;

/**
 * Exception thrown when a request cannot be routed to any backend.
 * Terminal: retrying the same request against the same registry fails again.
 */
public final class RoutingException extends RuntimeException {

    private final Reason reason;

    public RoutingException(Reason reason) {
        super("Routing failed: " + reason.getMessage());
        this.reason = reason;
    }

    public RoutingException(Reason reason, String details) {
        super("Routing failed: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public RoutingException(Reason reason, String details, Throwable cause) {
        super("Routing failed: " + reason.getMessage() + " - " + details, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        INVALID_REQUEST("Request is invalid"),
        NO_CANDIDATES("No enabled model is configured"),
        NO_CAPABLE_MODEL("No model satisfies the routing hints"),
        SELECTION_FAILED("Load balancing strategy failed");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
