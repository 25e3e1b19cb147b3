package fr.lapetina.llmrouter.router;

import fr.lapetina.llmrouter.domain.model.GenerationRequest;

/**
 * Validates generation requests before any cache or backend work.
 *
 * Validates:
 * - Request is not null
 * - Model id is present
 * - User prompt or history is present
 * - Prompt and message sizes are within limits
 * - History messages carry a role and a content
 */
public final class RequestValidator {

    private final int maxPromptLength;

    public RequestValidator(int maxPromptLength) {
        this.maxPromptLength = maxPromptLength;
    }

    /**
     * Creates a validator with the default prompt length.
     */
    public static RequestValidator withDefaults() {
        return new RequestValidator(100_000);
    }

    /**
     * @throws RoutingException with reason {@link RoutingException.Reason#INVALID_REQUEST}
     */
    public void validate(GenerationRequest request) {
        if (request == null) {
            throw invalid("Request is null");
        }

        String modelId = request.modelId();
        if (modelId == null || modelId.isBlank()) {
            throw invalid("Model id is required");
        }

        String userPrompt = request.userPrompt();
        if ((userPrompt == null || userPrompt.isBlank()) && request.history().isEmpty()) {
            throw invalid("Either user prompt or history must be provided");
        }

        checkLength(userPrompt, "User prompt");
        checkLength(request.systemPrompt(), "System prompt");

        for (GenerationRequest.ChatMessage message : request.history()) {
            if (message == null) {
                throw invalid("History message is null");
            }
            if (message.role() == null || message.role().isBlank()) {
                throw invalid("Message role is required");
            }
            if (message.content() == null) {
                throw invalid("Message content is required");
            }
            checkLength(message.content(), "Message content");
        }
    }

    private void checkLength(String text, String field) {
        if (text != null && text.length() > maxPromptLength) {
            throw invalid(field + " exceeds maximum length of " + maxPromptLength);
        }
    }

    private static RoutingException invalid(String details) {
        return new RoutingException(RoutingException.Reason.INVALID_REQUEST, details);
    }
}
