package fr.lapetina.llmrouter.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A text-generation request to be routed to one of the configured models.
 * Immutable and thread-safe; two requests with equal fields are the same request
 * for caching purposes.
 *
 * <p>The model id is either a registered model or one of the automatic aliases
 * ({@code auto}, {@code default}) that let the routing strategy choose.
 */
public record GenerationRequest(
        String modelId,
        String systemPrompt,
        String userPrompt,
        List<ChatMessage> history,
        Map<String, Object> executionSettings,
        RoutingHints routingHints
) {
    public static final String AUTO_MODEL = "auto";
    public static final String DEFAULT_MODEL = "default";

    public GenerationRequest {
        history = history != null ? List.copyOf(history) : List.of();
        // Map.copyOf rejects null values and loses ordering, settings may carry both
        executionSettings = executionSettings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(executionSettings))
                : Map.of();
        if (routingHints == null) {
            routingHints = RoutingHints.none();
        }
    }

    /**
     * Returns true if the request leaves model selection to the routing strategy.
     */
    public boolean isAutomaticModel() {
        return modelId == null
                || AUTO_MODEL.equalsIgnoreCase(modelId)
                || DEFAULT_MODEL.equalsIgnoreCase(modelId);
    }

    /**
     * Chat message for conversation-style requests.
     */
    public record ChatMessage(String role, String content) {

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }

        public static ChatMessage assistant(String content) {
            return new ChatMessage("assistant", content);
        }
    }

    /**
     * Creates a simple prompt-based request.
     */
    public static GenerationRequest ofPrompt(String modelId, String userPrompt) {
        return new GenerationRequest(modelId, null, userPrompt, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String modelId;
        private String systemPrompt;
        private String userPrompt;
        private final List<ChatMessage> history = new ArrayList<>();
        private final Map<String, Object> executionSettings = new LinkedHashMap<>();
        private RoutingHints routingHints;

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder userPrompt(String userPrompt) {
            this.userPrompt = userPrompt;
            return this;
        }

        public Builder history(List<ChatMessage> history) {
            this.history.clear();
            this.history.addAll(history);
            return this;
        }

        public Builder addMessage(String role, String content) {
            return addMessage(new ChatMessage(role, content));
        }

        public Builder addMessage(ChatMessage message) {
            this.history.add(message);
            return this;
        }

        public Builder executionSettings(Map<String, Object> executionSettings) {
            this.executionSettings.clear();
            this.executionSettings.putAll(executionSettings);
            return this;
        }

        public Builder setting(String name, Object value) {
            this.executionSettings.put(Objects.requireNonNull(name, "Setting name is required"), value);
            return this;
        }

        public Builder routingHints(RoutingHints routingHints) {
            this.routingHints = routingHints;
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(
                    modelId, systemPrompt, userPrompt, history, executionSettings, routingHints
            );
        }
    }
}
