package fr.lapetina.llmrouter.domain.model;

/**
 * Capabilities a model can advertise in the registry.
 * Requests may require a subset of these through {@link RoutingHints}.
 */
public enum ModelCapability {
    TEXT_GENERATION,
    FUNCTION_CALLING,
    STREAMING,
    EMBEDDING,
    VISION,
    CODE_GENERATION,
    TRANSLATION,
    SUMMARIZATION
}
