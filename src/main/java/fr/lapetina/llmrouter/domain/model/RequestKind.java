package fr.lapetina.llmrouter.domain.model;

/**
 * Kind of tracked backend request, used as a metrics dimension.
 */
public enum RequestKind {
    TEXT_GENERATION,
    STREAMING
}
