package fr.lapetina.llmrouter.infrastructure.config;

import fr.lapetina.llmrouter.domain.model.ModelDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the routable models.
 *
 * <p>The router reads one snapshot per request. Implementations replace snapshots
 * atomically; a snapshot never changes once returned.
 */
public interface ModelRegistry {

    /**
     * Returns all registered models in their configured order.
     */
    List<ModelDescriptor> snapshot();

    /**
     * Looks up one model.
     */
    Optional<ModelDescriptor> find(String modelId);
}
