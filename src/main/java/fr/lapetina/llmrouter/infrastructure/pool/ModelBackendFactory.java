package fr.lapetina.llmrouter.infrastructure.pool;

import fr.lapetina.llmrouter.domain.model.ModelDescriptor;

/**
 * Builds the execution handle of a model from its registry entry.
 * Construction may block, e.g. to load a model or open connections.
 */
@FunctionalInterface
public interface ModelBackendFactory {

    ModelBackend create(ModelDescriptor descriptor) throws Exception;
}
