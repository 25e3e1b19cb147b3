/**
 * Lazily built, shared backend handles.
 *
 * <p>Backend engines plug in through {@link fr.lapetina.llmrouter.infrastructure.pool.ModelBackendFactory};
 * {@link fr.lapetina.llmrouter.infrastructure.pool.InstancePool} guarantees one live handle per model id.
 */
package fr.lapetina.llmrouter.infrastructure.pool;
