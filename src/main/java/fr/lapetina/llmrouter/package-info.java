/**
 * LLM request router.
 *
 * <p>Entry point is {@link fr.lapetina.llmrouter.RouterFactory}, which wires the router
 * from a YAML configuration file and a {@link fr.lapetina.llmrouter.infrastructure.pool.ModelBackendFactory}
 * supplying the actual model backends.
 *
 * <p>Package layout:
 * <ul>
 *   <li>{@code domain.model} - requests, responses and model descriptors</li>
 *   <li>{@code domain.strategy} - load balancing strategies</li>
 *   <li>{@code infrastructure.cache} - two-tier response cache</li>
 *   <li>{@code infrastructure.metrics} - per-model statistics and Micrometer export</li>
 *   <li>{@code infrastructure.pool} - lazily created model backend handles</li>
 *   <li>{@code infrastructure.config} - YAML configuration and model registry</li>
 *   <li>{@code router} - request routing and failover</li>
 * </ul>
 */
package fr.lapetina.llmrouter;
