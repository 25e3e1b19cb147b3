/**
 * Domain model classes representing core concepts of the router.
 *
 * <p>This package contains immutable value objects shared by the routing,
 * caching and metrics layers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.GenerationRequest} - Immutable request to be routed</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.GenerationResponse} - Immutable response, cacheable</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.ModelDescriptor} - Registry entry for one routable model</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.HealthSnapshot} - Error-rate based health of a model</li>
 *   <li>{@link fr.lapetina.llmrouter.domain.model.ErrorKind} - Categorized error types for metrics</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All types are records or enums. Collections are copied on construction,
 * so instances can be shared freely across threads and cached.
 */
package fr.lapetina.llmrouter.domain.model;
