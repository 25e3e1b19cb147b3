/**
 * Request routing.
 *
 * <p>{@link fr.lapetina.llmrouter.router.RequestRouter} ties the response cache, the
 * model registry, the load balancing strategy, the instance pool and the metrics
 * collector together. Requests are rejected early by
 * {@link fr.lapetina.llmrouter.router.RequestValidator}; routing failures surface as
 * {@link fr.lapetina.llmrouter.router.RoutingException} and exhausted backend attempts
 * as {@link fr.lapetina.llmrouter.router.BackendInvocationException}.
 */
package fr.lapetina.llmrouter.router;
