/**
 * Per-model metrics and their Micrometer export.
 *
 * <p>{@link fr.lapetina.llmrouter.infrastructure.metrics.MetricsCollector} is the source of truth
 * the router reads back (health, latency for performance-based routing).
 * {@link fr.lapetina.llmrouter.infrastructure.metrics.MetricsRegistry} mirrors the same events
 * into Micrometer meters for Prometheus scraping.
 */
package fr.lapetina.llmrouter.infrastructure.metrics;
