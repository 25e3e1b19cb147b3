/**
 * Load balancing strategies for picking the model that serves a request.
 *
 * <p>This package provides pluggable strategy implementations following the Strategy pattern.
 * Strategies are generic over the candidate type; the router uses model ids.
 * All implementations are thread-safe and keep their state per instance.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th><th>Best For</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through candidates in order</td><td>Homogeneous models</td></tr>
 *   <tr><td>{@code weighted-round-robin}</td><td>Smooth weighted round-robin</td><td>Heterogeneous capacities</td></tr>
 *   <tr><td>{@code random}</td><td>Uniform random selection</td><td>Simple, low overhead</td></tr>
 *   <tr><td>{@code performance-based}</td><td>Healthiest, then fastest</td><td>Variable response times</td></tr>
 * </table>
 *
 * <h2>Custom Strategies</h2>
 * <p>Implement {@link fr.lapetina.llmrouter.domain.strategy.LoadBalancingStrategy} and register
 * it with a {@link fr.lapetina.llmrouter.domain.strategy.StrategyFactory}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * StrategyFactory<String> factory = StrategyFactory.withBuiltIns();
 * LoadBalancingStrategy<String> strategy = factory.create("performance-based").orElseThrow();
 * String modelId = strategy.selectNext(List.of("gpt-small", "gpt-large"),
 *         SelectionCriteria.withPerformance(metricsCollector::getPerformance));
 * }</pre>
 *
 * @see fr.lapetina.llmrouter.domain.strategy.LoadBalancingStrategy
 * @see fr.lapetina.llmrouter.domain.strategy.StrategyFactory
 */
package fr.lapetina.llmrouter.domain.strategy;
