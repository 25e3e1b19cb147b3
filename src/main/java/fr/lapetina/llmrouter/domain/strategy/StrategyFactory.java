package fr.lapetina.llmrouter.domain.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry mapping strategy names to strategy constructors.
 *
 * Every instance owns its registry, so tests and routers never share
 * strategies or their counters. Supports runtime strategy switching
 * without service restart.
 *
 * @param <T> candidate type of the strategies produced
 */
public final class StrategyFactory<T> {

    public static final String DEFAULT_STRATEGY = "round-robin";

    private final Map<String, Supplier<LoadBalancingStrategy<T>>> registry = new ConcurrentHashMap<>();

    /**
     * Creates a factory with the built-in strategies registered.
     */
    public static <T> StrategyFactory<T> withBuiltIns() {
        StrategyFactory<T> factory = new StrategyFactory<>();
        factory.register("round-robin", RoundRobinStrategy::new);
        factory.register("random", RandomStrategy::new);
        factory.register("weighted-round-robin", WeightedRoundRobinStrategy::new);
        factory.register("performance-based", PerformanceBasedStrategy::new);
        return factory;
    }

    /**
     * Registers a custom strategy, replacing any previous registration under the same name.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public void register(String name, Supplier<LoadBalancingStrategy<T>> supplier) {
        registry.put(normalize(name), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @param name Strategy name from configuration
     * @return Fresh strategy instance, or empty if not found
     */
    public Optional<LoadBalancingStrategy<T>> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<LoadBalancingStrategy<T>> supplier = registry.get(normalize(name));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, with default fallback.
     *
     * @param name Strategy name from configuration
     * @param defaultStrategy Default if name not found
     * @return Strategy instance
     */
    public LoadBalancingStrategy<T> createOrDefault(String name, LoadBalancingStrategy<T> defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    /**
     * Returns all registered strategy names.
     */
    public Set<String> getRegisteredNames() {
        return Set.copyOf(registry.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
