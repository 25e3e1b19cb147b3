package fr.lapetina.llmrouter.domain.strategy;

import java.util.List;

/**
 * Strategy interface for picking one candidate out of a non-empty list.
 *
 * Implementations must be thread-safe as they will be called from
 * many routing threads concurrently. State such as counters or weight
 * tables belongs to the strategy instance, never to static fields.
 *
 * @param <T> candidate type, compared with {@code equals}
 */
public interface LoadBalancingStrategy<T> {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects the next candidate.
     *
     * @param candidates Candidates in their stable configured order
     * @param criteria Optional signals such as per-candidate performance
     * @return The selected candidate
     * @throws IllegalStateException if {@code candidates} is empty
     */
    T selectNext(List<T> candidates, SelectionCriteria<T> criteria);

    /**
     * Selects the next candidate without any selection criteria.
     */
    default T selectNext(List<T> candidates) {
        return selectNext(candidates, SelectionCriteria.none());
    }

    /**
     * Sets the relative weight of a candidate.
     * Ignored by strategies that are not weight-aware.
     *
     * @param candidate The candidate
     * @param weight Its weight, values below 1 are raised to 1
     */
    default void setWeight(T candidate, int weight) {
        // Default no-op, override for weight-aware strategies
    }

    /**
     * Resets any internal state. Called when the model registry is reloaded.
     */
    default void reset() {
        // Default no-op
    }

    /**
     * Guards the common precondition of every strategy.
     */
    static <T> void requireCandidates(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalStateException("No candidates to select from");
        }
    }
}
