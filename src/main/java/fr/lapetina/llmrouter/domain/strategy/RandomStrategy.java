package fr.lapetina.llmrouter.domain.strategy;

import java.util.List;
import java.util.Random;

/**
 * Random load balancing strategy.
 *
 * Uniformly picks one of the candidates. Simple but effective for
 * homogeneous model pools with similar capacities.
 *
 * Each instance owns its random source; {@link Random} is thread-safe.
 */
public final class RandomStrategy<T> implements LoadBalancingStrategy<T> {

    private final Random random;

    public RandomStrategy() {
        this(new Random());
    }

    public RandomStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public T selectNext(List<T> candidates, SelectionCriteria<T> criteria) {
        LoadBalancingStrategy.requireCandidates(candidates);

        return candidates.get(random.nextInt(candidates.size()));
    }
}
