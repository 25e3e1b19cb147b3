package fr.lapetina.llmrouter.domain.strategy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simple round-robin load balancing strategy.
 *
 * Cycles through candidates in list order. The first call returns the
 * first candidate.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy<T> implements LoadBalancingStrategy<T> {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public T selectNext(List<T> candidates, SelectionCriteria<T> criteria) {
        LoadBalancingStrategy.requireCandidates(candidates);

        // floorMod keeps the index valid once the counter wraps around
        int index = Math.floorMod(counter.getAndIncrement(), candidates.size());
        return candidates.get(index);
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
