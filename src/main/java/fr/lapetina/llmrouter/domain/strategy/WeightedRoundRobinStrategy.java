package fr.lapetina.llmrouter.domain.strategy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted round-robin load balancing strategy.
 *
 * Distributes requests according to candidate weights. A candidate with weight 2
 * receives twice as many requests as a candidate with weight 1.
 *
 * Uses smooth weighted round-robin (SWRR): every candidate holds a running credit.
 * The candidate with the highest credit wins (first in list order on ties), pays the
 * total weight of the round, then every candidate earns its own weight back.
 *
 * Weights and credits are guarded by a single lock; weight changes are rare.
 */
public final class WeightedRoundRobinStrategy<T> implements LoadBalancingStrategy<T> {

    private static final int DEFAULT_WEIGHT = 1;

    private final Object lock = new Object();
    private final Map<T, Integer> weights = new HashMap<>();
    private final Map<T, Integer> credits = new HashMap<>();

    @Override
    public String getName() {
        return "weighted-round-robin";
    }

    @Override
    public T selectNext(List<T> candidates, SelectionCriteria<T> criteria) {
        LoadBalancingStrategy.requireCandidates(candidates);

        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        synchronized (lock) {
            T selected = null;
            int bestCredit = Integer.MIN_VALUE;
            int totalWeight = 0;

            for (T candidate : candidates) {
                int weight = weights.computeIfAbsent(candidate, c -> DEFAULT_WEIGHT);
                int credit = credits.computeIfAbsent(candidate, c -> weight);
                totalWeight += weight;
                if (credit > bestCredit) {
                    bestCredit = credit;
                    selected = candidate;
                }
            }

            credits.put(selected, bestCredit - totalWeight);
            for (T candidate : candidates) {
                credits.merge(candidate, weights.get(candidate), Integer::sum);
            }

            return selected;
        }
    }

    @Override
    public void setWeight(T candidate, int weight) {
        int effective = Math.max(DEFAULT_WEIGHT, weight);
        synchronized (lock) {
            weights.put(candidate, effective);
            credits.put(candidate, effective);
        }
    }

    /**
     * Returns the configured weight of a candidate, 1 if never set.
     */
    public int getWeight(T candidate) {
        synchronized (lock) {
            return weights.getOrDefault(candidate, DEFAULT_WEIGHT);
        }
    }

    @Override
    public void reset() {
        synchronized (lock) {
            credits.clear();
            weights.forEach(credits::put);
        }
    }
}
