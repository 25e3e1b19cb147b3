package fr.lapetina.llmrouter.domain.strategy;

import fr.lapetina.llmrouter.domain.model.HealthStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Performance-based load balancing strategy.
 *
 * Ranks candidates by health first (healthy, then unknown, then unhealthy) and by
 * ascending average latency second, then picks uniformly among the candidates
 * sharing the best rank. Without performance criteria every candidate ties, so
 * the strategy degrades to a random pick.
 */
public final class PerformanceBasedStrategy<T> implements LoadBalancingStrategy<T> {

    private final Random random;

    public PerformanceBasedStrategy() {
        this(new Random());
    }

    public PerformanceBasedStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "performance-based";
    }

    @Override
    public T selectNext(List<T> candidates, SelectionCriteria<T> criteria) {
        LoadBalancingStrategy.requireCandidates(candidates);

        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        SelectionCriteria<T> effective = criteria != null ? criteria : SelectionCriteria.none();
        List<T> best = new ArrayList<>();
        int bestHealthRank = Integer.MAX_VALUE;
        double bestLatency = Double.MAX_VALUE;

        for (T candidate : candidates) {
            CandidatePerformance performance = effective.performanceOf(candidate);
            int healthRank = healthRank(performance.health());
            double latency = performance.averageLatencyMs();

            int comparison = healthRank != bestHealthRank
                    ? Integer.compare(healthRank, bestHealthRank)
                    : Double.compare(latency, bestLatency);

            if (comparison < 0) {
                best.clear();
                bestHealthRank = healthRank;
                bestLatency = latency;
                best.add(candidate);
            } else if (comparison == 0) {
                best.add(candidate);
            }
        }

        return best.get(random.nextInt(best.size()));
    }

    private static int healthRank(HealthStatus health) {
        return switch (health) {
            case HEALTHY -> 0;
            case UNKNOWN -> 1;
            case UNHEALTHY -> 2;
        };
    }
}
