package fr.lapetina.llmrouter.domain.strategy;

import java.util.function.Function;

/**
 * Optional inputs a strategy may use when selecting a candidate.
 *
 * @param <T> candidate type
 */
public final class SelectionCriteria<T> {

    private static final SelectionCriteria<?> NONE = new SelectionCriteria<>(null);

    private final Function<T, CandidatePerformance> performanceLookup;

    private SelectionCriteria(Function<T, CandidatePerformance> performanceLookup) {
        this.performanceLookup = performanceLookup;
    }

    @SuppressWarnings("unchecked")
    public static <T> SelectionCriteria<T> none() {
        return (SelectionCriteria<T>) NONE;
    }

    public static <T> SelectionCriteria<T> withPerformance(Function<T, CandidatePerformance> performanceLookup) {
        return new SelectionCriteria<>(performanceLookup);
    }

    /**
     * Returns the performance of a candidate, or {@link CandidatePerformance#unknown()}
     * when no lookup was supplied or it has nothing for the candidate.
     */
    public CandidatePerformance performanceOf(T candidate) {
        if (performanceLookup == null) {
            return CandidatePerformance.unknown();
        }
        CandidatePerformance performance = performanceLookup.apply(candidate);
        return performance != null ? performance : CandidatePerformance.unknown();
    }
}
