package fr.lapetina.llmrouter.domain.strategy;

import fr.lapetina.llmrouter.domain.model.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadBalancingStrategyTest {

    private List<String> models;

    @BeforeEach
    void setUp() {
        models = List.of("model-a", "model-b", "model-c");
    }

    @Nested
    @DisplayName("RoundRobinStrategy")
    class RoundRobinTests {

        private RoundRobinStrategy<String> strategy;

        @BeforeEach
        void setUp() {
            strategy = new RoundRobinStrategy<>();
        }

        @Test
        @DisplayName("should cycle through candidates in order")
        void shouldCycleThroughCandidates() {
            List<String> selections = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                selections.add(strategy.selectNext(models));
            }

            assertThat(selections).containsExactly(
                    "model-a", "model-b", "model-c", "model-a", "model-b", "model-c");
        }

        @Test
        @DisplayName("should distribute evenly over many selections")
        void shouldDistributeEvenly() {
            Map<String, Integer> counts = new ConcurrentHashMap<>();
            for (int i = 0; i < 300; i++) {
                counts.merge(strategy.selectNext(models), 1, Integer::sum);
            }

            assertThat(counts).containsEntry("model-a", 100)
                    .containsEntry("model-b", 100)
                    .containsEntry("model-c", 100);
        }

        @Test
        @DisplayName("should restart from the first candidate after reset")
        void shouldRestartAfterReset() {
            strategy.selectNext(models);
            strategy.selectNext(models);

            strategy.reset();

            assertThat(strategy.selectNext(models)).isEqualTo("model-a");
        }

        @Test
        @DisplayName("should reject empty candidate list")
        void shouldRejectEmptyCandidates() {
            assertThatThrownBy(() -> strategy.selectNext(List.of()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("No candidates");
        }

        @Test
        @DisplayName("should stay fair under concurrent selection")
        void shouldStayFairUnderConcurrency() throws InterruptedException {
            int threads = 8;
            int perThread = 300;
            Map<String, Integer> counts = new ConcurrentHashMap<>();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch latch = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < perThread; i++) {
                            counts.merge(strategy.selectNext(models), 1, Integer::sum);
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(counts.values()).containsOnly(threads * perThread / models.size());
        }
    }

    @Nested
    @DisplayName("RandomStrategy")
    class RandomTests {

        @Test
        @DisplayName("should only select from given candidates")
        void shouldSelectFromCandidates() {
            RandomStrategy<String> strategy = new RandomStrategy<>(new Random(42));

            for (int i = 0; i < 100; i++) {
                assertThat(strategy.selectNext(models)).isIn(models);
            }
        }

        @Test
        @DisplayName("should eventually select every candidate")
        void shouldReachEveryCandidate() {
            RandomStrategy<String> strategy = new RandomStrategy<>(new Random(7));
            Map<String, Integer> counts = new ConcurrentHashMap<>();

            for (int i = 0; i < 300; i++) {
                counts.merge(strategy.selectNext(models), 1, Integer::sum);
            }

            assertThat(counts).containsOnlyKeys("model-a", "model-b", "model-c");
        }

        @Test
        @DisplayName("should reject empty candidate list")
        void shouldRejectEmptyCandidates() {
            RandomStrategy<String> strategy = new RandomStrategy<>();

            assertThatThrownBy(() -> strategy.selectNext(Collections.emptyList()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("WeightedRoundRobinStrategy")
    class WeightedRoundRobinTests {

        private WeightedRoundRobinStrategy<String> strategy;

        @BeforeEach
        void setUp() {
            strategy = new WeightedRoundRobinStrategy<>();
            strategy.setWeight("model-a", 2);
            strategy.setWeight("model-b", 1);
            strategy.setWeight("model-c", 1);
        }

        @Test
        @DisplayName("should give the heavier candidate exactly its share in every window")
        void shouldRespectWeightsInEveryWindow() {
            List<String> selections = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                selections.add(strategy.selectNext(models));
            }

            for (int start = 0; start + 4 <= selections.size(); start++) {
                List<String> window = selections.subList(start, start + 4);
                assertThat(window).filteredOn("model-a"::equals).hasSize(2);
                assertThat(window).filteredOn("model-b"::equals).hasSize(1);
                assertThat(window).filteredOn("model-c"::equals).hasSize(1);
            }
        }

        @Test
        @DisplayName("should interleave rather than burst the heavier candidate")
        void shouldInterleaveSelections() {
            List<String> selections = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                selections.add(strategy.selectNext(models));
            }

            assertThat(selections).containsExactly("model-a", "model-b", "model-c", "model-a");
        }

        @Test
        @DisplayName("should treat unknown candidates as weight 1")
        void shouldDefaultUnknownWeight() {
            WeightedRoundRobinStrategy<String> fresh = new WeightedRoundRobinStrategy<>();
            Map<String, Integer> counts = new ConcurrentHashMap<>();

            for (int i = 0; i < 90; i++) {
                counts.merge(fresh.selectNext(models), 1, Integer::sum);
            }

            assertThat(counts.values()).containsOnly(30);
            assertThat(fresh.getWeight("model-a")).isEqualTo(1);
        }

        @Test
        @DisplayName("should clamp weights below 1")
        void shouldClampWeights() {
            strategy.setWeight("model-c", 0);

            assertThat(strategy.getWeight("model-c")).isEqualTo(1);
        }

        @Test
        @DisplayName("should return the only candidate directly")
        void shouldReturnSingleCandidate() {
            assertThat(strategy.selectNext(List.of("model-b"))).isEqualTo("model-b");
        }

        @Test
        @DisplayName("should keep proportions under concurrent selection")
        void shouldKeepProportionsUnderConcurrency() throws InterruptedException {
            int threads = 4;
            int perThread = 400;
            Map<String, Integer> counts = new ConcurrentHashMap<>();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch latch = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < perThread; i++) {
                            counts.merge(strategy.selectNext(models), 1, Integer::sum);
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            // 1600 selections are 400 full rounds
            assertThat(counts).containsEntry("model-a", 800)
                    .containsEntry("model-b", 400)
                    .containsEntry("model-c", 400);
        }
    }

    @Nested
    @DisplayName("PerformanceBasedStrategy")
    class PerformanceBasedTests {

        private PerformanceBasedStrategy<String> strategy;

        @BeforeEach
        void setUp() {
            strategy = new PerformanceBasedStrategy<>(new Random(3));
        }

        @Test
        @DisplayName("should prefer the fastest healthy candidate")
        void shouldPreferFastestHealthy() {
            Map<String, CandidatePerformance> performance = Map.of(
                    "model-a", new CandidatePerformance(HealthStatus.HEALTHY, 300, 50),
                    "model-b", new CandidatePerformance(HealthStatus.HEALTHY, 120, 50),
                    "model-c", new CandidatePerformance(HealthStatus.UNHEALTHY, 10, 50));

            for (int i = 0; i < 20; i++) {
                assertThat(strategy.selectNext(models, SelectionCriteria.withPerformance(performance::get)))
                        .isEqualTo("model-b");
            }
        }

        @Test
        @DisplayName("should rank unknown candidates between healthy and unhealthy")
        void shouldRankUnknownBetween() {
            Map<String, CandidatePerformance> performance = Map.of(
                    "model-a", new CandidatePerformance(HealthStatus.UNHEALTHY, 5, 10),
                    "model-b", CandidatePerformance.unknown(),
                    "model-c", new CandidatePerformance(HealthStatus.UNHEALTHY, 1, 10));

            assertThat(strategy.selectNext(models, SelectionCriteria.withPerformance(performance::get)))
                    .isEqualTo("model-b");
        }

        @Test
        @DisplayName("should spread among equally ranked candidates")
        void shouldSpreadAmongTies() {
            Map<String, Integer> counts = new ConcurrentHashMap<>();

            for (int i = 0; i < 300; i++) {
                counts.merge(strategy.selectNext(models, SelectionCriteria.none()), 1, Integer::sum);
            }

            assertThat(counts).containsOnlyKeys("model-a", "model-b", "model-c");
        }

        @Test
        @DisplayName("should reject empty candidate list")
        void shouldRejectEmptyCandidates() {
            assertThatThrownBy(() -> strategy.selectNext(List.of(), SelectionCriteria.none()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
