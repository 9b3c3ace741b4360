package org.calista.decipher.search;

import org.calista.decipher.core.InvalidConfigurationException;
import org.calista.decipher.fitness.FeedbackFitness;
import org.calista.decipher.fitness.FitnessFunction;
import org.calista.decipher.fitness.FrequencyFitness;
import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.Mapping;
import org.calista.decipher.mapping.MappingSpace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingSearchEngineTest {

    private static final MappingSpace SPACE = MappingSpace.of(
            List.of("qo", "kch", "arin", "tar"),
            List.of("her", "ba", "aqua", "igni", "sol"));

    private static final List<String> TOKENS = List.of("qo", "kch", "ar", "qo", "kch", "arin");

    private static final FeedbackTable TABLE = table();

    private static FeedbackTable table() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("qo", "her");
        m.put("kch", "ba");
        m.put("arin", "aqua");
        m.put("tar", "igni");
        return FeedbackTable.of(m);
    }

    private static SearchParameters small() {
        return SearchParameters.builder().populationSize(20).generations(10).build();
    }

    private static SearchRequest request(SearchParameters p, long seed) {
        return new SearchRequest(SPACE, TOKENS, TABLE, p, seed);
    }

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) pool.shutdownNow();
    }

    // =========================================================================
    //  Reference scenario
    // =========================================================================

    @Nested
    @DisplayName("Reference scenario (population 20, generations 10, seed 42)")
    class Reference {

        @Test
        @DisplayName("returned fitness equals an independent recomputation")
        void fitnessRecomputes() {
            SearchResult r = new MappingSearchEngine().search(request(small(), 42L));

            int frequency = new FrequencyFitness().score(r.bestMapping, TOKENS);
            int feedback = new FeedbackFitness().score(r.bestMapping, TABLE);

            assertThat(r.bestFitness).isEqualTo((double) (frequency + feedback));
            assertThat(r.breakdown.frequency).isEqualTo(frequency);
            assertThat(r.breakdown.feedback).isEqualTo(feedback);
        }

        @Test
        @DisplayName("feedback term is +40 exactly when the mapping reproduces the table")
        void feedbackIffTable() {
            SearchResult r = new MappingSearchEngine().search(request(small(), 42L));

            boolean reproducesTable = r.bestMapping.asMap().equals(TABLE.entries());
            assertThat(r.breakdown.feedback == 40.0).isEqualTo(reproducesTable);
        }

        @Test
        @DisplayName("reaches the feedback table")
        void reachesTable() {
            SearchResult r = new MappingSearchEngine().search(request(small(), 42L));

            assertThat(r.bestMapping).isEqualTo(Mapping.of(SPACE, "her", "ba", "aqua", "igni"));
            assertThat(r.bestFitness).isEqualTo(42.0);
            assertThat(r.generations()).isEqualTo(10);
            assertThat(r.history).hasSize(11);
        }
    }

    // =========================================================================
    //  Determinism
    // =========================================================================

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("same seed gives the same population in every generation")
        void generationByGeneration() {
            List<Population> first = new ArrayList<>();
            List<Population> second = new ArrayList<>();

            new MappingSearchEngine().search(request(small(), 1234L), (s, st, p) -> first.add(p));
            new MappingSearchEngine().search(request(small(), 1234L), (s, st, p) -> second.add(p));

            assertThat(first).hasSize(12).isEqualTo(second);
        }

        @Test
        @DisplayName("one engine instance keeps no state between calls")
        void stateless() {
            MappingSearchEngine engine = new MappingSearchEngine();
            SearchResult a = engine.search(request(small(), 5L));
            engine.search(request(small(), 99L));
            SearchResult b = engine.search(request(small(), 5L));

            assertThat(b.finalPopulation).isEqualTo(a.finalPopulation);
            assertThat(b.bestMapping).isEqualTo(a.bestMapping);
        }

        @Test
        @DisplayName("parallel evaluation gives the sequential result")
        void parallelEqualsSequential() {
            pool = Executors.newFixedThreadPool(4);
            SearchParameters p = SearchParameters.builder().populationSize(64).generations(15).build();

            SearchResult seq = new MappingSearchEngine().search(request(p, 77L));
            SearchResult par = new MappingSearchEngine(null, pool, 4).search(request(p, 77L));

            assertThat(par.finalPopulation).isEqualTo(seq.finalPopulation);
            assertThat(par.bestMapping).isEqualTo(seq.bestMapping);
            assertThat(par.bestFitness).isEqualTo(seq.bestFitness);
        }
    }

    // =========================================================================
    //  Lifecycle
    // =========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("listener sees INITIALIZED, one EVOLVING per generation, then CONVERGED")
        void states() {
            List<MappingSearchEngine.State> states = new ArrayList<>();
            List<Integer> generations = new ArrayList<>();

            new MappingSearchEngine().search(request(small(), 3L), (s, st, p) -> {
                states.add(s);
                generations.add(st.generation);
            });

            assertThat(states).hasSize(12);
            assertThat(states.get(0)).isEqualTo(MappingSearchEngine.State.INITIALIZED);
            assertThat(states.subList(1, 11)).containsOnly(MappingSearchEngine.State.EVOLVING);
            assertThat(states.get(11)).isEqualTo(MappingSearchEngine.State.CONVERGED);
            assertThat(generations.subList(0, 11)).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        }

        @Test
        @DisplayName("zero generations returns the best initial individual")
        void zeroGenerations() {
            SearchParameters p = SearchParameters.builder().populationSize(20).generations(0).build();
            List<Population> seen = new ArrayList<>();

            SearchResult r = new MappingSearchEngine().search(request(p, 8L), (s, st, pop) -> seen.add(pop));

            assertThat(r.generations()).isZero();
            assertThat(r.bestFitness).isEqualTo(seen.get(0).best().fitness);
            assertThat(r.bestMapping).isEqualTo(seen.get(0).best().mapping);
        }

        @Test
        @DisplayName("best fitness is the best of the final population")
        void bestOfFinal() {
            SearchResult r = new MappingSearchEngine().search(request(small(), 17L));

            double max = Double.NEGATIVE_INFINITY;
            for (double f : r.finalPopulation.fitness()) max = Math.max(max, f);
            assertThat(r.bestFitness).isEqualTo(max);
            assertThat(r.history.get(r.history.size() - 1).best).isEqualTo(max);
        }

        @Test
        @DisplayName("empty tokens still run; only the feedback term counts")
        void emptyTokens() {
            SearchResult r = new MappingSearchEngine()
                    .search(new SearchRequest(SPACE, List.of(), TABLE, small(), 42L));

            assertThat(r.breakdown.frequency).isZero();
            assertThat(r.bestFitness).isEqualTo(r.breakdown.feedback);
        }

        @Test
        @DisplayName("a custom fitness function is used as given")
        void customFitness() {
            FitnessFunction solCounter = (m, tokens, fb) -> {
                int n = 0;
                for (String v : m.values()) if (v.equals("sol")) n++;
                return new FitnessFunction.Breakdown(n, 0);
            };

            SearchResult r = new MappingSearchEngine(solCounter).search(request(small(), 42L));

            assertThat(r.bestFitness).isEqualTo(r.breakdown.frequency);
            assertThat(r.breakdown.feedback).isZero();
            assertThat(r.bestFitness).isEqualTo(solCounter.fitness(r.bestMapping, TOKENS, TABLE));
        }
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("rejects unusable parameters before searching")
        void invalidParameters() {
            assertThatThrownBy(() -> SearchParameters.builder().populationSize(0).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> SearchParameters.builder().generations(-1).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> SearchParameters.builder().crossoverProbability(1.5).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> SearchParameters.builder().mutationProbability(-0.1).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> SearchParameters.builder().tournamentSize(0).build())
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> SearchParameters.builder().markerFragment("").build())
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("rejects feedback outside the mapping space")
        void invalidFeedback() {
            assertThatThrownBy(() -> new SearchRequest(SPACE, TOKENS,
                    FeedbackTable.of(Map.of("zz", "her")), small(), 1L))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("defaults follow the reference configuration")
        void defaults() {
            SearchParameters d = SearchParameters.defaults();
            assertThat(d.populationSize()).isEqualTo(200);
            assertThat(d.generations()).isEqualTo(100);
            assertThat(d.crossoverProbability()).isEqualTo(0.5);
            assertThat(d.mutationProbability()).isEqualTo(0.2);
            assertThat(d.swapProbability()).isEqualTo(0.5);
            assertThat(d.tournamentSize()).isEqualTo(3);
            assertThat(d.markerFragment()).isEqualTo("her");
            assertThat(d.toBuilder().generations(5).build().generations()).isEqualTo(5);
        }
    }
}
