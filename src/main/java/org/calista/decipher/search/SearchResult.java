package org.calista.decipher.search;

import org.calista.decipher.fitness.FitnessFunction;
import org.calista.decipher.mapping.Mapping;

import java.util.List;

/**
 * Outcome of a converged search.
 */
public final class SearchResult {

    public final Mapping bestMapping;
    public final double bestFitness;

    /** Term-by-term scores of {@link #bestMapping}; {@code breakdown.total == bestFitness}. */
    public final FitnessFunction.Breakdown breakdown;

    public final Population finalPopulation;
    public final List<GenerationStats> history;
    public final long seed;

    public SearchResult(Mapping bestMapping,
                        double bestFitness,
                        FitnessFunction.Breakdown breakdown,
                        Population finalPopulation,
                        List<GenerationStats> history,
                        long seed) {
        this.bestMapping = bestMapping;
        this.bestFitness = bestFitness;
        this.breakdown = breakdown;
        this.finalPopulation = finalPopulation;
        this.history = (history == null) ? List.of() : List.copyOf(history);
        this.seed = seed;
    }

    public int generations() {
        return Math.max(0, history.size() - 1);
    }

    @Override
    public String toString() {
        return "SearchResult{bestFitness=" + bestFitness
                + ", best=" + bestMapping
                + ", generations=" + generations()
                + ", seed=" + seed + '}';
    }
}
