package org.calista.decipher.search;

import org.calista.decipher.core.InvalidConfigurationException;
import org.calista.decipher.fitness.FrequencyFitness;

/**
 * SearchParameters — immutable knobs of one mapping search.
 *
 * Defaults are the reference values: N=200, 100 generations, p_c=0.5, p_m=0.2,
 * per-slot swap 0.5, tournament k=3. Validation happens in {@link Builder#build()},
 * before any search starts.
 */
public final class SearchParameters {

    public static final int DEFAULT_POPULATION_SIZE = 200;
    public static final int DEFAULT_GENERATIONS = 100;
    public static final double DEFAULT_CROSSOVER_PROBABILITY = 0.5;
    public static final double DEFAULT_MUTATION_PROBABILITY = 0.2;
    public static final double DEFAULT_SWAP_PROBABILITY = 0.5;
    public static final int DEFAULT_TOURNAMENT_SIZE = 3;

    private final int populationSize;
    private final int generations;
    private final double crossoverProbability;
    private final double mutationProbability;
    private final double swapProbability;
    private final int tournamentSize;
    private final String markerFragment;

    private SearchParameters(Builder b) {
        this.populationSize = b.populationSize;
        this.generations = b.generations;
        this.crossoverProbability = b.crossoverProbability;
        this.mutationProbability = b.mutationProbability;
        this.swapProbability = b.swapProbability;
        this.tournamentSize = b.tournamentSize;
        this.markerFragment = b.markerFragment;
    }

    public static SearchParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .populationSize(populationSize)
                .generations(generations)
                .crossoverProbability(crossoverProbability)
                .mutationProbability(mutationProbability)
                .swapProbability(swapProbability)
                .tournamentSize(tournamentSize)
                .markerFragment(markerFragment);
    }

    public int populationSize() { return populationSize; }
    public int generations() { return generations; }
    public double crossoverProbability() { return crossoverProbability; }
    public double mutationProbability() { return mutationProbability; }
    public double swapProbability() { return swapProbability; }
    public int tournamentSize() { return tournamentSize; }
    public String markerFragment() { return markerFragment; }

    @Override
    public String toString() {
        return "SearchParameters{N=" + populationSize
                + ", gens=" + generations
                + ", pc=" + crossoverProbability
                + ", pm=" + mutationProbability
                + ", swap=" + swapProbability
                + ", k=" + tournamentSize
                + ", marker='" + markerFragment + "'}";
    }

    // ---------------------------------------------------------------------

    public static final class Builder {
        private int populationSize = DEFAULT_POPULATION_SIZE;
        private int generations = DEFAULT_GENERATIONS;
        private double crossoverProbability = DEFAULT_CROSSOVER_PROBABILITY;
        private double mutationProbability = DEFAULT_MUTATION_PROBABILITY;
        private double swapProbability = DEFAULT_SWAP_PROBABILITY;
        private int tournamentSize = DEFAULT_TOURNAMENT_SIZE;
        private String markerFragment = FrequencyFitness.DEFAULT_MARKER;

        private Builder() {}

        public Builder populationSize(int v) { this.populationSize = v; return this; }

        public Builder generations(int v) { this.generations = v; return this; }

        public Builder crossoverProbability(double v) { this.crossoverProbability = v; return this; }

        public Builder mutationProbability(double v) { this.mutationProbability = v; return this; }

        public Builder swapProbability(double v) { this.swapProbability = v; return this; }

        public Builder tournamentSize(int v) { this.tournamentSize = v; return this; }

        public Builder markerFragment(String v) { this.markerFragment = v; return this; }

        public SearchParameters build() {
            InvalidConfigurationException.check(populationSize >= 1, "populationSize must be >= 1: " + populationSize);
            InvalidConfigurationException.check(generations >= 0, "generations must be >= 0: " + generations);
            InvalidConfigurationException.check(tournamentSize >= 1, "tournamentSize must be >= 1: " + tournamentSize);
            InvalidConfigurationException.probability(crossoverProbability, "crossoverProbability");
            InvalidConfigurationException.probability(mutationProbability, "mutationProbability");
            InvalidConfigurationException.probability(swapProbability, "swapProbability");
            InvalidConfigurationException.check(markerFragment != null && !markerFragment.isEmpty(),
                    "markerFragment must not be empty");
            return new SearchParameters(this);
        }
    }
}
