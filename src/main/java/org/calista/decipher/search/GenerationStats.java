package org.calista.decipher.search;

import java.util.Locale;

/**
 * Fitness summary of one generation. Generation 0 is the initial population.
 */
public final class GenerationStats {
    public final int generation;
    public final int size;
    public final double best;
    public final double mean;
    public final double worst;
    public final int distinct;

    public GenerationStats(int generation, int size, double best, double mean, double worst, int distinct) {
        this.generation = generation;
        this.size = size;
        this.best = best;
        this.mean = mean;
        this.worst = worst;
        this.distinct = distinct;
    }

    public String brief() {
        return "gen=" + generation
                + " best=" + String.format(Locale.ROOT, "%.2f", best)
                + " mean=" + String.format(Locale.ROOT, "%.2f", mean)
                + " worst=" + String.format(Locale.ROOT, "%.2f", worst)
                + " distinct=" + distinct + "/" + size;
    }

    @Override
    public String toString() {
        return "GenerationStats{" + brief() + '}';
    }
}
