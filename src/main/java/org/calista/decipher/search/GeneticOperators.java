package org.calista.decipher.search;

import org.calista.decipher.mapping.Mapping;
import org.calista.decipher.mapping.MappingSpace;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Variation and selection operators over slot-ordered mapping values.
 *
 * Every operator takes the random source as an argument; nothing here keeps state.
 * Draw order is part of the contract: changing it changes seeded runs.
 */
public final class GeneticOperators {

    private GeneticOperators() {}

    // ---------------------------------------------------------------------
    // Initialization
    // ---------------------------------------------------------------------

    public static List<Mapping> randomPopulation(MappingSpace space, int size, Random rnd) {
        Objects.requireNonNull(space, "space");
        Objects.requireNonNull(rnd, "rnd");

        List<String> candidates = space.candidates();
        ArrayList<Mapping> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            String[] v = new String[space.size()];
            for (int s = 0; s < v.length; s++) v[s] = candidates.get(rnd.nextInt(candidates.size()));
            out.add(Mapping.of(space, v));
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Variation
    // ---------------------------------------------------------------------

    /**
     * Offspring of the same size: pairwise two-point crossover with probability {@code pc},
     * then per-individual shuffle mutation with probability {@code pm}.
     */
    public static List<Mapping> vary(List<Mapping> parents, double pc, double pm, double swapProbability, Random rnd) {
        Objects.requireNonNull(parents, "parents");
        Objects.requireNonNull(rnd, "rnd");

        final int n = parents.size();
        String[][] genomes = new String[n][];
        for (int i = 0; i < n; i++) genomes[i] = parents.get(i).values();

        for (int i = 1; i < n; i += 2) {
            if (rnd.nextDouble() < pc) twoPointCrossover(genomes[i - 1], genomes[i], rnd);
        }

        for (int i = 0; i < n; i++) {
            if (rnd.nextDouble() < pm) shuffleMutation(genomes[i], swapProbability, rnd);
        }

        ArrayList<Mapping> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(parents.get(i).withValues(genomes[i]));
        return out;
    }

    /**
     * Exchanges slots [c1, c2) between two genomes in place.
     * c1 in [1, size], c2 in [1, size-1] then shifted so that c1 != c2, ordered ascending.
     */
    public static void twoPointCrossover(String[] a, String[] b, Random rnd) {
        int size = Math.min(a.length, b.length);
        if (size < 2) return;

        int c1 = rnd.nextInt(size) + 1;
        int c2 = rnd.nextInt(size - 1) + 1;
        if (c2 >= c1) {
            c2++;
        } else {
            int t = c1;
            c1 = c2;
            c2 = t;
        }

        for (int i = c1; i < c2; i++) {
            String t = a[i];
            a[i] = b[i];
            b[i] = t;
        }
    }

    /**
     * Position shuffle: each slot, with probability {@code swapProbability}, swaps its value with
     * another slot chosen uniformly. Symbols keep their slots; the value multiset is preserved.
     */
    public static void shuffleMutation(String[] genome, double swapProbability, Random rnd) {
        int size = genome.length;
        if (size < 2) return;

        for (int i = 0; i < size; i++) {
            if (rnd.nextDouble() < swapProbability) {
                int j = rnd.nextInt(size - 1);
                if (j >= i) j++;
                String t = genome[i];
                genome[i] = genome[j];
                genome[j] = t;
            }
        }
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    /**
     * {@code count} tournaments of size {@code k}, sampled with replacement.
     * Ties keep the first sampled contender.
     *
     * @return indices into {@code fitness}, one per tournament
     */
    public static int[] tournament(double[] fitness, int count, int k, Random rnd) {
        Objects.requireNonNull(fitness, "fitness");
        Objects.requireNonNull(rnd, "rnd");
        if (fitness.length == 0) throw new IllegalArgumentException("cannot select from an empty pool");

        int[] winners = new int[count];
        for (int t = 0; t < count; t++) {
            int best = -1;
            for (int j = 0; j < k; j++) {
                int idx = rnd.nextInt(fitness.length);
                if (best < 0 || fitness[idx] > fitness[best]) best = idx;
            }
            winners[t] = best;
        }
        return winners;
    }
}
