package org.calista.decipher.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.fitness.CompositeFitness;
import org.calista.decipher.fitness.FeedbackFitness;
import org.calista.decipher.fitness.FitnessFunction;
import org.calista.decipher.fitness.FrequencyFitness;
import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.Mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * MappingSearchEngine — generational evolutionary search over symbol -> token mappings.
 *
 * Cycle per generation:
 *   vary (crossover + mutation) -> evaluate offspring -> tournament selection from offspring.
 *
 * Determinism:
 *  - one {@link Random} per call, seeded from the request, handed to every operator
 *  - fitness evaluation may run on the eval pool, but results are joined in population
 *    order before selection, so parallelism never changes the outcome
 *
 * The engine is stateless between calls: one instance may serve many sections.
 */
public final class MappingSearchEngine {

    private static final Logger log = LogManager.getLogger(MappingSearchEngine.class);

    public enum State { INITIALIZED, EVOLVING, CONVERGED }

    /** Custom fitness; null => composite(frequency(marker of request), feedback). */
    private final FitnessFunction fitness;

    // Evaluation executor (injected; ownership handled by the composer)
    private final ExecutorService evalPool;
    private final int evalParallelism;

    public MappingSearchEngine() {
        this(null, null, 1);
    }

    public MappingSearchEngine(FitnessFunction fitness) {
        this(fitness, null, 1);
    }

    public MappingSearchEngine(FitnessFunction fitness, ExecutorService evalPool, int evalParallelism) {
        this.fitness = fitness;
        this.evalPool = evalPool;
        this.evalParallelism = Math.max(1, evalParallelism);
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    public SearchResult search(SearchRequest request) {
        return search(request, GenerationListener.NONE);
    }

    public SearchResult search(SearchRequest request, GenerationListener listener) {
        Objects.requireNonNull(request, "request");
        final GenerationListener l = (listener == null) ? GenerationListener.NONE : listener;

        final SearchParameters p = request.parameters;
        final FitnessFunction ff = fitnessFor(p);
        final Random rnd = new Random(request.seed);

        final long t0 = System.nanoTime();
        ArrayList<GenerationStats> history = new ArrayList<>(p.generations() + 1);

        // INITIALIZED
        List<Mapping> initial = GeneticOperators.randomPopulation(request.space, p.populationSize(), rnd);
        Population population = Population.of(initial, evaluate(ff, initial, request.tokens, request.feedback));
        GenerationStats s0 = population.stats(0);
        history.add(s0);
        l.onGeneration(State.INITIALIZED, s0, population);

        if (log.isDebugEnabled()) log.debug("search.init {} {}", request, s0.brief());

        // EVOLVING
        for (int g = 1; g <= p.generations(); g++) {
            List<Mapping> offspring = GeneticOperators.vary(
                    population.mappings(),
                    p.crossoverProbability(),
                    p.mutationProbability(),
                    p.swapProbability(),
                    rnd);

            double[] fit = evaluate(ff, offspring, request.tokens, request.feedback);

            int[] winners = GeneticOperators.tournament(fit, p.populationSize(), p.tournamentSize(), rnd);
            ArrayList<Population.Member> next = new ArrayList<>(winners.length);
            for (int w : winners) next.add(new Population.Member(offspring.get(w), fit[w]));
            population = new Population(next);

            GenerationStats st = population.stats(g);
            history.add(st);
            l.onGeneration(State.EVOLVING, st, population);

            if (log.isTraceEnabled()) log.trace("search.gen {}", st.brief());
        }

        // CONVERGED
        Population.Member best = population.best();
        FitnessFunction.Breakdown breakdown = ff.evaluate(best.mapping, request.tokens, request.feedback);
        l.onGeneration(State.CONVERGED, history.get(history.size() - 1), population);

        long ms = (System.nanoTime() - t0) / 1_000_000L;
        log.info("search.done generations={} population={} bestFitness={} frequency={} feedback={} ms={} best={}",
                p.generations(), p.populationSize(), best.fitness,
                breakdown.frequency, breakdown.feedback, ms, best.mapping);

        return new SearchResult(best.mapping, best.fitness, breakdown, population, history, request.seed);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private FitnessFunction fitnessFor(SearchParameters p) {
        if (fitness != null) return fitness;
        return new CompositeFitness(new FrequencyFitness(p.markerFragment()), new FeedbackFitness());
    }

    double[] evaluate(FitnessFunction ff, List<Mapping> mappings, List<String> tokens, FeedbackTable feedback) {
        final int n = mappings.size();
        final double[] out = new double[n];

        boolean canPar = (evalPool != null && evalParallelism > 1 && n > 2);
        if (!canPar) {
            for (int i = 0; i < n; i++) out[i] = ff.fitness(mappings.get(i), tokens, feedback);
            return out;
        }

        // one task per chunk; pure evaluations, joined in index order (barrier before selection)
        final int chunks = Math.min(evalParallelism, n);
        final int per = (n + chunks - 1) / chunks;
        ArrayList<CompletableFuture<Void>> futures = new ArrayList<>(chunks);
        for (int c = 0; c < chunks; c++) {
            final int from = c * per;
            final int to = Math.min(n, from + per);
            if (from >= to) break;
            futures.add(CompletableFuture.runAsync(() -> {
                for (int i = from; i < to; i++) out[i] = ff.fitness(mappings.get(i), tokens, feedback);
            }, evalPool));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = (e.getCause() != null) ? e.getCause() : e;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("fitness evaluation failed", cause);
        }
        return out;
    }
}
