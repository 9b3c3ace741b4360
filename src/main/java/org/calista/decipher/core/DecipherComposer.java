package org.calista.decipher.core;

import org.calista.decipher.graph.CooccurrenceGraphBuilder;
import org.calista.decipher.graph.GreedyModularityDetector;
import org.calista.decipher.search.MappingSearchEngine;
import org.calista.decipher.section.SectionOrchestrator;
import org.calista.decipher.section.external.RuleBasedPostProcessor;
import org.calista.decipher.section.external.TableAlignmentScorer;
import org.calista.decipher.section.external.TableTranslationGenerator;
import org.calista.decipher.section.external.TranscriptionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DecipherComposer — wires a {@link SectionOrchestrator} from the kernel's config.
 *
 * Owns the fitness evaluation pool (created only for evalPool.parallelism > 1)
 * and shuts it down on {@link #close()}. An injected pool is never shut down.
 */
public final class DecipherComposer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DecipherComposer.class);

    private final DecipherKernel kernel;

    private final ExecutorService evalPool; // nullable => sequential evaluation
    private final boolean ownsEvalPool;

    public DecipherComposer(DecipherKernel kernel) {
        this(kernel, null);
    }

    public DecipherComposer(DecipherKernel kernel, ExecutorService evalPool) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        DecipherConfig.EvalPool ep = kernel.config().evalPool;
        if (evalPool != null) {
            this.evalPool = evalPool;
            this.ownsEvalPool = false;
        } else {
            this.evalPool = (ep.parallelism > 1) ? createEvalPool(ep) : null;
            this.ownsEvalPool = (this.evalPool != null);
        }
    }

    public SectionOrchestrator buildOrchestrator() {
        return buildOrchestrator(kernel.transcription());
    }

    /** Same wiring with another token source (tests, embedding). */
    public SectionOrchestrator buildOrchestrator(TranscriptionSource transcription) {
        Objects.requireNonNull(transcription, "transcription");
        DecipherConfig cfg = kernel.config();

        MappingSearchEngine engine = new MappingSearchEngine(null, evalPool, cfg.evalPool.parallelism);

        SectionOrchestrator orchestrator = SectionOrchestrator.builder()
                .transcription(transcription)
                .translator(new TableTranslationGenerator(cfg.translation.texts, cfg.translation.fallback))
                .aligner(new TableAlignmentScorer(cfg.alignment.scores, cfg.alignment.defaultScore))
                .postProcessor(new RuleBasedPostProcessor(cfg.correction.rules, cfg.correction.sectionRules))
                .engine(engine)
                .graphBuilder(new CooccurrenceGraphBuilder())
                .detector(new GreedyModularityDetector())
                .space(cfg.mappingSpace())
                .feedback(cfg.feedbackTable())
                .parameters(cfg.searchParameters())
                .windowSize(cfg.graph.windowSize)
                .baseSeed(cfg.search.seed)
                .events(kernel.eventStore())
                .build();

        logCreation(cfg, transcription);
        return orchestrator;
    }

    public ExecutorService evalPool() {
        return evalPool;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (ownsEvalPool) {
            shutdownExecutor(evalPool, kernel.config().evalPool.shutdownTimeoutMs);
        } else if (evalPool != null) {
            log.debug("DecipherComposer.close(): evalPool is externally owned; skipping shutdown");
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static ExecutorService createEvalPool(DecipherConfig.EvalPool ep) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = Math.max(1, ep.parallelism);

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, ep.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        // bounded queue + CallerRunsPolicy => backpressure
        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(ep.queueCapacity),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    private static void shutdownExecutor(ExecutorService es, long timeoutMs) {
        if (es == null) return;

        es.shutdown();
        try {
            if (!es.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                es.shutdownNow();
                es.awaitTermination(Math.max(250, timeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }

    private void logCreation(DecipherConfig cfg, TranscriptionSource transcription) {
        if (!log.isInfoEnabled()) return;

        String msg = DecipherLogFmt.box("Decipher orchestrator", b -> {
            b.kv("transcription", transcription.getClass().getSimpleName());
            b.kv("sections", cfg.sections);
            b.sep();
            b.kv("symbols", cfg.mapping.symbols);
            b.kv("candidates", cfg.mapping.candidates);
            b.kv("feedback", cfg.mapping.feedback);
            b.sep();
            b.kv("populationSize", cfg.search.populationSize);
            b.kv("generations", cfg.search.generations);
            b.kv("crossover", cfg.search.crossoverProbability);
            b.kv("mutation", cfg.search.mutationProbability);
            b.kv("swap", cfg.search.swapProbability);
            b.kv("tournament", cfg.search.tournamentSize);
            b.kv("seed", cfg.search.seed);
            b.kv("marker", cfg.search.markerFragment);
            b.sep();
            b.kv("windowSize", cfg.graph.windowSize);
            b.kv("evalParallelism", cfg.evalPool.parallelism);
            b.kv("evalPool", (evalPool == null) ? "<caller thread>" : (ownsEvalPool ? "owned" : "external"));
        });
        log.info("\n{}", msg);
    }
}
