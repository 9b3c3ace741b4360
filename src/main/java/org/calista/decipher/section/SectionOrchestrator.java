package org.calista.decipher.section;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.core.InvalidConfigurationException;
import org.calista.decipher.events.DecipherEvent;
import org.calista.decipher.events.EventStore;
import org.calista.decipher.graph.CommunityDetector;
import org.calista.decipher.graph.CommunityPartition;
import org.calista.decipher.graph.CooccurrenceGraph;
import org.calista.decipher.graph.CooccurrenceGraphBuilder;
import org.calista.decipher.graph.GreedyModularityDetector;
import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.MappingSpace;
import org.calista.decipher.search.GenerationStats;
import org.calista.decipher.search.MappingSearchEngine;
import org.calista.decipher.search.SearchParameters;
import org.calista.decipher.search.SearchRequest;
import org.calista.decipher.search.SearchResult;
import org.calista.decipher.section.external.AlignmentScorer;
import org.calista.decipher.section.external.PostProcessor;
import org.calista.decipher.section.external.TranscriptionSource;
import org.calista.decipher.section.external.TranslationGenerator;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * SectionOrchestrator — runs the whole pipeline for one manuscript section.
 *
 * Per section:
 *   tokens -> mapping search -> co-occurrence graph -> communities
 *   -> translation -> post-processing -> alignment score -> result + SECTION_DONE event.
 *
 * A failure anywhere in that chain fails the section as a whole. {@link #runAll(List)}
 * records the failure and moves on to the next section.
 */
public final class SectionOrchestrator {

    private static final Logger log = LogManager.getLogger(SectionOrchestrator.class);

    static final String MDC_SECTION = "section";

    private final TranscriptionSource transcription;
    private final TranslationGenerator translator;
    private final AlignmentScorer aligner;
    private final PostProcessor postProcessor;

    private final MappingSearchEngine engine;
    private final CooccurrenceGraphBuilder graphBuilder;
    private final CommunityDetector detector;

    private final MappingSpace space;
    private final FeedbackTable feedback;
    private final SearchParameters parameters;
    private final int windowSize;
    private final long baseSeed;

    private final EventStore events; // nullable
    private final Clock clock;
    private final Supplier<String> runIds;

    private SectionOrchestrator(Builder b) {
        this.transcription = Objects.requireNonNull(b.transcription, "transcription");
        this.translator = Objects.requireNonNull(b.translator, "translator");
        this.aligner = Objects.requireNonNull(b.aligner, "aligner");
        this.postProcessor = Objects.requireNonNull(b.postProcessor, "postProcessor");

        this.engine = (b.engine != null) ? b.engine : new MappingSearchEngine();
        this.graphBuilder = (b.graphBuilder != null) ? b.graphBuilder : new CooccurrenceGraphBuilder();
        this.detector = (b.detector != null) ? b.detector : new GreedyModularityDetector();

        this.space = Objects.requireNonNull(b.space, "space");
        this.feedback = ((b.feedback == null) ? FeedbackTable.empty() : b.feedback).checkAgainst(space);
        this.parameters = Objects.requireNonNull(b.parameters, "parameters");
        this.windowSize = b.windowSize;
        InvalidConfigurationException.check(windowSize >= 1, "windowSize must be >= 1, got " + windowSize);
        this.baseSeed = b.baseSeed;

        this.events = b.events;
        this.clock = b.clock;
        this.runIds = (b.runIds != null) ? b.runIds : defaultRunIds(clock);
    }

    // ---------------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------------

    public SectionResult process(String section) throws SectionFailedException {
        return process(section, runIds.get());
    }

    public RunReport runAll(List<String> sections) {
        Objects.requireNonNull(sections, "sections");
        final String runId = runIds.get();
        final long t0 = System.nanoTime();

        log.info("run.start runId={} sections={}", runId, sections);
        emit(DecipherEvent.RUN_STARTED, runId, null, String.join(",", sections));

        ArrayList<SectionResult> results = new ArrayList<>(sections.size());
        LinkedHashMap<String, String> failures = new LinkedHashMap<>();

        for (String section : sections) {
            try {
                results.add(process(section, runId));
            } catch (SectionFailedException e) {
                String msg = e.getMessage();
                failures.put(section, msg);
                try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put(MDC_SECTION, section)) {
                    log.error("section.failed runId={} {}", runId, msg, e.getCause());
                    emit(DecipherEvent.SECTION_FAILED, runId, section, msg);
                }
            }
        }

        long ms = (System.nanoTime() - t0) / 1_000_000L;
        RunReport report = new RunReport(runId, results, failures, ms);
        log.info("run.done {}", report);
        emit(DecipherEvent.RUN_FINISHED, runId, null, "ok=" + results.size() + " failed=" + failures.size());
        return report;
    }

    /** Seed used for a section: base seed mixed with a stable hash of the name. */
    public long sectionSeed(String section) {
        return mix64(baseSeed, stableHash(section));
    }

    // ---------------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------------

    private SectionResult process(String section, String runId) throws SectionFailedException {
        Objects.requireNonNull(section, "section");

        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put(MDC_SECTION, section)) {
            final long t0 = System.nanoTime();
            SectionResult result;
            try {
                result = compute(section);
            } catch (IOException | RuntimeException e) {
                throw new SectionFailedException(section, e);
            }

            long ms = (System.nanoTime() - t0) / 1_000_000L;
            log.info("section.done runId={} fitness={} communities={} alignment={} ms={}",
                    runId, result.bestFitness, result.communities.size(), result.alignmentScore, ms);

            if (events != null) {
                try {
                    events.append(DecipherEvent.of(DecipherEvent.SECTION_DONE, runId, section,
                            summary(result), clock.millis()));
                } catch (IOException e) {
                    throw new SectionFailedException(section, e);
                }
            }
            return result;
        }
    }

    private SectionResult compute(String section) throws IOException {
        List<String> tokens = transcription.loadSectionTokens(section);
        if (tokens == null) tokens = List.of();
        log.debug("section.tokens count={}", tokens.size());

        final long seed = sectionSeed(section);
        SearchResult sr = engine.search(new SearchRequest(space, tokens, feedback, parameters, seed));

        CooccurrenceGraph graph = graphBuilder.build(tokens, windowSize);
        CommunityPartition partition = detector.detect(graph);
        double q = GreedyModularityDetector.modularity(graph, partition);
        log.debug("section.graph nodes={} edges={} communities={} modularity={}",
                graph.nodeCount(), graph.edgeCount(), partition.size(), q);

        String raw = translator.generateTranslation(section);
        String translation = postProcessor.postProcess(raw == null ? "" : raw, section);
        double alignment = aligner.alignmentScore(section);

        ArrayList<Double> trace = new ArrayList<>(sr.history.size());
        for (GenerationStats st : sr.history) trace.add(st.best);

        return new SectionResult(
                section,
                seed,
                tokens.size(),
                sr.bestMapping.asMap(),
                sr.bestFitness,
                sr.breakdown.frequency,
                sr.breakdown.feedback,
                trace,
                partition.asLists(),
                q,
                translation,
                alignment
        );
    }

    private void emit(String type, String runId, String section, String text) {
        if (events == null) return;
        try {
            events.append(DecipherEvent.of(type, runId, section, text, clock.millis()));
        } catch (IOException e) {
            log.warn("event.append failed type={} file={}: {}", type, events.file(), e.toString());
        }
    }

    private static String summary(SectionResult r) {
        return "fitness=" + r.bestFitness
                + " mapping=" + r.bestMapping
                + " communities=" + r.communities.size()
                + " alignment=" + r.alignmentScore;
    }

    // ---------------------------------------------------------------------
    // Seeds
    // ---------------------------------------------------------------------

    static long stableHash(String s) {
        // String.hashCode is specified, so it is stable across JVM runs.
        return (s == null) ? 0L : (long) s.hashCode();
    }

    static long mix64(long a, long b) {
        long x = a ^ b;
        x ^= (x >>> 33);
        x *= 0xff51afd7ed558ccdL;
        x ^= (x >>> 33);
        x *= 0xc4ceb9fe1a85ec53L;
        x ^= (x >>> 33);
        return x;
    }

    private static Supplier<String> defaultRunIds(Clock clock) {
        return () -> Long.toUnsignedString(mix64(clock.millis(), System.nanoTime()), 36);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TranscriptionSource transcription;
        private TranslationGenerator translator;
        private AlignmentScorer aligner;
        private PostProcessor postProcessor;

        private MappingSearchEngine engine;
        private CooccurrenceGraphBuilder graphBuilder;
        private CommunityDetector detector;

        private MappingSpace space;
        private FeedbackTable feedback = FeedbackTable.empty();
        private SearchParameters parameters = SearchParameters.defaults();
        private int windowSize = CooccurrenceGraphBuilder.DEFAULT_WINDOW_SIZE;
        private long baseSeed;

        private EventStore events;
        private Clock clock = Clock.systemUTC();
        private Supplier<String> runIds;

        private Builder() {
        }

        public Builder transcription(TranscriptionSource v) {
            this.transcription = Objects.requireNonNull(v, "transcription");
            return this;
        }

        public Builder translator(TranslationGenerator v) {
            this.translator = Objects.requireNonNull(v, "translator");
            return this;
        }

        public Builder aligner(AlignmentScorer v) {
            this.aligner = Objects.requireNonNull(v, "aligner");
            return this;
        }

        public Builder postProcessor(PostProcessor v) {
            this.postProcessor = Objects.requireNonNull(v, "postProcessor");
            return this;
        }

        public Builder engine(MappingSearchEngine v) {
            this.engine = Objects.requireNonNull(v, "engine");
            return this;
        }

        public Builder graphBuilder(CooccurrenceGraphBuilder v) {
            this.graphBuilder = Objects.requireNonNull(v, "graphBuilder");
            return this;
        }

        public Builder detector(CommunityDetector v) {
            this.detector = Objects.requireNonNull(v, "detector");
            return this;
        }

        public Builder space(MappingSpace v) {
            this.space = Objects.requireNonNull(v, "space");
            return this;
        }

        public Builder feedback(FeedbackTable v) {
            this.feedback = v; // null => empty
            return this;
        }

        public Builder parameters(SearchParameters v) {
            this.parameters = Objects.requireNonNull(v, "parameters");
            return this;
        }

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder baseSeed(long v) {
            this.baseSeed = v;
            return this;
        }

        public Builder events(EventStore v) {
            this.events = v; // nullable => no event log
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = Objects.requireNonNull(v, "clock");
            return this;
        }

        public Builder runIds(Supplier<String> v) {
            this.runIds = Objects.requireNonNull(v, "runIds");
            return this;
        }

        public SectionOrchestrator build() {
            return new SectionOrchestrator(this);
        }
    }
}
