package org.calista.decipher.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.graph.CooccurrenceGraphBuilder;
import org.calista.decipher.io.FileIO;
import org.calista.decipher.mapping.FeedbackTable;
import org.calista.decipher.mapping.MappingSpace;
import org.calista.decipher.search.SearchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DecipherConfig — plain POJO config:
 * - defaults in fields (the reference run)
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() fills missing parts, then rejects values no run can use
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DecipherConfig {

    private static final Logger log = LoggerFactory.getLogger(DecipherConfig.class);

    public String baseDir = "data";
    public MappingSection mapping = new MappingSection();
    public Search search = new Search();
    public Graph graph = new Graph();
    public Transcription transcription = new Transcription();
    public List<String> sections = new ArrayList<>(List.of("herbal", "astronomical", "balneological", "pharmaceutical"));
    public Translation translation = new Translation();
    public Alignment alignment = new Alignment();
    public Correction correction = new Correction();
    public EvalPool evalPool = new EvalPool();
    public Events events = new Events();
    public Results results = new Results();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class MappingSection {
        public List<String> symbols = new ArrayList<>(List.of("qo", "kch", "arin", "tar"));
        public List<String> candidates = new ArrayList<>(List.of("her", "ba", "aqua", "igni", "sol"));
        /** Expert feedback: symbol -> presumed token. May cover only part of the alphabet. */
        public Map<String, String> feedback = orderedMap(
                "qo", "her",
                "kch", "ba",
                "arin", "aqua",
                "tar", "igni");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Search {
        public int populationSize = SearchParameters.DEFAULT_POPULATION_SIZE;
        public int generations = SearchParameters.DEFAULT_GENERATIONS;
        public double crossoverProbability = SearchParameters.DEFAULT_CROSSOVER_PROBABILITY;
        public double mutationProbability = SearchParameters.DEFAULT_MUTATION_PROBABILITY;
        public double swapProbability = SearchParameters.DEFAULT_SWAP_PROBABILITY;
        public int tournamentSize = SearchParameters.DEFAULT_TOURNAMENT_SIZE;
        /** Base seed; each section mixes its name into it. */
        public long seed = 42L;
        public String markerFragment = "her";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Graph {
        public int windowSize = CooccurrenceGraphBuilder.DEFAULT_WINDOW_SIZE;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Transcription {
        /** JSONL under baseDir: {"section":..., "tokens":[...]} or {"section":..., "text":"..."} */
        public String file = "transcription.jsonl";
        public boolean failFast = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Translation {
        public Map<String, String> texts = orderedMap(
                "herbal", "the root of this plant is taken with water and heat against pain of the head",
                "astronomical", "when the sun stands in the sign the stars of the circle turn toward the north",
                "balneological", "the women bathe in green water , the waters flow through the tubes to the body",
                "pharmaceutical", "take the leaf and the root , grind them and mix with warm water before sleep");
        public String fallback = "no reading available for this section";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Alignment {
        public Map<String, Double> scores = orderedScores(
                "herbal", 0.82,
                "astronomical", 0.67,
                "balneological", 0.58,
                "pharmaceutical", 0.74);
        public double defaultScore = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Correction {
        /** Literal replacements applied to every section, in order. */
        public Map<String, String> rules = orderedMap(
                "teh", "the",
                "watre", "water");
        /** Extra literal replacements per section, applied after the global ones. */
        public Map<String, Map<String, String>> sectionRules = sectionRulesDefaults();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EvalPool {
        /** Fitness evaluation threads. 1 => evaluate on the caller thread. */
        public int parallelism = 1;

        /** Bounded queue capacity (backpressure via CallerRunsPolicy). */
        public int queueCapacity = 4096;

        public String threadNamePrefix = "decipher-eval-";

        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public String logFile = "events.jsonl";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Results {
        public String file = "results.jsonl";
    }

    // -------------------- Load / Create --------------------

    /**
     * Loads the config. A missing or blank file is replaced by the defaults, written to disk.
     */
    public static DecipherConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            DecipherConfig created = new DecipherConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            DecipherConfig created = new DecipherConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        DecipherConfig cfg = mapper.readValue(json, DecipherConfig.class);
        if (cfg == null) cfg = new DecipherConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, DecipherConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, DecipherConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    /**
     * Missing sections and blank names fall back to defaults; values that cannot
     * describe a run throw {@link InvalidConfigurationException}.
     */
    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (mapping == null) mapping = new MappingSection();
        if (mapping.symbols == null) mapping.symbols = List.of();
        if (mapping.candidates == null) mapping.candidates = List.of();
        if (mapping.feedback == null) mapping.feedback = new LinkedHashMap<>();

        if (search == null) search = new Search();
        if (search.markerFragment == null) search.markerFragment = "her";

        if (graph == null) graph = new Graph();

        if (transcription == null) transcription = new Transcription();
        if (transcription.file == null || transcription.file.isBlank()) transcription.file = "transcription.jsonl";

        if (sections == null) sections = new ArrayList<>();

        if (translation == null) translation = new Translation();
        if (translation.texts == null) translation.texts = new LinkedHashMap<>();
        if (translation.fallback == null) translation.fallback = "";

        if (alignment == null) alignment = new Alignment();
        if (alignment.scores == null) alignment.scores = new LinkedHashMap<>();
        if (!Double.isFinite(alignment.defaultScore)) alignment.defaultScore = 0.5;

        if (correction == null) correction = new Correction();
        if (correction.rules == null) correction.rules = new LinkedHashMap<>();
        if (correction.sectionRules == null) correction.sectionRules = new LinkedHashMap<>();

        if (evalPool == null) evalPool = new EvalPool();
        if (evalPool.parallelism < 1) evalPool.parallelism = 1;
        if (evalPool.queueCapacity < 32) evalPool.queueCapacity = 32;
        if (evalPool.threadNamePrefix == null || evalPool.threadNamePrefix.isBlank())
            evalPool.threadNamePrefix = "decipher-eval-";
        if (evalPool.shutdownTimeoutMs < 250) evalPool.shutdownTimeoutMs = 250;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";

        if (results == null) results = new Results();
        if (results.file == null || results.file.isBlank()) results.file = "results.jsonl";

        // hard checks: building the domain objects runs their own validation
        FeedbackTable fb = feedbackTable();
        fb.checkAgainst(mappingSpace());
        searchParameters();
        InvalidConfigurationException.check(graph.windowSize >= 1,
                "graph.windowSize must be >= 1, got " + graph.windowSize);
        for (String s : sections) {
            InvalidConfigurationException.check(s != null && !s.isBlank(), "sections must not contain blank names");
        }
        for (Double v : alignment.scores.values()) {
            InvalidConfigurationException.check(v != null && Double.isFinite(v), "alignment.scores must be finite numbers");
        }
    }

    // -------------------- Domain views --------------------

    public MappingSpace mappingSpace() {
        return MappingSpace.of(mapping.symbols, mapping.candidates);
    }

    public FeedbackTable feedbackTable() {
        return FeedbackTable.of(mapping.feedback);
    }

    public SearchParameters searchParameters() {
        return SearchParameters.builder()
                .populationSize(search.populationSize)
                .generations(search.generations)
                .crossoverProbability(search.crossoverProbability)
                .mutationProbability(search.mutationProbability)
                .swapProbability(search.swapProbability)
                .tournamentSize(search.tournamentSize)
                .markerFragment(search.markerFragment)
                .build();
    }

    // -------------------- Defaults helpers --------------------

    private static Map<String, String> orderedMap(String... kv) {
        LinkedHashMap<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }

    private static Map<String, Double> orderedScores(Object... kv) {
        LinkedHashMap<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) m.put((String) kv[i], ((Number) kv[i + 1]).doubleValue());
        return m;
    }

    private static Map<String, Map<String, String>> sectionRulesDefaults() {
        LinkedHashMap<String, Map<String, String>> m = new LinkedHashMap<>();
        m.put("herbal", orderedMap("leafe", "leaf", "rote", "root"));
        m.put("astronomical", orderedMap("sonne", "sun"));
        return m;
    }
}
