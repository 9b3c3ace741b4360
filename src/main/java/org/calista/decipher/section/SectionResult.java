package org.calista.decipher.section;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-section output of one run. Built once by the orchestrator, never mutated.
 *
 * Public final fields (Jackson reads them directly; the creator below restores them).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SectionResult {

    public final String section;
    public final long seed;
    public final int tokenCount;

    // mapping search
    public final Map<String, String> bestMapping;
    public final double bestFitness;
    public final double frequencyScore;
    public final double feedbackScore;
    /** Best fitness per generation, generation 0 first. */
    public final List<Double> fitnessHistory;

    // clustering
    public final List<List<String>> communities;
    public final double modularity;

    // external collaborators
    public final String translation;
    public final double alignmentScore;

    @JsonCreator
    public SectionResult(@JsonProperty("section") String section,
                         @JsonProperty("seed") long seed,
                         @JsonProperty("tokenCount") int tokenCount,
                         @JsonProperty("bestMapping") Map<String, String> bestMapping,
                         @JsonProperty("bestFitness") double bestFitness,
                         @JsonProperty("frequencyScore") double frequencyScore,
                         @JsonProperty("feedbackScore") double feedbackScore,
                         @JsonProperty("fitnessHistory") List<Double> fitnessHistory,
                         @JsonProperty("communities") List<List<String>> communities,
                         @JsonProperty("modularity") double modularity,
                         @JsonProperty("translation") String translation,
                         @JsonProperty("alignmentScore") double alignmentScore) {
        this.section = Objects.requireNonNull(section, "section");
        this.seed = seed;
        this.tokenCount = tokenCount;
        this.bestMapping = (bestMapping == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bestMapping));
        this.bestFitness = bestFitness;
        this.frequencyScore = frequencyScore;
        this.feedbackScore = feedbackScore;
        this.fitnessHistory = (fitnessHistory == null) ? List.of() : List.copyOf(fitnessHistory);
        this.communities = copyNested(communities);
        this.modularity = modularity;
        this.translation = (translation == null) ? "" : translation;
        this.alignmentScore = alignmentScore;
    }

    private static List<List<String>> copyNested(List<List<String>> in) {
        if (in == null || in.isEmpty()) return List.of();
        ArrayList<List<String>> out = new ArrayList<>(in.size());
        for (List<String> c : in) out.add(c == null ? List.of() : List.copyOf(c));
        return List.copyOf(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SectionResult r)) return false;
        return seed == r.seed
                && tokenCount == r.tokenCount
                && Double.compare(bestFitness, r.bestFitness) == 0
                && Double.compare(frequencyScore, r.frequencyScore) == 0
                && Double.compare(feedbackScore, r.feedbackScore) == 0
                && Double.compare(modularity, r.modularity) == 0
                && Double.compare(alignmentScore, r.alignmentScore) == 0
                && section.equals(r.section)
                && bestMapping.equals(r.bestMapping)
                && fitnessHistory.equals(r.fitnessHistory)
                && communities.equals(r.communities)
                && translation.equals(r.translation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(section, seed, bestMapping, bestFitness, communities, translation, alignmentScore);
    }

    @Override
    public String toString() {
        return "SectionResult{section=" + section
                + ", bestFitness=" + bestFitness
                + ", mapping=" + bestMapping
                + ", communities=" + communities.size()
                + ", alignment=" + alignmentScore + '}';
    }
}
