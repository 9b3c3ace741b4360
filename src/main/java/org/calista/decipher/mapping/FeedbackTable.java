package org.calista.decipher.mapping;

import org.calista.decipher.core.InvalidConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Expert feedback: presumed-correct token for a subset of the alphabet.
 */
public final class FeedbackTable {

    private static final FeedbackTable EMPTY = new FeedbackTable(Map.of());

    private final Map<String, String> expected;

    private FeedbackTable(Map<String, String> expected) {
        this.expected = expected;
    }

    public static FeedbackTable empty() {
        return EMPTY;
    }

    public static FeedbackTable of(Map<String, String> expected) {
        if (expected == null || expected.isEmpty()) return EMPTY;
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(expected.size() * 2);
        for (Map.Entry<String, String> e : expected.entrySet()) {
            if (e.getKey() == null || e.getKey().isEmpty() || e.getValue() == null) {
                throw new InvalidConfigurationException("feedback entries need a symbol and a token: " + e);
            }
            copy.put(e.getKey(), e.getValue());
        }
        return new FeedbackTable(Collections.unmodifiableMap(copy));
    }

    /**
     * Checks the table against a space: every symbol in the alphabet, every token a candidate.
     */
    public FeedbackTable checkAgainst(MappingSpace space) {
        Objects.requireNonNull(space, "space");
        for (Map.Entry<String, String> e : expected.entrySet()) {
            if (!space.hasSymbol(e.getKey())) {
                throw new InvalidConfigurationException("feedback symbol not in alphabet: " + e.getKey());
            }
            if (!space.hasCandidate(e.getValue())) {
                throw new InvalidConfigurationException("feedback token not a candidate: " + e.getValue());
            }
        }
        return this;
    }

    public Map<String, String> entries() { return expected; }

    public int size() { return expected.size(); }

    public boolean isEmpty() { return expected.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeedbackTable other)) return false;
        return expected.equals(other.expected);
    }

    @Override
    public int hashCode() {
        return expected.hashCode();
    }

    @Override
    public String toString() {
        return "FeedbackTable" + expected;
    }
}
