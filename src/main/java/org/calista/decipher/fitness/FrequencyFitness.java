package org.calista.decipher.fitness;

import org.calista.decipher.core.InvalidConfigurationException;
import org.calista.decipher.mapping.Mapping;
import org.calista.decipher.mapping.MappingSpace;

import java.util.List;
import java.util.Objects;

/**
 * FrequencyFitness — how often the marker fragment appears once a mapping is applied.
 *
 * <p>Substitution is cascading: one full-token literal replace pass per symbol, in alphabet
 * order, so later passes also rewrite text produced by earlier ones. Reproducibility depends
 * on keeping exactly this order.</p>
 *
 * Pure and thread-safe.
 */
public final class FrequencyFitness {

    public static final String DEFAULT_MARKER = "her";

    private final String marker;

    public FrequencyFitness() {
        this(DEFAULT_MARKER);
    }

    public FrequencyFitness(String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new InvalidConfigurationException("marker fragment must not be empty");
        }
        this.marker = marker;
    }

    public String marker() { return marker; }

    public int score(Mapping mapping, List<String> tokens) {
        Objects.requireNonNull(mapping, "mapping");
        if (tokens == null || tokens.isEmpty()) return 0;

        int total = 0;
        for (String token : tokens) {
            if (token == null || token.isEmpty()) continue;
            total += countOccurrences(transform(mapping, token), marker);
        }
        return total;
    }

    /**
     * Applies the mapping to one token (sequential pass per symbol).
     */
    public static String transform(Mapping mapping, String token) {
        if (token == null || token.isEmpty()) return "";
        MappingSpace space = mapping.space();
        String out = token;
        List<String> symbols = space.symbols();
        for (int i = 0; i < symbols.size(); i++) {
            out = out.replace(symbols.get(i), mapping.valueAt(i));
        }
        return out;
    }

    /** Non-overlapping, left to right. */
    static int countOccurrences(String text, String fragment) {
        if (text.isEmpty() || fragment.isEmpty()) return 0;
        int n = 0;
        int from = 0;
        while (true) {
            int at = text.indexOf(fragment, from);
            if (at < 0) return n;
            n++;
            from = at + fragment.length();
        }
    }
}
