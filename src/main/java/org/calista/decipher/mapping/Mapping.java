package org.calista.decipher.mapping;

import org.calista.decipher.core.InvalidConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mapping — total assignment symbol -> candidate token.
 *
 * Immutable value: variation operators build new instances via {@link #withValues(String[])},
 * so population members never alias each other. Values are kept in alphabet slot order.
 */
public final class Mapping {

    private final MappingSpace space;
    private final String[] values;

    private Mapping(MappingSpace space, String[] values) {
        this.space = space;
        this.values = values;
    }

    public static Mapping of(MappingSpace space, List<String> values) {
        Objects.requireNonNull(space, "space");
        Objects.requireNonNull(values, "values");
        return of(space, values.toArray(new String[0]));
    }

    public static Mapping of(MappingSpace space, String... values) {
        Objects.requireNonNull(space, "space");
        Objects.requireNonNull(values, "values");
        if (values.length != space.size()) {
            throw new InvalidConfigurationException(
                    "mapping needs " + space.size() + " values, got " + values.length);
        }
        String[] copy = values.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!space.hasCandidate(copy[i])) {
                throw new InvalidConfigurationException(
                        "symbol '" + space.symbols().get(i) + "' mapped to unknown candidate: " + copy[i]);
            }
        }
        return new Mapping(space, copy);
    }

    /** Builds a mapping from an explicit association; every symbol must be present. */
    public static Mapping fromMap(MappingSpace space, Map<String, String> assignment) {
        Objects.requireNonNull(space, "space");
        Objects.requireNonNull(assignment, "assignment");
        String[] v = new String[space.size()];
        for (int i = 0; i < v.length; i++) {
            String symbol = space.symbols().get(i);
            v[i] = assignment.get(symbol);
            if (v[i] == null) throw new InvalidConfigurationException("symbol is unmapped: " + symbol);
        }
        for (String k : assignment.keySet()) {
            if (!space.hasSymbol(k)) throw new InvalidConfigurationException("unknown symbol in mapping: " + k);
        }
        return of(space, v);
    }

    // ---------------------------------------------------------------------

    public MappingSpace space() { return space; }

    public int size() { return values.length; }

    public String valueAt(int slot) { return values[slot]; }

    public String get(String symbol) {
        int slot = space.slotOf(symbol);
        return slot < 0 ? null : values[slot];
    }

    /** Slot-ordered copy of the values, for variation operators. */
    public String[] values() { return values.clone(); }

    public Mapping withValues(String[] newValues) {
        return of(space, newValues);
    }

    /** Insertion-ordered (alphabet order) read-only view. */
    public Map<String, String> asMap() {
        LinkedHashMap<String, String> m = new LinkedHashMap<>(values.length * 2);
        for (int i = 0; i < values.length; i++) m.put(space.symbols().get(i), values[i]);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mapping other)) return false;
        return space.equals(other.space) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * space.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
