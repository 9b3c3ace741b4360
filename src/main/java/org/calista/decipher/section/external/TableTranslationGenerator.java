package org.calista.decipher.section.external;

import java.util.Map;

/**
 * Canned translations keyed by section, with a fallback for unknown sections.
 * No inference happens here.
 */
public final class TableTranslationGenerator implements TranslationGenerator {

    private final Map<String, String> texts;
    private final String fallback;

    public TableTranslationGenerator(Map<String, String> texts, String fallback) {
        this.texts = (texts == null) ? Map.of() : Map.copyOf(texts);
        this.fallback = (fallback == null) ? "" : fallback;
    }

    @Override
    public String generateTranslation(String section) {
        String t = texts.get(section);
        return (t == null) ? fallback : t;
    }
}
