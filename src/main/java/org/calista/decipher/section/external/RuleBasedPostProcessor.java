package org.calista.decipher.section.external;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RuleBasedPostProcessor — deterministic clean-up of generated text.
 *
 * Pipeline:
 *  1) NFKC, NBSP -> space
 *  2) global literal replacements, in rule order
 *  3) section replacements, in rule order
 *  4) whitespace collapse, no space before punctuation
 *  5) capitalize the first letter
 */
public final class RuleBasedPostProcessor implements PostProcessor {

    private final Map<String, String> rules;
    private final Map<String, Map<String, String>> sectionRules;

    public RuleBasedPostProcessor(Map<String, String> rules, Map<String, Map<String, String>> sectionRules) {
        this.rules = ordered(rules);
        LinkedHashMap<String, Map<String, String>> sr = new LinkedHashMap<>();
        if (sectionRules != null) {
            for (Map.Entry<String, Map<String, String>> e : sectionRules.entrySet()) {
                sr.put(e.getKey(), ordered(e.getValue()));
            }
        }
        this.sectionRules = sr;
    }

    @Override
    public String postProcess(String text, String section) {
        if (text == null || text.isBlank()) return "";

        String x = Normalizer.normalize(text, Normalizer.Form.NFKC).replace('\u00A0', ' ');
        x = apply(x, rules);
        x = apply(x, sectionRules.getOrDefault(section, Map.of()));

        x = x.replaceAll("\\s+", " ").trim();
        x = x.replaceAll(" +([.,;:!?])", "$1");

        return capitalizeFirst(x);
    }

    private static String apply(String text, Map<String, String> r) {
        String x = text;
        for (Map.Entry<String, String> e : r.entrySet()) {
            if (e.getKey().isEmpty()) continue;
            x = x.replace(e.getKey(), e.getValue() == null ? "" : e.getValue());
        }
        return x;
    }

    private static String capitalizeFirst(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                if (Character.isUpperCase(c)) return s;
                return s.substring(0, i) + Character.toUpperCase(c) + s.substring(i + 1);
            }
        }
        return s;
    }

    private static Map<String, String> ordered(Map<String, String> in) {
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        if (in != null) out.putAll(in);
        return out;
    }
}
