package org.calista.decipher.section.external;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Fixed section -> tokens table.
 */
public final class InMemoryTranscriptionSource implements TranscriptionSource {

    private final Map<String, List<String>> sections;

    public InMemoryTranscriptionSource(Map<String, List<String>> sections) {
        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
        if (sections != null) {
            for (Map.Entry<String, List<String>> e : sections.entrySet()) {
                copy.put(e.getKey(), e.getValue() == null ? List.of() : List.copyOf(e.getValue()));
            }
        }
        this.sections = copy;
    }

    @Override
    public List<String> loadSectionTokens(String section) {
        List<String> t = sections.get(section);
        if (t == null) throw new NoSuchElementException("no transcription for section: " + section);
        return t;
    }

    public Set<String> sections() {
        return sections.keySet();
    }
}
