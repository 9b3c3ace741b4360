package org.calista.decipher.section;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one pass over all configured sections: results of the sections that
 * completed, errors of those that did not.
 */
public final class RunReport {

    public final String runId;
    public final List<SectionResult> results;
    /** section -> failure message, in processing order */
    public final Map<String, String> failures;
    public final long elapsedMs;

    public RunReport(String runId, List<SectionResult> results, Map<String, String> failures, long elapsedMs) {
        this.runId = runId;
        this.results = (results == null) ? List.of() : List.copyOf(results);
        this.failures = (failures == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.elapsedMs = elapsedMs;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public Optional<SectionResult> result(String section) {
        for (SectionResult r : results) {
            if (r.section.equals(section)) return Optional.of(r);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RunReport{runId=" + runId
                + ", ok=" + results.size()
                + ", failed=" + failures.keySet()
                + ", ms=" + elapsedMs + '}';
    }
}
