package org.calista.decipher.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class DecipherEvent {

    public static final String RUN_STARTED = "RUN_STARTED";
    public static final String SECTION_DONE = "SECTION_DONE";
    public static final String SECTION_FAILED = "SECTION_FAILED";
    public static final String RUN_FINISHED = "RUN_FINISHED";
    public static final String RESULTS_SAVED = "RESULTS_SAVED";

    public String type;
    public long tsEpochMs;
    public String runId;
    public String section;     // null for run-level events
    public String text;        // payload: summary line / error message

    public static DecipherEvent of(String type, String runId, String section, String text, long tsEpochMs) {
        DecipherEvent e = new DecipherEvent();
        e.type = type;
        e.runId = runId;
        e.section = section;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
