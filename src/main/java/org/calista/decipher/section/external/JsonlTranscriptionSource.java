package org.calista.decipher.section.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.io.FileIO;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * JsonlTranscriptionSource — section tokens from a JSONL transcription file.
 *
 * <p>One record per line, either
 * {@code {"section":"herbal","tokens":["qo","kch"]}} or
 * {@code {"section":"herbal","text":"qo.kch arin"}} (split on whitespace and '.').
 * Records of the same section are concatenated in file order.</p>
 *
 * <p>The file is read once, on first use. Broken lines are skipped with a warning unless
 * {@code failFast}.</p>
 */
public final class JsonlTranscriptionSource implements TranscriptionSource {
    private static final Logger log = LogManager.getLogger(JsonlTranscriptionSource.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;
    private final boolean failFast;

    private volatile Map<String, List<String>> sections;

    public JsonlTranscriptionSource(FileIO io, ObjectMapper mapper, Path file, boolean failFast) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
        this.failFast = failFast;
    }

    @Override
    public List<String> loadSectionTokens(String section) throws IOException {
        List<String> t = sections().get(section);
        if (t == null) throw new NoSuchElementException("no transcription for section '" + section + "' in " + file);
        return t;
    }

    public Map<String, List<String>> sections() throws IOException {
        Map<String, List<String>> s = sections;
        if (s != null) return s;
        synchronized (this) {
            if (sections == null) sections = load().sections;
            return sections;
        }
    }

    public Path file() {
        return file;
    }

    public Report load() throws IOException {
        if (!io.exists(file)) throw new NoSuchFileException(file.toString(), null, "transcription not found");

        LinkedHashMap<String, List<String>> acc = new LinkedHashMap<>();
        int ok = 0, bad = 0;

        for (String line : io.readJsonl(file)) {
            try {
                Record r = mapper.readValue(line, Record.class);
                r.validate();
                acc.computeIfAbsent(r.section.trim(), k -> new ArrayList<>()).addAll(r.tokenList());
                ok++;
            } catch (Exception e) {
                bad++;
                log.warn("Bad transcription line in {}: {}", file, e.toString());
                if (failFast) throw new IOException("Bad transcription line in " + file + ": " + e, e);
            }
        }

        LinkedHashMap<String, List<String>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : acc.entrySet()) frozen.put(e.getKey(), List.copyOf(e.getValue()));

        log.info("Transcription loaded: {} (sections={}, ok={}, bad={})", file, frozen.size(), ok, bad);
        return new Report(file, Collections.unmodifiableMap(frozen), ok, bad);
    }

    // ---------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Record {
        public String section;
        public List<String> tokens;
        public String text;

        void validate() {
            if (section == null || section.isBlank()) throw new IllegalArgumentException("record.section is required");
            if (tokens == null && text == null) throw new IllegalArgumentException("record needs tokens or text");
        }

        List<String> tokenList() {
            ArrayList<String> out = new ArrayList<>();
            if (tokens != null) {
                for (String t : tokens) {
                    if (t != null && !t.isBlank()) out.add(t.trim());
                }
            }
            if (text != null) {
                for (String t : text.split("[\\s.]+")) {
                    if (!t.isBlank()) out.add(t);
                }
            }
            return out;
        }
    }

    public static final class Report {
        public final Path file;
        public final Map<String, List<String>> sections;
        public final int ok;
        public final int bad;

        public Report(Path file, Map<String, List<String>> sections, int ok, int bad) {
            this.file = file;
            this.sections = sections;
            this.ok = ok;
            this.bad = bad;
        }
    }
}
