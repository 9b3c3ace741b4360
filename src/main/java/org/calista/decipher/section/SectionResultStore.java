package org.calista.decipher.section;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.decipher.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * SectionResultStore — persists run results.
 *
 * <p>Format: JSONL, one {@link SectionResult} per line, preceded by the schema line
 * {@code {"_schema":"decipher-results-v1"}}. Written atomically through {@link FileIO}.
 * Reading skips the schema line; a broken row is logged and skipped.</p>
 */
public final class SectionResultStore {
    private static final Logger log = LogManager.getLogger(SectionResultStore.class);

    static final String SCHEMA_LINE = "{\"_schema\":\"decipher-results-v1\"}";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public SectionResultStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = io;
        this.mapper = mapper;
        this.file = file;
    }

    public void save(List<SectionResult> results) throws IOException {
        FileIO.WriterHandle h = io.openWriter(file);
        try {
            h.writer.write(SCHEMA_LINE);
            h.writer.newLine();
            for (SectionResult r : results) {
                h.writer.write(mapper.writeValueAsString(r));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            throw e;
        }
        log.info("Results saved: {} ({} sections)", file, results.size());
    }

    public List<SectionResult> load() throws IOException {
        if (!io.exists(file)) return List.of();

        ArrayList<SectionResult> out = new ArrayList<>();
        try (Stream<String> lines = io.jsonlStream(file)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.contains("\"_schema\"")) continue;
                try {
                    out.add(mapper.readValue(line, SectionResult.class));
                } catch (IOException | RuntimeException rowErr) {
                    log.warn("Skip broken result row in {}: {}", file, rowErr.getMessage());
                }
            }
        }
        return out;
    }

    public Path file() {
        return file;
    }
}
