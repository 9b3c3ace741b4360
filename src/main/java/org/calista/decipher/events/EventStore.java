package org.calista.decipher.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSONL run log.
 */
public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = io;
        this.mapper = mapper;
        this.file = file;
    }

    public synchronized void append(DecipherEvent e) throws IOException {
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    public List<DecipherEvent> readAll() throws IOException {
        if (!io.exists(file)) return List.of();
        ArrayList<DecipherEvent> out = new ArrayList<>();
        for (String line : io.readJsonl(file)) out.add(mapper.readValue(line, DecipherEvent.class));
        return out;
    }

    public Path file() {
        return file;
    }
}
