package org.calista.decipher.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventStoreTest {

    @TempDir
    Path dir;

    @Test
    void appendsInOrderAndReadsBack() throws Exception {
        FileIO io = new FileIO(dir);
        EventStore store = new EventStore(io, new ObjectMapper(), io.resolve("events.jsonl"));

        assertThat(store.readAll()).isEmpty();

        store.append(DecipherEvent.of(DecipherEvent.RUN_STARTED, "r1", null, "herbal", 1000L));
        store.append(DecipherEvent.of(DecipherEvent.SECTION_DONE, "r1", "herbal", "fitness=42.0", 1001L));

        List<DecipherEvent> all = store.readAll();
        assertThat(all).extracting(e -> e.type)
                .containsExactly(DecipherEvent.RUN_STARTED, DecipherEvent.SECTION_DONE);
        assertThat(all.get(0).section).isNull();
        assertThat(all.get(1).section).isEqualTo("herbal");
        assertThat(all.get(1).text).isEqualTo("fitness=42.0");
        assertThat(all.get(1).tsEpochMs).isEqualTo(1001L);
        assertThat(io.readJsonl(store.file())).hasSize(2);
    }
}
