package org.calista.decipher.section;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.io.FileIO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SectionResultStoreTest {

    @TempDir
    Path dir;

    private static SectionResult result(String section, double fitness) {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("qo", "her");
        mapping.put("kch", "ba");
        return new SectionResult(section, 7L, 6, mapping, fitness, 2.0, fitness - 2.0,
                List.of(10.0, fitness), List.of(List.of("qo", "kch"), List.of("ar")), 0.25,
                "The root.", 0.82);
    }

    @Test
    @DisplayName("saves a run with a schema line and loads it back")
    void saveAndLoad() throws Exception {
        FileIO io = new FileIO(dir);
        SectionResultStore store = new SectionResultStore(io, new ObjectMapper(), io.resolve("results.jsonl"));
        List<SectionResult> run = List.of(result("herbal", 42.0), result("astronomical", 27.0));

        store.save(run);

        List<String> lines = Files.readAllLines(store.file());
        assertThat(lines.get(0)).isEqualTo(SectionResultStore.SCHEMA_LINE);
        assertThat(lines).hasSize(3);

        List<SectionResult> loaded = store.load();
        assertThat(loaded).isEqualTo(run);
        assertThat(loaded.get(0).bestMapping.keySet()).containsExactly("qo", "kch");
        assertThat(Files.exists(dir.resolve("results.jsonl.tmp"))).isFalse();
    }

    @Test
    @DisplayName("skips broken rows and tolerates a missing file")
    void brokenRows() throws Exception {
        FileIO io = new FileIO(dir);
        SectionResultStore store = new SectionResultStore(io, new ObjectMapper(), io.resolve("results.jsonl"));

        assertThat(store.load()).isEmpty();

        store.save(List.of(result("herbal", 42.0)));
        Files.writeString(store.file(), "{broken\n", StandardOpenOption.APPEND);

        assertThat(store.load()).extracting(r -> r.section).containsExactly("herbal");
    }
}
