package org.calista.decipher;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.decipher.events.DecipherEvent;
import org.calista.decipher.events.EventStore;
import org.calista.decipher.io.FileIO;
import org.calista.decipher.section.RunReport;
import org.calista.decipher.section.SectionResult;
import org.calista.decipher.section.SectionResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DecipherAppTest {

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("config"));
        Files.writeString(root.resolve("config/decipher.json"),
                "{\"search\":{\"populationSize\":20,\"generations\":5},"
                        + "\"sections\":[\"herbal\",\"astronomical\",\"missing\"]}");

        Files.createDirectories(root.resolve("data"));
        Files.writeString(root.resolve("data/transcription.jsonl"), String.join("\n",
                "{\"section\":\"herbal\",\"tokens\":[\"qo\",\"kch\",\"ar\",\"qo\",\"kch\",\"arin\"]}",
                "{\"section\":\"astronomical\",\"text\":\"tar.arin.qo sol tar arin kch.tar\"}",
                ""));
    }

    @Test
    @DisplayName("runs every section, saves results and logs the run")
    void endToEnd() throws Exception {
        RunReport report = new DecipherApp(root, Path.of("config/decipher.json")).run();

        assertThat(report.results).extracting(r -> r.section).containsExactly("herbal", "astronomical");
        assertThat(report.failures).containsOnlyKeys("missing");
        assertThat(report.hasFailures()).isTrue();

        FileIO io = new FileIO(root.resolve("data"));
        ObjectMapper mapper = new ObjectMapper();

        List<SectionResult> saved = new SectionResultStore(io, mapper, io.resolve("results.jsonl")).load();
        assertThat(saved).isEqualTo(report.results);

        List<DecipherEvent> events = new EventStore(io, mapper, io.resolve("events.jsonl")).readAll();
        assertThat(events).extracting(e -> e.type).containsExactly(
                DecipherEvent.RUN_STARTED,
                DecipherEvent.SECTION_DONE,
                DecipherEvent.SECTION_DONE,
                DecipherEvent.SECTION_FAILED,
                DecipherEvent.RUN_FINISHED,
                DecipherEvent.RESULTS_SAVED);
        assertThat(events).extracting(e -> e.runId).containsOnly(report.runId);
    }

    @Test
    @DisplayName("the same config gives the same mappings on a second run")
    void reproducible() throws Exception {
        RunReport first = new DecipherApp(root, Path.of("config/decipher.json")).run();
        RunReport second = new DecipherApp(root, Path.of("config/decipher.json")).run();

        assertThat(second.results).isEqualTo(first.results);
    }

    @Test
    void summaryListsSectionsAndFailures() throws Exception {
        RunReport report = new DecipherApp(root, Path.of("config/decipher.json")).run();

        String box = DecipherApp.summary(report);

        assertThat(box).contains("sections.ok: 2", "sections.failed: 1", "section: herbal", "FAILED missing");
    }
}
