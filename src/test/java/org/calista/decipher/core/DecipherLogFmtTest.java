package org.calista.decipher.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class DecipherLogFmtTest {

    @Test
    void rendersFramedBox() {
        String box = DecipherLogFmt.box("Run", b -> b.kv("sections", 4).sep().line("free text").kv(null, "x"));

        String[] rows = box.split("\n");
        assertThat(rows).hasSize(8);
        assertThat(rows[0]).startsWith("┌").endsWith("┐");
        assertThat(rows[1]).contains("Run");
        assertThat(rows[3]).contains("sections: 4");
        assertThat(rows[4]).startsWith("│─");
        assertThat(rows[5]).contains("free text");
        assertThat(rows[6]).startsWith("│ : x");
        assertThat(rows[7]).startsWith("└");
        assertThat(Arrays.stream(rows).mapToInt(String::length).distinct().count()).isEqualTo(1);
    }
}
