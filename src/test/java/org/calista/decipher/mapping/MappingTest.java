package org.calista.decipher.mapping;

import org.calista.decipher.core.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingTest {

    private static final MappingSpace SPACE = MappingSpace.of(
            List.of("qo", "kch", "arin", "tar"),
            List.of("her", "ba", "aqua", "igni", "sol"));

    // =========================================================================
    //  MappingSpace
    // =========================================================================

    @Nested
    @DisplayName("MappingSpace")
    class Space {

        @Test
        @DisplayName("keeps configured order and slot lookup")
        void order() {
            assertThat(SPACE.symbols()).containsExactly("qo", "kch", "arin", "tar");
            assertThat(SPACE.candidates()).containsExactly("her", "ba", "aqua", "igni", "sol");
            assertThat(SPACE.size()).isEqualTo(4);
            assertThat(SPACE.slotOf("arin")).isEqualTo(2);
            assertThat(SPACE.slotOf("nope")).isEqualTo(-1);
            assertThat(SPACE.hasCandidate("sol")).isTrue();
            assertThat(SPACE.hasSymbol("her")).isFalse();
        }

        @Test
        @DisplayName("rejects empty alphabet or candidate set")
        void rejectsEmpty() {
            assertThatThrownBy(() -> MappingSpace.of(List.of(), List.of("her")))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> MappingSpace.of(List.of("qo"), List.of()))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("rejects duplicates and empty entries")
        void rejectsDuplicates() {
            assertThatThrownBy(() -> MappingSpace.of(List.of("qo", "qo"), List.of("her")))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("duplicate");
            assertThatThrownBy(() -> MappingSpace.of(List.of("qo", ""), List.of("her")))
                    .isInstanceOf(InvalidConfigurationException.class);
        }
    }

    // =========================================================================
    //  Mapping
    // =========================================================================

    @Nested
    @DisplayName("Mapping")
    class Values {

        @Test
        @DisplayName("stores values in slot order and exposes an ordered map")
        void asMap() {
            Mapping m = Mapping.of(SPACE, "her", "ba", "aqua", "igni");

            assertThat(m.get("kch")).isEqualTo("ba");
            assertThat(m.valueAt(3)).isEqualTo("igni");
            assertThat(m.asMap().keySet()).containsExactly("qo", "kch", "arin", "tar");
            assertThat(m.asMap()).containsEntry("arin", "aqua");
        }

        @Test
        @DisplayName("allows repeated values")
        void repeatedValues() {
            Mapping m = Mapping.of(SPACE, "her", "her", "her", "her");
            assertThat(m.asMap().values()).containsOnly("her");
        }

        @Test
        @DisplayName("values() returns a copy")
        void valuesAreCopied() {
            Mapping m = Mapping.of(SPACE, "her", "ba", "aqua", "igni");
            String[] v = m.values();
            v[0] = "sol";

            assertThat(m.get("qo")).isEqualTo("her");
            assertThat(m.withValues(v).get("qo")).isEqualTo("sol");
        }

        @Test
        @DisplayName("rejects wrong arity and unknown candidates")
        void rejectsInvalid() {
            assertThatThrownBy(() -> Mapping.of(SPACE, "her", "ba"))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> Mapping.of(SPACE, "her", "ba", "aqua", "fire"))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("fire");
        }

        @Test
        @DisplayName("fromMap requires every symbol and nothing else")
        void fromMap() {
            Map<String, String> full = new LinkedHashMap<>();
            full.put("tar", "igni");
            full.put("qo", "her");
            full.put("kch", "ba");
            full.put("arin", "aqua");

            assertThat(Mapping.fromMap(SPACE, full)).isEqualTo(Mapping.of(SPACE, "her", "ba", "aqua", "igni"));

            Map<String, String> missing = new LinkedHashMap<>(full);
            missing.remove("tar");
            assertThatThrownBy(() -> Mapping.fromMap(SPACE, missing))
                    .isInstanceOf(InvalidConfigurationException.class);

            Map<String, String> extra = new LinkedHashMap<>(full);
            extra.put("zz", "her");
            assertThatThrownBy(() -> Mapping.fromMap(SPACE, extra))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("has value semantics")
        void equality() {
            Mapping a = Mapping.of(SPACE, "her", "ba", "aqua", "igni");
            Mapping b = Mapping.of(SPACE, List.of("her", "ba", "aqua", "igni"));

            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
            assertThat(a).isNotEqualTo(Mapping.of(SPACE, "her", "ba", "aqua", "sol"));
        }
    }

    // =========================================================================
    //  FeedbackTable
    // =========================================================================

    @Nested
    @DisplayName("FeedbackTable")
    class Feedback {

        @Test
        @DisplayName("accepts a subset of the alphabet")
        void subset() {
            FeedbackTable t = FeedbackTable.of(Map.of("qo", "her")).checkAgainst(SPACE);
            assertThat(t.size()).isEqualTo(1);
            assertThat(FeedbackTable.of(null).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("rejects symbols outside the alphabet and tokens outside the candidates")
        void rejectsForeign() {
            assertThatThrownBy(() -> FeedbackTable.of(Map.of("xx", "her")).checkAgainst(SPACE))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("xx");
            assertThatThrownBy(() -> FeedbackTable.of(Map.of("qo", "fire")).checkAgainst(SPACE))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("fire");
        }
    }
}
