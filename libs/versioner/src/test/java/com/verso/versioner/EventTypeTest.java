package com.verso.versioner;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventType")
class EventTypeTest {

    @Test
    @DisplayName("canonical names are the published event contract")
    void canonicalNames() {
        assertThat(Arrays.stream(EventType.values()).map(EventType::value))
                .containsExactly(
                        "start",
                        "end",
                        "before-sync",
                        "after-sync",
                        "before-change",
                        "after-change",
                        "error-during-change",
                        "error");
    }

    @Nested
    @DisplayName("fromString")
    class FromString {

        @Test
        @DisplayName("resolves a known name")
        void resolvesKnown() {
            assertThat(EventType.fromString("error-during-change"))
                    .contains(EventType.ERROR_DURING_CHANGE);
        }

        @Test
        @DisplayName("is empty for unknown or constant-style names")
        void emptyForUnknown() {
            assertThat(EventType.fromString("BEFORE_CHANGE")).isEmpty();
            assertThat(EventType.fromString("rollback")).isEmpty();
            assertThat(EventType.fromString(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("only change events carry a version")
    void changeEvents() {
        assertThat(Arrays.stream(EventType.values()).filter(EventType::isChangeEvent))
                .containsExactlyInAnyOrder(
                        EventType.BEFORE_CHANGE,
                        EventType.AFTER_CHANGE,
                        EventType.ERROR_DURING_CHANGE);
    }
}
