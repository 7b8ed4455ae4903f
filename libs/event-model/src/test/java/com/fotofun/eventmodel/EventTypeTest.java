package com.fotofun.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the EventType tag enum and AggregateType.
 */
@DisplayName("EventType & AggregateType")
class EventTypeTest {

    @Nested
    @DisplayName("EventType enum")
    class EventTypeTests {

        @Test
        @DisplayName("uses dotted canonical names")
        void canonicalNames() {
            assertThat(EventType.OBJECT_ADDED.value()).isEqualTo("canvas.object.added");
            assertThat(EventType.OBJECT_REMOVED.value()).isEqualTo("canvas.object.removed");
            assertThat(EventType.LAYERS_REORDERED.value()).isEqualTo("layers.reordered");
            assertThat(EventType.HISTORY_UNDO.value()).isEqualTo("history.undo");
        }

        @Test
        @DisplayName("canonical names are unique")
        void uniqueNames() {
            assertThat(Arrays.stream(EventType.values()).map(EventType::value).distinct().count())
                    .isEqualTo(EventType.values().length);
        }

        @Test
        @DisplayName("fromValue returns correct enum for known type")
        void fromValueKnown() {
            assertThat(EventType.fromValue("tool.option.changed")).contains(EventType.TOOL_OPTION_CHANGED);
        }

        @Test
        @DisplayName("fromValue returns empty for unknown type")
        void fromValueUnknown() {
            assertThat(EventType.fromValue("canvas.exploded")).isEmpty();
        }

        @Test
        @DisplayName("only history kinds are flagged as history events")
        void historyFlag() {
            assertThat(Arrays.stream(EventType.values()).filter(EventType::isHistoryEvent))
                    .containsExactlyInAnyOrder(EventType.HISTORY_UNDO, EventType.HISTORY_REDO);
        }

        @Test
        @DisplayName("every type has a behaviour registered")
        void everyTypeHasBehaviour() {
            for (EventType type : EventType.values()) {
                assertThat(EventBehaviors.of(type).payloadType()).isEqualTo(type.payloadClass());
            }
        }
    }

    @Nested
    @DisplayName("AggregateType enum")
    class AggregateTypeTests {

        @Test
        @DisplayName("has the five aggregate groups")
        void hasGroups() {
            assertThat(AggregateType.values()).extracting(AggregateType::value)
                    .containsExactly("canvas", "layer", "selection", "tool", "workflow");
        }

        @Test
        @DisplayName("fromValue resolves canonical strings")
        void fromValue() {
            assertThat(AggregateType.fromValue("layer")).contains(AggregateType.LAYER);
            assertThat(AggregateType.fromValue("object")).isEmpty();
        }
    }
}
