package tech.flowcatalyst.resourcebridge.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CommandArgumentsTest {

    private static CommandArguments args(Map<String, Object> values) {
        return new CommandArguments(values);
    }

    @Test
    @DisplayName("integer should accept whole numbers in any numeric form")
    void integer_shouldAcceptWholeNumbers() {
        CommandArguments arguments = args(Map.of("a", 5, "b", 7L, "c", 3.0, "d", " 12 "));

        assertThat(arguments.integer("a")).isEqualTo(5);
        assertThat(arguments.integer("b")).isEqualTo(7);
        assertThat(arguments.integer("c")).isEqualTo(3);
        assertThat(arguments.integer("d")).isEqualTo(12);
        assertThat(arguments.integer("missing")).isNull();
        assertThat(arguments.integer("missing", 0)).isZero();
    }

    @Test
    @DisplayName("integer should reject fractions, text and out-of-range values")
    void integer_shouldRejectNonIntegers() {
        CommandArguments arguments = args(Map.of("frac", 1.5, "text", "abc", "big", Long.MAX_VALUE, "list", List.of(1)));

        assertThatThrownBy(() -> arguments.integer("frac")).isInstanceOf(InvalidArgumentException.class)
            .hasMessage("frac must be an integer");
        assertThatThrownBy(() -> arguments.integer("text")).hasMessage("text must be an integer");
        assertThatThrownBy(() -> arguments.integer("big")).hasMessage("big is out of range");
        assertThatThrownBy(() -> arguments.integer("list")).hasMessage("list must be an integer");
    }

    @Test
    @DisplayName("explicit nulls should read as absent")
    void nulls_shouldReadAsAbsent() {
        Map<String, Object> values = new HashMap<>();
        values.put("data", null);
        values.put("flag", null);
        CommandArguments arguments = args(values);

        assertThat(arguments.has("data")).isFalse();
        assertThat(arguments.map("data")).isEmpty();
        assertThat(arguments.bool("flag")).isFalse();
        assertThat(CommandArguments.empty().list("ids")).isEmpty();
    }

    @Test
    @DisplayName("map and list should enforce their shapes")
    void mapAndList_shouldEnforceShape() {
        CommandArguments arguments = args(Map.of("data", "oops", "ids", 4, "filters", Map.of("a", 1)));

        assertThatThrownBy(() -> arguments.map("data")).hasMessage("data must be an object");
        assertThatThrownBy(() -> arguments.list("filters")).hasMessage("filters must be a list");
        assertThat(arguments.list("ids")).containsExactly(4);
        assertThat(arguments.map("filters")).containsEntry("a", 1);
    }

    @Test
    @DisplayName("bool should accept booleans and their string forms only")
    void bool_shouldParse() {
        CommandArguments arguments = args(Map.of("a", true, "b", "FALSE", "c", "yes"));

        assertThat(arguments.bool("a")).isTrue();
        assertThat(arguments.bool("b")).isFalse();
        assertThatThrownBy(() -> arguments.bool("c")).hasMessage("c must be a boolean");
    }

    @Test
    @DisplayName("inlines should require lists of objects per child")
    void inlines_shouldValidateItems() {
        CommandArguments valid = args(Map.of("inlines", Map.of("comment", List.of(Map.of("data", Map.of("body", "x"))))));
        CommandArguments notList = args(Map.of("inlines", Map.of("comment", "x")));
        CommandArguments notObjects = args(Map.of("inlines", Map.of("comment", List.of(1))));

        assertThat(valid.inlines("inlines").get("comment")).hasSize(1);
        assertThatThrownBy(() -> notList.inlines("inlines")).hasMessage("inlines.comment must be a list");
        assertThatThrownBy(() -> notObjects.inlines("inlines")).hasMessage("inlines.comment items must be objects");
    }
}
