package me.golemcore.krishi.tools;

import me.golemcore.krishi.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentsTest {

    @Test
    void shouldTrimStrings() {
        ToolArguments arguments = new ToolArguments(Map.of("district", "  Pune "));

        assertEquals("Pune", arguments.requireString("district", "District is required"));
    }

    @Test
    void shouldTreatBlankAsMissing() {
        ToolArguments arguments = new ToolArguments(Map.of("district", "   "));

        ValidationException error = assertThrows(ValidationException.class,
                () -> arguments.requireString("district", "District is required"));
        assertEquals("District is required", error.getMessage());
        assertEquals("medium", arguments.optionalString("district", "medium"));
    }

    @Test
    void shouldAcceptNullArgumentMap() {
        ToolArguments arguments = new ToolArguments(null);

        assertEquals(7, arguments.optionalInt("days", 7));
        assertNull(arguments.optionalString("crop", null));
    }

    @Test
    void shouldParseIntegers() {
        Map<String, Object> values = new HashMap<>();
        values.put("a", 5);
        values.put("b", 3.0);
        values.put("c", " 12 ");
        values.put("d", null);
        ToolArguments arguments = new ToolArguments(values);

        assertEquals(5, arguments.optionalInt("a", 0));
        assertEquals(3, arguments.optionalInt("b", 0));
        assertEquals(12, arguments.optionalInt("c", 0));
        assertEquals(9, arguments.optionalInt("d", 9));
    }

    @Test
    void shouldRejectFractionsAndText() {
        ToolArguments arguments = new ToolArguments(Map.of("days", 2.5, "limit", "many"));

        assertThrows(ValidationException.class, () -> arguments.optionalInt("days", 7));
        assertThrows(ValidationException.class, () -> arguments.optionalInt("limit", 5));
    }
}
