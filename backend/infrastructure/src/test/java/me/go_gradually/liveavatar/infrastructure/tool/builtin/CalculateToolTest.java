package me.go_gradually.liveavatar.infrastructure.tool.builtin;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class CalculateToolTest {

    private final CalculateTool tool = new CalculateTool();

    @Test
    void invoke_returnsIntegerResultWithoutFraction() {
        Map<String, Object> result = tool.invoke(Map.of("expression", "(2 + 3) * 4"));

        assertEquals("(2 + 3) * 4", result.get("expression"));
        assertEquals("20", result.get("result"));
        assertFalse(result.containsKey("error"));
    }

    @Test
    void invoke_keepsFractionalResult() {
        assertEquals("3.5", tool.invoke(Map.of("expression", "7 / 2")).get("result"));
        assertEquals("1024", tool.invoke(Map.of("expression", "2 ** 10")).get("result"));
    }

    @Test
    void invoke_reportsUnparsableExpression() {
        Map<String, Object> result = tool.invoke(Map.of("expression", "__import__('os')"));

        assertEquals("Could not evaluate", result.get("error"));
        assertFalse(result.containsKey("result"));
    }

    @Test
    void invoke_reportsDivisionByZeroAndMissingExpression() {
        assertEquals("Could not evaluate", tool.invoke(Map.of("expression", "1 / 0")).get("error"));

        Map<String, Object> missing = tool.invoke(Map.of());
        assertEquals("", missing.get("expression"));
        assertEquals("Could not evaluate", missing.get("error"));
    }

    @Test
    void invoke_reportsDeeplyNestedExpression() {
        String expression = "(".repeat(200_000) + "1" + ")".repeat(200_000);

        Map<String, Object> result = tool.invoke(Map.of("expression", expression));

        assertEquals(expression, result.get("expression"));
        assertEquals("Could not evaluate", result.get("error"));
    }

    @Test
    void name_isCalculate() {
        assertEquals("calculate", tool.name());
    }
}
