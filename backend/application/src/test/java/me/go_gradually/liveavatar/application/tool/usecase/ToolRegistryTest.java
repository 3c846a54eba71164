package me.go_gradually.liveavatar.application.tool.usecase;

import me.go_gradually.liveavatar.application.tool.port.ToolFunction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ToolRegistryTest {

    @Test
    void invoke_routesByName() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("get_time", Map.of("time", "now"))));

        assertEquals(Map.of("time", "now"), registry.invoke("get_time", null));
    }

    @Test
    void invoke_unknownNameReturnsErrorResult() {
        ToolRegistry registry = new ToolRegistry(List.of());

        assertEquals(Map.of("error", "Unknown function: lookup"), registry.invoke("lookup", Map.of()));
    }

    @Test
    void duplicateNames_keepFirstRegistration() {
        ToolRegistry registry = new ToolRegistry(List.of(
                tool("calculate", Map.of("result", "first")),
                tool("calculate", Map.of("result", "second"))
        ));

        assertEquals(Map.of("result", "first"), registry.invoke("calculate", Map.of()));
        assertEquals(Set.of("calculate"), registry.names());
    }

    private ToolFunction tool(String name, Map<String, Object> result) {
        return new ToolFunction() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Map<String, Object> invoke(Map<String, Object> arguments) {
                return result;
            }
        };
    }
}
