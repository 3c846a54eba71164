package me.go_gradually.liveavatar.infrastructure.tool.builtin;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GetWeatherToolTest {

    private final GetWeatherTool tool = new GetWeatherTool();

    @Test
    void invoke_echoesLocation() {
        Map<String, Object> result = tool.invoke(Map.of("location", "Seattle"));

        assertEquals("Seattle", result.get("location"));
        assertEquals("72°F", result.get("temperature"));
        assertEquals("Sunny", result.get("condition"));
    }

    @Test
    void invoke_defaultsUnknownLocation() {
        assertEquals("unknown", tool.invoke(Map.of()).get("location"));
    }
}
