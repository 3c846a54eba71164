package me.go_gradually.liveavatar.infrastructure.tool.builtin;

import me.go_gradually.liveavatar.application.tool.port.ToolFunction;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class GetWeatherTool implements ToolFunction {

    @Override
    public String name() {
        return "get_weather";
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        Object location = arguments.get("location");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("location", location == null ? "unknown" : String.valueOf(location));
        result.put("temperature", "72°F");
        result.put("condition", "Sunny");
        return result;
    }
}
