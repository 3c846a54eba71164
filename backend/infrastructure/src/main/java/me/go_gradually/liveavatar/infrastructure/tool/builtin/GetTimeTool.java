package me.go_gradually.liveavatar.infrastructure.tool.builtin;

import me.go_gradually.liveavatar.application.tool.port.ToolFunction;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

@Component
public class GetTimeTool implements ToolFunction {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public GetTimeTool() {
        this(Clock.systemDefaultZone());
    }

    GetTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "get_time";
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        return Map.of("time", LocalDateTime.now(clock).format(FORMAT));
    }
}
