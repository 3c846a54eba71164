package me.go_gradually.liveavatar.application.tool.port;

import java.util.Map;

public interface ToolFunction {
    String name();

    Map<String, Object> invoke(Map<String, Object> arguments);
}
