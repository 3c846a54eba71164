package me.go_gradually.liveavatar.application.tool.usecase;

import me.go_gradually.liveavatar.application.tool.port.ToolFunction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

public class ToolRegistry {
    private static final Logger log = Logger.getLogger(ToolRegistry.class.getName());

    private final Map<String, ToolFunction> functions = new LinkedHashMap<>();

    public ToolRegistry(List<ToolFunction> functions) {
        if (functions == null) {
            return;
        }
        for (ToolFunction function : functions) {
            ToolFunction previous = this.functions.putIfAbsent(function.name(), function);
            if (previous != null) {
                log.warning("tool.registry.duplicate name=" + function.name());
            }
        }
    }

    public Map<String, Object> invoke(String name, Map<String, Object> arguments) {
        ToolFunction function = name == null ? null : functions.get(name);
        if (function == null) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("error", "Unknown function: " + name);
            return result;
        }
        return function.invoke(arguments == null ? Map.of() : arguments);
    }

    public Set<String> names() {
        return Set.copyOf(functions.keySet());
    }
}
