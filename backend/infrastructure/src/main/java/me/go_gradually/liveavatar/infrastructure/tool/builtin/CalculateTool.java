package me.go_gradually.liveavatar.infrastructure.tool.builtin;

import me.go_gradually.liveavatar.application.tool.port.ToolFunction;
import me.go_gradually.liveavatar.domain.util.ArithmeticExpression;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

@Component
public class CalculateTool implements ToolFunction {
    private static final Logger log = Logger.getLogger(CalculateTool.class.getName());
    private static final double EXACT_INTEGER_LIMIT = 1e15;

    @Override
    public String name() {
        return "calculate";
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> arguments) {
        Object raw = arguments.get("expression");
        String expression = raw == null ? "" : String.valueOf(raw);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("expression", expression);
        try {
            result.put("result", format(ArithmeticExpression.evaluate(expression)));
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.fine(() -> "tool.calculate.rejected expression=" + expression + " reason=" + e.getMessage());
            result.put("error", "Could not evaluate");
        }
        return result;
    }

    static String format(double value) {
        // 정수 결과는 소수점 없이 표기한다 (2+2 -> "4").
        if (value == Math.rint(value) && Math.abs(value) < EXACT_INTEGER_LIMIT) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
