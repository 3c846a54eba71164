package me.go_gradually.liveavatar.domain.util;

public final class ArithmeticExpression {
    static final int MAX_DEPTH = 100;

    private final String source;
    private int pos;
    private int depth;

    private ArithmeticExpression(String source) {
        this.source = source;
    }

    public static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression is empty");
        }
        ArithmeticExpression parser = new ArithmeticExpression(expression);
        double value = parser.parseSum();
        parser.skipSpaces();
        if (parser.pos < parser.source.length()) {
            throw parser.error("Unexpected character '" + parser.source.charAt(parser.pos) + "'");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("Result is not a finite number");
        }
        return value;
    }

    private double parseSum() {
        double value = parseProduct();
        while (true) {
            if (consume('+')) {
                value += parseProduct();
            } else if (consume('-')) {
                value -= parseProduct();
            } else {
                return value;
            }
        }
    }

    private double parseProduct() {
        double value = parseUnary();
        while (true) {
            skipSpaces();
            if (peekPower()) {
                return value;
            }
            if (consume('*')) {
                value *= parseUnary();
            } else if (consume('/')) {
                double divisor = parseUnary();
                if (divisor == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                value /= divisor;
            } else if (consume('%')) {
                double divisor = parseUnary();
                if (divisor == 0) {
                    throw new ArithmeticException("Modulo by zero");
                }
                // 파이썬과 같이 나머지의 부호는 제수를 따른다.
                value = value - divisor * Math.floor(value / divisor);
            } else {
                return value;
            }
        }
    }

    // 괄호, 부호, 거듭제곱 중첩은 모두 여기를 지나므로 깊이를 여기서만 센다.
    private double parseUnary() {
        if (++depth > MAX_DEPTH) {
            throw error("Expression too deeply nested");
        }
        try {
            if (consume('-')) {
                return -parseUnary();
            }
            if (consume('+')) {
                return parseUnary();
            }
            return parsePower();
        } finally {
            depth--;
        }
    }

    private double parsePower() {
        double base = parseAtom();
        skipSpaces();
        if (peekPower()) {
            pos += 2;
            return Math.pow(base, parseUnary());
        }
        return base;
    }

    private double parseAtom() {
        if (consume('(')) {
            double value = parseSum();
            if (!consume(')')) {
                throw error("Missing closing parenthesis");
            }
            return value;
        }
        skipSpaces();
        int start = pos;
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        if (start == pos) {
            throw error(pos < source.length() ? "Unexpected character '" + source.charAt(pos) + "'" : "Unexpected end");
        }
        try {
            return Double.parseDouble(source.substring(start, pos));
        } catch (NumberFormatException e) {
            throw error("Malformed number '" + source.substring(start, pos) + "'");
        }
    }

    private boolean peekPower() {
        return source.startsWith("**", pos);
    }

    private boolean consume(char expected) {
        skipSpaces();
        if (pos < source.length() && source.charAt(pos) == expected) {
            if (expected == '*' && peekPower()) {
                return false;
            }
            pos++;
            return true;
        }
        return false;
    }

    private void skipSpaces() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + pos);
    }
}
