package com.deepansh.chatagent.tool.impl;

import com.deepansh.chatagent.tool.AgentTool;
import com.deepansh.chatagent.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Arithmetic expression evaluator.
 *
 * Grammar (recursive descent, usual precedence, ^ is right-associative):
 *   expr   := term (('+' | '-') term)*
 *   term   := factor (('*' | '/' | '%') factor)*
 *   factor := unary ('^' factor)?
 *   unary  := '-' unary | primary
 *   primary:= number | constant | func '(' expr (',' expr)* ')' | '(' expr ')'
 */
@Component
@Slf4j
public class CalculateTool implements AgentTool {

    private static final int MAX_EXPRESSION_LENGTH = 500;

    @Override
    public String getName() {
        return "calculate";
    }

    @Override
    public String getDescription() {
        return """
                Evaluate a mathematical expression and return the numeric result.
                Supports + - * / % ^, parentheses, sqrt, abs, round, floor, ceil, min, max, pi and e.
                E.g: "15 * 87.5 / 100", "sqrt(16) + 2^3".
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "expression", Map.of(
                                "type", "string",
                                "description", "The expression to evaluate, e.g. '2 + 2 * 3'"
                        )
                ),
                "required", List.of("expression")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, String chatId) {
        Object raw = arguments.get("expression");
        if (raw == null || raw.toString().isBlank()) {
            throw new IllegalArgumentException("'expression' is required");
        }
        String expression = raw.toString();
        if (expression.length() > MAX_EXPRESSION_LENGTH) {
            throw new IllegalArgumentException("expression longer than " + MAX_EXPRESSION_LENGTH + " characters");
        }

        double value = new Parser(expression).parse();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("result is not a finite number");
        }
        log.debug("Calculated '{}' = {}", expression, value);
        return ToolResult.text(format(value));
    }

    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return new BigDecimal(value).round(new MathContext(12)).stripTrailingZeros().toPlainString();
    }

    private static final class Parser {

        private final String input;
        private int pos;

        Parser(String input) {
            this.input = input;
        }

        double parse() {
            double value = expr();
            skipWhitespace();
            if (pos < input.length()) {
                throw error("unexpected '" + input.charAt(pos) + "'");
            }
            return value;
        }

        private double expr() {
            double value = term();
            while (true) {
                if (eat('+')) value += term();
                else if (eat('-')) value -= term();
                else return value;
            }
        }

        private double term() {
            double value = factor();
            while (true) {
                if (eat('*')) {
                    value *= factor();
                } else if (eat('/')) {
                    double divisor = factor();
                    if (divisor == 0) throw new ArithmeticException("division by zero");
                    value /= divisor;
                } else if (eat('%')) {
                    double divisor = factor();
                    if (divisor == 0) throw new ArithmeticException("modulo by zero");
                    value %= divisor;
                } else {
                    return value;
                }
            }
        }

        private double factor() {
            double base = unary();
            if (eat('^')) {
                return Math.pow(base, factor());
            }
            return base;
        }

        private double unary() {
            if (eat('-')) return -unary();
            if (eat('+')) return unary();
            return primary();
        }

        private double primary() {
            skipWhitespace();
            if (eat('(')) {
                double value = expr();
                expect(')');
                return value;
            }
            if (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
                return number();
            }
            if (pos < input.length() && Character.isLetter(input.charAt(pos))) {
                String name = identifier();
                if (eat('(')) {
                    List<Double> args = new ArrayList<>();
                    args.add(expr());
                    while (eat(',')) {
                        args.add(expr());
                    }
                    expect(')');
                    return function(name, args);
                }
                return constant(name);
            }
            throw error(pos < input.length() ? "unexpected '" + input.charAt(pos) + "'" : "unexpected end");
        }

        private double number() {
            int start = pos;
            while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
                pos++;
            }
            try {
                return Double.parseDouble(input.substring(start, pos));
            } catch (NumberFormatException e) {
                throw error("bad number '" + input.substring(start, pos) + "'");
            }
        }

        private String identifier() {
            int start = pos;
            while (pos < input.length() && Character.isLetterOrDigit(input.charAt(pos))) {
                pos++;
            }
            return input.substring(start, pos).toLowerCase(Locale.ROOT);
        }

        private double constant(String name) {
            return switch (name) {
                case "pi" -> Math.PI;
                case "e" -> Math.E;
                default -> throw error("unknown constant '" + name + "'");
            };
        }

        private double function(String name, List<Double> args) {
            return switch (name) {
                case "sqrt" -> Math.sqrt(single(name, args));
                case "abs" -> Math.abs(single(name, args));
                case "round" -> Math.round(single(name, args));
                case "floor" -> Math.floor(single(name, args));
                case "ceil" -> Math.ceil(single(name, args));
                case "min" -> args.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
                case "max" -> args.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
                default -> throw error("unknown function '" + name + "'");
            };
        }

        private double single(String name, List<Double> args) {
            if (args.size() != 1) {
                throw error(name + " takes exactly one argument");
            }
            return args.get(0);
        }

        private boolean eat(char c) {
            skipWhitespace();
            if (pos < input.length() && input.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char c) {
            if (!eat(c)) {
                throw error("expected '" + c + "'");
            }
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException("Invalid expression at position " + pos + ": " + message);
        }
    }
}
