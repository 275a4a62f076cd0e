package com.wzz.fulfillcrm.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;

/**
 * 费用模板数量公式求值器
 * <p>
 * 仅支持数字、变量（如 itemsCount / totalWeight / totalVolume）、四则运算、一元负号和括号，
 * 例如 {@code totalWeight / 10 + 1}。不执行任何其他代码。
 */
public final class QuantityFormulaEvaluator {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final String text;
    private final Map<String, BigDecimal> variables;
    private int pos;

    private QuantityFormulaEvaluator(String text, Map<String, BigDecimal> variables) {
        this.text = text;
        this.variables = variables;
    }

    /**
     * 计算公式的原始值
     *
     * @throws IllegalArgumentException 公式语法错误、变量未知或除数为 0
     */
    public static BigDecimal evaluate(String formula, Map<String, BigDecimal> variables) {
        if (formula == null || formula.isBlank()) {
            throw new IllegalArgumentException("公式为空");
        }
        QuantityFormulaEvaluator parser = new QuantityFormulaEvaluator(formula, variables);
        BigDecimal value = parser.parseExpression();
        parser.skipWhitespace();
        if (parser.pos < parser.text.length()) {
            throw parser.error("多余的字符");
        }
        return value;
    }

    /**
     * 计算公式并向上取整
     */
    public static BigDecimal evaluateCeil(String formula, Map<String, BigDecimal> variables) {
        return evaluate(formula, variables).setScale(0, RoundingMode.CEILING);
    }

    // expression := term (('+' | '-') term)*
    private BigDecimal parseExpression() {
        BigDecimal value = parseTerm();
        while (true) {
            if (consume('+')) {
                value = value.add(parseTerm(), MC);
            } else if (consume('-')) {
                value = value.subtract(parseTerm(), MC);
            } else {
                return value;
            }
        }
    }

    // term := factor (('*' | '/') factor)*
    private BigDecimal parseTerm() {
        BigDecimal value = parseFactor();
        while (true) {
            if (consume('*')) {
                value = value.multiply(parseFactor(), MC);
            } else if (consume('/')) {
                BigDecimal divisor = parseFactor();
                if (divisor.signum() == 0) {
                    throw error("除数为 0");
                }
                value = value.divide(divisor, MC);
            } else {
                return value;
            }
        }
    }

    // factor := '-' factor | '+' factor | '(' expression ')' | number | variable
    private BigDecimal parseFactor() {
        if (consume('-')) {
            return parseFactor().negate();
        }
        if (consume('+')) {
            return parseFactor();
        }
        if (consume('(')) {
            BigDecimal value = parseExpression();
            if (!consume(')')) {
                throw error("缺少右括号");
            }
            return value;
        }
        skipWhitespace();
        if (pos >= text.length()) {
            throw error("公式意外结束");
        }
        char c = text.charAt(pos);
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return parseVariable();
        }
        throw error("无法识别的字符 '" + c + "'");
    }

    private BigDecimal parseNumber() {
        int start = pos;
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        try {
            return new BigDecimal(text.substring(start, pos));
        } catch (NumberFormatException e) {
            throw error("数字格式错误");
        }
    }

    private BigDecimal parseVariable() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        String name = text.substring(start, pos);
        BigDecimal value = variables.get(name);
        if (value == null) {
            throw error("未知变量 " + name);
        }
        return value;
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < text.length() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException("公式 [" + text + "] 第 " + (pos + 1) + " 位: " + message);
    }
}
