package io.github.cyfko.curatorkit.core.parsing;

import io.github.cyfko.curatorkit.core.config.PatternConfig;
import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;

/**
 * Evaluates the bare arithmetic literals language models sometimes write instead of a number,
 * such as {@code 5+5} or {@code (20 // 2) * 3}.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr    := term {("+" | "-") term}
 * term    := unary {("*" | "/" | "//" | "%") unary}
 * unary   := ("+" | "-") unary | power
 * power   := primary ["**" unary]
 * primary := number | "(" expr ")"
 * </pre>
 *
 * <h2>Numeric semantics</h2>
 * <ul>
 *   <li>Integers are {@link Long}; a literal with a decimal point is a {@link Double}.</li>
 *   <li>{@code /} always yields a {@link Double}.</li>
 *   <li>{@code //} is floor division and {@code %} takes the sign of the divisor.</li>
 *   <li>{@code + - * // % **} on two integers yield an integer (a negative exponent yields a decimal).</li>
 *   <li>Division or modulo by zero is a syntax error.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ArithmeticEvaluator {

    private final Scanner scanner;

    private ArithmeticEvaluator(Scanner scanner) {
        this.scanner = scanner;
    }

    /**
     * @param text candidate text
     * @return true if the text only contains digits, dots, whitespace, parentheses and operators
     */
    public static boolean isArithmetic(String text) {
        return text != null && !text.isBlank() && PatternConfig.ARITHMETIC_PATTERN.matcher(text).matches();
    }

    /**
     * Evaluates an arithmetic expression.
     *
     * @param expression the expression text
     * @return a {@link Long} or a {@link Double}
     * @throws DSLSyntaxException if the expression is malformed or divides by zero
     */
    public static Number evaluate(String expression) {
        if (!isArithmetic(expression)) {
            throw new DSLSyntaxException("Not an arithmetic expression: '" + expression + "'");
        }
        ArithmeticEvaluator evaluator = new ArithmeticEvaluator(new Scanner(expression));
        Number result;
        try {
            result = evaluator.expr();
        } catch (ArithmeticException e) {
            throw new DSLSyntaxException("Integer overflow in arithmetic expression '" + expression + "'", e);
        }
        evaluator.scanner.consumeWhitespace();
        if (!evaluator.scanner.isEof()) {
            throw evaluator.scanner.fail("Unexpected " + evaluator.scanner.describeCurrent() + " in arithmetic expression");
        }
        return result;
    }

    private Number expr() {
        Number left = term();
        while (true) {
            scanner.consumeWhitespace();
            char op = scanner.peek();
            if (op != '+' && op != '-') {
                return left;
            }
            scanner.consume();
            Number right = term();
            left = op == '+' ? add(left, right) : subtract(left, right);
        }
    }

    private Number term() {
        Number left = unary();
        while (true) {
            scanner.consumeWhitespace();
            int at = scanner.position();
            if (scanner.startsWith("**")) {
                return left;
            }
            if (scanner.startsWith("//")) {
                scanner.reset(at + 2);
                left = floorDivide(left, unary(), at);
            } else if (scanner.peek() == '/') {
                scanner.consume();
                left = divide(left, unary(), at);
            } else if (scanner.peek() == '*') {
                scanner.consume();
                left = multiply(left, unary());
            } else if (scanner.peek() == '%') {
                scanner.consume();
                left = modulo(left, unary(), at);
            } else {
                return left;
            }
        }
    }

    private Number unary() {
        scanner.consumeWhitespace();
        char c = scanner.peek();
        if (c == '-') {
            scanner.consume();
            Number operand = unary();
            return operand instanceof Long ? (Number) (-operand.longValue()) : (Number) (-operand.doubleValue());
        }
        if (c == '+') {
            scanner.consume();
            return unary();
        }
        return power();
    }

    private Number power() {
        Number base = primary();
        scanner.consumeWhitespace();
        if (scanner.startsWith("**")) {
            scanner.reset(scanner.position() + 2);
            Number exponent = unary();
            if (base instanceof Long && exponent instanceof Long && exponent.longValue() >= 0) {
                return integerPower(base.longValue(), exponent.longValue());
            }
            return Math.pow(base.doubleValue(), exponent.doubleValue());
        }
        return base;
    }

    // square-and-multiply: at most 63 squarings whatever the exponent
    private static long integerPower(long base, long exponent) {
        if (base == 0 || base == 1) {
            return exponent == 0 ? 1 : base;
        }
        if (base == -1) {
            return (exponent & 1) == 0 ? 1 : -1;
        }
        long result = 1;
        long factor = base;
        long remaining = exponent;
        while (true) {
            if ((remaining & 1) == 1) {
                result = Math.multiplyExact(result, factor);
            }
            remaining >>= 1;
            if (remaining == 0) {
                return result;
            }
            factor = Math.multiplyExact(factor, factor);
        }
    }

    private Number primary() {
        scanner.consumeWhitespace();
        if (scanner.peek() == '(') {
            scanner.descend();
            try {
                scanner.consume();
                Number inner = expr();
                scanner.expect(')');
                return inner;
            } finally {
                scanner.ascend();
            }
        }
        int start = scanner.position();
        String digits = scanner.consumeWhile(c -> Character.isDigit(c) || c == '.');
        if (digits.isEmpty()) {
            throw scanner.fail("Expected a number, got " + scanner.describeCurrent());
        }
        try {
            return digits.indexOf('.') >= 0 ? (Number) Double.parseDouble(digits) : (Number) Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw scanner.failAt("Invalid number '" + digits + "'", start);
        }
    }

    private static Number add(Number a, Number b) {
        return bothLong(a, b) ? (Number) Math.addExact(a.longValue(), b.longValue()) : (Number) (a.doubleValue() + b.doubleValue());
    }

    private static Number subtract(Number a, Number b) {
        return bothLong(a, b) ? (Number) Math.subtractExact(a.longValue(), b.longValue()) : (Number) (a.doubleValue() - b.doubleValue());
    }

    private static Number multiply(Number a, Number b) {
        return bothLong(a, b) ? (Number) Math.multiplyExact(a.longValue(), b.longValue()) : (Number) (a.doubleValue() * b.doubleValue());
    }

    private Number divide(Number a, Number b, int at) {
        checkDivisor(b, at);
        return a.doubleValue() / b.doubleValue();
    }

    private Number floorDivide(Number a, Number b, int at) {
        checkDivisor(b, at);
        if (bothLong(a, b)) {
            return Math.floorDiv(a.longValue(), b.longValue());
        }
        return Math.floor(a.doubleValue() / b.doubleValue());
    }

    private Number modulo(Number a, Number b, int at) {
        checkDivisor(b, at);
        if (bothLong(a, b)) {
            return Math.floorMod(a.longValue(), b.longValue());
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        return x - y * Math.floor(x / y);
    }

    private void checkDivisor(Number divisor, int at) {
        if (divisor.doubleValue() == 0.0) {
            throw scanner.failAt("Division by zero", at);
        }
    }

    private static boolean bothLong(Number a, Number b) {
        return a instanceof Long && b instanceof Long;
    }
}
