package com.circuit.sfg.algebra;

/**
 * Recursive descent parser for edge weights.
 *
 * <p>
 * Grammar:
 *
 * <pre>
 * sum     := product (('+' | '-') product)*
 * product := unary (('*' | '/') unary)*
 * unary   := ('-' | '+') unary | power
 * power   := primary ('^' '-'? integer)?
 * primary := number | identifier | '(' sum ')'
 * </pre>
 *
 * Numbers accept decimal and exponent notation and are converted to exact
 * rationals. Identifiers are letters, digits and underscores, starting with a
 * letter or underscore.
 */
final class ExpressionParser {
    private final String input;
    private int pos;

    ExpressionParser(String input) {
        if (input == null)
            throw new ExpressionException("Null expression");
        this.input = input;
    }

    Expression parse() {
        skipWS();
        if (pos >= input.length())
            throw err("Empty expression");
        Expression result = parseSum();
        skipWS();
        if (pos < input.length())
            throw err("Unexpected: " + input.charAt(pos));
        return result;
    }

    private Expression parseSum() {
        Expression acc = parseProduct();
        while (true) {
            skipWS();
            if (peek('+')) {
                pos++;
                acc = acc.add(parseProduct());
            } else if (peek('-')) {
                pos++;
                acc = acc.subtract(parseProduct());
            } else {
                return acc;
            }
        }
    }

    private Expression parseProduct() {
        Expression acc = parseUnary();
        while (true) {
            skipWS();
            if (peek('*')) {
                pos++;
                acc = acc.multiply(parseUnary());
            } else if (peek('/')) {
                pos++;
                int at = pos;
                Expression divisor = parseUnary();
                try {
                    acc = acc.divide(divisor);
                } catch (ExpressionException e) {
                    throw new ExpressionException(e.getMessage() + " at pos " + at, e);
                }
            } else {
                return acc;
            }
        }
    }

    private Expression parseUnary() {
        skipWS();
        if (peek('-')) {
            pos++;
            return parseUnary().negate();
        }
        if (peek('+')) {
            pos++;
            return parseUnary();
        }
        return parsePower();
    }

    private Expression parsePower() {
        Expression base = parsePrimary();
        skipWS();
        if (!peek('^'))
            return base;
        pos++;
        skipWS();
        boolean negative = false;
        if (peek('-')) {
            negative = true;
            pos++;
        }
        int s = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos)))
            pos++;
        if (s == pos)
            throw err("Expected integer exponent");
        int exponent;
        try {
            exponent = Integer.parseInt(input.substring(s, pos));
        } catch (NumberFormatException e) {
            throw err("Exponent out of range");
        }
        if (exponent > Expression.MAX_EXPONENT)
            throw err("Exponent out of range");
        return base.pow(negative ? -exponent : exponent);
    }

    private Expression parsePrimary() {
        skipWS();
        if (pos >= input.length())
            throw err("Unexpected end");
        char c = input.charAt(pos);
        if (c == '(') {
            pos++;
            Expression inner = parseSum();
            skipWS();
            if (!peek(')'))
                throw err("Expected ')'");
            pos++;
            return inner;
        }
        if (Character.isDigit(c) || c == '.')
            return Expression.constant(parseNumber());
        if (Character.isLetter(c) || c == '_')
            return Expression.symbol(parseIdentifier());
        throw err("Unexpected: " + c);
    }

    private Rational parseNumber() {
        int s = pos;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.'))
            pos++;
        // Exponent part only when digits follow it
        if (pos + 1 < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (input.charAt(pos) == '+' || input.charAt(pos) == '-')
                pos++;
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                    pos++;
            } else {
                pos = save;
            }
        }
        return Rational.parse(input.substring(s, pos));
    }

    private String parseIdentifier() {
        int s = pos;
        while (pos < input.length()
                && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_'))
            pos++;
        return input.substring(s, pos);
    }

    private boolean peek(char c) {
        return pos < input.length() && input.charAt(pos) == c;
    }

    private void skipWS() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
            pos++;
    }

    private ExpressionException err(String msg) {
        return new ExpressionException(msg + " at pos " + pos + " in '" + input + "'");
    }
}
