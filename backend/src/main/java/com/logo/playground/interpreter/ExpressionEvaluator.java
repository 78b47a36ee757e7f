package com.logo.playground.interpreter;

import com.logo.playground.exception.LogoException;

import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

public final class ExpressionEvaluator {

    static final double EQUALITY_TOLERANCE = 0.0001;

    private static final Pattern NUMBER_LITERAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Random random;

    public ExpressionEvaluator(Random random) {
        this.random = random;
    }

    public double readNumber(TokenCursor cursor, VariableStack scopes) throws LogoException {
        String token = cursor.next();

        if (token.length() > 1 && token.charAt(0) == ':') {
            String name = token.substring(1).toUpperCase(Locale.ROOT);
            return scopes.lookup(name).orElseThrow(() -> LogoException.undefinedVariable(name));
        }
        if (LogoKeywords.isBracket(token)) {
            throw LogoException.invalidExpression(token);
        }

        String keyword = token.toUpperCase(Locale.ROOT);
        switch (keyword) {
            case "SUM":
                return readNumber(cursor, scopes) + readNumber(cursor, scopes);
            case "DIFFERENCE":
                return readNumber(cursor, scopes) - readNumber(cursor, scopes);
            case "PRODUCT":
                return readNumber(cursor, scopes) * readNumber(cursor, scopes);
            case "QUOTIENT": {
                double left = readNumber(cursor, scopes);
                double right = readNumber(cursor, scopes);
                return right == 0 ? 0 : left / right;
            }
            case "REMAINDER": {
                double left = readNumber(cursor, scopes);
                double right = readNumber(cursor, scopes);
                return right == 0 ? 0 : left % right;
            }
            case "MIN":
                return Math.min(readNumber(cursor, scopes), readNumber(cursor, scopes));
            case "MAX":
                return Math.max(readNumber(cursor, scopes), readNumber(cursor, scopes));
            case "POWER": {
                double base = readNumber(cursor, scopes);
                double exponent = readNumber(cursor, scopes);
                return Math.pow(base, exponent);
            }
            case "LESS": {
                double left = readNumber(cursor, scopes);
                double right = readNumber(cursor, scopes);
                return truth(left < right);
            }
            case "GREATER": {
                double left = readNumber(cursor, scopes);
                double right = readNumber(cursor, scopes);
                return truth(left > right);
            }
            case "EQUAL": {
                double left = readNumber(cursor, scopes);
                double right = readNumber(cursor, scopes);
                return truth(Math.abs(left - right) < EQUALITY_TOLERANCE);
            }
            case "NOTEQUAL": {
                double left = readNumber(cursor, scopes);
                double right = readNumber(cursor, scopes);
                return truth(Math.abs(left - right) >= EQUALITY_TOLERANCE);
            }
            case "ABS":
                return Math.abs(readNumber(cursor, scopes));
            case "NEG":
                return -readNumber(cursor, scopes);
            case "RANDOM": {
                double limit = readNumber(cursor, scopes);
                return limit <= 0 ? 0 : random.nextDouble() * limit;
            }
            case "PI":
                return Math.PI;
            case "E":
                return Math.E;
            default:
                return parseLiteral(token);
        }
    }

    public static Double tryParse(String token) {
        if (!NUMBER_LITERAL.matcher(token).matches()) {
            return null;
        }
        return Double.parseDouble(token);
    }

    private static double parseLiteral(String token) throws LogoException {
        Double value = tryParse(token);
        if (value == null) {
            throw LogoException.invalidNumber(token);
        }
        return value;
    }

    private static double truth(boolean condition) {
        return condition ? 1.0 : 0.0;
    }
}
