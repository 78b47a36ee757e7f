package com.logo.playground.interpreter;

import java.util.Locale;
import java.util.Set;

public final class LogoKeywords {

    public static final String TO = "TO";
    public static final String END = "END";

    public static final Set<String> COMMANDS = Set.of(
            "FORWARD", "FD", "BACK", "BK", "RIGHT", "RT", "LEFT", "LT",
            "PENUP", "PU", "PENDOWN", "PD", "HOME", "CLEAR", "COLOR",
            "SETXY", "SETHEADING", "REPEAT", "TURTLE", "MAKE", "IF", "IFELSE",
            TO, END);

    public static final Set<String> BINARY_OPERATORS = Set.of(
            "SUM", "DIFFERENCE", "PRODUCT", "QUOTIENT", "REMAINDER", "MIN", "MAX",
            "POWER", "LESS", "GREATER", "EQUAL", "NOTEQUAL");

    public static final Set<String> UNARY_OPERATORS = Set.of("ABS", "NEG", "RANDOM");

    public static final Set<String> CONSTANTS = Set.of("PI", "E");

    private LogoKeywords() {
    }

    public static boolean isCommand(String token) {
        return COMMANDS.contains(token.toUpperCase(Locale.ROOT));
    }

    public static boolean isBuiltInFunction(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        return BINARY_OPERATORS.contains(upper) || UNARY_OPERATORS.contains(upper) || CONSTANTS.contains(upper);
    }

    public static boolean isBracket(String token) {
        return "[".equals(token) || "]".equals(token);
    }
}
