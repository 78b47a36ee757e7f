package com.logo.playground.interpreter;

import com.logo.playground.exception.ExecutionInterruptedException;
import com.logo.playground.exception.LogoException;
import com.logo.playground.model.Point;
import com.logo.playground.model.RgbColor;
import com.logo.playground.model.Segment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class StatementExecutor {

    private static final Logger logger = LoggerFactory.getLogger(StatementExecutor.class);

    private final ExpressionEvaluator evaluator;
    private final int maxCallDepth;

    StatementExecutor(ExpressionEvaluator evaluator, int maxCallDepth) {
        this.evaluator = evaluator;
        this.maxCallDepth = maxCallDepth;
    }

    void execute(List<String> tokens, InterpreterContext context, int callDepth) throws LogoException {
        if (callDepth > maxCallDepth) {
            throw LogoException.recursionLimitReached(maxCallDepth);
        }

        checkInterrupted();
        TokenCursor cursor = new TokenCursor(tokens);
        while (cursor.hasNext()) {
            checkInterrupted();
            executeStatement(cursor, context, callDepth);
        }
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ExecutionInterruptedException("Script execution was interrupted");
        }
    }

    private void executeStatement(TokenCursor cursor, InterpreterContext context, int callDepth)
            throws LogoException {
        String token = cursor.next();
        VariableStack scopes = context.scopes();
        Turtle turtle = context.activeTurtle();

        switch (token.toUpperCase(Locale.ROOT)) {
            case "FORWARD":
            case "FD":
                move(evaluator.readNumber(cursor, scopes), context);
                break;
            case "BACK":
            case "BK":
                move(-evaluator.readNumber(cursor, scopes), context);
                break;
            case "RIGHT":
            case "RT":
                turtle.turn(-evaluator.readNumber(cursor, scopes));
                break;
            case "LEFT":
            case "LT":
                turtle.turn(evaluator.readNumber(cursor, scopes));
                break;
            case "PENUP":
            case "PU":
                turtle.setPenDown(false);
                break;
            case "PENDOWN":
            case "PD":
                turtle.setPenDown(true);
                break;
            case "HOME":
                turtle.resetPose();
                context.bounds().register(turtle.position());
                break;
            case "CLEAR":
                clear(context);
                break;
            case "COLOR": {
                double red = evaluator.readNumber(cursor, scopes);
                double green = evaluator.readNumber(cursor, scopes);
                double blue = evaluator.readNumber(cursor, scopes);
                turtle.setPenColor(RgbColor.fromBytes(red, green, blue));
                break;
            }
            case "SETXY": {
                // Teleports: never draws, even with the pen down.
                double x = evaluator.readNumber(cursor, scopes);
                double y = evaluator.readNumber(cursor, scopes);
                turtle.setPosition(new Point(x, y));
                context.bounds().register(turtle.position());
                break;
            }
            case "SETHEADING":
                turtle.setHeading(evaluator.readNumber(cursor, scopes));
                break;
            case "REPEAT":
                repeat(cursor, context, callDepth);
                break;
            case "TURTLE":
                context.selectTurtle(readIdentifier(cursor, "TURTLE"));
                break;
            case "MAKE": {
                String name = readIdentifier(cursor, "MAKE");
                scopes.assign(name, evaluator.readNumber(cursor, scopes));
                break;
            }
            case "IF": {
                boolean condition = evaluator.readNumber(cursor, scopes) != 0;
                List<String> trueBlock = cursor.readBlock();
                List<String> falseBlock = "[".equals(cursor.peek()) ? cursor.readBlock() : null;
                if (condition) {
                    execute(trueBlock, context, callDepth);
                } else if (falseBlock != null) {
                    execute(falseBlock, context, callDepth);
                }
                break;
            }
            case "IFELSE": {
                boolean condition = evaluator.readNumber(cursor, scopes) != 0;
                List<String> trueBlock = cursor.readBlock();
                List<String> falseBlock = cursor.readBlock();
                execute(condition ? trueBlock : falseBlock, context, callDepth);
                break;
            }
            case "[":
            case "]":
                throw LogoException.unexpectedToken(token);
            default:
                invoke(token, cursor, context, callDepth);
        }
    }

    private void move(double distance, InterpreterContext context) {
        Turtle turtle = context.activeTurtle();
        Point start = turtle.position();
        Point end = turtle.destination(distance);
        if (turtle.isPenDown()) {
            context.segments().add(new Segment(
                    start, end, turtle.heading(), turtle.penColor(), turtle.lineWidth(), turtle.id()));
        }
        context.bounds().register(start);
        context.bounds().register(end);
        turtle.setPosition(end);
    }

    private void clear(InterpreterContext context) {
        context.segments().clear();
        context.bounds().reset();
        for (Turtle turtle : context.turtles()) {
            turtle.resetPose();
            context.recordInitialState(turtle);
        }
    }

    private void repeat(TokenCursor cursor, InterpreterContext context, int callDepth) throws LogoException {
        double countValue = evaluator.readNumber(cursor, context.scopes());
        if (!Double.isFinite(countValue)) {
            throw LogoException.invalidRepeatCount(countValue);
        }
        long count = roundHalfAwayFromZero(countValue);
        if (count < 0) {
            throw LogoException.invalidRepeatCount(countValue);
        }
        List<String> block = cursor.readBlock();
        for (long i = 0; i < count; i++) {
            execute(block, context, callDepth);
        }
    }

    private void invoke(String token, TokenCursor cursor, InterpreterContext context, int callDepth)
            throws LogoException {
        String name = token.toUpperCase(Locale.ROOT);
        Procedure procedure = context.procedure(name);
        if (procedure == null) {
            Double number = ExpressionEvaluator.tryParse(token);
            if (number != null) {
                throw LogoException.unexpectedNumber(number);
            }
            throw LogoException.unexpectedToken(token);
        }

        // Arguments are evaluated in the caller's scopes before the new scope exists.
        Map<String, Double> bindings = new HashMap<>();
        for (String parameter : procedure.parameters()) {
            bindings.put(parameter, evaluator.readNumber(cursor, context.scopes()));
        }

        logger.trace("Calling {} at depth {} with {}", name, callDepth + 1, bindings);

        context.scopes().push(bindings);
        try {
            execute(procedure.body(), context, callDepth + 1);
        } finally {
            context.scopes().pop();
        }
    }

    private static String readIdentifier(TokenCursor cursor, String keyword) throws LogoException {
        String token = cursor.peek();
        if (token == null || LogoKeywords.isBracket(token)) {
            throw LogoException.missingIdentifier(keyword);
        }
        cursor.next();

        String name = token;
        if (name.length() > 1 && (name.charAt(0) == '"' || name.charAt(0) == ':')) {
            name = name.substring(1);
        }
        return name.toUpperCase(Locale.ROOT);
    }

    private static long roundHalfAwayFromZero(double value) {
        return (long) (Math.signum(value) * Math.floor(Math.abs(value) + 0.5));
    }
}
