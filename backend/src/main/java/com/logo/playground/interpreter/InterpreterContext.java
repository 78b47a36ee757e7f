package com.logo.playground.interpreter;

import com.logo.playground.model.ExecutionResult;
import com.logo.playground.model.Segment;
import com.logo.playground.model.TurtleState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class InterpreterContext {

    static final String MAIN_TURTLE = "MAIN";

    private final Map<String, Turtle> turtles = new LinkedHashMap<>();
    private final Map<String, TurtleState> initialStates = new LinkedHashMap<>();
    private final List<Segment> segments = new ArrayList<>();
    private final BoundsTracker bounds = new BoundsTracker();
    private final VariableStack scopes = new VariableStack();
    private final Map<String, Procedure> procedures;
    private String activeTurtleId;

    InterpreterContext(Map<String, Procedure> procedures) {
        this.procedures = procedures;
        turtles.put(MAIN_TURTLE, new Turtle(MAIN_TURTLE, TurtleState.DEFAULT));
        initialStates.put(MAIN_TURTLE, TurtleState.DEFAULT);
        activeTurtleId = MAIN_TURTLE;
    }

    Turtle activeTurtle() {
        return turtles.get(activeTurtleId);
    }

    void selectTurtle(String id) {
        if (!turtles.containsKey(id)) {
            Turtle turtle = new Turtle(id, TurtleState.DEFAULT);
            turtles.put(id, turtle);
            initialStates.put(id, turtle.snapshot());
            bounds.register(turtle.position());
        }
        activeTurtleId = id;
    }

    Collection<Turtle> turtles() {
        return turtles.values();
    }

    void recordInitialState(Turtle turtle) {
        initialStates.put(turtle.id(), turtle.snapshot());
    }

    List<Segment> segments() {
        return segments;
    }

    BoundsTracker bounds() {
        return bounds;
    }

    VariableStack scopes() {
        return scopes;
    }

    Procedure procedure(String name) {
        return procedures.get(name);
    }

    ExecutionResult toResult() {
        Map<String, TurtleState> finalStates = new LinkedHashMap<>();
        for (Turtle turtle : turtles.values()) {
            finalStates.put(turtle.id(), turtle.snapshot());
            // An empty tracker keeps the default box; otherwise it must cover turtles reset by CLEAR.
            if (bounds.isInitialized()) {
                bounds.register(turtle.position());
            }
        }
        return new ExecutionResult(
                segments,
                bounds.rect(),
                initialStates,
                finalStates,
                new ArrayList<>(turtles.keySet()));
    }
}
