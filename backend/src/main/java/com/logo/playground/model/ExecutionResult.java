package com.logo.playground.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ExecutionResult(
        List<Segment> segments,
        Bounds bounds,
        Map<String, TurtleState> initialStates,
        Map<String, TurtleState> finalStates,
        List<String> turtleOrder) {

    public ExecutionResult {
        segments = List.copyOf(segments);
        initialStates = Collections.unmodifiableMap(new LinkedHashMap<>(initialStates));
        finalStates = Collections.unmodifiableMap(new LinkedHashMap<>(finalStates));
        turtleOrder = List.copyOf(turtleOrder);
    }

    public TurtleState finalState(String turtleId) {
        return finalStates.get(turtleId);
    }
}
