package com.logo.playground.interpreter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

public final class VariableStack {

    private final List<Map<String, Double>> scopes = new ArrayList<>();

    public VariableStack() {
        scopes.add(new HashMap<>());
    }

    public OptionalDouble lookup(String name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            Double value = scopes.get(i).get(name);
            if (value != null) {
                return OptionalDouble.of(value);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Writes to the innermost scope that already holds {@code name}; a name no
     * active scope holds is created in the global scope.
     */
    public void assign(String name, double value) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            Map<String, Double> scope = scopes.get(i);
            if (scope.containsKey(name)) {
                scope.put(name, value);
                return;
            }
        }
        scopes.get(0).put(name, value);
    }

    public void push(Map<String, Double> bindings) {
        scopes.add(new HashMap<>(bindings));
    }

    public void pop() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        scopes.remove(scopes.size() - 1);
    }

    public int depth() {
        return scopes.size();
    }
}
