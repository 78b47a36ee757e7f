package com.logo.playground.interpreter;

import java.util.List;

public record Procedure(String name, List<String> parameters, List<String> body) {

    public Procedure {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    public int arity() {
        return parameters.size();
    }
}
