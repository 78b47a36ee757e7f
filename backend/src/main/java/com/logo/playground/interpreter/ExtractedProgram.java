package com.logo.playground.interpreter;

import java.util.List;
import java.util.Map;

public record ExtractedProgram(List<String> tokens, Map<String, Procedure> procedures) {

    public ExtractedProgram {
        tokens = List.copyOf(tokens);
        procedures = Map.copyOf(procedures);
    }
}
