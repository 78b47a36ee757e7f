package com.logo.playground.interpreter;

import com.logo.playground.exception.LogoException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single pass that lifts {@code TO ... END} definitions out of the token
 * stream. Brackets are not tracked inside a body: the first bare {@code END}
 * closes the definition, wherever it appears.
 */
public final class ProcedureExtractor {

    private ProcedureExtractor() {
    }

    public static ExtractedProgram extract(List<String> tokens) throws LogoException {
        List<String> residual = new ArrayList<>();
        Map<String, Procedure> procedures = new HashMap<>();

        int index = 0;
        while (index < tokens.size()) {
            String token = tokens.get(index++);
            if (!LogoKeywords.TO.equalsIgnoreCase(token)) {
                residual.add(token);
                continue;
            }

            if (index >= tokens.size()) {
                throw LogoException.unexpectedEndOfInput();
            }
            String nameToken = tokens.get(index++);
            if (LogoKeywords.isBracket(nameToken)) {
                throw LogoException.missingIdentifier(LogoKeywords.TO);
            }
            String name = nameToken.toUpperCase(Locale.ROOT);

            List<String> parameters = new ArrayList<>();
            while (index < tokens.size() && isParameter(tokens.get(index))) {
                parameters.add(tokens.get(index++).substring(1).toUpperCase(Locale.ROOT));
            }

            List<String> body = new ArrayList<>();
            boolean closed = false;
            while (index < tokens.size()) {
                String bodyToken = tokens.get(index++);
                if (LogoKeywords.END.equalsIgnoreCase(bodyToken)) {
                    closed = true;
                    break;
                }
                body.add(bodyToken);
            }
            if (!closed) {
                throw LogoException.missingEnd(name);
            }

            procedures.put(name, new Procedure(name, parameters, body));
        }

        return new ExtractedProgram(residual, procedures);
    }

    private static boolean isParameter(String token) {
        return token.length() > 1 && token.charAt(0) == ':';
    }
}
