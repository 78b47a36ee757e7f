package com.logo.playground.interpreter;

import com.logo.playground.exception.LogoException;

import java.util.List;

public final class TokenCursor {

    private final List<String> tokens;
    private int position;

    public TokenCursor(List<String> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public boolean hasNext() {
        return position < tokens.size();
    }

    public String peek() {
        return hasNext() ? tokens.get(position) : null;
    }

    public String next() throws LogoException {
        if (!hasNext()) {
            throw LogoException.unexpectedEndOfInput();
        }
        return tokens.get(position++);
    }

    public List<String> readBlock() throws LogoException {
        if (!"[".equals(peek())) {
            throw LogoException.missingBlock();
        }
        int start = ++position;
        int depth = 1;
        while (position < tokens.size()) {
            String token = tokens.get(position++);
            if ("[".equals(token)) {
                depth++;
            } else if ("]".equals(token)) {
                depth--;
                if (depth == 0) {
                    return tokens.subList(start, position - 1);
                }
            }
        }
        throw LogoException.missingBlock();
    }
}
