package com.logo.playground.interpreter;

import java.util.ArrayList;
import java.util.List;

public final class Tokenizer {

    public record Span(String text, int offset) {
    }

    private Tokenizer() {
    }

    public static List<String> tokenize(String script) {
        List<String> tokens = new ArrayList<>();
        for (Span span : scan(script)) {
            tokens.add(span.text());
        }
        return tokens;
    }

    public static List<Span> scan(String script) {
        List<Span> spans = new ArrayList<>();
        if (script == null) {
            return spans;
        }

        int start = -1;
        for (int i = 0; i < script.length(); i++) {
            char c = script.charAt(i);
            if (isSeparator(c) || c == '[' || c == ']') {
                if (start >= 0) {
                    spans.add(new Span(script.substring(start, i), start));
                    start = -1;
                }
                if (c == '[' || c == ']') {
                    spans.add(new Span(String.valueOf(c), i));
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            spans.add(new Span(script.substring(start), start));
        }
        return spans;
    }

    private static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
