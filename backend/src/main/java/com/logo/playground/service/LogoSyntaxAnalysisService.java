package com.logo.playground.service;

import com.logo.playground.dto.KeywordCatalog;
import com.logo.playground.dto.SyntaxAnalysisRequest;
import com.logo.playground.dto.SyntaxAnalysisResponse;
import com.logo.playground.dto.SyntaxToken;
import com.logo.playground.dto.SyntaxToken.TokenType;
import com.logo.playground.interpreter.ExpressionEvaluator;
import com.logo.playground.interpreter.LogoKeywords;
import com.logo.playground.interpreter.Tokenizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static classification of script tokens for editor highlighting. It never
 * runs the script, so it answers for scripts the interpreter would reject.
 */
@Service
public class LogoSyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(LogoSyntaxAnalysisService.class);

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();

        try {
            String source = sanitizeInput(request.sourceCode());
            logger.debug("Starting syntax analysis for {} characters of code", source.length());

            List<SyntaxToken> tokens = performStaticLexicalAnalysis(source);

            long analysisTime = System.currentTimeMillis() - startTime;
            logger.debug("Syntax analysis completed in {}ms with {} tokens", analysisTime, tokens.size());

            return SyntaxAnalysisResponse.success(tokens, analysisTime);

        } catch (Exception e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Syntax analysis failed", e);
            return SyntaxAnalysisResponse.error(
                    "Syntax analysis failed: " + e.getMessage(),
                    analysisTime);
        }
    }

    public KeywordCatalog keywordCatalog() {
        List<String> operators = new ArrayList<>(LogoKeywords.BINARY_OPERATORS);
        operators.addAll(LogoKeywords.UNARY_OPERATORS);
        return new KeywordCatalog(
                sorted(LogoKeywords.COMMANDS),
                sorted(operators),
                sorted(LogoKeywords.CONSTANTS));
    }

    List<SyntaxToken> performStaticLexicalAnalysis(String source) {
        List<Tokenizer.Span> spans = Tokenizer.scan(source);
        Set<String> procedureNames = extractProcedureNames(spans);
        int[] lineStarts = lineStarts(source);

        List<SyntaxToken> tokens = new ArrayList<>();
        String previous = null;
        for (Tokenizer.Span span : spans) {
            String type = classify(span.text(), previous, procedureNames).name();
            int line = lineOf(lineStarts, span.offset());
            int column = span.offset() - lineStarts[line];
            tokens.add(new SyntaxToken(line, column, line, column + span.text().length(), type, span.text()));
            previous = span.text();
        }
        return tokens;
    }

    private Set<String> extractProcedureNames(List<Tokenizer.Span> spans) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i + 1 < spans.size(); i++) {
            if (LogoKeywords.TO.equalsIgnoreCase(spans.get(i).text())) {
                String name = spans.get(i + 1).text();
                if (!LogoKeywords.isBracket(name)) {
                    names.add(name.toUpperCase(Locale.ROOT));
                }
            }
        }
        logger.debug("Procedures found: {}", names);
        return names;
    }

    private TokenType classify(String token, String previous, Set<String> procedureNames) {
        if (LogoKeywords.isBracket(token)) {
            return TokenType.PUNCTUATION;
        }
        if (token.length() > 1 && (token.charAt(0) == ':' || token.charAt(0) == '"')) {
            return TokenType.USER_VARIABLE;
        }
        if (ExpressionEvaluator.tryParse(token) != null) {
            return TokenType.NUMBER_LITERAL;
        }
        if (previous != null && LogoKeywords.TO.equalsIgnoreCase(previous)) {
            return TokenType.USER_FUNCTION;
        }
        if (LogoKeywords.isCommand(token)) {
            return TokenType.KEYWORD;
        }
        if (LogoKeywords.isBuiltInFunction(token)) {
            return TokenType.BUILT_IN_FUNCTION;
        }
        if (procedureNames.contains(token.toUpperCase(Locale.ROOT))) {
            return TokenType.USER_FUNCTION;
        }
        return TokenType.IDENTIFIER;
    }

    private static List<String> sorted(Collection<String> words) {
        List<String> list = new ArrayList<>(words);
        Collections.sort(list);
        return list;
    }

    private int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private int lineOf(int[] lineStarts, int offset) {
        int line = 0;
        while (line + 1 < lineStarts.length && lineStarts[line + 1] <= offset) {
            line++;
        }
        return line;
    }

    private String sanitizeInput(String input) {
        if (input == null) {
            return "";
        }
        return input
                .replace("\0", "")
                .replace("\r\n", "\n")
                .replace("\r", "\n");
    }
}
