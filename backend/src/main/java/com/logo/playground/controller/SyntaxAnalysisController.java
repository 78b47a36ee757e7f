package com.logo.playground.controller;

import com.logo.playground.dto.KeywordCatalog;
import com.logo.playground.dto.SyntaxAnalysisRequest;
import com.logo.playground.dto.SyntaxAnalysisResponse;
import com.logo.playground.service.LogoSyntaxAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/syntax")
@Validated
public class SyntaxAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisController.class);

    private final LogoSyntaxAnalysisService syntaxAnalysisService;

    public SyntaxAnalysisController(LogoSyntaxAnalysisService syntaxAnalysisService) {
        this.syntaxAnalysisService = syntaxAnalysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<SyntaxAnalysisResponse> analyzeSyntax(@Valid @RequestBody SyntaxAnalysisRequest request) {
        logger.debug("Highlighting {} characters", request.sourceCode().length());

        SyntaxAnalysisResponse response = syntaxAnalysisService.analyzeSyntax(request);
        if (!response.success()) {
            logger.warn("Highlighting failed: {}", response.error());
            return ResponseEntity.internalServerError().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/keywords")
    public ResponseEntity<KeywordCatalog> keywords() {
        return ResponseEntity.ok(syntaxAnalysisService.keywordCatalog());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Syntax analysis service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SyntaxAnalysisResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " - " + error.getDefaultMessage())
                .reduce((left, right) -> left + "; " + right)
                .orElse("invalid request");

        logger.warn("Rejected syntax analysis request: {}", message);
        return ResponseEntity.badRequest().body(SyntaxAnalysisResponse.error("Validation error: " + message, 0));
    }
}
