package com.logo.playground.controller;

import com.logo.playground.dto.RunRequest;
import com.logo.playground.dto.RunResponse;
import com.logo.playground.service.LogoInterpreterService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class RunController {

    private static final Logger logger = LoggerFactory.getLogger(RunController.class);

    private final LogoInterpreterService interpreterService;

    public RunController(LogoInterpreterService interpreterService) {
        this.interpreterService = interpreterService;
    }

    @PostMapping("/run")
    public ResponseEntity<RunResponse> run(@Valid @RequestBody RunRequest request) {
        logger.info("Received run request (length: {} chars)",
                   request.script() != null ? request.script().length() : 0);

        try {
            RunResponse response = interpreterService.run(request.sanitizedScript());

            logger.info("Run completed - Success: {}, Type: {}",
                       response.success(), response.resultType());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during run: {}", e.getMessage(), e);

            RunResponse errorResponse = RunResponse.internalError(
                "Internal server error: " + e.getMessage()
            );

            return ResponseEntity.internalServerError().body(errorResponse);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Logo Playground Backend is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<RunResponse> handleValidationException(MethodArgumentNotValidException e) {

        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        RunResponse response = RunResponse.validationError(errorMessage.toString());
        return ResponseEntity.badRequest().body(response);
    }
}
