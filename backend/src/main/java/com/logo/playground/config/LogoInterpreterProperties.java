package com.logo.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "logo.interpreter")
@Validated
public record LogoInterpreterProperties(
    @Positive
    Integer maxRecursionDepth,

    @Positive
    Long executionTimeoutMs,

    @Positive
    Integer maxScriptLength,

    @Positive
    Integer workerThreads
) {

    @ConstructorBinding
    public LogoInterpreterProperties {
        if (maxRecursionDepth == null) {
            maxRecursionDepth = 32;
        }
        if (executionTimeoutMs == null) {
            executionTimeoutMs = 5000L;
        }
        if (maxScriptLength == null) {
            maxScriptLength = 10000;
        }
        if (workerThreads == null) {
            workerThreads = 4;
        }
    }

    public LogoInterpreterProperties() {
        this(32, 5000L, 10000, 4);
    }
}
