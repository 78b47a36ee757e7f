package com.logo.playground.service;

import com.logo.playground.config.LogoInterpreterProperties;
import com.logo.playground.dto.RunResponse;
import com.logo.playground.exception.ExecutionInterruptedException;
import com.logo.playground.exception.LogoException;
import com.logo.playground.interpreter.LogoInterpreter;
import com.logo.playground.model.ExecutionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class LogoInterpreterService implements DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(LogoInterpreterService.class);

    private final LogoInterpreterProperties properties;
    private final LogoInterpreter interpreter;
    private final ExecutorService workers;
    private final AtomicLong workerCounter = new AtomicLong(0);

    public LogoInterpreterService(LogoInterpreterProperties properties) {
        this.properties = properties;
        this.interpreter = new LogoInterpreter(properties.maxRecursionDepth(), new Random());
        this.workers = Executors.newFixedThreadPool(properties.workerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "logo-worker-" + workerCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public RunResponse run(String script) {

        if (script == null || script.trim().isEmpty()) {
            return RunResponse.validationError("Script cannot be empty");
        }

        if (script.length() > properties.maxScriptLength()) {
            return RunResponse.validationError(
                "Script exceeds maximum length of " + properties.maxScriptLength() + " characters"
            );
        }

        String runId = UUID.randomUUID().toString().substring(0, 8);
        long startTime = System.currentTimeMillis();
        Future<ExecutionResult> future = workers.submit(() -> interpreter.run(script));

        try {
            ExecutionResult result = future.get(properties.executionTimeoutMs(), TimeUnit.MILLISECONDS);
            long executionTime = System.currentTimeMillis() - startTime;

            logger.info("Run {} finished in {}ms: {} segments, {} turtles",
                    runId, executionTime, result.segments().size(), result.turtleOrder().size());
            return RunResponse.success(result, executionTime);

        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Run {} timed out after {}ms, interrupting worker", runId, properties.executionTimeoutMs());
            return RunResponse.timeout(
                "Script execution exceeded " + properties.executionTimeoutMs() + "ms"
            );
        } catch (ExecutionException e) {
            long executionTime = System.currentTimeMillis() - startTime;
            Throwable cause = e.getCause();
            if (cause instanceof LogoException logoError) {
                logger.info("Run {} failed with {}: {}", runId, logoError.getKind(), logoError.getMessage());
                return RunResponse.scriptError(logoError, executionTime);
            }
            if (cause instanceof StackOverflowError) {
                logger.warn("Run {} exhausted the call stack", runId);
                return RunResponse.internalError("Script nesting is too deep to execute");
            }
            if (cause instanceof ExecutionInterruptedException) {
                return RunResponse.timeout(cause.getMessage());
            }
            logger.error("Unexpected error for run {}: {}", runId, cause.getMessage(), cause);
            return RunResponse.internalError("Internal server error: " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for run {}", runId);
            return RunResponse.internalError("Request was interrupted");
        }
    }

    @Override
    public void destroy() {
        logger.info("Shutting down LogoInterpreterService");

        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
