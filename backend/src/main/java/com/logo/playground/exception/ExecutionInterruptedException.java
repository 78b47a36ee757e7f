package com.logo.playground.exception;

/**
 * Raised when the thread running a script is interrupted, which is how the
 * hosting service enforces its wall-clock budget.
 */
public class ExecutionInterruptedException extends RuntimeException {

    public ExecutionInterruptedException(String message) {
        super(message);
    }
}
