package com.filterbench.engine;

/**
 * A failure of the execution machinery itself, as opposed to a failure of an
 * individual task. Aborts the current run.
 */
public class StrategyExecutionException extends RuntimeException {

    public StrategyExecutionException(String message) {
        super(message);
    }

    public StrategyExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
