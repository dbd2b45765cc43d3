package com.example.jestadapter.service;

/**
 * The runner produced no output file within the retry budget.
 */
public class RunnerExecutionException extends AdapterException {

    public RunnerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
