package com.example.jestadapter.service;

/**
 * The runner's JSON output is missing or malformed.
 */
public class ReportParseException extends AdapterException {

    public ReportParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
