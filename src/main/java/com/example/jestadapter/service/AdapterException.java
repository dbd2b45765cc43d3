package com.example.jestadapter.service;

/**
 * Base class of the adapter's pipeline failures.
 */
public class AdapterException extends RuntimeException {

    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
