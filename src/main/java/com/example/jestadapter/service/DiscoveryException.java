package com.example.jestadapter.service;

/**
 * Discovery could not complete: the test files could not be listed or a source file could not be read.
 */
public class DiscoveryException extends AdapterException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
