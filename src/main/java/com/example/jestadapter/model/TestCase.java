package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A test as known to the test platform.
 *
 * @param name       selector, possibly percent-encoded
 * @param attributes free-form attributes
 */
public record TestCase(
        @JsonProperty("Name") String name,
        @JsonProperty("Attributes") Map<String, String> attributes
) {
    public TestCase {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public TestCase(String name) {
        this(name, Map.of());
    }
}
