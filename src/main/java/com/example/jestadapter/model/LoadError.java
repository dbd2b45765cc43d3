package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reason a load could not discover (part of) the project's tests.
 */
public record LoadError(
        @JsonProperty("Name") String name,
        @JsonProperty("Message") String message
) {
}
