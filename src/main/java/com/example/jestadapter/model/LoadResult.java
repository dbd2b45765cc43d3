package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Discovery document reported to the test platform.
 */
public record LoadResult(
        @JsonProperty("Tests") List<TestCase> tests,
        @JsonProperty("LoadErrors") List<LoadError> loadErrors
) {
    public LoadResult {
        tests = tests != null ? List.copyOf(tests) : List.of();
        loadErrors = loadErrors != null ? List.copyOf(loadErrors) : List.of();
    }

    public static LoadResult of(List<TestCase> tests) {
        return new LoadResult(tests, List.of());
    }

    public static LoadResult failed(LoadError error) {
        return new LoadResult(List.of(), List.of(error));
    }
}
