package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Normalized result of one test case, in the shape expected by the reporting side.
 *
 * @param test       the test, with a percent-encoded selector as name
 * @param startTime  ISO-8601
 * @param endTime    ISO-8601
 * @param resultType SUCCESS or FAILURE
 * @param message    top-level message (failure text, empty on success)
 * @param steps      execution steps, one per normalized record
 */
public record TestResult(
        @JsonProperty("Test") TestCase test,
        @JsonProperty("StartTime") String startTime,
        @JsonProperty("EndTime") String endTime,
        @JsonProperty("ResultType") ResultType resultType,
        @JsonProperty("Message") String message,
        @JsonProperty("Steps") List<TestCaseStep> steps
) {
    public TestResult {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }
}
