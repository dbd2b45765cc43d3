package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Subset of the {@code jest --json} output consumed by the adapter.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JestReport(List<SuiteResult> testResults) {

    public JestReport {
        testResults = testResults != null ? testResults : List.of();
    }

    /**
     * One test file.
     *
     * @param name             absolute path of the test file
     * @param startTime        epoch millis
     * @param endTime          epoch millis
     * @param message          free-text failure log, sections introduced by {@code ●}
     * @param assertionResults cases of the file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SuiteResult(
            String name,
            long startTime,
            long endTime,
            String message,
            List<AssertionResult> assertionResults
    ) {
        public SuiteResult {
            message = message != null ? message : "";
            assertionResults = assertionResults != null ? assertionResults : List.of();
        }
    }

    /**
     * One case.
     *
     * @param fullName        describe titles and case title joined by spaces
     * @param status          {@code passed}, {@code failed} or {@code pending}
     * @param failureMessages failure texts; Jest may emit a list, a single string or nothing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssertionResult(
            String fullName,
            String status,
            @JsonDeserialize(using = FailureMessagesDeserializer.class) List<String> failureMessages
    ) {
        public AssertionResult {
            failureMessages = failureMessages != null ? failureMessages : List.of();
        }

        public String joinedFailureMessages() {
            return String.join("\n", failureMessages);
        }
    }
}
