package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TestCaseStep(
        @JsonProperty("StartTime") String startTime,
        @JsonProperty("EndTime") String endTime,
        @JsonProperty("Title") String title,
        @JsonProperty("ResultType") ResultType resultType,
        @JsonProperty("Logs") List<TestCaseLog> logs
) {
    public TestCaseStep {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }
}
