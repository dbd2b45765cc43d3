package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A log entry attached to a step.
 *
 * @param time        ISO-8601 timestamp
 * @param level       INFO for a passing case, ERROR for a failing one
 * @param content     log body
 * @param attachments attached file references
 */
public record TestCaseLog(
        @JsonProperty("Time") String time,
        @JsonProperty("Level") LogLevel level,
        @JsonProperty("Content") String content,
        @JsonProperty("Attachments") List<String> attachments
) {
    public TestCaseLog {
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }
}
