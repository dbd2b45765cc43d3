package com.example.jestadapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Input descriptor handed over by the test platform for a load or run invocation.
 *
 * @param testSelectors  selectors to load or run
 * @param projectPath    root of the project under test
 * @param taskId         platform task identifier
 * @param fileReportPath directory receiving result documents and coverage artifacts
 */
public record TaskParameters(
        @JsonProperty("TestSelectors") List<String> testSelectors,
        @JsonProperty("ProjectPath") String projectPath,
        @JsonProperty("TaskId") String taskId,
        @JsonProperty("FileReportPath") String fileReportPath
) {
    public TaskParameters {
        testSelectors = testSelectors != null ? List.copyOf(testSelectors) : List.of();
    }
}
