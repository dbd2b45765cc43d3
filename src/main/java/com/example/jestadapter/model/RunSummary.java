package com.example.jestadapter.model;

/**
 * Outcome of a run invocation.
 *
 * @param groups          execution groups attempted
 * @param failedGroups    groups whose execution or parsing failed
 * @param reportedResults normalized results handed to the reporter
 */
public record RunSummary(int groups, int failedGroups, int reportedResults) {

    public boolean hasFailures() {
        return failedGroups > 0;
    }
}
