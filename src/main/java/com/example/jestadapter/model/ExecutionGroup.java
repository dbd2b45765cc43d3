package com.example.jestadapter.model;

import java.util.List;

/**
 * The test names to run within one source file, executed as a single runner invocation.
 * An empty string in {@code testNames} stands for "no name filter for this file".
 *
 * @param filePath  relative file path
 * @param testNames names in input order, duplicates preserved
 */
public record ExecutionGroup(String filePath, List<String> testNames) {

    public ExecutionGroup {
        testNames = List.copyOf(testNames);
    }

    /** Runner output file for this group: the path with {@code /} replaced by {@code _}, plus {@code .json}. */
    public String outputFileName() {
        return filePath.replace('/', '_') + ".json";
    }
}
