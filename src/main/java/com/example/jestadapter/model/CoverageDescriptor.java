package com.example.jestadapter.model;

/**
 * Side artifact describing a relocated coverage file.
 *
 * @param coverageFile absolute path of the relocated artifact
 * @param coverageType format tag (e.g. {@code clover_xml})
 * @param projectPath  project the coverage belongs to
 */
public record CoverageDescriptor(String coverageFile, String coverageType, String projectPath) {
}
