package com.example.jestadapter.model;

/**
 * A test declaration found while scanning a source file.
 *
 * @param filePath      path relative to the project root, forward slashes
 * @param describeTitle title of the enclosing {@code describe} block, empty when ungrouped
 * @param caseTitle     title of the {@code it}/{@code test} declaration
 */
public record DiscoveredCase(String filePath, String describeTitle, String caseTitle) {

    public DiscoveredCase {
        describeTitle = describeTitle != null ? describeTitle : "";
    }

    /** Jest full name: the describe title and the case title joined by a single space. */
    public String fullName() {
        return describeTitle.isEmpty() ? caseTitle : describeTitle + " " + caseTitle;
    }

    public TestSelector toSelector() {
        return new TestSelector(filePath, fullName());
    }
}
