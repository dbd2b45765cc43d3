package com.example.jestadapter.model;

import java.util.List;

/**
 * A runner invocation for one execution group.
 *
 * @param command         shell command line
 * @param testIdentifiers {@code path?name} per requested name, in request order; empty for a whole-file run
 */
public record JestCommand(String command, List<String> testIdentifiers) {

    public JestCommand {
        testIdentifiers = List.copyOf(testIdentifiers);
    }
}
