package com.example.jestadapter.service;

import com.example.jestadapter.TestSupport;
import com.example.jestadapter.config.AdapterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TestFileListerTest {

    @TempDir
    Path project;

    private TestFileLister lister(CommandRunner runner) {
        return new TestFileLister(runner, AdapterConfig.newObjectMapper(), TestSupport.fastProperties());
    }

    @Test
    void parsesListingInProjectDirectory() {
        AtomicReference<Path> workingDir = new AtomicReference<>();
        AtomicReference<String> command = new AtomicReference<>();
        TestFileLister lister = lister((cmd, dir) -> {
            command.set(cmd);
            workingDir.set(dir);
            return new CommandRunner.CommandResult(0, "[\"/p/a.test.js\",\"/p/b.test.js\"]\n", "");
        });

        List<String> files = lister.listTestFiles(project);

        assertEquals(List.of("/p/a.test.js", "/p/b.test.js"), files);
        assertEquals(project, workingDir.get());
        assertEquals("npx jest --listTests --json", command.get());
    }

    @Test
    void ignoresNoiseAroundTheArray() {
        TestFileLister lister = lister((cmd, dir) ->
                new CommandRunner.CommandResult(0, "Browserslist: caniuse-lite is outdated\n[\"/p/a.test.js\"]\n", ""));

        assertEquals(List.of("/p/a.test.js"), lister.listTestFiles(project));
    }

    @Test
    void missingArrayIsADiscoveryError() {
        TestFileLister lister = lister((cmd, dir) ->
                new CommandRunner.CommandResult(1, "", "Cannot find module 'jest'"));

        DiscoveryException e = assertThrows(DiscoveryException.class, () -> lister.listTestFiles(project));
        assertTrue(e.getMessage().contains("Cannot find module"));
    }

    @Test
    void malformedArrayIsADiscoveryError() {
        TestFileLister lister = lister((cmd, dir) -> new CommandRunner.CommandResult(0, "[\"a\", ]", ""));

        assertThrows(DiscoveryException.class, () -> lister.listTestFiles(project));
    }
}
