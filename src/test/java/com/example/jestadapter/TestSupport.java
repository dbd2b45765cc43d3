package com.example.jestadapter;

import com.example.jestadapter.config.AdapterProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public final class TestSupport {

    private TestSupport() {
    }

    /** Defaults with no retry backoff and no coverage settle delay. */
    public static AdapterProperties fastProperties() {
        return properties("", "", false);
    }

    public static AdapterProperties properties(String runMode, String extraArgs, boolean coverage) {
        return new AdapterProperties(
                new AdapterProperties.Runner(null, extraArgs),
                new AdapterProperties.Discovery(runMode, null),
                new AdapterProperties.Execution(3, Duration.ZERO),
                new AdapterProperties.Coverage(coverage ? "true" : "", null, null, null, Duration.ZERO));
    }

    public static Path write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            return Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** A jest --json document with a single passing case {@code suite case} in {@code file}. */
    public static String passingReport(Path file, String fullName) {
        return """
                {
                  "numFailedTests": 0,
                  "testResults": [
                    {
                      "name": "%s",
                      "startTime": 1610000000000,
                      "endTime": 1610000010000,
                      "message": "",
                      "status": "passed",
                      "assertionResults": [
                        {"fullName": "%s", "status": "passed", "failureMessages": [], "title": "x"}
                      ]
                    }
                  ]
                }
                """.formatted(file.toAbsolutePath().toString().replace("\\", "\\\\"), fullName);
    }
}
