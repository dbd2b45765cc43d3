package com.example.jestadapter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the Jest adapter.
 * The environment switches of the test platform are mapped onto these in {@code application.yml}.
 */
@ConfigurationProperties(prefix = "adapter")
public record AdapterProperties(
        Runner runner,
        Discovery discovery,
        Execution execution,
        Coverage coverage
) {

    public AdapterProperties {
        if (runner == null) runner = new Runner(null, null);
        if (discovery == null) discovery = new Discovery(null, null);
        if (execution == null) execution = new Execution(0, null);
        if (coverage == null) coverage = new Coverage(null, null, null, null, null);
    }

    /**
     * How the Jest CLI is invoked.
     *
     * @param command   runner invocation prefix (e.g. {@code npx jest})
     * @param extraArgs arguments appended verbatim to every built command
     */
    public record Runner(String command, String extraArgs) {
        public Runner {
            if (command == null || command.isBlank()) command = "npx jest";
            if (extraArgs == null) extraArgs = "";
        }
    }

    /**
     * Test discovery settings.
     *
     * @param runMode     {@code file} for file-level granularity, anything else scans for cases
     * @param listCommand command printing the project's test files as a JSON array
     */
    public record Discovery(String runMode, String listCommand) {
        public Discovery {
            if (runMode == null) runMode = "";
            if (listCommand == null || listCommand.isBlank()) listCommand = "npx jest --listTests --json";
        }

        public boolean fileMode() {
            return "file".equals(runMode);
        }
    }

    /**
     * Retry policy of the resilient executor.
     *
     * @param maxAttempts  total number of runner launches per group
     * @param retryBackoff fixed pause between two attempts
     */
    public record Execution(int maxAttempts, Duration retryBackoff) {
        public Execution {
            if (maxAttempts <= 0) maxAttempts = 3;
            if (retryBackoff == null) retryBackoff = Duration.ofSeconds(1);
        }
    }

    /**
     * Coverage hand-off.
     *
     * @param enabled     switch for {@code --collect-coverage} and relocation; any value other than
     *                    blank, {@code false}, {@code 0} or {@code no} turns it on
     * @param artifact    artifact location relative to the project path
     * @param indexDir    directory (relative to the project path) receiving descriptor files
     * @param format      coverage format tag written into the descriptor
     * @param settleDelay pause before relocating, so the runner has flushed the artifact
     */
    public record Coverage(String enabled, String artifact, String indexDir, String format, Duration settleDelay) {
        public Coverage {
            if (enabled == null) enabled = "";
            if (artifact == null || artifact.isBlank()) artifact = "coverage/clover.xml";
            if (indexDir == null || indexDir.isBlank()) indexDir = "testsolar_coverage";
            if (format == null || format.isBlank()) format = "clover_xml";
            if (settleDelay == null) settleDelay = Duration.ofSeconds(3);
        }

        public boolean isEnabled() {
            String value = enabled.strip();
            return !value.isEmpty()
                    && !"false".equalsIgnoreCase(value)
                    && !"0".equals(value)
                    && !"no".equalsIgnoreCase(value);
        }
    }

    /** Defaults for every setting; used by tests and as fallback when nothing is bound. */
    public static AdapterProperties defaults() {
        return new AdapterProperties(null, null, null, null);
    }
}
