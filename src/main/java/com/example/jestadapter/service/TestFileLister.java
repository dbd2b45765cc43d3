package com.example.jestadapter.service;

import com.example.jestadapter.config.AdapterProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Asks Jest which files of the project are test files ({@code jest --listTests --json}).
 */
@Service
public class TestFileLister {

    private static final Logger log = LoggerFactory.getLogger(TestFileLister.class);

    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final AdapterProperties properties;

    public TestFileLister(CommandRunner commandRunner, ObjectMapper objectMapper, AdapterProperties properties) {
        this.commandRunner = commandRunner;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @param projectPath project root, used as working directory
     * @return test file paths as printed by Jest (usually absolute)
     * @throws DiscoveryException if the command cannot run or its output is not a JSON array
     */
    public List<String> listTestFiles(Path projectPath) {
        String command = properties.discovery().listCommand();
        CommandRunner.CommandResult result;
        try {
            result = commandRunner.run(command, projectPath);
        } catch (RuntimeException e) {
            throw new DiscoveryException("Unable to list test files with '" + command + "': " + e.getMessage(), e);
        }
        if (!result.succeeded()) {
            log.warn("'{}' exited with code {}, parsing its output anyway", command, result.exitCode());
        }

        String json = extractJsonArray(result.stdout());
        if (json == null) {
            throw new DiscoveryException("No JSON array in output of '" + command + "'. stderr: "
                    + result.stderr().strip());
        }
        try {
            List<String> files = objectMapper.readValue(json, new TypeReference<List<String>>() {});
            log.info("Jest listed {} test files", files.size());
            return files;
        } catch (JsonProcessingException e) {
            throw new DiscoveryException("Malformed test file listing: " + e.getOriginalMessage(), e);
        }
    }

    /** Jest may print warnings around the listing; keep only the outermost JSON array. */
    static String extractJsonArray(String stdout) {
        int start = stdout.indexOf('[');
        int end = stdout.lastIndexOf(']');
        if (start < 0 || end < start) {
            return null;
        }
        return stdout.substring(start, end + 1);
    }
}
