package com.example.jestadapter.service;

import com.example.jestadapter.config.AdapterProperties;
import com.example.jestadapter.model.JestCommand;
import com.example.jestadapter.model.TestSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the Jest command line for one source file.
 * Every command writes JSON results to the group's output file and disables color output.
 */
@Service
public class JestCommandBuilder {

    private static final Logger log = LoggerFactory.getLogger(JestCommandBuilder.class);

    static final String COVERAGE_FLAG = "--collect-coverage";

    private final AdapterProperties properties;

    public JestCommandBuilder(AdapterProperties properties) {
        this.properties = properties;
    }

    /**
     * @param filePath       relative test file path
     * @param testNames      names to run, OR-ed into a single {@code --testNamePattern}; empty runs the whole file
     * @param outputFileName JSON output file, relative to the project path
     */
    public JestCommand build(String filePath, List<String> testNames, String outputFileName) {
        StringBuilder command = new StringBuilder(properties.runner().command()).append(' ').append(filePath);
        List<String> identifiers = new ArrayList<>(testNames.size());

        if (!testNames.isEmpty()) {
            String pattern = TestSelector.decodeUri(String.join("|", testNames));
            if (!pattern.isEmpty()) {
                command.append(" --testNamePattern=\"").append(pattern).append('"');
            }
            for (String name : testNames) {
                identifiers.add(new TestSelector(filePath, name).value());
            }
        }

        command.append(" --json --outputFile=").append(outputFileName).append(" --color=false");

        String extraArgs = properties.runner().extraArgs();
        if (!extraArgs.isBlank()) {
            command.append(' ').append(extraArgs.strip());
        }
        if (properties.coverage().isEnabled()) {
            log.info("Coverage enabled, running jest with {}", COVERAGE_FLAG);
            command.append(' ').append(COVERAGE_FLAG);
        }

        log.info("Generated command for {}: {}", filePath, command);
        return new JestCommand(command.toString(), identifiers);
    }
}
