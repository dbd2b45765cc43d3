package com.example.jestadapter.service;

import com.example.jestadapter.config.AdapterProperties;
import com.example.jestadapter.model.DiscoveredCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts Jest test selectors from source text without a JavaScript parser.
 * <p>
 * Each file is scanned line by line with two states:
 * <ul>
 *   <li>{@code NO_GROUP}: no {@code describe} title is active. Indented cases are dropped.</li>
 *   <li>{@code IN_GROUP}: a {@code describe} title is active. Indented cases are emitted as
 *       {@code <describe> <case>}.</li>
 * </ul>
 * A {@code describe(...)} line enters {@code IN_GROUP}; a case at column 0 is emitted ungrouped
 * and returns to {@code NO_GROUP}.
 */
@Service
public class CaseDiscoveryScanner {

    private static final Logger log = LoggerFactory.getLogger(CaseDiscoveryScanner.class);

    private static final Pattern GROUP_DECLARATION = Pattern.compile("describe\\(['\"](.*?)['\"],");
    private static final Pattern TOP_LEVEL_CASE = Pattern.compile("^(?:it|test)\\(['\"](.*?)['\"],");
    private static final Pattern NESTED_CASE = Pattern.compile("\\s+(?:it|test)\\(['\"](.*?)['\"],");

    enum ScanState { NO_GROUP, IN_GROUP }

    private final AdapterProperties properties;

    public CaseDiscoveryScanner(AdapterProperties properties) {
        this.properties = properties;
    }

    /**
     * Produces the selector set for the given test files. In file mode the file paths are
     * returned as they are, without reading any content.
     *
     * @param projectRoot project root, used to relativize paths
     * @param files       test file paths, absolute or relative to the root
     * @return deduplicated selectors in discovery order
     * @throws DiscoveryException if a file cannot be read
     */
    public Set<String> discover(Path projectRoot, Collection<String> files) {
        if (properties.discovery().fileMode()) {
            log.info("File mode: returning {} test files without scanning cases", files.size());
            Set<String> selectors = new LinkedHashSet<>();
            files.forEach(f -> selectors.add(ProjectPaths.toForwardSlashes(f)));
            return selectors;
        }
        return scan(projectRoot, files);
    }

    /**
     * Scans every file for {@code describe}/{@code it}/{@code test} declarations.
     *
     * Files are decoded as UTF-8; invalid byte sequences become replacement characters.
     *
     * @throws DiscoveryException if a file cannot be read; no partial result is returned
     */
    public Set<String> scan(Path projectRoot, Collection<String> files) {
        Set<String> selectors = new LinkedHashSet<>();
        for (String file : files) {
            String relativePath = ProjectPaths.relativize(projectRoot, file);
            List<String> lines;
            try {
                // malformed bytes are replaced rather than failing the whole discovery
                lines = new String(Files.readAllBytes(projectRoot.resolve(file)), StandardCharsets.UTF_8)
                        .lines().toList();
            } catch (IOException e) {
                throw new DiscoveryException("Unable to read test file " + file + ": " + e.getMessage(), e);
            }
            for (DiscoveredCase discovered : scanLines(relativePath, lines)) {
                selectors.add(discovered.toSelector().value());
            }
        }
        log.info("Scanned {} files, {} test cases found", files.size(), selectors.size());
        return selectors;
    }

    /**
     * Scans the lines of a single file.
     *
     * @param relativePath path used in the produced cases
     * @param lines        file content
     * @return cases in declaration order, possibly with duplicates
     */
    List<DiscoveredCase> scanLines(String relativePath, List<String> lines) {
        List<DiscoveredCase> cases = new ArrayList<>();
        ScanState state = ScanState.NO_GROUP;
        String groupTitle = "";

        for (String line : lines) {
            Matcher group = GROUP_DECLARATION.matcher(line);
            if (group.find()) {
                groupTitle = group.group(1);
                state = ScanState.IN_GROUP;
            }

            Matcher topLevel = TOP_LEVEL_CASE.matcher(line);
            if (topLevel.find()) {
                cases.add(new DiscoveredCase(relativePath, "", topLevel.group(1)));
                groupTitle = "";
                state = ScanState.NO_GROUP;
                continue;
            }

            Matcher nested = NESTED_CASE.matcher(line);
            if (nested.find()) {
                if (state == ScanState.IN_GROUP && !groupTitle.isEmpty()) {
                    cases.add(new DiscoveredCase(relativePath, groupTitle, nested.group(1)));
                } else {
                    log.debug("Dropping indented case '{}' in {}: no enclosing describe", nested.group(1), relativePath);
                }
            }
        }
        return cases;
    }
}
