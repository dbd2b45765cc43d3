package com.example.jestadapter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Narrows discovered selectors against the selectors requested by the platform.
 */
@Service
public class SelectorFilter {

    private static final Logger log = LoggerFactory.getLogger(SelectorFilter.class);

    /** Selector meaning "everything". */
    public static final String SELECT_ALL = ".";

    enum EntryKind { FILE, DIRECTORY, OTHER }

    /**
     * Applies the platform's selection: an empty list or the single selector {@code "."} keeps
     * every candidate, anything else goes through {@link #filter}.
     */
    public List<String> select(Path projectRoot, List<String> selectors, Collection<String> candidates) {
        if (selectors.isEmpty() || (selectors.size() == 1 && SELECT_ALL.equals(selectors.get(0)))) {
            return List.copyOf(candidates);
        }
        return filter(projectRoot, selectors, candidates, false);
    }

    /**
     * Keeps the candidates matched by at least one selector, or the unmatched ones when {@code exclude}.
     * A directory selector matches candidates containing {@code selector + "/"}; any other selector
     * matches by plain substring.
     *
     * @param projectRoot root against which relative selectors are classified
     */
    public List<String> filter(Path projectRoot, List<String> selectors, Collection<String> candidates,
                               boolean exclude) {
        if (selectors.isEmpty()) {
            return List.copyOf(candidates);
        }

        List<String> needles = new ArrayList<>(selectors.size());
        for (String selector : selectors) {
            needles.add(classify(projectRoot, selector) == EntryKind.DIRECTORY ? selector + "/" : selector);
        }

        List<String> kept = new ArrayList<>();
        for (String candidate : candidates) {
            boolean matched = needles.stream().anyMatch(candidate::contains);
            if (matched != exclude) {
                kept.add(candidate);
            }
        }
        log.info("Selector filter kept {}/{} test cases (exclude={})", kept.size(), candidates.size(), exclude);
        return kept;
    }

    /**
     * Classifies a selector as file, directory or neither. Stat failures (missing path, selector
     * with a {@code ?}, permission problems) classify as {@link EntryKind#OTHER}.
     */
    EntryKind classify(Path projectRoot, String selector) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(projectRoot.resolve(selector), BasicFileAttributes.class);
            if (attrs.isDirectory()) return EntryKind.DIRECTORY;
            if (attrs.isRegularFile()) return EntryKind.FILE;
            return EntryKind.OTHER;
        } catch (IOException | InvalidPathException e) {
            log.debug("Cannot stat selector '{}': {}", selector, e.getMessage());
            return EntryKind.OTHER;
        }
    }
}
