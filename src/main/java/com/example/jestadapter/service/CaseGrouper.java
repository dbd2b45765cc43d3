package com.example.jestadapter.service;

import com.example.jestadapter.model.ExecutionGroup;
import com.example.jestadapter.model.TestSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions selectors by source file, the unit of execution.
 */
@Service
public class CaseGrouper {

    private static final Logger log = LoggerFactory.getLogger(CaseGrouper.class);

    /**
     * Groups selectors by path. Names keep input order and duplicates; a selector without
     * {@code ?} contributes an empty name. Files appear in order of first occurrence.
     */
    public Map<String, List<String>> group(List<String> selectors) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (String selector : selectors) {
            TestSelector parsed = TestSelector.parse(selector);
            grouped.computeIfAbsent(parsed.path(), k -> new ArrayList<>()).add(parsed.name());
        }
        log.info("Grouped {} selectors into {} files", selectors.size(), grouped.size());
        return grouped;
    }

    public List<ExecutionGroup> executionGroups(List<String> selectors) {
        return group(selectors).entrySet().stream()
                .map(e -> new ExecutionGroup(e.getKey(), e.getValue()))
                .toList();
    }
}
