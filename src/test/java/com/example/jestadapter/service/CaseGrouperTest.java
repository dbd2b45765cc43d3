package com.example.jestadapter.service;

import com.example.jestadapter.model.ExecutionGroup;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CaseGrouperTest {

    private final CaseGrouper grouper = new CaseGrouper();

    @Test
    void groupsByPath() {
        Map<String, List<String>> result = grouper.group(List.of(
                "tests/utils.test.js?sum module adds 1 + 2 to equal 3",
                "tests/utils.test.js"));

        assertEquals(Map.of("tests/utils.test.js", List.of("sum module adds 1 + 2 to equal 3", "")), result);
    }

    @Test
    void keepsOrderAndDuplicates() {
        Map<String, List<String>> result = grouper.group(List.of(
                "b.test.js?two", "a.test.js?one", "b.test.js?two", "b.test.js?three"));

        assertEquals(List.of("b.test.js", "a.test.js"), new ArrayList<>(result.keySet()));
        assertEquals(List.of("two", "two", "three"), result.get("b.test.js"));
    }

    @Test
    void flatteningRecoversInputPairs() {
        List<String> selectors = List.of("a.test.js?x", "a.test.js", "b.test.js?y?z", "a.test.js?x");

        List<String> flattened = new ArrayList<>();
        grouper.group(selectors).forEach((path, names) ->
                names.forEach(name -> flattened.add(name.isEmpty() ? path : path + "?" + name)));

        assertEquals(selectors.size(), flattened.size());
        assertTrue(flattened.containsAll(selectors));
    }

    @Test
    void executionGroupsCarryOutputFileName() {
        List<ExecutionGroup> groups = grouper.executionGroups(List.of("src/tests/a.test.js?x"));

        assertEquals(1, groups.size());
        assertEquals("src_tests_a.test.js.json", groups.get(0).outputFileName());
    }

    @Test
    void emptyInputGivesNoGroups() {
        assertEquals(new LinkedHashMap<>(), grouper.group(List.of()));
    }
}
