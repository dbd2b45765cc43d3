package com.example.jestadapter.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunRecordTest {

    @Test
    void mergeKeepsFirstRecordAndAppendsMessage() {
        RunRecord first = new RunRecord("a.test.js?x", RunStatus.FAILED, 10, 30, "boom", "boom");
        RunRecord second = new RunRecord("a.test.js?x", RunStatus.PASSED, 40, 50, "again", "again");

        RunRecord merged = RunRecord.merge(first, second);

        assertEquals(RunStatus.FAILED, merged.status());
        assertEquals(10, merged.startTime());
        assertEquals(30, merged.endTime());
        assertEquals(20, merged.duration());
        assertEquals("boom\nagain", merged.message());
        assertEquals("boom", merged.content());
    }

    @Test
    void pendingStatusIsNotARunStatus() {
        assertTrue(RunStatus.fromJest("pending").isEmpty());
        assertEquals(RunStatus.PASSED, RunStatus.fromJest("passed").orElseThrow());
        assertEquals(RunStatus.FAILED, RunStatus.fromJest("failed").orElseThrow());
    }

    @Test
    void nullTextsBecomeEmpty() {
        RunRecord record = new RunRecord("a.test.js?x", RunStatus.PASSED, 0, 0, null, null);
        assertEquals("", record.message());
        assertEquals("", record.content());
    }
}
