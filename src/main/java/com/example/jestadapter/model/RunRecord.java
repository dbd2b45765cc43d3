package com.example.jestadapter.model;

/**
 * Parsed, pre-normalization result of one selector within one execution group.
 *
 * @param selector  {@code path?fullName}
 * @param status    passed or failed
 * @param startTime epoch millis
 * @param endTime   epoch millis
 * @param message   failure text, newline-joined across merged assertions
 * @param content   failure text of the first assertion
 */
public record RunRecord(
        String selector,
        RunStatus status,
        long startTime,
        long endTime,
        String message,
        String content
) {

    public RunRecord {
        message = message != null ? message : "";
        content = content != null ? content : "";
    }

    public long duration() {
        return endTime - startTime;
    }

    public boolean passed() {
        return status == RunStatus.PASSED;
    }

    /**
     * Merges a later assertion for the same selector into this record: the first record is
     * kept and the incoming message is appended after a newline.
     */
    public static RunRecord merge(RunRecord existing, RunRecord incoming) {
        return new RunRecord(existing.selector, existing.status, existing.startTime, existing.endTime,
                existing.message + "\n" + incoming.message, existing.content);
    }
}
