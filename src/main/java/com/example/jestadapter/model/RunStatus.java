package com.example.jestadapter.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Status of a parsed assertion. Pending assertions never become a {@link RunRecord}.
 */
public enum RunStatus {
    PASSED, FAILED;

    /**
     * Maps a Jest status string; {@code pending} (and any other skipped state) yields empty.
     * Unknown non-skip values are treated as failures.
     */
    public static Optional<RunStatus> fromJest(String raw) {
        if (raw == null) {
            return Optional.of(FAILED);
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "passed" -> Optional.of(PASSED);
            case "pending", "skipped", "todo", "disabled" -> Optional.empty();
            default -> Optional.of(FAILED);
        };
    }
}
