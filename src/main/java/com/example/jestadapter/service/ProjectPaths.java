package com.example.jestadapter.service;

import java.nio.file.Path;

/**
 * Path helpers shared by discovery and parsing. The project root is always passed in explicitly;
 * the process working directory is never consulted or changed.
 */
final class ProjectPaths {

    private ProjectPaths() {
    }

    /**
     * Returns {@code file} relative to {@code projectRoot} with forward slashes.
     * Relative inputs are resolved against the root first; files outside the root keep a {@code ../} prefix.
     */
    static String relativize(Path projectRoot, String file) {
        Path root = projectRoot.toAbsolutePath().normalize();
        Path target = root.resolve(file).normalize();
        return toForwardSlashes(root.relativize(target).toString());
    }

    static String toForwardSlashes(String path) {
        return path.replace('\\', '/');
    }
}
