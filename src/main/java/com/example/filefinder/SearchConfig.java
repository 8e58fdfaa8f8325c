package com.example.filefinder;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable settings for one search run.
 */
public record SearchConfig(
        Path startPath,
        String pattern,
        int threadCount,
        Optional<Path> logFile,
        boolean followLinks,
        boolean substringFallback,
        List<String> excludeDirectoryPatterns,
        boolean verbose
) {
    public SearchConfig {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1: " + threadCount);
        }
        excludeDirectoryPatterns = List.copyOf(excludeDirectoryPatterns);
    }

    /**
     * Settings with every optional feature at its default.
     */
    public static SearchConfig of(Path startPath, String pattern, int threadCount) {
        return new SearchConfig(startPath, pattern, threadCount, Optional.empty(), false, true, List.of(), false);
    }
}
