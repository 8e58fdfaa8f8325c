package com.example.filefinder;

@FunctionalInterface
public interface FileNameMatcher {
    /**
     * Returns true if the given file name (no directory part) is a hit.
     */
    boolean matches(String fileName);

    /**
     * Builds the matcher shared by all workers. With {@code substringFallback} enabled a pattern
     * without wildcards is rewritten to {@code *pattern*}, turning it into a case-insensitive
     * containment check on the same glob engine.
     */
    static FileNameMatcher forPattern(String pattern, boolean substringFallback) {
        String effective = substringFallback && !GlobMatcher.hasWildcards(pattern)
                ? "*" + pattern + "*"
                : pattern;
        return fileName -> GlobMatcher.matches(fileName, effective);
    }
}
