package com.example.filefinder;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileNameMatcherTest {
    @Test
    void plainPatternMatchesAsSubstringWhenFallbackEnabled() {
        FileNameMatcher matcher = FileNameMatcher.forPattern("port", true);

        assertTrue(matcher.matches("REPORT.txt"));
        assertTrue(matcher.matches("port"));
        assertFalse(matcher.matches("pot.txt"));
    }

    @Test
    void plainPatternMatchesWholeNameWhenExact() {
        FileNameMatcher matcher = FileNameMatcher.forPattern("port", false);

        assertTrue(matcher.matches("PORT"));
        assertFalse(matcher.matches("report.txt"));
    }

    @Test
    void wildcardPatternIsNotRewritten() {
        FileNameMatcher matcher = FileNameMatcher.forPattern("*.log", true);

        assertTrue(matcher.matches("app.log"));
        assertFalse(matcher.matches("app.log.1"));
    }
}
