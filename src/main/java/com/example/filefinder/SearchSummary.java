package com.example.filefinder;

import java.time.Duration;

/**
 * Totals of one finished walk.
 */
public record SearchSummary(
        long matches,
        long directoriesExpanded,
        long tasksPushed,
        long tasksCompleted,
        long warnings,
        Duration elapsed,
        boolean cancelled
) {
}
