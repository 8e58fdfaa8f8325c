package com.example.filefinder;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A recoverable problem met while expanding one directory or classifying one of its entries.
 *
 * @param entryLevel true if only a single entry was affected and its siblings were still read
 */
public record ExpansionFailure(
        FailureKind kind,
        Path path,
        String message,
        boolean entryLevel
) {
    public static ExpansionFailure directory(Path path, IOException ex) {
        return new ExpansionFailure(FailureKind.of(ex), path, describe(ex), false);
    }

    public static ExpansionFailure entry(Path path, IOException ex) {
        return new ExpansionFailure(FailureKind.of(ex), path, describe(ex), true);
    }

    public static ExpansionFailure unexpected(Path path, RuntimeException ex) {
        return new ExpansionFailure(FailureKind.UNEXPECTED, path, describe(ex), false);
    }

    private static String describe(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
