package com.example.filefinder;

import java.nio.file.Path;

/**
 * One child of an expanded directory. An entry whose attributes could not be read carries the
 * failure instead of a kind.
 */
public record ListedEntry(
        Path path,
        EntryKind kind,
        ExpansionFailure failure
) {
    public static ListedEntry of(Path path, EntryKind kind) {
        return new ListedEntry(path, kind, null);
    }

    public static ListedEntry failed(ExpansionFailure failure) {
        return new ListedEntry(failure.path(), null, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public String fileName() {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
