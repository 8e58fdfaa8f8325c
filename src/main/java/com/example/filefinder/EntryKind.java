package com.example.filefinder;

import java.nio.file.attribute.BasicFileAttributes;

public enum EntryKind {
    DIRECTORY,
    FILE,
    SYMLINK,
    OTHER;

    /**
     * Classifies attributes read without following links.
     */
    static EntryKind of(BasicFileAttributes attrs) {
        if (attrs.isSymbolicLink()) {
            return SYMLINK;
        }
        if (attrs.isDirectory()) {
            return DIRECTORY;
        }
        if (attrs.isRegularFile()) {
            return FILE;
        }
        return OTHER;
    }
}
