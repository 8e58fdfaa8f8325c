package com.example.filefinder;

import java.nio.file.Path;

/**
 * Enumerates the children of one task. Implementations report I/O problems through the returned
 * listing instead of throwing.
 */
@FunctionalInterface
public interface DirectoryExpander {
    DirectoryListing expand(Path directory);
}
