package com.example.filefinder;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link DirectoryExpander} backed by {@link Files#newDirectoryStream(Path)}.
 * <p>
 * Entries are classified without following links. With {@code followLinks} a link that resolves
 * to a directory is reported as {@link EntryKind#DIRECTORY} and gets expanded; there is no cycle
 * detection in that mode. A task that turns out not to be a directory expands to itself, which
 * lets a plain file be used as the start path.
 */
public final class FileSystemExpander implements DirectoryExpander {
    private final boolean followLinks;

    public FileSystemExpander(boolean followLinks) {
        this.followLinks = followLinks;
    }

    @Override
    public DirectoryListing expand(Path directory) {
        List<ListedEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                entries.add(classify(entry));
            }
        } catch (NotDirectoryException ex) {
            return DirectoryListing.entries(List.of(classify(directory)));
        } catch (DirectoryIteratorException ex) {
            return DirectoryListing.partial(entries, ExpansionFailure.directory(directory, ex.getCause()));
        } catch (IOException ex) {
            return DirectoryListing.partial(entries, ExpansionFailure.directory(directory, ex));
        }
        return DirectoryListing.entries(entries);
    }

    private ListedEntry classify(Path entry) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            EntryKind kind = EntryKind.of(attrs);
            if (kind == EntryKind.SYMLINK && followLinks && Files.isDirectory(entry)) {
                kind = EntryKind.DIRECTORY;
            }
            return ListedEntry.of(entry, kind);
        } catch (IOException ex) {
            return ListedEntry.failed(ExpansionFailure.entry(entry, ex));
        }
    }
}
