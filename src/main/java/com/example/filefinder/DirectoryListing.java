package com.example.filefinder;

import java.util.List;

/**
 * Outcome of expanding one task: the children that could be read and, if enumeration broke off
 * or never started, the reason. A listing can carry both when iteration failed midway.
 */
public final class DirectoryListing {
    private final List<ListedEntry> entries;
    private final ExpansionFailure failure;

    private DirectoryListing(List<ListedEntry> entries, ExpansionFailure failure) {
        this.entries = entries;
        this.failure = failure;
    }

    public static DirectoryListing entries(List<ListedEntry> entries) {
        return new DirectoryListing(List.copyOf(entries), null);
    }

    public static DirectoryListing failure(ExpansionFailure failure) {
        return new DirectoryListing(List.of(), failure);
    }

    public static DirectoryListing partial(List<ListedEntry> entries, ExpansionFailure failure) {
        return new DirectoryListing(List.copyOf(entries), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public List<ListedEntry> getEntries() {
        return entries;
    }

    public ExpansionFailure getFailure() {
        return failure;
    }
}
