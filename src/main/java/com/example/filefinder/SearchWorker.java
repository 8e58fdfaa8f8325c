package com.example.filefinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One worker of the pool. Takes directories from the shared queue, pushes their subdirectories
 * back and matches every leaf by name, until the queue reports that the walk is over.
 */
final class SearchWorker implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SearchWorker.class);

    private final int index;
    private final WorkQueue queue;
    private final DirectoryExpander expander;
    private final FileNameMatcher matcher;
    private final List<String> excludeDirectoryPatterns;
    private final ResultSink sink;
    private final AtomicLong directoriesExpanded;

    SearchWorker(int index,
                 WorkQueue queue,
                 DirectoryExpander expander,
                 FileNameMatcher matcher,
                 List<String> excludeDirectoryPatterns,
                 ResultSink sink,
                 AtomicLong directoriesExpanded) {
        this.index = index;
        this.queue = queue;
        this.expander = expander;
        this.matcher = matcher;
        this.excludeDirectoryPatterns = excludeDirectoryPatterns;
        this.sink = sink;
        this.directoriesExpanded = directoriesExpanded;
    }

    @Override
    public void run() {
        sink.workerStarted(index);
        long expanded = 0;
        try {
            while (true) {
                Optional<Path> next = queue.take();
                if (next.isEmpty()) {
                    break;
                }
                Path directory = next.get();
                try {
                    expand(directory);
                    expanded++;
                } catch (RuntimeException ex) {
                    LOGGER.error("Worker {} failed while expanding {}", index, directory, ex);
                    sink.warning(ExpansionFailure.unexpected(directory, ex));
                } finally {
                    // Every task taken is retired exactly once, whatever happened above.
                    queue.completeOne();
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Worker {} interrupted while waiting for work", index);
        } finally {
            directoriesExpanded.addAndGet(expanded);
            sink.workerFinished(index, expanded);
        }
    }

    private void expand(Path directory) {
        DirectoryListing listing = expander.expand(directory);
        for (ListedEntry entry : listing.getEntries()) {
            if (entry.isFailed()) {
                sink.warning(entry.failure());
                continue;
            }
            switch (entry.kind()) {
                case DIRECTORY -> {
                    if (isExcluded(entry)) {
                        LOGGER.debug("Skipping excluded directory {}", entry.path());
                    } else {
                        queue.push(entry.path());
                    }
                }
                case FILE, SYMLINK -> {
                    if (matcher.matches(entry.fileName())) {
                        sink.match(new MatchEvent(entry.path(), sink.now(), index));
                    }
                }
                case OTHER -> LOGGER.debug("Skipping special file {}", entry.path());
            }
        }
        if (!listing.isSuccess()) {
            sink.warning(listing.getFailure());
        }
    }

    private boolean isExcluded(ListedEntry entry) {
        String name = entry.fileName();
        for (String pattern : excludeDirectoryPatterns) {
            if (GlobMatcher.matches(name, pattern)) {
                return true;
            }
        }
        return false;
    }
}
