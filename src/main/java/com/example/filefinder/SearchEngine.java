package com.example.filefinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one search: seeds the queue with the start path, starts a fixed pool of
 * {@link SearchWorker}s and waits until all of them have observed the end of the walk.
 * <p>
 * An engine runs once. The {@link ResultSink} handed in should not be shared with another run,
 * since the summary takes its match and warning totals from it.
 */
public final class SearchEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SearchEngine.class);

    private final SearchConfig config;
    private final ResultSink sink;
    private final DirectoryExpander expander;
    private final WorkQueue queue = new WorkQueue();
    private final AtomicBoolean started = new AtomicBoolean();

    public SearchEngine(SearchConfig config, ResultSink sink) {
        this(config, sink, new FileSystemExpander(config.followLinks()));
    }

    SearchEngine(SearchConfig config, ResultSink sink, DirectoryExpander expander) {
        this.config = config;
        this.sink = sink;
        this.expander = expander;
    }

    /**
     * Walks the tree and blocks until every worker has exited. Completion is decided solely by
     * the queue's pending count reaching zero, or by {@link #stop()}.
     */
    public SearchSummary run() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("SearchEngine can only run once");
        }
        long startNanos = System.nanoTime();
        int threads = config.threadCount();
        FileNameMatcher matcher = FileNameMatcher.forPattern(config.pattern(), config.substringFallback());
        AtomicLong directoriesExpanded = new AtomicLong();

        LOGGER.info("Searching {} for '{}' with {} worker(s).", config.startPath(), config.pattern(), threads);
        sink.sessionStarted(config);
        queue.push(config.startPath());

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads,
                runnable -> new Thread(runnable, "search-worker-" + threadIds.getAndIncrement()));
        List<Future<?>> workers = new ArrayList<>(threads);
        try {
            for (int i = 0; i < threads; i++) {
                workers.add(executor.submit(new SearchWorker(
                        i,
                        queue,
                        expander,
                        matcher,
                        config.excludeDirectoryPatterns(),
                        sink,
                        directoriesExpanded
                )));
            }
            executor.shutdown();
            for (Future<?> worker : workers) {
                worker.get();
            }
        } catch (ExecutionException ex) {
            queue.stop();
            throw new IllegalStateException("Search worker terminated abnormally", ex.getCause());
        } catch (InterruptedException ex) {
            queue.stop();
            throw ex;
        } finally {
            executor.shutdownNow();
        }

        SearchSummary summary = new SearchSummary(
                sink.matchCount(),
                directoriesExpanded.get(),
                queue.pushedCount(),
                queue.completedCount(),
                sink.warningCount(),
                Duration.ofNanos(System.nanoTime() - startNanos),
                queue.isStopped()
        );
        sink.sessionFinished(summary);
        LOGGER.info("Search completed: {} matches in {} directories ({} ms).",
                summary.matches(), summary.directoriesExpanded(), summary.elapsed().toMillis());
        return summary;
    }

    /**
     * Requests cancellation. Workers finish the directory in hand and then exit without draining
     * the rest of the queue.
     */
    public void stop() {
        LOGGER.info("Stop requested.");
        queue.stop();
    }

    WorkQueue queue() {
        return queue;
    }
}
