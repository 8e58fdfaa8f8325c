package com.example.filefinder;

import java.io.Closeable;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Funnels matches and diagnostics from all workers into stdout, stderr and the optional session
 * log. Every write happens under one lock, so lines never interleave; the order of matches
 * across workers is whatever order they arrive in.
 */
public final class ResultSink implements Closeable {
    public static final String NO_MATCH = "No match found.";

    private final Object lock = new Object();
    private final PrintStream out;
    private final PrintStream err;
    private final Optional<SearchLog> log;
    private final Clock clock;
    private long matches;
    private long warnings;

    public ResultSink(PrintStream out, PrintStream err) {
        this(out, err, Optional.empty(), Clock.systemDefaultZone());
    }

    public ResultSink(PrintStream out, PrintStream err, Optional<SearchLog> log, Clock clock) {
        this.out = out;
        this.err = err;
        this.log = log;
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public void sessionStarted(SearchConfig config) {
        synchronized (lock) {
            log.ifPresent(l -> l.header(config));
        }
    }

    public void workerStarted(int worker) {
        synchronized (lock) {
            log.ifPresent(l -> l.event(now(), workerName(worker) + " started"));
        }
    }

    public void workerFinished(int worker, long directoriesExpanded) {
        synchronized (lock) {
            log.ifPresent(l -> l.event(now(), workerName(worker) + " finished (" + directoriesExpanded + " directories)"));
        }
    }

    public void match(MatchEvent event) {
        synchronized (lock) {
            matches++;
            out.println(event.path());
            log.ifPresent(l -> l.event(event.timestamp(), workerName(event.worker()) + " MATCH " + event.path()));
        }
    }

    public void warning(ExpansionFailure failure) {
        String tag = failure.kind() == FailureKind.UNEXPECTED ? "[error]" : "[warn]";
        String scope = failure.entryLevel() ? "entry " : "";
        String line = failure.kind().label() + " " + scope + failure.path() + ": " + failure.message();
        synchronized (lock) {
            warnings++;
            err.println(tag + " " + line);
            log.ifPresent(l -> l.event(now(), (failure.kind() == FailureKind.UNEXPECTED ? "ERROR " : "WARN ") + line));
        }
    }

    /**
     * Closes the session. Prints the no-match notice if a completed walk found nothing.
     */
    public void sessionFinished(SearchSummary summary) {
        synchronized (lock) {
            if (summary.matches() == 0 && !summary.cancelled()) {
                out.println(NO_MATCH);
            }
            out.flush();
            log.ifPresent(l -> l.footer(summary));
        }
    }

    public long matchCount() {
        synchronized (lock) {
            return matches;
        }
    }

    public long warningCount() {
        synchronized (lock) {
            return warnings;
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (lock) {
            if (log.isPresent()) {
                log.get().close();
            }
        }
    }

    private static String workerName(int worker) {
        return "worker-" + worker;
    }
}
