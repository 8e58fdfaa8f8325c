package com.example.filefinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Plain-text session log opened in append mode, so consecutive runs accumulate in one file.
 * Not thread-safe; {@link ResultSink} serializes all calls.
 */
public final class SearchLog implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SearchLog.class);
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final Path path;
    private final BufferedWriter writer;
    private final Clock clock;
    private boolean broken;

    private SearchLog(Path path, BufferedWriter writer, Clock clock) {
        this.path = path;
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * Opens (or creates) the log file. Failure here is fatal for the run.
     */
    public static SearchLog open(Path path, Clock clock) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        return new SearchLog(path, writer, clock);
    }

    public void header(SearchConfig config) {
        write("=== search started " + format(clock.instant()) + " ===");
        write("start path: " + config.startPath());
        write("pattern: " + config.pattern());
        write("threads: " + config.threadCount());
        flush();
    }

    public void event(Instant timestamp, String message) {
        write("[" + format(timestamp) + "] " + message);
    }

    public void footer(SearchSummary summary) {
        Instant now = clock.instant();
        if (summary.matches() == 0 && !summary.cancelled()) {
            event(now, "no match found");
        }
        String outcome = summary.cancelled() ? "cancelled" : "finished";
        write("=== search " + outcome + " " + format(now) + ": "
                + summary.matches() + " matches, "
                + summary.directoriesExpanded() + " directories, "
                + summary.warnings() + " warnings ===");
        flush();
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    static String format(Instant instant) {
        return TIMESTAMP.format(instant.atZone(ZoneId.systemDefault()));
    }

    private void write(String line) {
        if (broken) {
            return;
        }
        try {
            writer.write(line);
            writer.newLine();
        } catch (IOException ex) {
            broken = true;
            LOGGER.warn("Session log {} is no longer writable; further entries are dropped.", path, ex);
        }
    }

    private void flush() {
        if (broken) {
            return;
        }
        try {
            writer.flush();
        } catch (IOException ex) {
            broken = true;
            LOGGER.warn("Failed to flush session log {}", path, ex);
        }
    }
}
