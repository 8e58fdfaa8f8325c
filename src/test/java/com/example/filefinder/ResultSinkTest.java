package com.example.filefinder;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultSinkTest {
    private static final Instant NOW = Instant.parse("2026-03-14T09:26:53.589Z");

    @Test
    void writesSessionLog() throws Exception {
        Path dir = Files.createTempDirectory("sink-test");
        Path logFile = dir.resolve("logs/search.log");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        SearchConfig config = SearchConfig.of(dir, "*.txt", 3);
        Path match = dir.resolve("a.txt");
        try (ResultSink sink = new ResultSink(printStream(out), printStream(err), Optional.of(SearchLog.open(logFile, clock)), clock)) {
            sink.sessionStarted(config);
            sink.workerStarted(0);
            sink.match(new MatchEvent(match, NOW, 0));
            sink.warning(ExpansionFailure.entry(dir.resolve("gone"), new NoSuchFileException("gone")));
            sink.workerFinished(0, 4);
            sink.sessionFinished(new SearchSummary(1, 4, 4, 4, 1, Duration.ofMillis(12), false));
        }

        String ts = SearchLog.format(NOW);
        List<String> lines = Files.readAllLines(logFile);
        assertEquals(List.of(
                "=== search started " + ts + " ===",
                "start path: " + dir,
                "pattern: *.txt",
                "threads: 3",
                "[" + ts + "] worker-0 started",
                "[" + ts + "] worker-0 MATCH " + match,
                "[" + ts + "] WARN not found entry " + dir.resolve("gone") + ": gone",
                "[" + ts + "] worker-0 finished (4 directories)",
                "=== search finished " + ts + ": 1 matches, 4 directories, 1 warnings ==="
        ), lines);
        assertEquals(match + System.lineSeparator(), out.toString(StandardCharsets.UTF_8));
        assertEquals("[warn] not found entry " + dir.resolve("gone") + ": gone" + System.lineSeparator(),
                err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void appendsToExistingLog() throws Exception {
        Path logFile = Files.createTempDirectory("sink-append").resolve("search.log");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SearchConfig config = SearchConfig.of(logFile.getParent(), "x", 1);

        for (int run = 0; run < 2; run++) {
            try (ResultSink sink = new ResultSink(printStream(new ByteArrayOutputStream()),
                    printStream(new ByteArrayOutputStream()), Optional.of(SearchLog.open(logFile, clock)), clock)) {
                sink.sessionStarted(config);
                sink.sessionFinished(new SearchSummary(0, 1, 1, 1, 0, Duration.ZERO, false));
            }
        }

        List<String> lines = Files.readAllLines(logFile);
        assertEquals(2L, lines.stream().filter(line -> line.startsWith("=== search started")).count());
        assertEquals(2L, lines.stream().filter(line -> line.endsWith("no match found")).count());
    }

    @Test
    void noMatchNoticeOnlyForCompletedEmptyWalk() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ResultSink sink = new ResultSink(printStream(out), printStream(new ByteArrayOutputStream()))) {
            sink.sessionFinished(new SearchSummary(0, 1, 1, 1, 0, Duration.ZERO, true));
            assertEquals("", out.toString(StandardCharsets.UTF_8));

            sink.sessionFinished(new SearchSummary(0, 1, 1, 1, 0, Duration.ZERO, false));
            assertEquals(ResultSink.NO_MATCH + System.lineSeparator(), out.toString(StandardCharsets.UTF_8));
        }
    }

    @Test
    void concurrentMatchesProduceWholeLines() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ResultSink sink = new ResultSink(printStream(out), printStream(new ByteArrayOutputStream()));
        int workers = 8;
        int perWorker = 500;
        Set<String> expected = new HashSet<>();
        for (int w = 0; w < workers; w++) {
            for (int i = 0; i < perWorker; i++) {
                expected.add(Path.of("dir-" + w, "match-" + i + ".txt").toString());
            }
        }

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                int worker = w;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perWorker; i++) {
                        sink.match(new MatchEvent(Path.of("dir-" + worker, "match-" + i + ".txt"), Instant.now(), worker));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        List<String> lines = out.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(workers * perWorker, lines.size());
        assertEquals(expected, new HashSet<>(lines));
        assertEquals(workers * perWorker, sink.matchCount());
        assertTrue(lines.stream().allMatch(expected::contains));
    }

    private static PrintStream printStream(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }
}
