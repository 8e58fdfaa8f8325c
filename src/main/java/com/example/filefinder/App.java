package com.example.filefinder;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.util.Optional;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private App() {
    }

    public static void main(String[] args) {
        System.exit(execute(args, System.out, System.err));
    }

    /**
     * Runs one search and returns the process exit code. Only problems detected before the walk
     * starts produce a failure code; warnings met during the walk do not.
     */
    static int execute(String[] args, PrintStream out, PrintStream err) {
        SearchConfig config;
        try {
            config = new ConfigLoader().load(args);
        } catch (UsageException ex) {
            err.println("Error: " + ex.getMessage());
            err.println(ConfigLoader.USAGE);
            return EXIT_FAILURE;
        } catch (IOException ex) {
            err.println("Error: failed to read configuration: " + ex.getMessage());
            return EXIT_FAILURE;
        }
        configureLogging(config.verbose());

        Clock clock = Clock.systemDefaultZone();
        Optional<SearchLog> log = Optional.empty();
        if (config.logFile().isPresent()) {
            try {
                log = Optional.of(SearchLog.open(config.logFile().get(), clock));
            } catch (IOException ex) {
                err.println("Error: cannot open log file " + config.logFile().get() + ": " + ex.getMessage());
                return EXIT_FAILURE;
            }
        }

        try (ResultSink sink = new ResultSink(out, err, log, clock)) {
            new SearchEngine(config, sink).run();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            err.println("Error: search interrupted");
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOGGER.warn("Failed to close session log {}", config.logFile().orElse(null), ex);
        }
        return EXIT_OK;
    }

    private static void configureLogging(boolean verbose) {
        if (!verbose) {
            return;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
