package com.example.filefinder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link SearchConfig} from the command line and an optional JSON file.
 * Values given on the command line take precedence over the file.
 */
public class ConfigLoader {
    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: file-finder <start_path> <pattern> [num_threads] [options]",
            "",
            "  pattern          supports '*' and '?' (e.g. *.txt, data_??.csv), case-insensitive;",
            "                   without wildcards it matches any name containing it",
            "  num_threads      worker count, defaults to the number of available processors;",
            "                   values below 1 run a single worker",
            "",
            "Options:",
            "  --log <file>     append a session log to <file>",
            "  --config <file>  read defaults from a JSON file",
            "  --follow-links   expand symbolic links to directories",
            "  --exact          match wildcard-free patterns against the whole name",
            "  -v, --verbose    debug logging on stderr");

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SearchConfig load(String... args) throws IOException {
        List<String> positional = new ArrayList<>();
        String logFile = null;
        String configFile = null;
        Boolean followLinks = null;
        Boolean exact = null;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--log" -> logFile = requireValue(args, ++i, arg);
                case "--config" -> configFile = requireValue(args, ++i, arg);
                case "--follow-links" -> followLinks = Boolean.TRUE;
                case "--exact" -> exact = Boolean.TRUE;
                case "-v", "--verbose" -> verbose = true;
                default -> {
                    if (isOption(arg)) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.size() < 2 || positional.size() > 3) {
            throw new UsageException("Expected <start_path> <pattern> [num_threads]");
        }

        RawConfig raw = configFile == null ? new RawConfig() : readRaw(Path.of(configFile));

        Path startPath = Path.of(positional.get(0));
        if (!Files.exists(startPath)) {
            throw new UsageException("Start path does not exist: " + startPath);
        }
        String pattern = positional.get(1);

        int threadCount;
        if (positional.size() == 3) {
            threadCount = parseThreadCount(positional.get(2));
        } else if (raw.threadCount != null) {
            threadCount = Math.max(1, raw.threadCount);
        } else {
            threadCount = Math.max(1, Runtime.getRuntime().availableProcessors());
        }

        Optional<Path> log = Optional.ofNullable(logFile)
                .or(() -> Optional.ofNullable(raw.logFile).filter(value -> !value.isBlank()))
                .map(Path::of);
        boolean follow = followLinks != null ? followLinks : raw.followLinks != null && raw.followLinks;
        boolean substringFallback = exact != null ? !exact : raw.substringFallback == null || raw.substringFallback;
        List<String> excludes = raw.excludeDirectoryPatterns == null
                ? List.of()
                : raw.excludeDirectoryPatterns.stream().filter(value -> value != null && !value.isBlank()).toList();

        return new SearchConfig(startPath, pattern, threadCount, log, follow, substringFallback, excludes, verbose);
    }

    private RawConfig readRaw(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new UsageException("Config file does not exist: " + path);
        }
        try {
            RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
            if (raw == null) {
                throw new UsageException("Invalid config file " + path + ": empty document");
            }
            return raw;
        } catch (JsonProcessingException ex) {
            throw new UsageException("Invalid config file " + path + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException("Missing value for " + option);
        }
        return args[index];
    }

    /**
     * Zero and negative counts run with a single worker.
     */
    private static int parseThreadCount(String value) {
        try {
            return Math.max(1, Integer.parseInt(value));
        } catch (NumberFormatException ex) {
            throw new UsageException("num_threads must be an integer: " + value, ex);
        }
    }

    // A lone "-" or a negative number is a positional argument.
    private static boolean isOption(String arg) {
        return arg.startsWith("-") && arg.length() > 1 && !arg.matches("-\\d+");
    }

    private static class RawConfig {
        public Integer threadCount;
        public String logFile;
        public Boolean followLinks;
        public Boolean substringFallback;
        public List<String> excludeDirectoryPatterns;
    }
}
