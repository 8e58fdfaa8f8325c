package com.example.filefinder;

import java.nio.file.Path;
import java.time.Instant;

public record MatchEvent(
        Path path,
        Instant timestamp,
        int worker
) {
}
