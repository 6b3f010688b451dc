package com.modelcache.agent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Appends messages to files under a log directory, one entry per call:
 * <pre>
 * 2024-05-02T10:15:30+02:00 DEBUG (7): message
 * </pre>
 */
public class FileLogSink implements LogSink {

    static final String DEFAULT_FILE = "system.log";

    private final Path logDir;
    private final Clock clock;

    public FileLogSink(Path logDir) {
        this(logDir, Clock.systemDefaultZone());
    }

    FileLogSink(Path logDir, Clock clock) {
        this.logDir = logDir;
        this.clock = clock;
    }

    @Override
    public void append(String file, String message) {
        Path target = resolve(file);
        String timestamp = OffsetDateTime.now(clock)
            .truncatedTo(ChronoUnit.SECONDS)
            .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        String entry = timestamp + " DEBUG (7): " + message + "\n";
        try {
            Files.createDirectories(target.getParent() != null ? target.getParent() : Path.of("."));
            Files.writeString(target, entry, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new LogWriteException("Failed to append to " + target + ": " + e.getMessage(), e);
        }
    }

    Path resolve(String file) {
        return logDir.resolve(file == null || file.isBlank() ? DEFAULT_FILE : file.trim());
    }

    public static class LogWriteException extends RuntimeException {
        public LogWriteException(String message, Throwable cause) { super(message, cause); }
    }
}
