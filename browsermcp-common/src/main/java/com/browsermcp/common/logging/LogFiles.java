package com.browsermcp.common.logging;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Per-process diagnostic log file location.
 *
 * <p>{@link #install()} must run before the first logger is created: {@code logback.xml}
 * reads the {@value #LOG_FILE_PROPERTY} system property to place its file appender.
 */
public final class LogFiles {

    public static final String LOG_FILE_PROPERTY = "browsermcp.log.file";

    private LogFiles() {
    }

    public static Path install() {
        String existing = System.getProperty(LOG_FILE_PROPERTY);
        if (existing != null && !existing.isBlank()) {
            return Path.of(existing);
        }
        Path path = defaultPath(Path.of(System.getProperty("java.io.tmpdir")),
                Instant.now(), ProcessHandle.current().pid());
        System.setProperty(LOG_FILE_PROPERTY, path.toString());
        return path;
    }

    public static Path current() {
        String value = System.getProperty(LOG_FILE_PROPERTY);
        return value != null ? Path.of(value) : null;
    }

    public static String describeCurrent() {
        Path path = current();
        return path != null ? path.toString() : "<stderr only>";
    }

    static Path defaultPath(Path tmpDir, Instant startedAt, long pid) {
        String stamp = startedAt.toString().replaceAll("[:.]", "-");
        return tmpDir.resolve("browsermcp-" + stamp + "-" + pid + ".log");
    }
}
