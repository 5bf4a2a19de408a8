package com.vfxport;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Application log for the editor. Every line goes to the log file and, unless
 * disabled, to the console as {@code [2024-05-01 12:00:00] [INFO] message}.
 * The most recent events are also kept in memory so the status panel can
 * show what the last edits, ports and saves reported.
 */
public class AppLogger {

    public static final int DEFAULT_RECENT_LIMIT = 200;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean debugEnabled;
    private final int recentLimit;
    private final Deque<LogEvent> recent = new ArrayDeque<>();

    AppLogger(OutputStream fileStream, PrintStream consoleOutput, boolean debugEnabled, int recentLimit) {
        this.fileOutput = new PrintStream(fileStream, true, StandardCharsets.UTF_8);
        this.consoleOutput = consoleOutput;
        this.debugEnabled = debugEnabled;
        this.recentLimit = Math.max(1, recentLimit);
    }

    public static synchronized void initialize(Path logFile, boolean devMode) throws IOException {
        if (instance != null) {
            return;
        }
        AppLogger logger = new AppLogger(new FileOutputStream(logFile.toFile(), true), System.out,
            devMode, DEFAULT_RECENT_LIMIT);
        logger.fileOutput.println();
        logger.fileOutput.println("=== VFX Port started " + LocalDateTime.now().format(TIME_FORMAT) + " ===");
        instance = logger;
    }

    /** May be null when the logger was never initialized (unit tests). */
    public static AppLogger get() {
        return instance;
    }

    public void debug(String message) {
        if (debugEnabled) {
            log("DEBUG", message);
        }
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        synchronized (this) {
            t.printStackTrace(fileOutput);
            if (consoleOutput != null) {
                t.printStackTrace(consoleOutput);
            }
        }
    }

    /** Startup banner lines; written as-is and not kept as events. */
    public synchronized void console(String message) {
        if (consoleOutput != null) {
            consoleOutput.println(message);
        }
        fileOutput.println(message);
    }

    /**
     * Newest-last copy of the retained events. At most {@code limit} are
     * returned; a non-positive limit returns all of them.
     */
    public synchronized List<LogEvent> recent(int limit) {
        List<LogEvent> all = new ArrayList<>(recent);
        if (limit <= 0 || limit >= all.size()) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - limit, all.size()));
    }

    public synchronized void close() {
        fileOutput.close();
    }

    private synchronized void log(String level, String message) {
        LocalDateTime now = LocalDateTime.now();
        String line = String.format("[%s] [%s] %s", now.format(TIME_FORMAT), level, message);
        fileOutput.println(line);
        if (consoleOutput != null) {
            consoleOutput.println(line);
        }
        if (recent.size() == recentLimit) {
            recent.removeFirst();
        }
        recent.addLast(new LogEvent(now.format(TIME_FORMAT), level, message));
    }

    public static class LogEvent {
        private final String timestamp;
        private final String level;
        private final String message;

        public LogEvent(String timestamp, String level, String message) {
            this.timestamp = timestamp;
            this.level = level;
            this.message = message;
        }

        public String getTimestamp() {
            return timestamp;
        }

        public String getLevel() {
            return level;
        }

        public String getMessage() {
            return message;
        }
    }
}
