package com.vfxport.session;

import com.vfxport.AppLogger;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Debounced save after a burst of edits. Each request replaces the pending
 * one; when the delay elapses the save only proceeds if the session is still
 * at the version captured when the request was made.
 */
public class BackgroundSaveScheduler {

    private final SaveService saveService;
    private final long delayMs;
    private final ScheduledExecutorService executor;
    private final AppLogger logger = AppLogger.get();
    private ScheduledFuture<?> pending;
    private volatile long lastRunAt = 0L;
    private volatile SaveOutcome lastOutcome = null;

    public BackgroundSaveScheduler(SaveService saveService, long delayMs) {
        this.saveService = Objects.requireNonNull(saveService, "saveService");
        this.delayMs = delayMs >= 0 ? delayMs : 500L;
        this.executor = Executors.newSingleThreadScheduledExecutor(saveThreadFactory());
    }

    public synchronized void schedule(EditSession session) {
        cancelPending();
        long captured = session.getVersion();
        pending = executor.schedule(() -> runOnce(session, captured), delayMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public void stop() {
        executor.shutdownNow();
    }

    void runOnce(EditSession session, long capturedVersion) {
        try {
            SaveOutcome outcome = saveService.saveIfCurrent(session, capturedVersion);
            lastRunAt = System.currentTimeMillis();
            lastOutcome = outcome;
            if (outcome.isSuperseded()) {
                log("Skipped background save: version " + capturedVersion + " superseded");
            } else if (!outcome.isSuccess()) {
                logWarning("Background save failed: " + outcome.getMessage());
            }
        } catch (Exception e) {
            logWarning("Background save failed: " + e.getMessage());
        }
    }

    public BackgroundSaveStatus getStatus() {
        BackgroundSaveStatus status = new BackgroundSaveStatus();
        status.delayMs = delayMs;
        status.lastRunAt = lastRunAt;
        status.lastOutcome = lastOutcome;
        return status;
    }

    private ThreadFactory saveThreadFactory() {
        return r -> {
            Thread t = new Thread(r, "background-save-runner");
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[BackgroundSaveScheduler] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[BackgroundSaveScheduler] " + message);
        }
    }

    public static class BackgroundSaveStatus {
        public long delayMs;
        public long lastRunAt;
        public SaveOutcome lastOutcome;
    }
}
