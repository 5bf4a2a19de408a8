package com.vfxport.mutations;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Progress and cooperative cancellation for bulk ports. The port loop checks
 * {@link #isCancelled()} between items; items finished before the cancel
 * stay in place.
 */
public class BulkPortMonitor {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile int done;
    private volatile int total;
    private volatile String current;
    private volatile boolean running;

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void start(int total) {
        this.total = total;
        this.done = 0;
        this.current = null;
        this.running = true;
    }

    void advance(String item) {
        this.current = item;
        this.done++;
        Thread.yield();
    }

    void finish() {
        this.running = false;
    }

    public int getDone() { return done; }
    public int getTotal() { return total; }
    public String getCurrent() { return current; }
    public boolean isRunning() { return running; }
}
