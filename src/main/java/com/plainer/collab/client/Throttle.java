package com.plainer.collab.client;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Emits at most one value per interval. The first value of a quiet period goes out immediately;
 * values arriving inside the interval are coalesced and the latest one is emitted when it ends.
 */
public class Throttle<T> {

    private final long intervalNanos;
    private final ScheduledExecutorService scheduler;
    private final Consumer<T> sink;

    private long lastEmitNanos;
    private boolean emitted;
    private T pending;
    private ScheduledFuture<?> trailing;
    private boolean cancelled;

    public Throttle(Duration interval, ScheduledExecutorService scheduler, Consumer<T> sink) {
        this.intervalNanos = interval.toNanos();
        this.scheduler = scheduler;
        this.sink = sink;
    }

    public void submit(T value) {
        T now = null;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            long elapsed = System.nanoTime() - lastEmitNanos;
            if (!emitted || elapsed >= intervalNanos) {
                if (trailing == null) {
                    emitted = true;
                    lastEmitNanos = System.nanoTime();
                    now = value;
                } else {
                    pending = value;
                }
            } else {
                pending = value;
                if (trailing == null) {
                    trailing = scheduler.schedule(this::flush, intervalNanos - elapsed, TimeUnit.NANOSECONDS);
                }
            }
        }
        if (now != null) {
            sink.accept(now);
        }
    }

    private void flush() {
        T value;
        synchronized (this) {
            trailing = null;
            if (cancelled || pending == null) {
                return;
            }
            value = pending;
            pending = null;
            lastEmitNanos = System.nanoTime();
        }
        sink.accept(value);
    }

    /** Drops any pending value. Later submissions are ignored. */
    public synchronized void cancel() {
        cancelled = true;
        pending = null;
        if (trailing != null) {
            trailing.cancel(false);
            trailing = null;
        }
    }
}
