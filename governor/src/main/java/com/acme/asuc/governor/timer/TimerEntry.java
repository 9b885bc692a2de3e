package com.acme.asuc.governor.timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Registry record for one managed timer: the "fire" handle for the real callback and
 * the guard handle that force-reclaims the timer once its lifetime runs out.
 */
public final class TimerEntry {
    private final String id;
    private final String componentId;
    private final TimerScheduler scheduler;
    private final Runnable callback;
    private final long delayMillis;
    private final boolean repeat;
    private final long creationNanos;
    private final long timeoutMillis;
    private volatile ScheduledCallback fireHandle;
    private volatile ScheduledCallback guardHandle;

    TimerEntry(String id,
               String componentId,
               TimerScheduler scheduler,
               Runnable callback,
               long delayMillis,
               boolean repeat,
               long creationNanos,
               long timeoutMillis) {
        this.id = Objects.requireNonNull(id, "id");
        this.componentId = componentId;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.delayMillis = delayMillis;
        this.repeat = repeat;
        this.creationNanos = creationNanos;
        this.timeoutMillis = timeoutMillis;
    }

    void fireHandle(ScheduledCallback handle) {
        this.fireHandle = handle;
    }

    void guardHandle(ScheduledCallback handle) {
        this.guardHandle = handle;
    }

    Runnable callback() {
        return callback;
    }

    public String id() {
        return id;
    }

    public String componentId() {
        return componentId;
    }

    public TimerScheduler scheduler() {
        return scheduler;
    }

    public ScheduledCallback fireHandle() {
        return fireHandle;
    }

    public ScheduledCallback guardHandle() {
        return guardHandle;
    }

    public long delayMillis() {
        return delayMillis;
    }

    public boolean repeat() {
        return repeat;
    }

    public long creationNanos() {
        return creationNanos;
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }

    boolean expired(long nowNanos) {
        return nowNanos - creationNanos >= TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    }

    @Override
    public String toString() {
        return "TimerEntry{id=" + id + ", component=" + componentId + ", delayMs=" + delayMillis + ", repeat=" + repeat + '}';
    }
}
