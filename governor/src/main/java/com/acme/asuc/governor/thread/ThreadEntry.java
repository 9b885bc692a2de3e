package com.acme.asuc.governor.thread;

import com.acme.asuc.governor.system.WorkloadClass;

import java.util.Objects;

/**
 * Registry record for one managed thread. Identity fields are fixed at admission;
 * only the wrapper around the work updates the runtime fields.
 */
public final class ThreadEntry {
    private final String id;
    private final Thread thread;
    private final boolean background;
    private final String componentId;
    private final WorkloadClass workload;
    private final long registeredNanos;
    private volatile long runStartNanos;
    private volatile long runtimeNanos = -1L;

    ThreadEntry(String id,
                Thread thread,
                boolean background,
                String componentId,
                WorkloadClass workload,
                long registeredNanos) {
        this.id = Objects.requireNonNull(id, "id");
        this.thread = Objects.requireNonNull(thread, "thread");
        this.background = background;
        this.componentId = componentId;
        this.workload = workload;
        this.registeredNanos = registeredNanos;
        this.runStartNanos = registeredNanos;
    }

    void markRunning(long nowNanos) {
        runStartNanos = nowNanos;
    }

    void markFinished(long runtime) {
        runtimeNanos = runtime;
    }

    public String id() {
        return id;
    }

    public Thread thread() {
        return thread;
    }

    public boolean background() {
        return background;
    }

    public String componentId() {
        return componentId;
    }

    public WorkloadClass workload() {
        return workload;
    }

    public long registeredNanos() {
        return registeredNanos;
    }

    /** Measured runtime once finished, otherwise the time elapsed since the work began. */
    public long runtimeNanos(long nowNanos) {
        long measured = runtimeNanos;
        return measured >= 0 ? measured : nowNanos - runStartNanos;
    }

    @Override
    public String toString() {
        return "ThreadEntry{id=" + id + ", component=" + componentId + ", background=" + background + '}';
    }
}
