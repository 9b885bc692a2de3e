package com.acme.asuc.governor;

import com.acme.asuc.governor.system.WorkloadClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Governor view bound to one component. Closing the scope cancels every timer the
 * component still owns, so a torn-down widget leaves no callbacks behind.
 *
 * <pre>{@code
 * try (ComponentScope scope = governor.componentScope("feed_panel")) {
 *     scope.delayedCallback(500, this::refresh);
 * }
 * }</pre>
 */
public final class ComponentScope implements AutoCloseable {
    private final ConcurrencyGovernor governor;
    private final String componentId;

    ComponentScope(ConcurrencyGovernor governor, String componentId) {
        this.governor = Objects.requireNonNull(governor, "governor");
        this.componentId = Objects.requireNonNull(componentId, "componentId");
    }

    public String componentId() {
        return componentId;
    }

    public Optional<Thread> createThread(String id, Runnable work, boolean background) {
        return governor.createManagedThread(id, work, background, componentId);
    }

    public Optional<Thread> createThread(String id, Runnable work, boolean background, WorkloadClass workload) {
        return governor.createManagedThread(id, work, background, componentId, workload);
    }

    public Optional<String> createTimer(long delayMillis, Runnable callback, long timeoutMillis, boolean repeat) {
        return governor.createTimer(delayMillis, callback, componentId, timeoutMillis, repeat);
    }

    public Optional<String> delayedCallback(long delayMillis, Runnable callback) {
        return governor.delayedCallback(delayMillis, callback, componentId);
    }

    public Optional<String> repeatingTimer(long intervalMillis, Runnable callback, long maxLifetimeMillis) {
        return governor.repeatingTimer(intervalMillis, callback, componentId, maxLifetimeMillis);
    }

    public int activeTimers() {
        return governor.activeTimerCount(componentId);
    }

    @Override
    public void close() {
        governor.cancelComponentTimers(componentId);
    }
}
