package com.acme.asuc.governor.accounting;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Single source of truth for live resource counts.
 *
 * <p>Every counter and every registration is mutated under one reentrant
 * coordination lock. Governors take the same lock (see {@link #callLocked(Supplier)})
 * when an admission needs read-check-write atomicity across several calls.</p>
 *
 * <p>{@link #register(Registration)} and {@link #unregister(ResourceKind, String)} are
 * idempotent so that the wrapper of a finishing resource and the sweeper can both
 * attempt cleanup without double-counting.</p>
 */
public final class ResourceAccountant {
    private static final Logger LOG = Logger.getLogger(ResourceAccountant.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ResourceKind, Map<String, Registration>> registrations = new EnumMap<>(ResourceKind.class);
    private final Map<ResourceKind, Map<String, Integer>> byComponent = new EnumMap<>(ResourceKind.class);
    private int backgroundThreads;

    public ResourceAccountant() {
        for (ResourceKind kind : ResourceKind.values()) {
            registrations.put(kind, new HashMap<>());
            byComponent.put(kind, new HashMap<>());
        }
    }

    /**
     * Records a live resource.
     *
     * @return {@code false} if a resource of the same kind and id is already registered
     */
    public boolean register(Registration registration) {
        Objects.requireNonNull(registration, "registration");
        lock.lock();
        try {
            Map<String, Registration> live = registrations.get(registration.kind());
            if (live.putIfAbsent(registration.id(), registration) != null) {
                return false;
            }
            if (registration.kind() == ResourceKind.THREAD && registration.background()) {
                backgroundThreads++;
            }
            if (registration.componentId() != null) {
                byComponent.get(registration.kind()).merge(registration.componentId(), 1, Integer::sum);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a live resource and decrements its counters.
     *
     * @return {@code false} if the resource was not (or no longer) registered
     */
    public boolean unregister(ResourceKind kind, String id) {
        Objects.requireNonNull(kind, "kind");
        if (id == null) {
            return false;
        }
        lock.lock();
        try {
            Registration removed = registrations.get(kind).remove(id);
            if (removed == null) {
                return false;
            }
            if (kind == ResourceKind.THREAD && removed.background()) {
                backgroundThreads--;
            }
            String componentId = removed.componentId();
            if (componentId != null) {
                byComponent.get(kind).computeIfPresent(componentId, (k, v) -> v > 1 ? v - 1 : null);
            }
            if (backgroundThreads < 0) {
                LOG.severe("background thread counter went negative; resetting");
                backgroundThreads = 0;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(ResourceKind kind, String id) {
        lock.lock();
        try {
            return registrations.get(kind).containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public int count(ResourceKind kind) {
        lock.lock();
        try {
            return registrations.get(kind).size();
        } finally {
            lock.unlock();
        }
    }

    public int backgroundThreads() {
        lock.lock();
        try {
            return backgroundThreads;
        } finally {
            lock.unlock();
        }
    }

    public int countFor(ResourceKind kind, String componentId) {
        if (componentId == null) {
            return 0;
        }
        lock.lock();
        try {
            return byComponent.get(kind).getOrDefault(componentId, 0);
        } finally {
            lock.unlock();
        }
    }

    /** Components that currently own at least one live resource of any kind. */
    public Set<String> activeComponents() {
        lock.lock();
        try {
            Set<String> out = new LinkedHashSet<>();
            for (Map<String, Integer> counts : byComponent.values()) {
                out.addAll(counts.keySet());
            }
            return Set.copyOf(out);
        } finally {
            lock.unlock();
        }
    }

    public AccountantSnapshot snapshot() {
        lock.lock();
        try {
            return new AccountantSnapshot(
                registrations.get(ResourceKind.THREAD).size(),
                backgroundThreads,
                byComponent.get(ResourceKind.THREAD),
                registrations.get(ResourceKind.TIMER).size(),
                byComponent.get(ResourceKind.TIMER)
            );
        } finally {
            lock.unlock();
        }
    }

    /** Runs {@code action} while holding the coordination lock. */
    public <T> T callLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
