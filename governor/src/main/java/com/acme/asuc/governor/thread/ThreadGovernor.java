package com.acme.asuc.governor.thread;

import com.acme.asuc.governor.AdmissionDecision;
import com.acme.asuc.governor.DenialReason;
import com.acme.asuc.governor.GovernorLimits;
import com.acme.asuc.governor.accounting.AccountantSnapshot;
import com.acme.asuc.governor.accounting.Registration;
import com.acme.asuc.governor.accounting.ResourceAccountant;
import com.acme.asuc.governor.accounting.ResourceKind;
import com.acme.asuc.governor.ratelimit.SlidingWindowRateLimiter;
import com.acme.asuc.governor.security.ComponentBlockList;
import com.acme.asuc.governor.security.SecurityMonitor;
import com.acme.asuc.governor.sweep.Sweepable;
import com.acme.asuc.governor.system.ResourcePressureCheck;
import com.acme.asuc.governor.system.SystemSample;
import com.acme.asuc.governor.system.WorkloadClass;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gatekeeper and registry for managed platform threads.
 *
 * <p>Admission and every registry mutation run under the accountant's coordination
 * lock. A thread is registered before it is started, and its wrapper unregisters it
 * in a {@code finally} path, so the registry never holds a finished thread for longer
 * than it takes the wrapper to exit and never misses a running one.</p>
 *
 * <p>Threads cannot be interrupted: a thread that outlives the timeout is logged and
 * its slot reclaimed by {@link #sweep(long)}, but the work itself keeps running.</p>
 */
public final class ThreadGovernor implements Sweepable {
    private static final Logger LOG = Logger.getLogger(ThreadGovernor.class.getName());
    private static final String THREAD_NAME_PREFIX = "managed_";

    private final GovernorLimits limits;
    private final ResourceAccountant accountant;
    private final ComponentBlockList blockList;
    private final ResourcePressureCheck pressure;
    private final SecurityMonitor monitor;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ThreadSpawner spawner;
    private final LongSupplier nanoClock;
    private final long timeoutNanos;
    private final Map<String, ThreadEntry> registry = new HashMap<>();

    public ThreadGovernor(GovernorLimits limits,
                          ResourceAccountant accountant,
                          ComponentBlockList blockList,
                          ResourcePressureCheck pressure,
                          SecurityMonitor monitor,
                          SlidingWindowRateLimiter rateLimiter,
                          ThreadSpawner spawner,
                          LongSupplier nanoClock) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.accountant = Objects.requireNonNull(accountant, "accountant");
        this.blockList = Objects.requireNonNull(blockList, "blockList");
        this.pressure = Objects.requireNonNull(pressure, "pressure");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.spawner = Objects.requireNonNull(spawner, "spawner");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.timeoutNanos = limits.threadTimeout().toNanos();
    }

    @Override
    public String name() {
        return "threads";
    }

    public boolean canCreate(boolean background, String componentId) {
        return decide(background, componentId, WorkloadClass.STANDARD).admitted();
    }

    public boolean canCreate(boolean background, String componentId, WorkloadClass workload) {
        return decide(background, componentId, workload).admitted();
    }

    /**
     * Runs the admission pipeline: dead-thread cleanup, system pressure, suspicious
     * activity, total/background/per-component ceilings, block list, then the rate limit.
     * A denial is recorded with the security monitor. The rate window is only read here;
     * a creation is counted against it once the thread has actually started.
     */
    public AdmissionDecision decide(boolean background, String componentId, WorkloadClass workload) {
        WorkloadClass work = workload == null ? WorkloadClass.STANDARD : workload;
        return accountant.callLocked(() -> {
            long now = nanoClock.getAsLong();
            sweep(now);

            boolean grace = pressure.inStartupGrace(now);
            if (grace) {
                LOG.fine(() -> "Thread admission during startup grace period for "
                    + (componentId == null ? "unknown" : componentId));
            }
            if (!pressure.allows(componentId, work, registry.size())) {
                if (grace) {
                    LOG.info("Thread creation denied during startup: system under heavy load");
                } else {
                    LOG.warning("Thread creation denied: system resources exhausted");
                }
                return deny(DenialReason.SYSTEM_RESOURCES, now);
            }

            if (monitor.isSuspicious(now)) {
                LOG.warning("Thread creation denied: suspicious activity detected");
                return deny(DenialReason.SUSPICIOUS_ACTIVITY, now);
            }

            int active = accountant.count(ResourceKind.THREAD);
            if (active >= limits.maxTotalThreads()) {
                LOG.warning(() -> "Thread creation denied: reached max total threads (" + limits.maxTotalThreads()
                    + "), registry=" + registry.size()
                    + ", components=" + accountant.snapshot().threadsByComponent());
                return deny(DenialReason.TOTAL_LIMIT, now);
            }
            if (background && accountant.backgroundThreads() >= limits.maxBackgroundThreads()) {
                LOG.warning(() -> "Background thread creation denied: reached max background threads ("
                    + limits.maxBackgroundThreads() + ")");
                return deny(DenialReason.BACKGROUND_LIMIT, now);
            }
            if (componentId != null
                && accountant.countFor(ResourceKind.THREAD, componentId) >= limits.maxThreadsPerComponent()) {
                LOG.warning(() -> "Thread creation denied: component " + componentId + " reached limit ("
                    + limits.maxThreadsPerComponent() + ")");
                return deny(DenialReason.COMPONENT_LIMIT, now);
            }
            if (blockList.isBlocked(componentId)) {
                LOG.warning(() -> "Thread creation denied: component " + componentId + " is blocked");
                return deny(DenialReason.COMPONENT_BLOCKED, now);
            }
            if (!rateLimiter.wouldAllow(componentId, now)) {
                return deny(DenialReason.RATE_LIMITED, now);
            }
            return AdmissionDecision.ADMITTED;
        });
    }

    private AdmissionDecision deny(DenialReason reason, long now) {
        monitor.recordFailure(reason, now);
        return AdmissionDecision.deny(reason);
    }

    public Optional<Thread> createManaged(String id, Runnable work, boolean background, String componentId) {
        return createManaged(id, work, background, componentId, WorkloadClass.STANDARD);
    }

    /**
     * Admits, registers and starts a thread running {@code work}.
     *
     * <p>Failures thrown by {@code work} reach the thread's uncaught-exception handler
     * after the slot has been released.</p>
     *
     * @return the started thread, or empty when admission was denied
     */
    public Optional<Thread> createManaged(String id,
                                          Runnable work,
                                          boolean background,
                                          String componentId,
                                          WorkloadClass workload) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(work, "work");
        return accountant.callLocked(() -> {
            long now = nanoClock.getAsLong();
            if (registry.containsKey(id)) {
                LOG.warning(() -> "Thread creation denied: id " + id + " is already registered");
                monitor.recordFailure(DenialReason.DUPLICATE_ID, now);
                return Optional.empty();
            }
            if (!decide(background, componentId, workload).admitted()) {
                return Optional.empty();
            }

            ThreadEntry entry = null;
            try {
                Thread thread = spawner.newThread(wrap(id, work), THREAD_NAME_PREFIX + id, background);
                thread.setDaemon(background);
                entry = new ThreadEntry(id, thread, background, componentId, workload, now);
                registry.put(id, entry);
                accountant.register(Registration.thread(id, background, componentId));
                monitor.recordCreation(id, background, now);
                int total = registry.size();
                LOG.fine(() -> "Registered thread " + id + " (total: " + total + ")");
                thread.start();
                rateLimiter.record(componentId, now);
                return Optional.of(thread);
            } catch (RuntimeException | OutOfMemoryError e) {
                LOG.log(Level.SEVERE, "Failed to create thread " + id, e);
                if (entry != null) {
                    unregister(id);
                }
                monitor.recordFailure(DenialReason.CREATION_ERROR, now);
                return Optional.empty();
            }
        });
    }

    private Runnable wrap(String id, Runnable work) {
        return () -> {
            ThreadEntry self = accountant.callLocked(() -> {
                ThreadEntry e = registry.get(id);
                return e != null && e.thread() == Thread.currentThread() ? e : null;
            });
            long began = nanoClock.getAsLong();
            if (self != null) {
                self.markRunning(began);
            }
            try {
                observeMemory(id);
                work.run();
                LOG.fine(() -> "Thread " + id + " completed successfully");
            } catch (RuntimeException | Error e) {
                LOG.log(Level.SEVERE, "Thread " + id + " failed", e);
                throw e;
            } finally {
                long runtime = nanoClock.getAsLong() - began;
                LOG.fine(() -> "Thread " + id + " runtime: " + runtime / 1_000_000L + "ms");
                if (self != null) {
                    self.markFinished(runtime);
                    unregister(self);
                }
            }
        };
    }

    private void observeMemory(String id) {
        try {
            long usedMb = pressure.sampler().processMemoryMb();
            if (usedMb > limits.maxThreadMemoryMb()) {
                LOG.warning(() -> "Thread " + id + " started with high process memory: " + usedMb + "MB");
            }
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Memory observation failed for thread " + id, e);
        }
    }

    /**
     * Removes the registry entry for {@code id}.
     *
     * @return {@code false} if nothing was registered under {@code id}
     */
    public boolean unregister(String id) {
        if (id == null) {
            return false;
        }
        return accountant.callLocked(() -> {
            ThreadEntry entry = registry.get(id);
            return entry != null && unregister(entry);
        });
    }

    // Only removes the exact entry, so a stale wrapper cannot evict a newer thread that reused the id.
    private boolean unregister(ThreadEntry entry) {
        return accountant.callLocked(() -> {
            if (!registry.remove(entry.id(), entry)) {
                return false;
            }
            accountant.unregister(ResourceKind.THREAD, entry.id());
            long now = nanoClock.getAsLong();
            long runtime = entry.runtimeNanos(now);
            if (runtime > timeoutNanos) {
                LOG.warning(() -> "Thread " + entry.id() + " ran for " + seconds(runtime)
                    + "s (timeout: " + limits.threadTimeout().toSeconds() + "s)");
            }
            int total = registry.size();
            LOG.fine(() -> "Unregistered thread " + entry.id() + " (total: " + total + ")");
            return true;
        });
    }

    /**
     * Reclaims threads that are no longer alive and threads that exceeded the timeout.
     * Timed-out threads keep running; only their slot is released.
     */
    @Override
    public int sweep(long nowNanos) {
        return accountant.callLocked(() -> {
            List<ThreadEntry> reclaim = new ArrayList<>();
            for (ThreadEntry entry : registry.values()) {
                if (!entry.thread().isAlive()) {
                    reclaim.add(entry);
                    continue;
                }
                long runtime = nowNanos - entry.registeredNanos();
                if (runtime > timeoutNanos) {
                    LOG.warning(() -> "Thread " + entry.id() + " timed out after " + seconds(runtime)
                        + "s; it cannot be interrupted and should be stopped by its owner");
                    reclaim.add(entry);
                }
            }
            int reclaimed = 0;
            for (ThreadEntry entry : reclaim) {
                if (unregister(entry)) {
                    reclaimed++;
                }
            }
            if (reclaimed > 0) {
                int count = reclaimed;
                LOG.fine(() -> "Cleaned up " + count + " dead threads");
            }
            return reclaimed;
        });
    }

    public void blockComponent(String componentId, String reason) {
        blockList.block(componentId, reason);
    }

    public void unblockComponent(String componentId) {
        blockList.unblock(componentId);
    }

    /**
     * Blocks every component that currently owns a thread or timer, then reclaims dead
     * or timed-out threads. Running threads are not stopped.
     */
    public void emergencyShutdown() {
        LOG.severe("Emergency thread shutdown initiated");
        accountant.runLocked(() -> {
            Set<String> components = accountant.activeComponents();
            blockList.blockAll(components, "emergency shutdown");
            sweep(nanoClock.getAsLong());
            int remaining = registry.size();
            LOG.severe(() -> "Emergency shutdown complete. Remaining threads: " + remaining);
        });
    }

    public boolean isRegistered(String id) {
        return accountant.callLocked(() -> registry.containsKey(id));
    }

    public int activeCount() {
        return accountant.callLocked(registry::size);
    }

    public ThreadStats stats() {
        SystemSample sample = pressure.sample();
        return accountant.callLocked(() -> {
            AccountantSnapshot snapshot = accountant.snapshot();
            return new ThreadStats(
                snapshot.totalThreads(),
                snapshot.backgroundThreads(),
                snapshot.foregroundThreads(),
                snapshot.threadsByComponent(),
                registry.size(),
                limits.maxTotalThreads(),
                limits.maxBackgroundThreads(),
                limits.maxThreadsPerComponent(),
                blockList.blockedComponents(),
                monitor.isSuspicious(nanoClock.getAsLong()),
                monitor.failureCount(),
                monitor.failuresByReason(),
                rateLimiter.rejectedCount(),
                sample.cpuPercent(),
                sample.memoryPercent()
            );
        });
    }

    private static String seconds(long nanos) {
        return String.format("%.1f", nanos / 1_000_000_000.0d);
    }
}
