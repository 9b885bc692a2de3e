package com.acme.asuc.governor;

import com.acme.asuc.governor.accounting.ResourceAccountant;
import com.acme.asuc.governor.ratelimit.SlidingWindowRateLimiter;
import com.acme.asuc.governor.security.ComponentBlockList;
import com.acme.asuc.governor.security.SecurityMonitor;
import com.acme.asuc.governor.sweep.CleanupSweeper;
import com.acme.asuc.governor.system.JvmSystemSampler;
import com.acme.asuc.governor.system.ResourcePressureCheck;
import com.acme.asuc.governor.system.SystemSampler;
import com.acme.asuc.governor.system.WorkloadClass;
import com.acme.asuc.governor.telemetry.PeriodicStatsReporter;
import com.acme.asuc.governor.thread.ManagedPools;
import com.acme.asuc.governor.thread.NettyThreadSpawner;
import com.acme.asuc.governor.thread.ThreadGovernor;
import com.acme.asuc.governor.thread.ThreadSpawner;
import com.acme.asuc.governor.timer.EventExecutorTimerScheduler;
import com.acme.asuc.governor.timer.TimerGovernor;
import com.acme.asuc.governor.timer.TimerScheduler;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Process-wide authority for managed threads and timers.
 *
 * <p>Built once at startup and handed to every component that creates concurrent
 * work. All state lives in this instance; two governors never share counters.
 * Admission denial is reported as an empty {@link Optional}, never as an exception.</p>
 */
public final class ConcurrencyGovernor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ConcurrencyGovernor.class.getName());

    private final GovernorLimits limits;
    private final ComponentBlockList blockList;
    private final SecurityMonitor threadMonitor;
    private final SecurityMonitor timerMonitor;
    private final ThreadGovernor threads;
    private final TimerGovernor timers;
    private final ManagedPools pools;
    private final CleanupSweeper sweeper;
    private final TimerScheduler defaultScheduler;
    private final EventExecutorTimerScheduler ownedScheduler;
    private final PeriodicStatsReporter statsReporter;
    private final LongSupplier nanoClock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ConcurrencyGovernor(Builder b) {
        this.limits = b.limits;
        this.nanoClock = b.nanoClock;
        ResourceAccountant accountant = new ResourceAccountant();
        this.blockList = new ComponentBlockList();
        this.threadMonitor = new SecurityMonitor("thread", limits.threadSecurity());
        this.timerMonitor = new SecurityMonitor("timer", limits.timerSecurity());
        this.threads = new ThreadGovernor(
            limits,
            accountant,
            blockList,
            new ResourcePressureCheck(limits.pressure(), b.sampler, nanoClock),
            threadMonitor,
            new SlidingWindowRateLimiter("thread", limits.threadRateLimit()),
            b.spawner,
            nanoClock);
        this.timers = new TimerGovernor(
            limits,
            accountant,
            blockList,
            timerMonitor,
            new SlidingWindowRateLimiter("timer", limits.timerRateLimit()),
            nanoClock);
        this.pools = new ManagedPools(limits.maxConcurrentOperations());
        if (b.scheduler != null) {
            this.defaultScheduler = b.scheduler;
            this.ownedScheduler = null;
        } else {
            this.ownedScheduler = EventExecutorTimerScheduler.create("governor-timers");
            this.defaultScheduler = ownedScheduler;
        }
        this.sweeper = new CleanupSweeper(List.of(threads, timers), limits.cleanupInterval(), nanoClock);
        if (b.backgroundSweep) {
            sweeper.start();
        }
        long statsInterval = limits.statsLogInterval().toSeconds();
        if (statsInterval > 0) {
            this.statsReporter = new PeriodicStatsReporter(this::getStats, statsInterval);
            statsReporter.start();
        } else {
            this.statsReporter = null;
        }
        LOG.fine(() -> "Concurrency governor started: maxThreads=" + limits.maxTotalThreads()
            + ", maxTimers=" + limits.maxTotalTimers());
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Governor with limits from {@code GOVERNOR_*} environment variables and the default adapters. */
    public static ConcurrencyGovernor fromEnv() {
        return builder().limits(GovernorLimits.fromEnv()).build();
    }

    // ---- threads ----

    public Optional<Thread> createManagedThread(String id, Runnable work, boolean background, String componentId) {
        return createManagedThread(id, work, background, componentId, WorkloadClass.STANDARD);
    }

    public Optional<Thread> createManagedThread(String id,
                                                Runnable work,
                                                boolean background,
                                                String componentId,
                                                WorkloadClass workload) {
        if (closed.get()) {
            rejectClosed(threadMonitor, "thread " + id);
            return Optional.empty();
        }
        return threads.createManaged(id, work, background, componentId, workload);
    }

    public boolean canCreateThread(boolean background, String componentId) {
        return !closed.get() && threads.canCreate(background, componentId);
    }

    public boolean unregisterThread(String id) {
        return threads.unregister(id);
    }

    // ---- timers ----

    public Optional<String> createTimer(TimerScheduler scheduler,
                                        long delayMillis,
                                        Runnable callback,
                                        String componentId,
                                        long timeoutMillis,
                                        boolean repeat) {
        if (closed.get()) {
            rejectClosed(timerMonitor, "timer for " + componentId);
            return Optional.empty();
        }
        return timers.create(scheduler, delayMillis, callback, componentId, timeoutMillis, repeat);
    }

    /** Creates a timer on the governor's default scheduler. */
    public Optional<String> createTimer(long delayMillis,
                                        Runnable callback,
                                        String componentId,
                                        long timeoutMillis,
                                        boolean repeat) {
        return createTimer(defaultScheduler, delayMillis, callback, componentId, timeoutMillis, repeat);
    }

    public Optional<String> delayedCallback(long delayMillis, Runnable callback, String componentId) {
        return createTimer(delayMillis, callback, componentId, 0L, false);
    }

    public Optional<String> repeatingTimer(long intervalMillis, Runnable callback, String componentId, long maxLifetimeMillis) {
        return createTimer(intervalMillis, callback, componentId, maxLifetimeMillis, true);
    }

    public Optional<String> autosaveTimer(Runnable saveCallback, String componentId) {
        if (closed.get()) {
            rejectClosed(timerMonitor, "autosave timer for " + componentId);
            return Optional.empty();
        }
        return timers.autosaveTimer(defaultScheduler, saveCallback, componentId);
    }

    public boolean cancelTimer(String timerId) {
        return timers.cancel(timerId);
    }

    public int cancelComponentTimers(String componentId) {
        return timers.cancelForComponent(componentId);
    }

    public int cancelAllTimers() {
        return timers.cancelAll();
    }

    public int activeTimerCount() {
        return timers.activeCount();
    }

    public int activeTimerCount(String componentId) {
        return timers.activeCount(componentId);
    }

    // ---- administration ----

    public GovernorStats getStats() {
        return GovernorStats.of(threads.stats(), timers.stats());
    }

    /** Refuses further threads and timers for {@code componentId} until unblocked. */
    public void blockComponent(String componentId, String reason) {
        blockList.block(componentId, reason);
    }

    public void unblockComponent(String componentId) {
        blockList.unblock(componentId);
    }

    public boolean isBlocked(String componentId) {
        return blockList.isBlocked(componentId);
    }

    /**
     * Blocks every component that owns a thread or timer, reclaims dead threads and
     * cancels every timer.
     * Threads already running keep running.
     */
    public void emergencyShutdown() {
        threads.emergencyShutdown();
        timers.emergencyCleanup();
    }

    /** Runs a cleanup pass over both registries now. */
    public int sweep() {
        return sweeper.sweepNow();
    }

    public ComponentScope componentScope(String componentId) {
        return new ComponentScope(this, componentId);
    }

    public ManagedPools pools() {
        return pools;
    }

    public ThreadGovernor threads() {
        return threads;
    }

    public TimerGovernor timers() {
        return timers;
    }

    public TimerScheduler defaultScheduler() {
        return defaultScheduler;
    }

    public GovernorLimits limits() {
        return limits;
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void rejectClosed(SecurityMonitor monitor, String what) {
        LOG.warning(() -> "Creation of " + what + " denied: governor is shut down");
        monitor.recordFailure(DenialReason.SHUT_DOWN, nanoClock.getAsLong());
    }

    /**
     * Stops the background sweeper and reporter, cancels all timers and shuts the
     * worker pools down. Managed threads that are still running are left alone.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (statsReporter != null) {
            try {
                statsReporter.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: statsReporter stop failed: " + e.getClass().getSimpleName());
            }
        }
        try {
            sweeper.close();
        } catch (Exception e) {
            LOG.fine("Shutdown: sweeper stop failed: " + e.getClass().getSimpleName());
        }
        try {
            int cancelled = timers.cancelAll();
            LOG.fine(() -> "Shutdown: cancelled " + cancelled + " timers");
        } catch (Exception e) {
            LOG.fine("Shutdown: timer cancellation failed: " + e.getClass().getSimpleName());
        }
        try {
            pools.close();
        } catch (Exception e) {
            LOG.fine("Shutdown: pools stop failed: " + e.getClass().getSimpleName());
        }
        if (ownedScheduler != null) {
            try {
                ownedScheduler.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: scheduler stop failed: " + e.getClass().getSimpleName());
            }
        }
    }

    public static final class Builder {
        private GovernorLimits limits = GovernorLimits.defaults();
        private SystemSampler sampler;
        private ThreadSpawner spawner;
        private TimerScheduler scheduler;
        private LongSupplier nanoClock = System::nanoTime;
        private boolean backgroundSweep = true;

        private Builder() {
        }

        public Builder limits(GovernorLimits value) {
            this.limits = Objects.requireNonNull(value, "limits");
            return this;
        }

        public Builder sampler(SystemSampler value) {
            this.sampler = value;
            return this;
        }

        public Builder spawner(ThreadSpawner value) {
            this.spawner = value;
            return this;
        }

        /** Default scheduler for timer calls that do not pass one; the governor does not close it. */
        public Builder scheduler(TimerScheduler value) {
            this.scheduler = value;
            return this;
        }

        public Builder nanoClock(LongSupplier value) {
            this.nanoClock = Objects.requireNonNull(value, "nanoClock");
            return this;
        }

        public Builder backgroundSweep(boolean value) {
            this.backgroundSweep = value;
            return this;
        }

        public ConcurrencyGovernor build() {
            if (sampler == null) {
                sampler = new JvmSystemSampler();
            }
            if (spawner == null) {
                spawner = new NettyThreadSpawner();
            }
            return new ConcurrencyGovernor(this);
        }
    }
}
