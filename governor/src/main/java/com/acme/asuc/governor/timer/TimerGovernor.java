package com.acme.asuc.governor.timer;

import com.acme.asuc.governor.AdmissionDecision;
import com.acme.asuc.governor.Clearable;
import com.acme.asuc.governor.DenialReason;
import com.acme.asuc.governor.GovernorLimits;
import com.acme.asuc.governor.accounting.Registration;
import com.acme.asuc.governor.accounting.ResourceAccountant;
import com.acme.asuc.governor.accounting.ResourceKind;
import com.acme.asuc.governor.ratelimit.SlidingWindowRateLimiter;
import com.acme.asuc.governor.security.ComponentBlockList;
import com.acme.asuc.governor.security.SecurityMonitor;
import com.acme.asuc.governor.sweep.Sweepable;
import com.acme.asuc.governor.util.GovernorDefaults;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gatekeeper and registry for callbacks hosted by a cooperative {@link TimerScheduler}.
 *
 * <p>Every timer is scheduled twice: the real callback after {@code delay} and a guard
 * after {@code timeout}. Whichever runs first decides the outcome. A one-shot timer
 * unregisters right after its callback and cancels the guard; a guard that runs first
 * cancels the fire handle and reclaims the entry. Repeating timers reschedule
 * themselves until they are cancelled or their guard fires.</p>
 *
 * <p>Registry mutations take the accountant's reentrant lock, so a callback may
 * create or cancel timers from inside the scheduler thread.</p>
 */
public final class TimerGovernor implements Sweepable {
    private static final Logger LOG = Logger.getLogger(TimerGovernor.class.getName());

    private final GovernorLimits limits;
    private final ResourceAccountant accountant;
    private final ComponentBlockList blockList;
    private final SecurityMonitor monitor;
    private final SlidingWindowRateLimiter rateLimiter;
    private final LongSupplier nanoClock;
    private final long cleanupIntervalNanos;
    private final Map<String, TimerEntry> registry = new LinkedHashMap<>();
    private long lastSweepNanos;

    public TimerGovernor(GovernorLimits limits,
                         ResourceAccountant accountant,
                         ComponentBlockList blockList,
                         SecurityMonitor monitor,
                         SlidingWindowRateLimiter rateLimiter,
                         LongSupplier nanoClock) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.accountant = Objects.requireNonNull(accountant, "accountant");
        this.blockList = Objects.requireNonNull(blockList, "blockList");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.cleanupIntervalNanos = limits.cleanupInterval().toNanos();
        this.lastSweepNanos = nanoClock.getAsLong();
    }

    @Override
    public String name() {
        return "timers";
    }

    /**
     * Admits and schedules a timer.
     *
     * @param timeoutMillis maximum lifetime; {@code <= 0} selects the configured default
     * @return the timer id, or empty when admission was denied or scheduling failed
     */
    public Optional<String> create(TimerScheduler scheduler,
                                   long delayMillis,
                                   Runnable callback,
                                   String componentId,
                                   long timeoutMillis,
                                   boolean repeat) {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(callback, "callback");
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0: " + delayMillis);
        }
        long lifetime = timeoutMillis > 0 ? timeoutMillis : limits.defaultTimerTimeout().toMillis();
        return accountant.callLocked(() -> {
            long now = nanoClock.getAsLong();
            AdmissionDecision decision = decide(componentId, now);
            if (!decision.admitted()) {
                return Optional.empty();
            }

            String id = nextId();
            TimerEntry entry = new TimerEntry(id, componentId, scheduler, callback, delayMillis, repeat, now, lifetime);
            registry.put(id, entry);
            accountant.register(Registration.timer(id, componentId));
            try {
                entry.fireHandle(scheduler.schedule(delayMillis, () -> fire(entry)));
                entry.guardHandle(scheduler.schedule(lifetime, () -> guardExpired(entry)));
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "Failed to schedule timer " + id, e);
                cleanup(entry);
                monitor.recordFailure(DenialReason.CREATION_ERROR, now);
                return Optional.empty();
            }
            rateLimiter.record(componentId, now);
            monitor.recordCreation(id, false, now);
            LOG.fine(() -> "Created timer " + id + " with " + delayMillis + "ms delay, component: " + componentId);
            return Optional.of(id);
        });
    }

    private AdmissionDecision decide(String componentId, long now) {
        sweepIfDue(now);

        if (monitor.isSuspicious(now)) {
            LOG.warning("Timer creation denied: suspicious activity detected");
            return deny(DenialReason.SUSPICIOUS_ACTIVITY, now);
        }
        if (blockList.isBlocked(componentId)) {
            LOG.warning(() -> "Timer creation denied: component " + componentId + " is blocked");
            return deny(DenialReason.COMPONENT_BLOCKED, now);
        }
        if (registry.size() >= limits.maxTotalTimers()) {
            LOG.warning(() -> "Timer creation denied: global limit reached (" + limits.maxTotalTimers() + ")");
            sweep(now);
            if (registry.size() >= limits.maxTotalTimers()) {
                return deny(DenialReason.TOTAL_LIMIT, now);
            }
        }
        if (componentId != null
            && accountant.countFor(ResourceKind.TIMER, componentId) >= limits.maxTimersPerComponent()) {
            LOG.warning(() -> "Timer creation denied: component limit reached for " + componentId);
            return deny(DenialReason.COMPONENT_LIMIT, now);
        }
        if (!rateLimiter.wouldAllow(componentId, now)) {
            return deny(DenialReason.RATE_LIMITED, now);
        }
        return AdmissionDecision.ADMITTED;
    }

    private AdmissionDecision deny(DenialReason reason, long now) {
        monitor.recordFailure(reason, now);
        return AdmissionDecision.deny(reason);
    }

    private String nextId() {
        String id;
        do {
            id = "timer_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (registry.containsKey(id));
        return id;
    }

    private void fire(TimerEntry entry) {
        if (!isCurrent(entry)) {
            return;
        }
        try {
            entry.callback().run();
        } catch (RuntimeException | Error e) {
            LOG.log(Level.SEVERE, "Timer " + entry.id() + " callback failed", e);
            throw e;
        } finally {
            if (entry.repeat()) {
                reschedule(entry);
            } else {
                cleanup(entry);
            }
        }
    }

    private void reschedule(TimerEntry entry) {
        accountant.runLocked(() -> {
            if (!isCurrent(entry)) {
                return;
            }
            try {
                entry.fireHandle(entry.scheduler().schedule(entry.delayMillis(), () -> fire(entry)));
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to reschedule repeating timer " + entry.id() + "; reclaiming it", e);
                cleanup(entry);
            }
        });
    }

    private void guardExpired(TimerEntry entry) {
        if (cleanup(entry)) {
            LOG.warning(() -> "Timer " + entry.id() + " timed out after " + entry.timeoutMillis() + "ms");
        }
    }

    private boolean isCurrent(TimerEntry entry) {
        return accountant.callLocked(() -> registry.get(entry.id()) == entry);
    }

    /**
     * Cancels the timer's fire and guard callbacks and removes it.
     *
     * @return {@code false} if the timer was already gone
     */
    public boolean cancel(String timerId) {
        if (timerId == null) {
            return false;
        }
        return accountant.callLocked(() -> {
            TimerEntry entry = registry.get(timerId);
            return entry != null && cleanup(entry);
        });
    }

    /** Cancels every timer owned by {@code componentId}. */
    public int cancelForComponent(String componentId) {
        Objects.requireNonNull(componentId, "componentId");
        return accountant.callLocked(() -> {
            List<TimerEntry> owned = new ArrayList<>();
            for (TimerEntry entry : registry.values()) {
                if (componentId.equals(entry.componentId())) {
                    owned.add(entry);
                }
            }
            int cancelled = cleanupAll(owned);
            LOG.fine(() -> "Cancelled " + cancelled + " timers for component " + componentId);
            return cancelled;
        });
    }

    /** Cancels every timer. Meant for error recovery and teardown. */
    public int cancelAll() {
        return accountant.callLocked(() -> {
            int cancelled = cleanupAll(new ArrayList<>(registry.values()));
            LOG.fine(() -> "Cancelled all " + cancelled + " active timers");
            return cancelled;
        });
    }

    private int cleanupAll(List<TimerEntry> entries) {
        int cancelled = 0;
        for (TimerEntry entry : entries) {
            if (cleanup(entry)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    // Removes exactly this entry and cancels both of its scheduled callbacks.
    private boolean cleanup(TimerEntry entry) {
        return accountant.callLocked(() -> {
            if (!registry.remove(entry.id(), entry)) {
                return false;
            }
            accountant.unregister(ResourceKind.TIMER, entry.id());
            cancelQuietly(entry, entry.fireHandle(), "fire");
            cancelQuietly(entry, entry.guardHandle(), "guard");
            LOG.fine(() -> "Cleaned up timer " + entry.id());
            return true;
        });
    }

    private static void cancelQuietly(TimerEntry entry, ScheduledCallback handle, String which) {
        if (handle == null || handle.isDone()) {
            return;
        }
        try {
            entry.scheduler().cancel(handle);
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Cancel of " + which + " callback failed for timer " + entry.id(), e);
        }
    }

    /** Sweeps expired timers if the cleanup interval has elapsed since the last sweep. */
    public int sweepIfDue(long nowNanos) {
        return accountant.callLocked(() -> nowNanos - lastSweepNanos >= cleanupIntervalNanos ? sweep(nowNanos) : 0);
    }

    /** Reclaims timers whose lifetime has run out, whether or not their guard ran. */
    @Override
    public int sweep(long nowNanos) {
        return accountant.callLocked(() -> {
            lastSweepNanos = nowNanos;
            List<TimerEntry> expired = new ArrayList<>();
            for (TimerEntry entry : registry.values()) {
                if (entry.expired(nowNanos)) {
                    LOG.fine(() -> "Timer " + entry.id() + " expired after " + entry.timeoutMillis() + "ms");
                    expired.add(entry);
                }
            }
            int reclaimed = cleanupAll(expired);
            if (reclaimed > 0) {
                LOG.info(() -> "Cleaned up " + reclaimed + " expired timers");
            }
            return reclaimed;
        });
    }

    public Optional<String> delayedCallback(TimerScheduler scheduler, long delayMillis, Runnable callback, String componentId) {
        return create(scheduler, delayMillis, callback, componentId, 0L, false);
    }

    /**
     * @param maxLifetimeMillis lifetime after which the guard stops the timer; {@code <= 0} selects the default
     */
    public Optional<String> repeatingTimer(TimerScheduler scheduler,
                                           long intervalMillis,
                                           Runnable callback,
                                           String componentId,
                                           long maxLifetimeMillis) {
        return create(scheduler, intervalMillis, callback, componentId, maxLifetimeMillis, true);
    }

    public Optional<String> autosaveTimer(TimerScheduler scheduler, Runnable saveCallback, String componentId) {
        return delayedCallback(scheduler, GovernorDefaults.AUTOSAVE_DELAY_MS, saveCallback, componentId);
    }

    public int activeCount() {
        return accountant.callLocked(registry::size);
    }

    public int activeCount(String componentId) {
        return accountant.countFor(ResourceKind.TIMER, componentId);
    }

    public boolean isRegistered(String timerId) {
        return accountant.callLocked(() -> registry.containsKey(timerId));
    }

    /**
     * Components holding more than 80% of their timer ceiling. Each one is logged.
     */
    public Set<String> componentsNearLimit() {
        return accountant.callLocked(() -> {
            Map<String, Integer> counts = accountant.snapshot().timersByComponent();
            double threshold = limits.maxTimersPerComponent() * GovernorDefaults.TIMER_PRESSURE_RATIO;
            Set<String> out = new LinkedHashSet<>();
            for (Map.Entry<String, Integer> e : counts.entrySet()) {
                if (e.getValue() > threshold) {
                    LOG.warning(() -> "Component " + e.getKey() + " approaching timer limit: "
                        + e.getValue() + "/" + limits.maxTimersPerComponent());
                    out.add(e.getKey());
                }
            }
            return Set.copyOf(out);
        });
    }

    /**
     * Cancels every timer and forgets the rate-limit window and the security history.
     */
    public void emergencyCleanup() {
        LOG.severe("Performing emergency timer cleanup");
        accountant.runLocked(() -> {
            int cancelled = cancelAll();
            for (Clearable state : List.<Clearable>of(rateLimiter, monitor)) {
                state.clear();
            }
            LOG.info(() -> "Emergency timer cleanup completed, cancelled " + cancelled + " timers");
        });
    }

    public TimerStats stats() {
        return accountant.callLocked(() -> {
            long now = nanoClock.getAsLong();
            return new TimerStats(
                registry.size(),
                accountant.snapshot().timersByComponent(),
                limits.maxTotalTimers(),
                limits.maxTimersPerComponent(),
                rateLimiter.recentCount(now),
                rateLimiter.rejectedCount(),
                monitor.failureCount(),
                monitor.isSuspicious(now),
                componentsNearLimit()
            );
        });
    }
}
