package com.acme.asuc.governor.sweep;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reclaims dead and expired entries from every registered {@link Sweepable}.
 *
 * <p>Runs opportunistically through {@link #sweepIfDue()} and, once {@link #start()}ed,
 * on a fixed interval from a daemon thread.</p>
 */
public final class CleanupSweeper implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(CleanupSweeper.class.getName());

    private final List<Sweepable> targets;
    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private final Object lock = new Object();
    private ScheduledExecutorService executor;
    private long lastSweepNanos;

    public CleanupSweeper(List<? extends Sweepable> targets, Duration interval, LongSupplier nanoClock) {
        this.targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
        this.intervalNanos = Objects.requireNonNull(interval, "interval").toNanos();
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        if (intervalNanos <= 0) {
            throw new IllegalArgumentException("interval must be > 0: " + interval);
        }
        this.lastSweepNanos = nanoClock.getAsLong();
    }

    /**
     * @return reclaimed entries, or {@code 0} when the interval has not elapsed yet
     */
    public int sweepIfDue() {
        long now = nanoClock.getAsLong();
        synchronized (lock) {
            if (now - lastSweepNanos < intervalNanos) {
                return 0;
            }
        }
        return sweepNow();
    }

    public int sweepNow() {
        long now = nanoClock.getAsLong();
        synchronized (lock) {
            lastSweepNanos = now;
        }
        int total = 0;
        for (Sweepable target : targets) {
            try {
                int reclaimed = target.sweep(now);
                if (reclaimed > 0) {
                    LOG.fine(() -> "Sweep of " + target.name() + " reclaimed " + reclaimed + " entries");
                }
                total += reclaimed;
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Sweep of " + target.name() + " failed", e);
            }
        }
        return total;
    }

    public void start() {
        synchronized (lock) {
            if (executor != null) {
                return;
            }
            executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "governor-cleanup-sweeper");
                t.setDaemon(true);
                return t;
            });
            executor.scheduleWithFixedDelay(this::sweepNow, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return executor != null;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (executor != null) {
                executor.shutdownNow();
                executor = null;
            }
        }
    }
}
