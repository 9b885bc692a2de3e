package com.acme.asuc.governor.security;

import com.acme.asuc.governor.Clearable;
import com.acme.asuc.governor.DenialReason;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Tracks creation failures and creation bursts and raises a "suspicious" signal.
 *
 * <p>Failure tracking is advisory only: it logs once the failure count passes the
 * warning threshold. The burst heuristic is what feeds {@link #isSuspicious(long)},
 * which the governors consult as an admission gate.</p>
 */
public final class SecurityMonitor implements Clearable {
    private static final Logger LOG = Logger.getLogger(SecurityMonitor.class.getName());

    private final String name;
    private final SecurityPolicy policy;
    private final long burstWindowNanos;
    private final long horizonNanos;
    private final Deque<CreationEvent> recentCreations = new ArrayDeque<>();
    private final Deque<Long> suspiciousPatterns = new ArrayDeque<>();
    private final Map<DenialReason, Long> failuresByReason = new EnumMap<>(DenialReason.class);
    private long failureCount;
    private long lastFailureNanos;

    public SecurityMonitor(String name, SecurityPolicy policy) {
        this.name = Objects.requireNonNull(name, "name");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.burstWindowNanos = policy.burstWindow().toNanos();
        this.horizonNanos = policy.suspicionHorizon().toNanos();
    }

    public synchronized void recordFailure(DenialReason reason, long nowNanos) {
        Objects.requireNonNull(reason, "reason");
        failureCount++;
        lastFailureNanos = nowNanos;
        failuresByReason.merge(reason, 1L, Long::sum);
        if (failureCount > policy.failureWarnThreshold()) {
            long count = failureCount;
            LOG.warning(() -> "High " + name + " creation failure rate: " + count
                + " failures (latest: " + reason.code() + ")");
        }
    }

    public synchronized void recordCreation(String id, boolean background, long nowNanos) {
        if (recentCreations.size() >= policy.historySize()) {
            recentCreations.pollFirst();
        }
        recentCreations.addLast(new CreationEvent(nowNanos, id, background));
        checkCreationRate(nowNanos);
    }

    private void checkCreationRate(long nowNanos) {
        int recent = 0;
        for (CreationEvent event : recentCreations) {
            if (nowNanos - event.timestampNanos() < burstWindowNanos) {
                recent++;
            }
        }
        if (recent > policy.burstThreshold()) {
            int count = recent;
            LOG.warning(() -> "High " + name + " creation rate detected: " + count
                + " in " + policy.burstWindow().toSeconds() + "s");
            suspiciousPatterns.addLast(nowNanos);
        }
    }

    /** True while any flagged pattern is younger than the suspicion horizon. */
    public synchronized boolean isSuspicious(long nowNanos) {
        Long head;
        while ((head = suspiciousPatterns.peekFirst()) != null && nowNanos - head >= horizonNanos) {
            suspiciousPatterns.pollFirst();
        }
        return !suspiciousPatterns.isEmpty();
    }

    public synchronized long failureCount() {
        return failureCount;
    }

    public synchronized long lastFailureNanos() {
        return lastFailureNanos;
    }

    public synchronized Map<DenialReason, Long> failuresByReason() {
        return failuresByReason.isEmpty() ? Map.of() : Map.copyOf(failuresByReason);
    }

    public synchronized int recentCreationCount() {
        return recentCreations.size();
    }

    @Override
    public synchronized void clear() {
        recentCreations.clear();
        suspiciousPatterns.clear();
        failuresByReason.clear();
        failureCount = 0L;
        lastFailureNanos = 0L;
    }

    private record CreationEvent(long timestampNanos, String id, boolean background) {}
}
