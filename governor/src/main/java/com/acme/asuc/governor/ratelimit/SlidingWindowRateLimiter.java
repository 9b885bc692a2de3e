package com.acme.asuc.governor.ratelimit;

import com.acme.asuc.governor.Clearable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sliding-window creation counter, global and per component.
 *
 * <p>Records are appended in time order, so expiring the window is a prefix
 * trim of the queue. A record is expired once its age reaches the window
 * duration. Anonymous creations ({@code componentId == null}) only count
 * against the global budget.</p>
 *
 * <p>Not a token bucket: a burst is refused as soon as the window holds the
 * threshold number of records, and capacity comes back only as records age out.</p>
 */
public final class SlidingWindowRateLimiter implements Clearable {
    private static final Logger LOG = Logger.getLogger(SlidingWindowRateLimiter.class.getName());

    private final String name;
    private final RateLimitPolicy policy;
    private final long windowNanos;
    private final Deque<CreationRecord> window = new ArrayDeque<>();
    private final Map<String, Integer> perComponent = new HashMap<>();
    private long rejected;

    public SlidingWindowRateLimiter(String name, RateLimitPolicy policy) {
        this.name = Objects.requireNonNull(name, "name");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.windowNanos = policy.window().toNanos();
    }

    /**
     * Admits one creation for {@code componentId} if both the global and the
     * per-component budgets have room, and records it.
     */
    public synchronized boolean allow(String componentId, long nowNanos) {
        if (!wouldAllow(componentId, nowNanos)) {
            return false;
        }
        record(componentId, nowNanos);
        return true;
    }

    /**
     * Checks both budgets without recording anything. A refusal still counts
     * towards {@link #rejectedCount()}.
     */
    public synchronized boolean wouldAllow(String componentId, long nowNanos) {
        evictExpired(nowNanos);

        if (window.size() >= policy.globalCapacity()) {
            rejected++;
            LOG.warning(() -> name + " global rate limit exceeded: " + window.size()
                + " creations in " + policy.window().toSeconds() + "s");
            return false;
        }
        if (componentId != null) {
            int recent = perComponent.getOrDefault(componentId, 0);
            if (recent >= policy.perComponentCapacity()) {
                rejected++;
                LOG.warning(() -> name + " rate limit exceeded for component " + componentId
                    + ": " + recent + " creations in " + policy.window().toSeconds() + "s");
                return false;
            }
        }
        return true;
    }

    /** Counts a creation that already happened against both budgets. */
    public synchronized void record(String componentId, long nowNanos) {
        evictExpired(nowNanos);
        if (componentId != null) {
            perComponent.merge(componentId, 1, Integer::sum);
        }
        window.addLast(new CreationRecord(nowNanos, componentId));
    }

    private void evictExpired(long nowNanos) {
        CreationRecord head;
        while ((head = window.peekFirst()) != null && nowNanos - head.timestampNanos() >= windowNanos) {
            window.pollFirst();
            if (head.componentId() != null) {
                perComponent.computeIfPresent(head.componentId(), (k, v) -> v > 1 ? v - 1 : null);
            }
        }
    }

    public synchronized int recentCount(long nowNanos) {
        evictExpired(nowNanos);
        return window.size();
    }

    public synchronized int recentCountFor(String componentId, long nowNanos) {
        evictExpired(nowNanos);
        return componentId == null ? 0 : perComponent.getOrDefault(componentId, 0);
    }

    /** Age of the oldest retained record, or zero when the window is empty. */
    synchronized long oldestAgeNanos(long nowNanos) {
        CreationRecord head = window.peekFirst();
        return head == null ? 0L : nowNanos - head.timestampNanos();
    }

    public synchronized long rejectedCount() {
        return rejected;
    }

    public RateLimitPolicy policy() {
        return policy;
    }

    @Override
    public synchronized void clear() {
        window.clear();
        perComponent.clear();
        rejected = 0L;
    }
}
