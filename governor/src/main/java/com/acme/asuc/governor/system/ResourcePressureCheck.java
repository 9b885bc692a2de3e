package com.acme.asuc.governor.system;

import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether the host has headroom for another thread.
 *
 * <p>Memory is always enforced. CPU uses the standard threshold except during the
 * startup grace period (over-threshold readings are logged and allowed) and for
 * {@link WorkloadClass#LONG_RUNNING_CHECK} work (relaxed threshold, refused only at
 * the hard stop). A sampler failure fails open.</p>
 */
public final class ResourcePressureCheck {
    private static final Logger LOG = Logger.getLogger(ResourcePressureCheck.class.getName());

    private final PressurePolicy policy;
    private final SystemSampler sampler;
    private final LongSupplier nanoClock;
    private final long startedNanos;

    public ResourcePressureCheck(PressurePolicy policy, SystemSampler sampler, LongSupplier nanoClock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.startedNanos = nanoClock.getAsLong();
    }

    public boolean inStartupGrace(long nowNanos) {
        return nowNanos - startedNanos < policy.startupGrace().toNanos();
    }

    /**
     * @param activeThreads live managed threads, compared against descriptor headroom
     * @return {@code true} when the system can take another thread, or when sampling failed
     */
    public boolean allows(String componentId, WorkloadClass workload, int activeThreads) {
        long now = nanoClock.getAsLong();
        boolean grace = inStartupGrace(now);
        boolean relaxed = workload == WorkloadClass.LONG_RUNNING_CHECK;
        String who = componentId == null ? "unknown" : componentId;
        try {
            double cpu = sampler.cpuPercent();
            double cpuThreshold = grace || relaxed ? policy.relaxedCpuPercent() : policy.maxCpuPercent();
            if (cpu > cpuThreshold) {
                if (grace) {
                    LOG.info(() -> "High CPU usage during startup (" + format(cpu) + "%), within grace period for " + who);
                } else if (relaxed && cpu < policy.relaxedCpuHardStopPercent()) {
                    LOG.info(() -> "Allowing long-running check for " + who + " despite high CPU (" + format(cpu) + "%)");
                } else {
                    LOG.warning(() -> "High CPU usage: " + format(cpu) + "% (threshold " + format(cpuThreshold) + "%)");
                    return false;
                }
            }

            double mem = sampler.memoryPercent();
            if (mem > policy.maxMemoryPercent()) {
                LOG.warning(() -> "High memory usage: " + format(mem) + "%");
                return false;
            }

            long maxFd = sampler.maxFileDescriptors();
            if (maxFd > 0 && activeThreads > maxFd * policy.fdHeadroomRatio()) {
                LOG.warning(() -> "Approaching file descriptor limit: " + activeThreads + " threads, limit " + maxFd);
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "System resource sampling failed; allowing admission", e);
            return true;
        }
    }

    /** Samples CPU and memory independently; a failed reading is reported as {@code null}. */
    public SystemSample sample() {
        Double cpu;
        Double mem;
        try {
            cpu = sampler.cpuPercent();
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "cpu sampling failed", e);
            cpu = null;
        }
        try {
            mem = sampler.memoryPercent();
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "memory sampling failed", e);
            mem = null;
        }
        return new SystemSample(cpu, mem);
    }

    public SystemSampler sampler() {
        return sampler;
    }

    private static String format(double percent) {
        return String.format("%.1f", percent);
    }
}
