package com.acme.asuc.governor.system;

import java.time.Duration;
import java.util.Objects;

/**
 * CPU, memory and descriptor thresholds applied before a thread is admitted.
 *
 * <p>The relaxed CPU threshold is {@code min(relaxedCpuCapPercent, maxCpuPercent + cpuRelaxationPercent)}.
 * It applies during the startup grace period and to {@link WorkloadClass#LONG_RUNNING_CHECK} work.</p>
 */
public record PressurePolicy(double maxCpuPercent,
                             double maxMemoryPercent,
                             double cpuRelaxationPercent,
                             double relaxedCpuCapPercent,
                             double relaxedCpuHardStopPercent,
                             double fdHeadroomRatio,
                             Duration startupGrace) {

    public PressurePolicy {
        Objects.requireNonNull(startupGrace, "startupGrace");
    }

    public double relaxedCpuPercent() {
        return Math.min(relaxedCpuCapPercent, maxCpuPercent + cpuRelaxationPercent);
    }
}
