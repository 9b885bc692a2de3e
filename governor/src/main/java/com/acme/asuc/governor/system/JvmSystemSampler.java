package com.acme.asuc.governor.system;

import com.sun.management.UnixOperatingSystemMXBean;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;

/**
 * {@link SystemSampler} backed by the platform {@code OperatingSystemMXBean}.
 */
public final class JvmSystemSampler implements SystemSampler {
    private static final long MB = 1024L * 1024L;

    private final OperatingSystemMXBean os;
    private final MemoryMXBean memory;

    public JvmSystemSampler() {
        this(ManagementFactory.getOperatingSystemMXBean(), ManagementFactory.getMemoryMXBean());
    }

    JvmSystemSampler(OperatingSystemMXBean os, MemoryMXBean memory) {
        this.os = os;
        this.memory = memory;
    }

    @Override
    public double cpuPercent() {
        double load = extended().getCpuLoad();
        if (load < 0.0d || Double.isNaN(load)) {
            throw new SamplingException("cpu load not available yet");
        }
        return load * 100.0d;
    }

    @Override
    public double memoryPercent() {
        com.sun.management.OperatingSystemMXBean bean = extended();
        long total = bean.getTotalMemorySize();
        if (total <= 0L) {
            throw new SamplingException("total memory size not reported");
        }
        long used = total - bean.getFreeMemorySize();
        return (used * 100.0d) / total;
    }

    @Override
    public long maxFileDescriptors() {
        if (os instanceof UnixOperatingSystemMXBean unix) {
            return unix.getMaxFileDescriptorCount();
        }
        return -1L;
    }

    @Override
    public long processMemoryMb() {
        long used = memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();
        return used / MB;
    }

    private com.sun.management.OperatingSystemMXBean extended() {
        if (os instanceof com.sun.management.OperatingSystemMXBean bean) {
            return bean;
        }
        throw new SamplingException("extended OperatingSystemMXBean not available on " + os.getClass().getName());
    }
}
