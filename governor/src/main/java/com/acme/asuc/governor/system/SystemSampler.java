package com.acme.asuc.governor.system;

/**
 * Best-effort source of system load readings. Any method may throw
 * {@link SamplingException} (or another runtime exception) when a reading is unavailable.
 */
public interface SystemSampler {

    /** System-wide CPU usage in percent, {@code 0..100}. */
    double cpuPercent();

    /** Physical memory in use in percent, {@code 0..100}. */
    double memoryPercent();

    /** Maximum number of open file descriptors for this process, or {@code -1} if unknown. */
    default long maxFileDescriptors() {
        return -1L;
    }

    /** Memory currently used by this process, in megabytes. */
    default long processMemoryMb() {
        Runtime rt = Runtime.getRuntime();
        return (rt.totalMemory() - rt.freeMemory()) / (1024L * 1024L);
    }
}
