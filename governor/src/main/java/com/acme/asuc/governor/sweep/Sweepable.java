package com.acme.asuc.governor.sweep;

/**
 * Registry that can reclaim its dead or expired entries.
 */
public interface Sweepable {
    String name();

    /**
     * Reclaims every dead or expired entry.
     *
     * @return number of entries reclaimed
     */
    int sweep(long nowNanos);
}
