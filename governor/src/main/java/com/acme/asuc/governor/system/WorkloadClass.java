package com.acme.asuc.governor.system;

/**
 * Declared shape of the work a component is about to start.
 */
public enum WorkloadClass {
    /** Ordinary short work; the standard CPU threshold applies. */
    STANDARD,
    /**
     * Legitimate long CPU-bound work such as an update check. Gets the relaxed CPU
     * threshold and is only refused above the hard stop.
     */
    LONG_RUNNING_CHECK
}
