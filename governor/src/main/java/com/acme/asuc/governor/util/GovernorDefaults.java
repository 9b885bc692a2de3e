package com.acme.asuc.governor.util;

/**
 * Default ceilings, windows and thresholds for the governor.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class GovernorDefaults {

    // ---- Thread ceilings ----
    public static final int MAX_TOTAL_THREADS = 30;
    public static final int MAX_BACKGROUND_THREADS = 20;
    public static final int MAX_THREADS_PER_COMPONENT = 10;
    public static final int MAX_CONCURRENT_OPERATIONS = 8;
    public static final long THREAD_TIMEOUT_SECONDS = 180L;
    public static final long MAX_THREAD_MEMORY_MB = 100L;

    // ---- System pressure ----
    public static final double MAX_CPU_PERCENT = 80.0d;
    public static final double MAX_MEMORY_PERCENT = 85.0d;
    public static final double CPU_RELAXATION_PERCENT = 15.0d;
    public static final double RELAXED_CPU_CAP_PERCENT = 95.0d;
    public static final double RELAXED_CPU_HARD_STOP_PERCENT = 98.0d;
    public static final double FD_HEADROOM_RATIO = 0.8d;
    public static final long STARTUP_GRACE_SECONDS = 30L;
    public static final long CLEANUP_INTERVAL_SECONDS = 30L;

    // ---- Timer ceilings ----
    public static final int MAX_TOTAL_TIMERS = 100;
    public static final int MAX_TIMERS_PER_COMPONENT = 10;
    public static final long DEFAULT_TIMER_TIMEOUT_MS = 300_000L;
    public static final long AUTOSAVE_DELAY_MS = 1_000L;
    public static final double TIMER_PRESSURE_RATIO = 0.8d;

    // ---- Rate limiting ----
    public static final int RATE_MAX_PER_SECOND = 5;
    public static final long RATE_WINDOW_SECONDS = 10L;

    // ---- Security monitor ----
    public static final int FAILURE_WARN_THRESHOLD = 10;
    public static final int CREATION_BURST_THRESHOLD = 15;
    public static final int TIMER_CREATION_BURST_THRESHOLD = 60;
    public static final long CREATION_BURST_WINDOW_SECONDS = 10L;
    public static final long SUSPICION_HORIZON_SECONDS = 60L;
    public static final int RECENT_CREATION_HISTORY = 100;

    // ---- Stats reporter ----
    public static final long STATS_LOG_INTERVAL_SECONDS = 0L;

    private GovernorDefaults() {
    }
}
