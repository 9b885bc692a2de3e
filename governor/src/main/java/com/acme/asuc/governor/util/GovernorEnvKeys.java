package com.acme.asuc.governor.util;

/**
 * Canonical environment variable names read by the governor at startup.
 */
public final class GovernorEnvKeys {
    public static final String GOVERNOR_MAX_TOTAL_THREADS = "GOVERNOR_MAX_TOTAL_THREADS";
    public static final String GOVERNOR_MAX_BACKGROUND_THREADS = "GOVERNOR_MAX_BACKGROUND_THREADS";
    public static final String GOVERNOR_MAX_THREADS_PER_COMPONENT = "GOVERNOR_MAX_THREADS_PER_COMPONENT";
    public static final String GOVERNOR_MAX_CONCURRENT_OPERATIONS = "GOVERNOR_MAX_CONCURRENT_OPERATIONS";
    public static final String GOVERNOR_THREAD_TIMEOUT_SEC = "GOVERNOR_THREAD_TIMEOUT_SEC";
    public static final String GOVERNOR_MAX_THREAD_MEMORY_MB = "GOVERNOR_MAX_THREAD_MEMORY_MB";

    public static final String GOVERNOR_MAX_CPU_PERCENT = "GOVERNOR_MAX_CPU_PERCENT";
    public static final String GOVERNOR_MAX_MEMORY_PERCENT = "GOVERNOR_MAX_MEMORY_PERCENT";
    public static final String GOVERNOR_STARTUP_GRACE_SEC = "GOVERNOR_STARTUP_GRACE_SEC";
    public static final String GOVERNOR_CLEANUP_INTERVAL_SEC = "GOVERNOR_CLEANUP_INTERVAL_SEC";

    public static final String GOVERNOR_MAX_TOTAL_TIMERS = "GOVERNOR_MAX_TOTAL_TIMERS";
    public static final String GOVERNOR_MAX_TIMERS_PER_COMPONENT = "GOVERNOR_MAX_TIMERS_PER_COMPONENT";
    public static final String GOVERNOR_TIMER_DEFAULT_TIMEOUT_MS = "GOVERNOR_TIMER_DEFAULT_TIMEOUT_MS";

    public static final String GOVERNOR_THREAD_RATE_MAX_PER_SECOND = "GOVERNOR_THREAD_RATE_MAX_PER_SECOND";
    public static final String GOVERNOR_THREAD_RATE_WINDOW_SEC = "GOVERNOR_THREAD_RATE_WINDOW_SEC";
    public static final String GOVERNOR_TIMER_RATE_MAX_PER_SECOND = "GOVERNOR_TIMER_RATE_MAX_PER_SECOND";
    public static final String GOVERNOR_TIMER_RATE_WINDOW_SEC = "GOVERNOR_TIMER_RATE_WINDOW_SEC";

    public static final String GOVERNOR_SECURITY_FAILURE_WARN_THRESHOLD = "GOVERNOR_SECURITY_FAILURE_WARN_THRESHOLD";
    public static final String GOVERNOR_SECURITY_BURST_THRESHOLD = "GOVERNOR_SECURITY_BURST_THRESHOLD";
    public static final String GOVERNOR_SECURITY_BURST_WINDOW_SEC = "GOVERNOR_SECURITY_BURST_WINDOW_SEC";
    public static final String GOVERNOR_TIMER_SECURITY_BURST_THRESHOLD = "GOVERNOR_TIMER_SECURITY_BURST_THRESHOLD";

    public static final String GOVERNOR_STATS_LOG_INTERVAL_SEC = "GOVERNOR_STATS_LOG_INTERVAL_SEC";

    private GovernorEnvKeys() {
    }
}
