package com.acme.asuc.governor;

import com.acme.asuc.governor.ratelimit.RateLimitPolicy;
import com.acme.asuc.governor.security.SecurityPolicy;
import com.acme.asuc.governor.system.PressurePolicy;
import com.acme.asuc.governor.util.EnvVars;
import com.acme.asuc.governor.util.GovernorDefaults;
import com.acme.asuc.governor.util.GovernorEnvKeys;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable set of ceilings, windows and thresholds for one governor instance.
 */
public record GovernorLimits(int maxTotalThreads,
                             int maxBackgroundThreads,
                             int maxThreadsPerComponent,
                             int maxConcurrentOperations,
                             Duration threadTimeout,
                             long maxThreadMemoryMb,
                             int maxTotalTimers,
                             int maxTimersPerComponent,
                             Duration defaultTimerTimeout,
                             Duration cleanupInterval,
                             RateLimitPolicy threadRateLimit,
                             RateLimitPolicy timerRateLimit,
                             SecurityPolicy threadSecurity,
                             SecurityPolicy timerSecurity,
                             PressurePolicy pressure,
                             Duration statsLogInterval) {

    public GovernorLimits {
        Objects.requireNonNull(threadTimeout, "threadTimeout");
        Objects.requireNonNull(defaultTimerTimeout, "defaultTimerTimeout");
        Objects.requireNonNull(cleanupInterval, "cleanupInterval");
        Objects.requireNonNull(threadRateLimit, "threadRateLimit");
        Objects.requireNonNull(timerRateLimit, "timerRateLimit");
        Objects.requireNonNull(threadSecurity, "threadSecurity");
        Objects.requireNonNull(timerSecurity, "timerSecurity");
        Objects.requireNonNull(pressure, "pressure");
        Objects.requireNonNull(statsLogInterval, "statsLogInterval");
        if (maxTotalThreads < 1 || maxBackgroundThreads < 0 || maxThreadsPerComponent < 1) {
            throw new IllegalArgumentException("thread ceilings must be positive");
        }
        if (maxTotalTimers < 1 || maxTimersPerComponent < 1) {
            throw new IllegalArgumentException("timer ceilings must be positive");
        }
    }

    public static GovernorLimits defaults() {
        return builder().build();
    }

    public static GovernorLimits fromEnv() {
        return fromEnv(EnvVars.system());
    }

    public static GovernorLimits fromEnv(EnvVars env) {
        Objects.requireNonNull(env, "env");
        return builder()
            .maxTotalThreads(env.getIntClamped(GovernorEnvKeys.GOVERNOR_MAX_TOTAL_THREADS,
                GovernorDefaults.MAX_TOTAL_THREADS, 1, 1_024))
            .maxBackgroundThreads(env.getIntClamped(GovernorEnvKeys.GOVERNOR_MAX_BACKGROUND_THREADS,
                GovernorDefaults.MAX_BACKGROUND_THREADS, 0, 1_024))
            .maxThreadsPerComponent(env.getIntClamped(GovernorEnvKeys.GOVERNOR_MAX_THREADS_PER_COMPONENT,
                GovernorDefaults.MAX_THREADS_PER_COMPONENT, 1, 1_024))
            .maxConcurrentOperations(env.getIntClamped(GovernorEnvKeys.GOVERNOR_MAX_CONCURRENT_OPERATIONS,
                GovernorDefaults.MAX_CONCURRENT_OPERATIONS, 1, 256))
            .threadTimeout(Duration.ofSeconds(env.getLongClamped(GovernorEnvKeys.GOVERNOR_THREAD_TIMEOUT_SEC,
                GovernorDefaults.THREAD_TIMEOUT_SECONDS, 1, 86_400)))
            .maxThreadMemoryMb(env.getLongClamped(GovernorEnvKeys.GOVERNOR_MAX_THREAD_MEMORY_MB,
                GovernorDefaults.MAX_THREAD_MEMORY_MB, 1, 1_048_576))
            .maxTotalTimers(env.getIntClamped(GovernorEnvKeys.GOVERNOR_MAX_TOTAL_TIMERS,
                GovernorDefaults.MAX_TOTAL_TIMERS, 1, 100_000))
            .maxTimersPerComponent(env.getIntClamped(GovernorEnvKeys.GOVERNOR_MAX_TIMERS_PER_COMPONENT,
                GovernorDefaults.MAX_TIMERS_PER_COMPONENT, 1, 100_000))
            .defaultTimerTimeout(Duration.ofMillis(env.getLongClamped(GovernorEnvKeys.GOVERNOR_TIMER_DEFAULT_TIMEOUT_MS,
                GovernorDefaults.DEFAULT_TIMER_TIMEOUT_MS, 1, 86_400_000L)))
            .cleanupInterval(Duration.ofSeconds(env.getLongClamped(GovernorEnvKeys.GOVERNOR_CLEANUP_INTERVAL_SEC,
                GovernorDefaults.CLEANUP_INTERVAL_SECONDS, 1, 3_600)))
            .threadRateLimit(new RateLimitPolicy(
                env.getIntClamped(GovernorEnvKeys.GOVERNOR_THREAD_RATE_MAX_PER_SECOND,
                    GovernorDefaults.RATE_MAX_PER_SECOND, 1, 10_000),
                Duration.ofSeconds(env.getLongClamped(GovernorEnvKeys.GOVERNOR_THREAD_RATE_WINDOW_SEC,
                    GovernorDefaults.RATE_WINDOW_SECONDS, 1, 3_600))))
            .timerRateLimit(new RateLimitPolicy(
                env.getIntClamped(GovernorEnvKeys.GOVERNOR_TIMER_RATE_MAX_PER_SECOND,
                    GovernorDefaults.RATE_MAX_PER_SECOND, 1, 10_000),
                Duration.ofSeconds(env.getLongClamped(GovernorEnvKeys.GOVERNOR_TIMER_RATE_WINDOW_SEC,
                    GovernorDefaults.RATE_WINDOW_SECONDS, 1, 3_600))))
            .threadSecurity(securityPolicy(env, GovernorEnvKeys.GOVERNOR_SECURITY_BURST_THRESHOLD,
                GovernorDefaults.CREATION_BURST_THRESHOLD))
            .timerSecurity(securityPolicy(env, GovernorEnvKeys.GOVERNOR_TIMER_SECURITY_BURST_THRESHOLD,
                GovernorDefaults.TIMER_CREATION_BURST_THRESHOLD))
            .pressure(new PressurePolicy(
                env.getDoubleClamped(GovernorEnvKeys.GOVERNOR_MAX_CPU_PERCENT,
                    GovernorDefaults.MAX_CPU_PERCENT, 1.0d, 100.0d),
                env.getDoubleClamped(GovernorEnvKeys.GOVERNOR_MAX_MEMORY_PERCENT,
                    GovernorDefaults.MAX_MEMORY_PERCENT, 1.0d, 100.0d),
                GovernorDefaults.CPU_RELAXATION_PERCENT,
                GovernorDefaults.RELAXED_CPU_CAP_PERCENT,
                GovernorDefaults.RELAXED_CPU_HARD_STOP_PERCENT,
                GovernorDefaults.FD_HEADROOM_RATIO,
                Duration.ofSeconds(env.getLongClamped(GovernorEnvKeys.GOVERNOR_STARTUP_GRACE_SEC,
                    GovernorDefaults.STARTUP_GRACE_SECONDS, 0, 3_600))))
            .statsLogInterval(Duration.ofSeconds(env.getLongClamped(GovernorEnvKeys.GOVERNOR_STATS_LOG_INTERVAL_SEC,
                GovernorDefaults.STATS_LOG_INTERVAL_SECONDS, 0, 86_400)))
            .build();
    }

    private static SecurityPolicy securityPolicy(EnvVars env, String burstKey, int burstDefault) {
        return new SecurityPolicy(
            env.getIntClamped(GovernorEnvKeys.GOVERNOR_SECURITY_FAILURE_WARN_THRESHOLD,
                GovernorDefaults.FAILURE_WARN_THRESHOLD, 0, 1_000_000),
            env.getIntClamped(burstKey, burstDefault, 1, 1_000_000),
            Duration.ofSeconds(env.getLongClamped(GovernorEnvKeys.GOVERNOR_SECURITY_BURST_WINDOW_SEC,
                GovernorDefaults.CREATION_BURST_WINDOW_SECONDS, 1, 3_600)),
            Duration.ofSeconds(GovernorDefaults.SUSPICION_HORIZON_SECONDS),
            GovernorDefaults.RECENT_CREATION_HISTORY
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxTotalThreads(maxTotalThreads)
            .maxBackgroundThreads(maxBackgroundThreads)
            .maxThreadsPerComponent(maxThreadsPerComponent)
            .maxConcurrentOperations(maxConcurrentOperations)
            .threadTimeout(threadTimeout)
            .maxThreadMemoryMb(maxThreadMemoryMb)
            .maxTotalTimers(maxTotalTimers)
            .maxTimersPerComponent(maxTimersPerComponent)
            .defaultTimerTimeout(defaultTimerTimeout)
            .cleanupInterval(cleanupInterval)
            .threadRateLimit(threadRateLimit)
            .timerRateLimit(timerRateLimit)
            .threadSecurity(threadSecurity)
            .timerSecurity(timerSecurity)
            .pressure(pressure)
            .statsLogInterval(statsLogInterval);
    }

    public static final class Builder {
        private int maxTotalThreads = GovernorDefaults.MAX_TOTAL_THREADS;
        private int maxBackgroundThreads = GovernorDefaults.MAX_BACKGROUND_THREADS;
        private int maxThreadsPerComponent = GovernorDefaults.MAX_THREADS_PER_COMPONENT;
        private int maxConcurrentOperations = GovernorDefaults.MAX_CONCURRENT_OPERATIONS;
        private Duration threadTimeout = Duration.ofSeconds(GovernorDefaults.THREAD_TIMEOUT_SECONDS);
        private long maxThreadMemoryMb = GovernorDefaults.MAX_THREAD_MEMORY_MB;
        private int maxTotalTimers = GovernorDefaults.MAX_TOTAL_TIMERS;
        private int maxTimersPerComponent = GovernorDefaults.MAX_TIMERS_PER_COMPONENT;
        private Duration defaultTimerTimeout = Duration.ofMillis(GovernorDefaults.DEFAULT_TIMER_TIMEOUT_MS);
        private Duration cleanupInterval = Duration.ofSeconds(GovernorDefaults.CLEANUP_INTERVAL_SECONDS);
        private RateLimitPolicy threadRateLimit = new RateLimitPolicy(
            GovernorDefaults.RATE_MAX_PER_SECOND, Duration.ofSeconds(GovernorDefaults.RATE_WINDOW_SECONDS));
        private RateLimitPolicy timerRateLimit = new RateLimitPolicy(
            GovernorDefaults.RATE_MAX_PER_SECOND, Duration.ofSeconds(GovernorDefaults.RATE_WINDOW_SECONDS));
        private SecurityPolicy threadSecurity = defaultSecurity(GovernorDefaults.CREATION_BURST_THRESHOLD);
        private SecurityPolicy timerSecurity = defaultSecurity(GovernorDefaults.TIMER_CREATION_BURST_THRESHOLD);
        private PressurePolicy pressure = new PressurePolicy(
            GovernorDefaults.MAX_CPU_PERCENT,
            GovernorDefaults.MAX_MEMORY_PERCENT,
            GovernorDefaults.CPU_RELAXATION_PERCENT,
            GovernorDefaults.RELAXED_CPU_CAP_PERCENT,
            GovernorDefaults.RELAXED_CPU_HARD_STOP_PERCENT,
            GovernorDefaults.FD_HEADROOM_RATIO,
            Duration.ofSeconds(GovernorDefaults.STARTUP_GRACE_SECONDS));
        private Duration statsLogInterval = Duration.ofSeconds(GovernorDefaults.STATS_LOG_INTERVAL_SECONDS);

        private Builder() {
        }

        private static SecurityPolicy defaultSecurity(int burstThreshold) {
            return new SecurityPolicy(
                GovernorDefaults.FAILURE_WARN_THRESHOLD,
                burstThreshold,
                Duration.ofSeconds(GovernorDefaults.CREATION_BURST_WINDOW_SECONDS),
                Duration.ofSeconds(GovernorDefaults.SUSPICION_HORIZON_SECONDS),
                GovernorDefaults.RECENT_CREATION_HISTORY);
        }

        public Builder maxTotalThreads(int value) {
            this.maxTotalThreads = value;
            return this;
        }

        public Builder maxBackgroundThreads(int value) {
            this.maxBackgroundThreads = value;
            return this;
        }

        public Builder maxThreadsPerComponent(int value) {
            this.maxThreadsPerComponent = value;
            return this;
        }

        public Builder maxConcurrentOperations(int value) {
            this.maxConcurrentOperations = value;
            return this;
        }

        public Builder threadTimeout(Duration value) {
            this.threadTimeout = value;
            return this;
        }

        public Builder maxThreadMemoryMb(long value) {
            this.maxThreadMemoryMb = value;
            return this;
        }

        public Builder maxTotalTimers(int value) {
            this.maxTotalTimers = value;
            return this;
        }

        public Builder maxTimersPerComponent(int value) {
            this.maxTimersPerComponent = value;
            return this;
        }

        public Builder defaultTimerTimeout(Duration value) {
            this.defaultTimerTimeout = value;
            return this;
        }

        public Builder cleanupInterval(Duration value) {
            this.cleanupInterval = value;
            return this;
        }

        public Builder threadRateLimit(RateLimitPolicy value) {
            this.threadRateLimit = value;
            return this;
        }

        public Builder timerRateLimit(RateLimitPolicy value) {
            this.timerRateLimit = value;
            return this;
        }

        public Builder threadSecurity(SecurityPolicy value) {
            this.threadSecurity = value;
            return this;
        }

        public Builder timerSecurity(SecurityPolicy value) {
            this.timerSecurity = value;
            return this;
        }

        public Builder pressure(PressurePolicy value) {
            this.pressure = value;
            return this;
        }

        public Builder statsLogInterval(Duration value) {
            this.statsLogInterval = value;
            return this;
        }

        public GovernorLimits build() {
            return new GovernorLimits(
                maxTotalThreads,
                maxBackgroundThreads,
                maxThreadsPerComponent,
                maxConcurrentOperations,
                threadTimeout,
                maxThreadMemoryMb,
                maxTotalTimers,
                maxTimersPerComponent,
                defaultTimerTimeout,
                cleanupInterval,
                threadRateLimit,
                timerRateLimit,
                threadSecurity,
                timerSecurity,
                pressure,
                statsLogInterval
            );
        }
    }
}
