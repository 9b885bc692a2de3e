package com.acme.asuc.governor.security;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds for the security monitor.
 *
 * @param failureWarnThreshold failure count above which every further failure logs a warning
 * @param burstThreshold       creations inside {@code burstWindow} above which the activity is flagged
 * @param burstWindow          trailing window for the creation-burst heuristic
 * @param suspicionHorizon     how long a flagged pattern keeps admissions closed
 * @param historySize          bound of the recent-creation history
 */
public record SecurityPolicy(int failureWarnThreshold,
                             int burstThreshold,
                             Duration burstWindow,
                             Duration suspicionHorizon,
                             int historySize) {

    public SecurityPolicy {
        Objects.requireNonNull(burstWindow, "burstWindow");
        Objects.requireNonNull(suspicionHorizon, "suspicionHorizon");
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1: " + historySize);
        }
    }
}
