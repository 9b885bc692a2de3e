package com.acme.asuc.governor.timer;

import java.util.Map;
import java.util.Set;

/**
 * @param componentsNearLimit components holding more than 80% of their timer ceiling
 */
public record TimerStats(int totalTimers,
                         Map<String, Integer> componentCounts,
                         int maxTotalTimers,
                         int maxPerComponent,
                         int recentCreationCount,
                         long rateLimited,
                         long failureCount,
                         boolean suspiciousActivity,
                         Set<String> componentsNearLimit) {

    public TimerStats {
        componentCounts = Map.copyOf(componentCounts);
        componentsNearLimit = Set.copyOf(componentsNearLimit);
    }
}
