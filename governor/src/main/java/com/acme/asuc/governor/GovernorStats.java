package com.acme.asuc.governor;

import com.acme.asuc.governor.thread.ThreadStats;
import com.acme.asuc.governor.timer.TimerStats;
import com.acme.asuc.governor.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only diagnostics for a status panel: the headline thread counts plus the
 * full thread and timer breakdowns. {@code cpu} and {@code memory} are {@code null}
 * when sampling failed.
 */
public record GovernorStats(int total,
                            int background,
                            Map<String, Integer> perComponent,
                            boolean suspicious,
                            Double cpu,
                            Double memory,
                            ThreadStats threads,
                            TimerStats timers) {

    public GovernorStats {
        perComponent = Map.copyOf(perComponent);
        Objects.requireNonNull(threads, "threads");
        Objects.requireNonNull(timers, "timers");
    }

    public static GovernorStats of(ThreadStats threads, TimerStats timers) {
        return new GovernorStats(
            threads.totalActive(),
            threads.background(),
            threads.componentBreakdown(),
            threads.suspiciousActivity() || timers.suspiciousActivity(),
            threads.cpuPercent(),
            threads.memoryPercent(),
            threads,
            timers
        );
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> failures = new LinkedHashMap<>();
        threads.failuresByReason().forEach((reason, count) -> failures.put(reason.code(), count));

        Map<String, Object> threadPart = new LinkedHashMap<>();
        threadPart.put("total", threads.totalActive());
        threadPart.put("background", threads.background());
        threadPart.put("foreground", threads.foreground());
        threadPart.put("maxTotal", threads.maxTotal());
        threadPart.put("maxBackground", threads.maxBackground());
        threadPart.put("maxPerComponent", threads.maxPerComponent());
        threadPart.put("perComponent", threads.componentBreakdown());
        threadPart.put("blockedComponents", threads.blockedComponents());
        threadPart.put("failureCount", threads.failureCount());
        threadPart.put("failuresByReason", failures);
        threadPart.put("rateLimited", threads.rateLimited());

        Map<String, Object> timerPart = new LinkedHashMap<>();
        timerPart.put("total", timers.totalTimers());
        timerPart.put("maxTotal", timers.maxTotalTimers());
        timerPart.put("maxPerComponent", timers.maxPerComponent());
        timerPart.put("perComponent", timers.componentCounts());
        timerPart.put("recentCreations", timers.recentCreationCount());
        timerPart.put("rateLimited", timers.rateLimited());
        timerPart.put("failureCount", timers.failureCount());
        timerPart.put("nearLimit", timers.componentsNearLimit());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("total", total);
        payload.put("background", background);
        payload.put("perComponent", perComponent);
        payload.put("suspicious", suspicious);
        payload.put("cpu", cpu);
        payload.put("memory", memory);
        payload.put("threads", threadPart);
        payload.put("timers", timerPart);
        return payload;
    }

    public String toJson() throws JsonProcessingException {
        return JsonCodec.writeString(toPayload());
    }
}
