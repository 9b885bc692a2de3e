package com.acme.asuc.governor.accounting;

import java.util.Map;

public record AccountantSnapshot(int totalThreads,
                                 int backgroundThreads,
                                 Map<String, Integer> threadsByComponent,
                                 int totalTimers,
                                 Map<String, Integer> timersByComponent) {

    public AccountantSnapshot {
        threadsByComponent = Map.copyOf(threadsByComponent);
        timersByComponent = Map.copyOf(timersByComponent);
    }

    public int foregroundThreads() {
        return totalThreads - backgroundThreads;
    }
}
