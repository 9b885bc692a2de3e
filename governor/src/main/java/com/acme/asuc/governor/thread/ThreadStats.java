package com.acme.asuc.governor.thread;

import com.acme.asuc.governor.DenialReason;

import java.util.Map;
import java.util.Set;

public record ThreadStats(int totalActive,
                          int background,
                          int foreground,
                          Map<String, Integer> componentBreakdown,
                          int registrySize,
                          int maxTotal,
                          int maxBackground,
                          int maxPerComponent,
                          Set<String> blockedComponents,
                          boolean suspiciousActivity,
                          long failureCount,
                          Map<DenialReason, Long> failuresByReason,
                          long rateLimited,
                          Double cpuPercent,
                          Double memoryPercent) {}
