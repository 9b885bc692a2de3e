package com.acme.asuc.governor.system;

/**
 * Point-in-time load readings; a {@code null} field means the reading failed.
 */
public record SystemSample(Double cpuPercent, Double memoryPercent) {}
