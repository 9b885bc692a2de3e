package com.acme.asuc.governor.ratelimit;

/**
 * One admitted creation inside the rate-limit window.
 *
 * @param componentId owning component, or {@code null} for anonymous creations
 */
public record CreationRecord(long timestampNanos, String componentId) {}
