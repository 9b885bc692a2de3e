package com.acme.asuc.governor;

public enum DenialReason {
    SYSTEM_RESOURCES("system_resources"),
    SUSPICIOUS_ACTIVITY("suspicious_activity"),
    TOTAL_LIMIT("total_limit"),
    BACKGROUND_LIMIT("background_limit"),
    COMPONENT_LIMIT("component_limit"),
    COMPONENT_BLOCKED("component_blocked"),
    RATE_LIMITED("rate_limited"),
    DUPLICATE_ID("duplicate_id"),
    CREATION_ERROR("creation_error"),
    SHUT_DOWN("shut_down");

    private final String code;

    DenialReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
