package com.acme.asuc.governor.accounting;

public enum ResourceKind {
    THREAD, TIMER
}
