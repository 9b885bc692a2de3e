package com.acme.asuc.governor;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Nano clock that only moves when a test advances it.
 */
public final class ManualClock implements LongSupplier {
    private final AtomicLong nanos;

    public ManualClock() {
        this(1_000_000_000L);
    }

    public ManualClock(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long getAsLong() {
        return nanos.get();
    }

    public long advance(Duration by) {
        return nanos.addAndGet(by.toNanos());
    }

    public long advanceMillis(long millis) {
        return nanos.addAndGet(millis * 1_000_000L);
    }

    public void set(long value) {
        nanos.set(value);
    }
}
