package com.acme.asuc.governor.timer;

/**
 * Handle to one scheduled callback.
 */
public interface ScheduledCallback {
    /** @return {@code true} if the callback will no longer run because of this call */
    boolean cancel();

    boolean isDone();
}
