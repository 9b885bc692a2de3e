package com.acme.asuc.governor.timer;

/**
 * Cooperative single-threaded scheduler hosting timer callbacks (a UI event loop).
 *
 * <p>Callbacks may schedule further callbacks.</p>
 */
public interface TimerScheduler {
    ScheduledCallback schedule(long delayMillis, Runnable callback);

    default boolean cancel(ScheduledCallback handle) {
        return handle != null && handle.cancel();
    }
}
