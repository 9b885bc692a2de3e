package com.acme.asuc.governor.timer;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerScheduler} over a Netty {@link EventExecutor}. Every callback runs on
 * the executor's single thread, in due order.
 */
public final class EventExecutorTimerScheduler implements TimerScheduler, AutoCloseable {
    private final EventExecutor executor;
    private final boolean owned;

    public EventExecutorTimerScheduler(EventExecutor executor) {
        this(executor, false);
    }

    private EventExecutorTimerScheduler(EventExecutor executor, boolean owned) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.owned = owned;
    }

    /** Creates a scheduler with its own daemon event-loop thread, shut down by {@link #close()}. */
    public static EventExecutorTimerScheduler create(String name) {
        return new EventExecutorTimerScheduler(new DefaultEventExecutor(new DefaultThreadFactory(name, true)), true);
    }

    @Override
    public ScheduledCallback schedule(long delayMillis, Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        ScheduledFuture<?> future = executor.schedule(callback, Math.max(0L, delayMillis), TimeUnit.MILLISECONDS);
        return new FutureCallback(future);
    }

    public EventExecutor executor() {
        return executor;
    }

    @Override
    public void close() {
        if (owned) {
            executor.shutdownGracefully(0L, 1L, TimeUnit.SECONDS);
        }
    }

    private record FutureCallback(ScheduledFuture<?> future) implements ScheduledCallback {
        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
