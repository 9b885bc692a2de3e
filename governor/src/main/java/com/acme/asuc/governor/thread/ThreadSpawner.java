package com.acme.asuc.governor.thread;

/**
 * Creates (but does not start) platform threads for managed work.
 */
@FunctionalInterface
public interface ThreadSpawner {
    Thread newThread(Runnable task, String name, boolean daemon);
}
