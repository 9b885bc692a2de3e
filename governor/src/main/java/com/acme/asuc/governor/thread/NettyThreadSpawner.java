package com.acme.asuc.governor.thread;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.util.Objects;

/**
 * {@link ThreadSpawner} on Netty's {@link DefaultThreadFactory}, one factory per daemon flag.
 */
public final class NettyThreadSpawner implements ThreadSpawner {
    private final DefaultThreadFactory daemonFactory;
    private final DefaultThreadFactory userFactory;

    public NettyThreadSpawner() {
        this("managed");
    }

    public NettyThreadSpawner(String poolName) {
        Objects.requireNonNull(poolName, "poolName");
        this.daemonFactory = new DefaultThreadFactory(poolName + "-bg", true);
        this.userFactory = new DefaultThreadFactory(poolName + "-fg", false);
    }

    @Override
    public Thread newThread(Runnable task, String name, boolean daemon) {
        Thread t = (daemon ? daemonFactory : userFactory).newThread(task);
        if (name != null && !name.isBlank()) {
            t.setName(name);
        }
        return t;
    }
}
