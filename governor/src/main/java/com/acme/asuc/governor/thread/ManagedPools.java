package com.acme.asuc.governor.thread;

import io.netty.util.concurrent.DefaultThreadFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Named worker pools with a global cap on workers per pool.
 *
 * <p>A pool is created on first request and reused afterwards; the worker count of
 * the first request wins.</p>
 */
public final class ManagedPools implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ManagedPools.class.getName());

    private final int maxWorkersPerPool;
    private final Map<String, ExecutorService> pools = new LinkedHashMap<>();

    public ManagedPools(int maxWorkersPerPool) {
        this.maxWorkersPerPool = Math.max(1, maxWorkersPerPool);
    }

    public synchronized ExecutorService pool(String poolId, int maxWorkers) {
        Objects.requireNonNull(poolId, "poolId");
        ExecutorService existing = pools.get(poolId);
        if (existing != null) {
            return existing;
        }
        int workers = Math.max(1, Math.min(maxWorkers, maxWorkersPerPool));
        ExecutorService created = Executors.newFixedThreadPool(workers, new DefaultThreadFactory("pool_" + poolId, true));
        pools.put(poolId, created);
        LOG.fine(() -> "Created thread pool " + poolId + " with " + workers + " workers");
        return created;
    }

    public synchronized int size() {
        return pools.size();
    }

    /**
     * Shuts every pool down and waits up to {@code timeout} for each one.
     *
     * @return number of pools that terminated within the timeout
     */
    public synchronized int shutdownAll(Duration timeout) {
        int terminated = 0;
        boolean interrupted = false;
        for (Map.Entry<String, ExecutorService> e : pools.entrySet()) {
            ExecutorService pool = e.getValue();
            if (interrupted) {
                pool.shutdownNow();
                continue;
            }
            pool.shutdown();
            try {
                if (pool.awaitTermination(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                    terminated++;
                    LOG.fine(() -> "Shutdown thread pool " + e.getKey());
                } else {
                    LOG.warning(() -> "Thread pool " + e.getKey() + " did not terminate within " + timeout.toMillis() + "ms");
                    pool.shutdownNow();
                }
            } catch (InterruptedException ie) {
                LOG.log(Level.WARNING, "Interrupted while shutting down pool " + e.getKey(), ie);
                pool.shutdownNow();
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        pools.clear();
        return terminated;
    }

    @Override
    public void close() {
        shutdownAll(Duration.ofSeconds(30));
    }
}
