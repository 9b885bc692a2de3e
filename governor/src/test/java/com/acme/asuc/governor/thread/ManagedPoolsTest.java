package com.acme.asuc.governor.thread;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManagedPoolsTest {

    @Test
    void shouldReusePoolAndClampWorkers() throws Exception {
        try (ManagedPools pools = new ManagedPools(2)) {
            ExecutorService first = pools.pool("fetch", 16);
            assertSame(first, pools.pool("fetch", 1));
            assertEquals(1, pools.size());

            Set<String> workerNames = ConcurrentHashMap.newKeySet();
            CountDownLatch done = new CountDownLatch(20);
            for (int i = 0; i < 20; i++) {
                first.execute(() -> {
                    workerNames.add(Thread.currentThread().getName());
                    done.countDown();
                });
            }
            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertTrue(workerNames.size() <= 2, "workers: " + workerNames);
            assertTrue(workerNames.stream().allMatch(n -> n.startsWith("pool_fetch")));
        }
    }

    @Test
    void shouldShutDownEveryPool() {
        ManagedPools pools = new ManagedPools(4);
        ExecutorService a = pools.pool("a", 2);
        ExecutorService b = pools.pool("b", 2);
        a.execute(() -> { });

        assertEquals(2, pools.shutdownAll(Duration.ofSeconds(5)));
        assertTrue(a.isShutdown());
        assertTrue(b.isShutdown());
        assertEquals(0, pools.size());
    }
}
