package com.acme.asuc.governor.thread;

import com.acme.asuc.governor.GovernorLimits;
import com.acme.asuc.governor.StubSampler;
import com.acme.asuc.governor.accounting.ResourceAccountant;
import com.acme.asuc.governor.ratelimit.RateLimitPolicy;
import com.acme.asuc.governor.ratelimit.SlidingWindowRateLimiter;
import com.acme.asuc.governor.security.ComponentBlockList;
import com.acme.asuc.governor.security.SecurityMonitor;
import com.acme.asuc.governor.security.SecurityPolicy;
import com.acme.asuc.governor.system.ResourcePressureCheck;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadGovernorConcurrencyTest {

    @Test
    void shouldNeverExceedCeilingsUnderConcurrentAdmission() throws Exception {
        GovernorLimits limits = GovernorLimits.builder()
            .maxTotalThreads(8)
            .maxBackgroundThreads(5)
            .maxThreadsPerComponent(3)
            .threadRateLimit(new RateLimitPolicy(100_000, Duration.ofSeconds(1)))
            .threadSecurity(new SecurityPolicy(1_000_000, 1_000_000, Duration.ofSeconds(10), Duration.ofSeconds(60), 100))
            .build();
        ThreadGovernor governor = new ThreadGovernor(
            limits,
            new ResourceAccountant(),
            new ComponentBlockList(),
            new ResourcePressureCheck(limits.pressure(), StubSampler.idle(), System::nanoTime),
            new SecurityMonitor("thread", limits.threadSecurity()),
            new SlidingWindowRateLimiter("thread", limits.threadRateLimit()),
            new NettyThreadSpawner("stress"),
            System::nanoTime);

        String[] components = {"feeds", "packages", "panel", "tray"};
        AtomicInteger running = new AtomicInteger();
        AtomicInteger runningBackground = new AtomicInteger();
        Map<String, AtomicInteger> runningByComponent = new ConcurrentHashMap<>();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger maxBackground = new AtomicInteger();
        AtomicInteger maxPerComponent = new AtomicInteger();
        List<Thread> admitted = new CopyOnWriteArrayList<>();
        AtomicInteger nextId = new AtomicInteger();

        int submitters = 6;
        int attemptsEach = 300;
        ExecutorService pool = Executors.newFixedThreadPool(submitters);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[submitters];
            for (int s = 0; s < submitters; s++) {
                futures[s] = pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < attemptsEach; i++) {
                        int id = nextId.getAndIncrement();
                        String component = components[id % components.length];
                        boolean background = id % 2 == 0;
                        Optional<Thread> thread = governor.createManaged("w" + id, () -> {
                            AtomicInteger mine = runningByComponent.computeIfAbsent(component, k -> new AtomicInteger());
                            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                            maxPerComponent.accumulateAndGet(mine.incrementAndGet(), Math::max);
                            if (background) {
                                maxBackground.accumulateAndGet(runningBackground.incrementAndGet(), Math::max);
                            }
                            LockSupport.parkNanos(200_000L);
                            if (background) {
                                runningBackground.decrementAndGet();
                            }
                            mine.decrementAndGet();
                            running.decrementAndGet();
                        }, background, component);
                        thread.ifPresent(admitted::add);
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        for (Thread t : admitted) {
            t.join(5_000L);
        }

        assertFalse(admitted.isEmpty());
        assertTrue(maxRunning.get() <= 8, "total ceiling exceeded: " + maxRunning.get());
        assertTrue(maxBackground.get() <= 5, "background ceiling exceeded: " + maxBackground.get());
        assertTrue(maxPerComponent.get() <= 3, "component ceiling exceeded: " + maxPerComponent.get());
        assertEquals(0, governor.activeCount());
        assertEquals(0, governor.stats().totalActive());
    }
}
