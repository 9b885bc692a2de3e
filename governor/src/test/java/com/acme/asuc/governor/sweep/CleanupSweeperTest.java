package com.acme.asuc.governor.sweep;

import com.acme.asuc.governor.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CleanupSweeperTest {

    private static Sweepable target(String name, int reclaimed, List<Long> calls) {
        return new Sweepable() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int sweep(long nowNanos) {
                calls.add(nowNanos);
                return reclaimed;
            }
        };
    }

    @Test
    void shouldSweepOnlyOnceIntervalElapsed() {
        ManualClock clock = new ManualClock();
        List<Long> calls = new CopyOnWriteArrayList<>();
        CleanupSweeper sweeper = new CleanupSweeper(
            List.of(target("threads", 2, calls), target("timers", 1, calls)), Duration.ofSeconds(30), clock);

        clock.advance(Duration.ofSeconds(29));
        assertEquals(0, sweeper.sweepIfDue());
        assertTrue(calls.isEmpty());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(3, sweeper.sweepIfDue());
        assertEquals(List.of(clock.getAsLong(), clock.getAsLong()), calls);

        assertEquals(0, sweeper.sweepIfDue());
    }

    @Test
    void shouldKeepSweepingOtherTargetsWhenOneFails() {
        ManualClock clock = new ManualClock();
        List<Long> calls = new CopyOnWriteArrayList<>();
        Sweepable broken = new Sweepable() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public int sweep(long nowNanos) {
                throw new IllegalStateException("sweep failed");
            }
        };
        CleanupSweeper sweeper = new CleanupSweeper(List.of(broken, target("timers", 4, calls)), Duration.ofSeconds(1), clock);
        assertEquals(4, sweeper.sweepNow());
        assertEquals(1, calls.size());
    }

    @Test
    void shouldSweepPeriodicallyOnceStarted() throws Exception {
        CountDownLatch swept = new CountDownLatch(2);
        Sweepable counting = new Sweepable() {
            @Override
            public String name() {
                return "counting";
            }

            @Override
            public int sweep(long nowNanos) {
                swept.countDown();
                return 0;
            }
        };
        try (CleanupSweeper sweeper = new CleanupSweeper(List.of(counting), Duration.ofMillis(20), System::nanoTime)) {
            sweeper.start();
            assertTrue(sweeper.isRunning());
            assertTrue(swept.await(5, TimeUnit.SECONDS));
            sweeper.close();
            assertFalse(sweeper.isRunning());
        }
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> new CleanupSweeper(List.of(), Duration.ZERO, System::nanoTime));
    }
}
