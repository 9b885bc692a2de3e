package com.acme.asuc.governor.system;

import com.acme.asuc.governor.ManualClock;
import com.acme.asuc.governor.StubSampler;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourcePressureCheckTest {
    private static final PressurePolicy POLICY = new PressurePolicy(
        80.0d, 85.0d, 15.0d, 95.0d, 98.0d, 0.8d, Duration.ofSeconds(30));

    private final ManualClock clock = new ManualClock();
    private final StubSampler sampler = StubSampler.idle();
    private final ResourcePressureCheck check = new ResourcePressureCheck(POLICY, sampler, clock);

    @Test
    void shouldAllowHighCpuDuringStartupGraceUpToRelaxedThreshold() {
        sampler.cpu(90.0d);
        assertTrue(check.inStartupGrace(clock.getAsLong()));
        assertTrue(check.allows("feeds", WorkloadClass.STANDARD, 0));

        clock.advance(Duration.ofSeconds(30));
        assertFalse(check.inStartupGrace(clock.getAsLong()));
        assertFalse(check.allows("feeds", WorkloadClass.STANDARD, 0));
    }

    @Test
    void shouldRelaxCpuForLongRunningChecksUntilHardStop() {
        clock.advance(Duration.ofMinutes(1));
        sampler.cpu(96.0d);
        assertFalse(check.allows("feeds", WorkloadClass.STANDARD, 0));
        assertTrue(check.allows("pkg_check", WorkloadClass.LONG_RUNNING_CHECK, 0));

        sampler.cpu(98.5d);
        assertFalse(check.allows("pkg_check", WorkloadClass.LONG_RUNNING_CHECK, 0));
    }

    @Test
    void shouldAlwaysEnforceMemory() {
        sampler.memory(90.0d);
        assertFalse(check.allows("feeds", WorkloadClass.STANDARD, 0));
        assertFalse(check.allows("pkg_check", WorkloadClass.LONG_RUNNING_CHECK, 0));
    }

    @Test
    void shouldDenyNearFileDescriptorLimit() {
        sampler.maxFileDescriptors(100L);
        assertTrue(check.allows("feeds", WorkloadClass.STANDARD, 80));
        assertFalse(check.allows("feeds", WorkloadClass.STANDARD, 81));
    }

    @Test
    void shouldFailOpenWhenSamplingFails() {
        sampler.failing();
        clock.advance(Duration.ofMinutes(1));
        assertTrue(check.allows("feeds", WorkloadClass.STANDARD, 0));

        SystemSample sample = check.sample();
        assertNull(sample.cpuPercent());
        assertNull(sample.memoryPercent());
    }

    @Test
    void shouldSampleReadings() {
        sampler.cpu(12.5d).memory(40.0d);
        SystemSample sample = check.sample();
        assertEquals(12.5d, sample.cpuPercent());
        assertEquals(40.0d, sample.memoryPercent());
    }
}
