package com.acme.asuc.governor.system;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class JvmSystemSamplerTest {

    @Test
    void shouldReportPercentagesOrSamplingFailure() {
        JvmSystemSampler sampler = new JvmSystemSampler();
        try {
            double memory = sampler.memoryPercent();
            assertTrue(memory >= 0.0d && memory <= 100.0d, "memory: " + memory);
        } catch (SamplingException expected) {
            // platform without the extended bean
        }
        try {
            double cpu = sampler.cpuPercent();
            assertTrue(cpu >= 0.0d && cpu <= 100.0d, "cpu: " + cpu);
        } catch (SamplingException expected) {
            // first reading may not be ready
        }
        assertTrue(sampler.processMemoryMb() >= 0L);
    }
}
