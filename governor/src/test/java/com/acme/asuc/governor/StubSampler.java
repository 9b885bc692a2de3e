package com.acme.asuc.governor;

import com.acme.asuc.governor.system.SamplingException;
import com.acme.asuc.governor.system.SystemSampler;

/**
 * Sampler with settable readings; {@link #failing()} makes every reading throw.
 */
public final class StubSampler implements SystemSampler {
    private volatile double cpu;
    private volatile double memory;
    private volatile long maxFds = -1L;
    private volatile long processMb;
    private volatile boolean failing;

    public StubSampler(double cpu, double memory) {
        this.cpu = cpu;
        this.memory = memory;
    }

    public static StubSampler idle() {
        return new StubSampler(5.0d, 30.0d);
    }

    public StubSampler cpu(double value) {
        this.cpu = value;
        return this;
    }

    public StubSampler memory(double value) {
        this.memory = value;
        return this;
    }

    public StubSampler maxFileDescriptors(long value) {
        this.maxFds = value;
        return this;
    }

    public StubSampler processMemoryMb(long value) {
        this.processMb = value;
        return this;
    }

    public StubSampler failing() {
        this.failing = true;
        return this;
    }

    @Override
    public double cpuPercent() {
        if (failing) {
            throw new SamplingException("cpu unavailable");
        }
        return cpu;
    }

    @Override
    public double memoryPercent() {
        if (failing) {
            throw new SamplingException("memory unavailable");
        }
        return memory;
    }

    @Override
    public long maxFileDescriptors() {
        if (failing) {
            throw new SamplingException("fd limit unavailable");
        }
        return maxFds;
    }

    @Override
    public long processMemoryMb() {
        return processMb;
    }
}
