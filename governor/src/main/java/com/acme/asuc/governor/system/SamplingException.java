package com.acme.asuc.governor.system;

/**
 * Thrown by a {@link SystemSampler} that cannot produce a reading.
 * Admission treats it as "no pressure" and proceeds.
 */
public final class SamplingException extends RuntimeException {

    public SamplingException(String message) {
        super(message);
    }
}
