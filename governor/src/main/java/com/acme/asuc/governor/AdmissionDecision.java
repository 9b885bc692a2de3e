package com.acme.asuc.governor;

/**
 * Outcome of an admission check. A denial is an ordinary result, not an error:
 * callers defer or skip the work.
 */
public sealed interface AdmissionDecision permits AdmissionDecision.Admitted, AdmissionDecision.Denied {
    AdmissionDecision ADMITTED = new Admitted();

    record Admitted() implements AdmissionDecision {}
    record Denied(DenialReason reason) implements AdmissionDecision {}

    static AdmissionDecision deny(DenialReason reason) {
        return new Denied(reason);
    }

    default boolean admitted() {
        return this instanceof Admitted;
    }
}
