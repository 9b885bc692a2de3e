package com.acme.asuc.governor.accounting;

import java.util.Objects;

/**
 * What the accountant needs to know about a live resource to keep its counters.
 *
 * @param componentId owning component, or {@code null} for anonymous resources
 */
public record Registration(String id, ResourceKind kind, boolean background, String componentId) {

    public Registration {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    public static Registration thread(String id, boolean background, String componentId) {
        return new Registration(id, ResourceKind.THREAD, background, componentId);
    }

    public static Registration timer(String id, String componentId) {
        return new Registration(id, ResourceKind.TIMER, false, componentId);
    }
}
