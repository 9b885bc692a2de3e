package com.acme.asuc.governor.security;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Administrative list of components that may not create threads or timers.
 */
public final class ComponentBlockList {
    private static final Logger LOG = Logger.getLogger(ComponentBlockList.class.getName());

    private final Map<String, String> blocked = new ConcurrentHashMap<>();

    public void block(String componentId, String reason) {
        Objects.requireNonNull(componentId, "componentId");
        String why = reason == null || reason.isBlank() ? "security" : reason;
        blocked.put(componentId, why);
        LOG.warning(() -> "Blocked component " + componentId + " from creating resources: " + why);
    }

    public void blockAll(Collection<String> componentIds, String reason) {
        for (String componentId : componentIds) {
            if (componentId != null) {
                block(componentId, reason);
            }
        }
    }

    /** @return {@code true} if the component was blocked */
    public boolean unblock(String componentId) {
        if (componentId == null) {
            return false;
        }
        boolean removed = blocked.remove(componentId) != null;
        if (removed) {
            LOG.info(() -> "Unblocked component " + componentId);
        }
        return removed;
    }

    public boolean isBlocked(String componentId) {
        return componentId != null && blocked.containsKey(componentId);
    }

    public Set<String> blockedComponents() {
        return Set.copyOf(blocked.keySet());
    }
}
