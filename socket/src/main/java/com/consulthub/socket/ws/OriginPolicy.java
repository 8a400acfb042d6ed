package com.consulthub.socket.ws;

/**
 * Allow/deny decision for the {@code Origin} header of an upgrade request.
 * Evaluated once per upgrade attempt.
 */
@FunctionalInterface
public interface OriginPolicy {

    /**
     * @param origin value of the Origin header, or null if absent
     * @return true if the upgrade may proceed
     */
    boolean isAllowed(String origin);
}
