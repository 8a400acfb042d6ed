package com.consulthub.socket.ws;

import com.consulthub.socket.config.SocketConfig;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Origin policy backed by an explicit allow-list (exact, case-insensitive match).
 * <p>
 * Requests without an Origin header come from non-browser clients; whether they are allowed
 * is configurable.
 * </p>
 */
public class AllowListOriginPolicy implements OriginPolicy {

    private final Set<String> allowedOrigins;
    private final boolean allowMissingOrigin;

    public AllowListOriginPolicy(Collection<String> allowedOrigins, boolean allowMissingOrigin) {
        this.allowedOrigins = allowedOrigins.stream()
            .map(AllowListOriginPolicy::normalize)
            .collect(Collectors.toUnmodifiableSet());
        this.allowMissingOrigin = allowMissingOrigin;
    }

    public static AllowListOriginPolicy fromConfig(SocketConfig config) {
        return new AllowListOriginPolicy(config.getAllowedOrigins(), config.isAllowMissingOrigin());
    }

    @Override
    public boolean isAllowed(String origin) {
        if (origin == null || origin.isBlank()) {
            return allowMissingOrigin;
        }
        return allowedOrigins.contains(normalize(origin));
    }

    private static String normalize(String origin) {
        String trimmed = origin.trim().toLowerCase(Locale.ROOT);
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
