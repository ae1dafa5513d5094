package com.polybot.crypto.discovery;

import java.util.List;

/**
 * Counts from one discovery run. {@code errors} holds per-listing failures and, when the listing
 * fetch itself failed, that failure.
 */
public record DiscoveryResult(
        int discovered,
        int matched,
        int excluded,
        int rejected,
        int deactivated,
        List<String> errors
) {

    public static DiscoveryResult fetchFailed(String error) {
        return new DiscoveryResult(0, 0, 0, 0, 0, List.of(error));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
