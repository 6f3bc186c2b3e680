package com.mouse.keeper.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Solved challenge cookies for one site. Never mutated; a refresh swaps in a new entry.
 */
@Value
public class ChallengeCacheEntry {

    String siteName;
    Map<String, String> cookies;
    Instant solvedAt;
    Instant expiresAt;
    Instant refreshDeadline;

    public static ChallengeCacheEntry of(String siteName, Map<String, String> cookies, Instant solvedAt,
                                         Duration ttl, Duration preRefreshWindow) {
        Instant expiresAt = solvedAt.plus(ttl);
        return new ChallengeCacheEntry(
                siteName,
                Collections.unmodifiableMap(new LinkedHashMap<>(cookies)),
                solvedAt,
                expiresAt,
                expiresAt.minus(preRefreshWindow));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isRefreshDue(Instant now) {
        return !now.isBefore(refreshDeadline);
    }

    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
