package com.mouse.keeper.service;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.enums.ChallengeState;
import com.mouse.keeper.exception.ChallengeCacheException;
import com.mouse.keeper.exception.SessionException;
import com.mouse.keeper.interfaces.ChallengeSession;
import com.mouse.keeper.model.ChallengeCacheEntry;
import com.mouse.keeper.model.ChallengeCacheStatus;
import com.mouse.keeper.model.Site;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-site cache of solved challenge cookies.
 * <p>
 * At most one solve runs per site: whoever registers the in-flight future first does the
 * work, everyone else waits on that future. A fresh entry replaces the old one in the same
 * step that retires the in-flight future, so readers see either the old or the new entry.
 * <p>
 * Inside the pre-refresh window the current cookies are served while a single background
 * refresh runs; once an entry has expired, callers block on a foreground solve.
 */
@Slf4j
@Service
public class ChallengeCookieCache {

    private static final String EMOJI_COOKIE = "🍪";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";

    private final ChallengeSession session;
    private final KeeperProperties.Challenge config;
    private final Clock clock;
    private final Executor refreshExecutor;
    private final ExecutorService ownedExecutor;

    private final ConcurrentMap<String, ChallengeCacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<ChallengeCacheEntry>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SiteStats> stats = new ConcurrentHashMap<>();

    @Autowired
    public ChallengeCookieCache(ChallengeSession session, KeeperProperties properties, Clock clock) {
        this(session, properties, clock, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "challenge-refresh");
            t.setDaemon(true);
            return t;
        }));
    }

    public ChallengeCookieCache(ChallengeSession session, KeeperProperties properties, Clock clock,
                                Executor refreshExecutor) {
        this.session = session;
        this.config = properties.getChallenge();
        this.clock = clock;
        this.refreshExecutor = refreshExecutor;
        this.ownedExecutor = refreshExecutor instanceof ExecutorService es ? es : null;
    }

    /**
     * Cookies that authorize traffic to {@code site}; empty for sites without a challenge.
     *
     * @throws ChallengeCacheException if no valid cookies could be produced
     */
    public Map<String, String> getCookies(Site site) {
        if (!site.isRequiresChallenge()) {
            return Map.of();
        }

        String key = site.getName();
        Instant now = clock.instant();
        ChallengeCacheEntry entry = entries.get(key);

        if (entry != null && !entry.isExpired(now)) {
            statsOf(key).hits.incrementAndGet();
            if (entry.isRefreshDue(now)) {
                startBackgroundRefresh(site);
            }
            return entry.getCookies();
        }

        statsOf(key).misses.incrementAndGet();
        return awaitSolve(site).getCookies();
    }

    /**
     * Cookies of a current, unexpired entry. Never solves, never refreshes, never counts.
     */
    public Optional<Map<String, String>> peekValidCookies(Site site) {
        ChallengeCacheEntry entry = entries.get(site.getName());
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.getCookies());
    }

    /** Drops the entry so the next {@link #getCookies} solves again. */
    public void invalidate(Site site) {
        String key = site.getName();
        inFlight.remove(key);
        if (entries.remove(key) != null) {
            log.info("{} Invalidated challenge cookies for {}", EMOJI_COOKIE, key);
        }
    }

    /** Invalidates and solves at once. */
    public ChallengeCacheStatus refreshNow(Site site) {
        invalidate(site);
        getCookies(site);
        return status(site);
    }

    public ChallengeCacheStatus status(Site site) {
        String key = site.getName();
        SiteStats siteStats = statsOf(key);
        Instant now = clock.instant();
        ChallengeCacheEntry entry = entries.get(key);

        ChallengeCacheStatus.ChallengeCacheStatusBuilder builder = ChallengeCacheStatus.builder()
                .site(key)
                .state(stateOf(site, entry, now))
                .hits(siteStats.hits.get())
                .misses(siteStats.misses.get())
                .solves(siteStats.solves.get())
                .failedSolves(siteStats.failedSolves.get())
                .lastError(siteStats.lastError);

        if (entry != null) {
            builder.ttlSeconds(entry.remaining(now).getSeconds())
                    .cookieNames(new ArrayList<>(entry.getCookies().keySet()))
                    .solvedAt(entry.getSolvedAt())
                    .refreshDeadline(entry.getRefreshDeadline())
                    .expiresAt(entry.getExpiresAt());
        } else {
            builder.cookieNames(List.of());
        }
        return builder.build();
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ChallengeCacheEntry awaitSolve(Site site) {
        String key = site.getName();
        CompletableFuture<ChallengeCacheEntry> mine = new CompletableFuture<>();
        CompletableFuture<ChallengeCacheEntry> existing = inFlight.putIfAbsent(key, mine);

        CompletableFuture<ChallengeCacheEntry> target;
        if (existing == null) {
            // A solve may have published between our miss and the registration
            ChallengeCacheEntry published = entries.get(key);
            if (published != null && !published.isExpired(clock.instant())) {
                inFlight.remove(key, mine);
                mine.complete(published);
                return published;
            }
            runSolve(site, mine, false);
            target = mine;
        } else {
            log.debug("Joining in-flight challenge solve for {}", key);
            target = existing;
        }

        // The solve is bounded by the session's own timeouts and always completes its future
        try {
            return target.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ChallengeCacheException cce) {
                throw cce;
            }
            throw new ChallengeCacheException(key, "Challenge solve failed for " + key + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChallengeCacheException(key, "Interrupted while waiting for challenge solve of " + key, e);
        }
    }

    private void startBackgroundRefresh(Site site) {
        String key = site.getName();
        CompletableFuture<ChallengeCacheEntry> future = new CompletableFuture<>();
        if (inFlight.putIfAbsent(key, future) != null) {
            return;
        }
        ChallengeCacheEntry published = entries.get(key);
        if (published != null && !published.isRefreshDue(clock.instant())) {
            inFlight.remove(key, future);
            future.complete(published);
            return;
        }
        log.info("{} Cookies for {} entered the refresh window, refreshing in background", EMOJI_COOKIE, key);
        try {
            refreshExecutor.execute(() -> runSolve(site, future, true));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, future);
            future.completeExceptionally(e);
            log.warn("{} Background refresh for {} rejected: {}", EMOJI_WARNING, key, e.getMessage());
        }
    }

    private void runSolve(Site site, CompletableFuture<ChallengeCacheEntry> future, boolean background) {
        String key = site.getName();
        SiteStats siteStats = statsOf(key);
        try {
            Map<String, String> cookies = solveWithRetries(site);
            ChallengeCacheEntry fresh = ChallengeCacheEntry.of(key, cookies, clock.instant(),
                    config.getTtl(), config.getPreRefreshWindow());

            // Swap the entry only if this solve is still the registered one
            inFlight.computeIfPresent(key, (k, registered) -> {
                if (registered == future) {
                    entries.put(k, fresh);
                    return null;
                }
                return registered;
            });
            siteStats.lastError = null;
            log.info("{} Cached challenge cookies for {} until {}", EMOJI_COOKIE, key, fresh.getExpiresAt());
            future.complete(fresh);
        } catch (RuntimeException e) {
            inFlight.remove(key, future);
            siteStats.failedSolves.incrementAndGet();
            siteStats.lastError = e.getMessage();
            if (background) {
                log.warn("{} Background refresh for {} failed, serving current cookies until expiry: {}",
                        EMOJI_WARNING, key, e.getMessage());
            } else {
                log.error("{} Challenge solve for {} failed: {}", EMOJI_ERROR, key, e.getMessage());
            }
            future.completeExceptionally(e);
        }
    }

    private Map<String, String> solveWithRetries(Site site) {
        SessionException last = null;
        for (int attempt = 1; attempt <= config.getMaxSolveAttempts(); attempt++) {
            statsOf(site.getName()).solves.incrementAndGet();
            try {
                return session.solve(site);
            } catch (SessionException e) {
                last = e;
                log.warn("{} Solve attempt {}/{} for {} failed ({}): {}", EMOJI_WARNING, attempt,
                        config.getMaxSolveAttempts(), site.getName(), e.getReason(), e.getMessage());
            }
        }
        throw new ChallengeCacheException(site.getName(),
                "Challenge solve failed for " + site.getName() + " after " + config.getMaxSolveAttempts()
                        + " attempts: " + last.getMessage(), last);
    }

    private ChallengeState stateOf(Site site, ChallengeCacheEntry entry, Instant now) {
        if (!site.isRequiresChallenge()) {
            return ChallengeState.NOT_REQUIRED;
        }
        if (inFlight.containsKey(site.getName())) {
            return ChallengeState.REFRESHING;
        }
        if (entry == null) {
            return ChallengeState.EMPTY;
        }
        if (entry.isExpired(now)) {
            return ChallengeState.EXPIRED;
        }
        return entry.isRefreshDue(now) ? ChallengeState.EXPIRING : ChallengeState.VALID;
    }

    private SiteStats statsOf(String key) {
        return stats.computeIfAbsent(key, k -> new SiteStats());
    }

    private static final class SiteStats {
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();
        private final AtomicLong solves = new AtomicLong();
        private final AtomicLong failedSolves = new AtomicLong();
        private volatile String lastError;
    }
}
