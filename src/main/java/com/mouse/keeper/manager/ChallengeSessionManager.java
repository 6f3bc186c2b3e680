package com.mouse.keeper.manager;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.enums.SessionFailureReason;
import com.mouse.keeper.exception.SessionException;
import com.mouse.keeper.interfaces.BrowserHandle;
import com.mouse.keeper.interfaces.BrowserLauncher;
import com.mouse.keeper.interfaces.ChallengeSession;
import com.mouse.keeper.model.SessionStatus;
import com.mouse.keeper.model.Site;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single long-lived browser used to solve the anti-bot challenge.
 * <p>
 * Lock order is always {@code solveLock} then {@code creationLock}. A session that
 * crashed, lost its connection or outlived the restart interval is torn down and
 * replaced before the next use; it is never retried in place.
 */
@Slf4j
@Component
public class ChallengeSessionManager implements ChallengeSession {

    private static final String EMOJI_BROWSER = "🌐";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";

    private final BrowserLauncher launcher;
    private final KeeperProperties properties;
    private final Clock clock;

    private final ReentrantLock creationLock = new ReentrantLock();
    private final ReentrantLock solveLock = new ReentrantLock(true);
    private volatile LiveSession current;

    private final AtomicLong restartCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);
    private final AtomicLong solveCount = new AtomicLong(0);

    private static final class LiveSession {
        private final BrowserHandle handle;
        private final Instant createdAt;
        private final AtomicBoolean crashed = new AtomicBoolean(false);

        private LiveSession(BrowserHandle handle, Instant createdAt) {
            this.handle = handle;
            this.createdAt = createdAt;
        }

        private boolean isStale(Instant now, Duration restartInterval) {
            return Duration.between(createdAt, now).compareTo(restartInterval) >= 0;
        }
    }

    public ChallengeSessionManager(BrowserLauncher launcher, KeeperProperties properties, Clock clock) {
        this.launcher = launcher;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Map<String, String> solve(Site site) {
        solveLock.lock();
        try {
            LiveSession session = acquire();
            solveCount.incrementAndGet();
            Duration timeout = properties.getChallenge().getSolveTimeout();
            log.info("{} Solving challenge for {} ({})", EMOJI_BROWSER, site.getName(), site.challengeUrl());

            Map<String, String> cookies;
            try {
                cookies = session.handle.collectCookies(site.challengeUrl(), timeout);
            } catch (TimeoutException e) {
                markCrashed(session, "challenge timeout");
                throw new SessionException(SessionFailureReason.CHALLENGE_TIMEOUT,
                        "Challenge for " + site.getName() + " did not resolve within " + timeout, e);
            } catch (RuntimeException e) {
                markCrashed(session, e.getMessage());
                throw new SessionException(SessionFailureReason.CRASHED,
                        "Browser session failed while solving " + site.getName() + ": " + e.getMessage(), e);
            }

            List<String> missing = properties.getChallenge().getRequiredCookies().stream()
                    .filter(name -> !cookies.containsKey(name))
                    .toList();
            if (!missing.isEmpty()) {
                errorCount.incrementAndGet();
                log.warn("{} Challenge for {} returned cookies {} but is missing {}",
                        EMOJI_WARNING, site.getName(), cookies.keySet(), missing);
                throw new SessionException(SessionFailureReason.EXTRACTION_FAILED,
                        "Required cookies missing after challenge: " + missing);
            }

            log.info("{} Challenge solved for {}, cookies={}", EMOJI_BROWSER, site.getName(), cookies.keySet());
            return cookies;
        } finally {
            solveLock.unlock();
        }
    }

    /**
     * Waits for any running solve, then replaces the session unconditionally.
     */
    @Override
    public void restart() {
        solveLock.lock();
        try {
            creationLock.lock();
            try {
                log.info("{} Restarting browser session", EMOJI_BROWSER);
                replace(current);
            } finally {
                creationLock.unlock();
            }
        } finally {
            solveLock.unlock();
        }
    }

    @Override
    public boolean isAlive() {
        LiveSession session = current;
        return session != null && !session.crashed.get() && session.handle.isConnected();
    }

    @Override
    public SessionStatus status() {
        LiveSession session = current;
        Instant startedAt = session != null ? session.createdAt : null;
        long uptime = startedAt != null ? Duration.between(startedAt, clock.instant()).getSeconds() : 0;
        return SessionStatus.builder()
                .alive(isAlive())
                .crashed(session != null && session.crashed.get())
                .startedAt(startedAt)
                .uptimeSeconds(Math.max(0, uptime))
                .restartCount(restartCount.get())
                .errorCount(errorCount.get())
                .solveCount(solveCount.get())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        creationLock.lock();
        try {
            teardown(current);
            current = null;
            log.info("{} Browser session stopped", EMOJI_BROWSER);
        } finally {
            creationLock.unlock();
        }
    }

    private LiveSession acquire() {
        LiveSession session = current;
        if (isUsable(session)) {
            return session;
        }

        creationLock.lock();
        try {
            // Another caller may have finished creating while we waited
            session = current;
            if (isUsable(session)) {
                return session;
            }
            if (session != null) {
                log.info("{} Replacing browser session (crashed={}, connected={}, stale={})", EMOJI_WARNING,
                        session.crashed.get(), session.handle.isConnected(),
                        session.isStale(clock.instant(), properties.getSession().getRestartInterval()));
            }
            return replace(session);
        } finally {
            creationLock.unlock();
        }
    }

    private boolean isUsable(LiveSession session) {
        return session != null
                && !session.crashed.get()
                && session.handle.isConnected()
                && !session.isStale(clock.instant(), properties.getSession().getRestartInterval());
    }

    /** Caller holds {@code creationLock}. */
    private LiveSession replace(LiveSession old) {
        teardown(old);
        current = null;

        BrowserHandle handle;
        try {
            handle = launcher.launch();
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            log.error("{} Failed to launch browser: {}", EMOJI_ERROR, e.getMessage());
            throw new SessionException(SessionFailureReason.CRASHED, "Failed to launch browser: " + e.getMessage(), e);
        }

        LiveSession created = new LiveSession(handle, clock.instant());
        current = created;
        if (old != null) {
            restartCount.incrementAndGet();
        }
        log.info("{} Browser session ready (restarts so far: {})", EMOJI_BROWSER, restartCount.get());
        return created;
    }

    private void markCrashed(LiveSession session, String cause) {
        errorCount.incrementAndGet();
        if (!session.crashed.getAndSet(true)) {
            log.error("{} Browser session marked crashed: {}", EMOJI_ERROR, cause);
        }
    }

    private void teardown(LiveSession session) {
        if (session == null) {
            return;
        }
        try {
            session.handle.close();
        } catch (RuntimeException e) {
            log.warn("{} Error closing browser session: {}", EMOJI_WARNING, e.getMessage());
        }
    }
}
