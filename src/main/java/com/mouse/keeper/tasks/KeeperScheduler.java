package com.mouse.keeper.tasks;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.config.SiteCatalog;
import com.mouse.keeper.interfaces.ChallengeSession;
import com.mouse.keeper.manager.SiteFailoverController;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.service.ChallengeCookieCache;
import com.mouse.keeper.service.CheckinService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background timers. Each task has its own single-thread executor so a slow tick never
 * delays another task, and talks to the core only through public component methods.
 * <p>
 * Shutdown raises a stop flag, lets running ticks finish within a bounded wait, then
 * interrupts what is left.
 */
@Slf4j
@Component
public class KeeperScheduler {

    private static final String EMOJI_START = "🚀";
    private static final String EMOJI_ERROR = "❌";
    private static final long DRAIN_SECONDS = 30;

    private final ChallengeSession session;
    private final ChallengeCookieCache cookieCache;
    private final SiteFailoverController failover;
    private final CheckinService checkinService;
    private final SiteCatalog siteCatalog;
    private final KeeperProperties properties;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final List<ScheduledExecutorService> executors = new ArrayList<>();

    public KeeperScheduler(ChallengeSession session,
                           ChallengeCookieCache cookieCache,
                           SiteFailoverController failover,
                           CheckinService checkinService,
                           SiteCatalog siteCatalog,
                           KeeperProperties properties,
                           Clock clock) {
        this.session = session;
        this.cookieCache = cookieCache;
        this.failover = failover;
        this.checkinService = checkinService;
        this.siteCatalog = siteCatalog;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        boolean anyChallenge = siteCatalog.inFailoverOrder().stream().anyMatch(Site::isRequiresChallenge);

        if (anyChallenge) {
            ScheduledExecutorService warmup = newExecutor("keeper-warmup");
            warmup.execute(() -> runTick("warmup", this::warmUp));

            Duration refreshEvery = properties.getChallenge().getRefreshCheckInterval();
            newExecutor("keeper-challenge-refresh").scheduleWithFixedDelay(
                    () -> runTick("challenge pre-refresh", this::refreshActiveSite),
                    refreshEvery.toMillis(), refreshEvery.toMillis(), TimeUnit.MILLISECONDS);

            Duration restartEvery = properties.getSession().getRestartInterval();
            newExecutor("keeper-session-restart").scheduleWithFixedDelay(
                    () -> runTick("session restart", session::restart),
                    restartEvery.toMillis(), restartEvery.toMillis(), TimeUnit.MILLISECONDS);
        }

        if (properties.getFailover().isPrimaryCheckEnabled() && !siteCatalog.backups().isEmpty()) {
            Duration probeEvery = properties.getFailover().getProbeInterval();
            newExecutor("keeper-primary-probe").scheduleWithFixedDelay(
                    () -> runTick("primary probe", failover::runPrimaryProbe),
                    probeEvery.toMillis(), probeEvery.toMillis(), TimeUnit.MILLISECONDS);
        }

        if (properties.getCheckin().isEnabled()) {
            scheduleNextCheckin(newExecutor("keeper-checkin"));
        }

        log.info("{} Scheduler started: {} timers (challenge sites: {}, primary check: {}, check-in: {})",
                EMOJI_START, executors.size(), anyChallenge, properties.getFailover().isPrimaryCheckEnabled(),
                properties.getCheckin().isEnabled() ? properties.getCheckin().getCron() : "off");
    }

    @PreDestroy
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping scheduler, draining running tasks");
        List<ScheduledExecutorService> all;
        synchronized (executors) {
            all = new ArrayList<>(executors);
        }
        all.forEach(ScheduledExecutorService::shutdown);
        try {
            for (ScheduledExecutorService executor : all) {
                if (!executor.awaitTermination(DRAIN_SECONDS, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            all.forEach(ScheduledExecutorService::shutdownNow);
            Thread.currentThread().interrupt();
        }
    }

    public boolean isStopping() {
        return stopping.get();
    }

    void warmUp() {
        session.restart();
        Site active = failover.activeSite();
        if (active.isRequiresChallenge()) {
            cookieCache.getCookies(active);
        }
    }

    /**
     * Serves the cached cookies and, inside the refresh window, lets the cache start its
     * single background refresh. An expired entry is solved here rather than on a request.
     */
    void refreshActiveSite() {
        Site active = failover.activeSite();
        if (active.isRequiresChallenge()) {
            cookieCache.getCookies(active);
        }
    }

    private void scheduleNextCheckin(ScheduledExecutorService executor) {
        if (stopping.get()) {
            return;
        }
        Instant now = clock.instant();
        Instant next = checkinService.nextRunAfter(now);
        if (next == null) {
            log.warn("Check-in cron {} has no future fire time", properties.getCheckin().getCron());
            return;
        }
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        log.info("Next check-in at {}", next);
        executor.schedule(() -> {
            runTick("check-in", checkinService::runAll);
            scheduleNextCheckin(executor);
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    private void runTick(String name, Runnable task) {
        if (stopping.get()) {
            return;
        }
        try {
            task.run();
        } catch (Exception e) {
            log.error("{} Scheduled {} failed: {}", EMOJI_ERROR, name, e.getMessage());
        }
    }

    private ScheduledExecutorService newExecutor(String name) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        synchronized (executors) {
            executors.add(executor);
        }
        return executor;
    }
}
