package com.mouse.keeper.manager;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.config.SiteCatalog;
import com.mouse.keeper.exception.SitesExhaustedException;
import com.mouse.keeper.interfaces.SiteProbe;
import com.mouse.keeper.model.FailoverSnapshot;
import com.mouse.keeper.model.ProbeResult;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.model.SiteSwitchedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks which site receives traffic.
 * <p>
 * Reads go through a single {@link AtomicReference} and never lock. Every transition
 * runs under {@code transitionLock} and swaps in a whole new {@link FailoverSnapshot},
 * so a report that arrives after the site already moved on is a no-op.
 * <p>
 * Failures only ever move forward through the backups; the way back to the primary is
 * the recovery probe or an operator switch.
 */
@Slf4j
@Component
public class SiteFailoverController {

    private static final String EMOJI_SWITCH = "🔀";
    private static final String EMOJI_PROBE = "🔍";
    private static final String EMOJI_ERROR = "❌";

    private final SiteCatalog catalog;
    private final SiteProbe probe;
    private final KeeperProperties.Failover config;
    private final Clock clock;
    private final ApplicationEventPublisher events;

    private final Object transitionLock = new Object();
    private final AtomicReference<FailoverSnapshot> state;

    public SiteFailoverController(SiteCatalog catalog,
                                  SiteProbe probe,
                                  KeeperProperties properties,
                                  Clock clock,
                                  ApplicationEventPublisher events) {
        this.catalog = catalog;
        this.probe = probe;
        this.config = properties.getFailover();
        this.clock = clock;
        this.events = events;
        this.state = new AtomicReference<>(FailoverSnapshot.builder()
                .activeIndex(0)
                .activeSite(catalog.primary())
                .build());
    }

    public Site activeSite() {
        return state.get().getActiveSite();
    }

    public FailoverSnapshot snapshot() {
        return state.get();
    }

    /**
     * Records a site-level failure observed on {@code failed}.
     *
     * @return the site that is active once the report has been applied
     * @throws SitesExhaustedException if {@code failed} was the last site in failover order
     */
    public Site reportSiteFailure(Site failed, String cause) {
        SiteSwitchedEvent event;
        Site next;
        synchronized (transitionLock) {
            FailoverSnapshot current = state.get();
            if (!current.getActiveSite().getName().equals(failed.getName())) {
                log.debug("Ignoring failure of {}; active site is already {}", failed.getName(),
                        current.getActiveSite().getName());
                return current.getActiveSite();
            }
            if (current.isBackupsExhausted()) {
                throw new SitesExhaustedException("No site left after " + failed.getName() + " failed: " + cause);
            }

            int failures = current.getConsecutiveActiveSiteFailures() + 1;
            if (failures < config.getFailuresBeforeSwitch()) {
                state.set(current.toBuilder().consecutiveActiveSiteFailures(failures).build());
                log.warn("Site {} failed ({}/{}): {}", failed.getName(), failures,
                        config.getFailuresBeforeSwitch(), cause);
                return failed;
            }

            int nextIndex = current.getActiveIndex() + 1;
            if (nextIndex >= catalog.size()) {
                state.set(current.toBuilder()
                        .backupsExhausted(true)
                        .consecutiveActiveSiteFailures(0)
                        .build());
                log.error("{} Every backup site has failed, staying on {}: {}", EMOJI_ERROR, failed.getName(), cause);
                events.publishEvent(new SiteSwitchedEvent(failed, null, cause));
                throw new SitesExhaustedException("No site left after " + failed.getName() + " failed: " + cause);
            }

            next = catalog.at(nextIndex);
            state.set(current.toBuilder()
                    .activeIndex(nextIndex)
                    .activeSite(next)
                    .lastSwitchTime(clock.instant())
                    .switchCount(current.getSwitchCount() + 1)
                    .consecutiveActiveSiteFailures(0)
                    .consecutivePrimaryProbeSuccesses(0)
                    .consecutivePrimaryProbeFailures(0)
                    .build());
            event = new SiteSwitchedEvent(failed, next, cause);
        }

        log.warn("{} Switched from {} ({}) to {} ({}): {}", EMOJI_SWITCH,
                failed.getName(), failed.getUrl(), next.getName(), next.getUrl(), cause);
        events.publishEvent(event);
        return next;
    }

    /** Resets the failure streak of the active site. */
    public void reportSiteSuccess(Site site) {
        FailoverSnapshot current = state.get();
        if (current.getConsecutiveActiveSiteFailures() == 0 && !current.isBackupsExhausted()) {
            return;
        }
        synchronized (transitionLock) {
            current = state.get();
            if (current.getActiveSite().getName().equals(site.getName())) {
                state.set(current.toBuilder()
                        .consecutiveActiveSiteFailures(0)
                        .backupsExhausted(false)
                        .build());
            }
        }
    }

    /**
     * One tick of the recovery probe. Does nothing while the primary is active or the
     * check is disabled.
     */
    public FailoverSnapshot runPrimaryProbe() {
        if (!config.isPrimaryCheckEnabled() || state.get().isOnPrimary()) {
            return state.get();
        }

        Site primary = catalog.primary();
        ProbeResult result = probe.probe(primary);
        Instant now = clock.instant();

        SiteSwitchedEvent event = null;
        FailoverSnapshot updated;
        synchronized (transitionLock) {
            FailoverSnapshot current = state.get();
            FailoverSnapshot.FailoverSnapshotBuilder builder = current.toBuilder()
                    .lastPrimaryProbeTime(now)
                    .lastProbeResult(result.getDetail());

            if (current.isOnPrimary()) {
                updated = builder.build();
            } else if (!result.isHealthy()) {
                updated = builder
                        .consecutivePrimaryProbeSuccesses(0)
                        .consecutivePrimaryProbeFailures(current.getConsecutivePrimaryProbeFailures() + 1)
                        .build();
                log.info("{} Primary {} still unhealthy: {}", EMOJI_PROBE, primary.getName(), result.getDetail());
            } else {
                int successes = current.getConsecutivePrimaryProbeSuccesses() + 1;
                if (successes >= config.getRecoverySuccessThreshold()) {
                    updated = onPrimary(builder, current, now).build();
                    event = new SiteSwitchedEvent(current.getActiveSite(), primary,
                            "primary recovered after " + successes + " healthy probes");
                } else {
                    updated = builder
                            .consecutivePrimaryProbeSuccesses(successes)
                            .consecutivePrimaryProbeFailures(0)
                            .build();
                    log.info("{} Primary {} healthy ({}/{})", EMOJI_PROBE, primary.getName(), successes,
                            config.getRecoverySuccessThreshold());
                }
            }
            state.set(updated);
        }

        if (event != null) {
            log.info("{} Primary {} recovered, switched back from {}", EMOJI_SWITCH, primary.getName(),
                    event.getFrom().getName());
            events.publishEvent(event);
        }
        return updated;
    }

    /**
     * Health-checked switch back to the primary.
     *
     * @return whether the primary is active afterwards
     */
    public boolean switchToPrimary() {
        if (state.get().isOnPrimary()) {
            return true;
        }
        Site primary = catalog.primary();
        ProbeResult result = probe.probe(primary);
        if (!result.isHealthy()) {
            log.warn("Manual switch to {} refused: {}", primary.getName(), result.getDetail());
            synchronized (transitionLock) {
                state.set(state.get().toBuilder()
                        .lastPrimaryProbeTime(clock.instant())
                        .lastProbeResult(result.getDetail())
                        .build());
            }
            return false;
        }
        moveToPrimary("manual switch, primary healthy");
        return true;
    }

    /** Unconditional switch back to the primary. */
    public void forceSwitchToPrimary() {
        moveToPrimary("forced switch");
    }

    private void moveToPrimary(String reason) {
        Site from;
        synchronized (transitionLock) {
            FailoverSnapshot current = state.get();
            if (current.isOnPrimary()) {
                state.set(current.toBuilder()
                        .consecutiveActiveSiteFailures(0)
                        .backupsExhausted(false)
                        .build());
                return;
            }
            from = current.getActiveSite();
            state.set(onPrimary(current.toBuilder(), current, clock.instant()).build());
        }
        log.info("{} Switched from {} to primary {}: {}", EMOJI_SWITCH, from.getName(), catalog.primary().getName(), reason);
        events.publishEvent(new SiteSwitchedEvent(from, catalog.primary(), reason));
    }

    private FailoverSnapshot.FailoverSnapshotBuilder onPrimary(FailoverSnapshot.FailoverSnapshotBuilder builder,
                                                               FailoverSnapshot current,
                                                               Instant now) {
        return builder
                .activeIndex(0)
                .activeSite(catalog.primary())
                .lastSwitchTime(now)
                .switchCount(current.getSwitchCount() + 1)
                .recoveryCount(current.getRecoveryCount() + 1)
                .consecutivePrimaryProbeSuccesses(0)
                .consecutivePrimaryProbeFailures(0)
                .consecutiveActiveSiteFailures(0)
                .backupsExhausted(false);
    }
}
