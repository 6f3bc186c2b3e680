package com.mouse.keeper.manager;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.enums.FailureKind;
import com.mouse.keeper.exception.NoEligibleAccountException;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.AccountHealthView;
import com.mouse.keeper.repository.AccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Chooses the account for each upstream attempt and keeps runtime health per account.
 * <p>
 * The account list and the {@code enabled} flag are read from the repository on every
 * selection. Health is per account and guarded by that account's own monitor only.
 */
@Slf4j
@Component
public class AccountPool {

    private static final String EMOJI_DOWN = "🔻";

    private final AccountRepository repository;
    private final KeeperProperties.Pool config;
    private final Clock clock;
    private final ConcurrentMap<String, AccountHealth> health = new ConcurrentHashMap<>();

    public AccountPool(AccountRepository repository, KeeperProperties properties, Clock clock) {
        this.repository = repository;
        this.config = properties.getPool();
        this.clock = clock;
    }

    /**
     * Picks uniformly at random among enabled, healthy accounts with an API key.
     *
     * @throws NoEligibleAccountException if no account qualifies
     */
    public Account selectAccount(Set<String> excluding) {
        Instant now = clock.instant();
        List<Account> candidates = repository.findAll().stream()
                .filter(Account::isEnabled)
                .filter(Account::hasApiKey)
                .filter(a -> !excluding.contains(a.getName()))
                .filter(a -> healthOf(a.getName()).isEligible(now, config.getCooldown()))
                .toList();

        if (candidates.isEmpty()) {
            throw new NoEligibleAccountException("No eligible account (excluded: " + excluding + ")");
        }
        return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
    }

    public void reportSuccess(String name) {
        healthOf(name).recordSuccess();
    }

    /**
     * @throws IllegalArgumentException for outcomes that are not account-level
     */
    public void reportFailure(String name, FailureKind kind) {
        if (!kind.isAccountLevel()) {
            throw new IllegalArgumentException(kind + " is not an account-level failure");
        }
        AccountHealth accountHealth = healthOf(name);
        boolean demoted = accountHealth.recordFailure(kind, clock.instant(), config.getFailureThreshold());
        if (demoted) {
            log.warn("{} Account {} marked unhealthy after {} ({} consecutive failures), cooldown {}",
                    EMOJI_DOWN, name, kind, accountHealth.consecutiveFailures(), config.getCooldown());
        } else {
            log.info("Account {} failed with {} ({}/{})", name, kind, accountHealth.consecutiveFailures(),
                    config.getFailureThreshold());
        }
    }

    /** Clears the failure state of an account so it is eligible at once. */
    public void resetHealth(String name) {
        healthOf(name).recordSuccess();
    }

    /** Drops runtime health of accounts that no longer exist. */
    public void retainOnly(Set<String> names) {
        health.keySet().retainAll(names);
    }

    public void forget(String name) {
        health.remove(name);
    }

    /**
     * Re-reads account definitions, keeping runtime health for names that survive.
     */
    public List<Account> reload() {
        List<Account> accounts = repository.reload();
        retainOnly(accounts.stream().map(Account::getName).collect(Collectors.toSet()));
        return accounts;
    }

    public List<AccountHealthView> snapshot() {
        Instant now = clock.instant();
        return repository.findAll().stream()
                .map(a -> healthOf(a.getName()).view(a, now, config.getCooldown()))
                .toList();
    }

    private AccountHealth healthOf(String name) {
        return health.computeIfAbsent(name, n -> new AccountHealth());
    }

    private static final class AccountHealth {

        private boolean healthy = true;
        private int consecutiveFailures;
        private Instant lastFailureAt;
        private FailureKind lastFailureKind;

        synchronized boolean isEligible(Instant now, Duration cooldown) {
            if (healthy) {
                return true;
            }
            if (lastFailureAt != null && Duration.between(lastFailureAt, now).compareTo(cooldown) > 0) {
                healthy = true;
                consecutiveFailures = 0;
                return true;
            }
            return false;
        }

        /** @return true if this failure took the account out of rotation */
        synchronized boolean recordFailure(FailureKind kind, Instant now, int threshold) {
            consecutiveFailures++;
            lastFailureAt = now;
            lastFailureKind = kind;
            if (healthy && (kind.isHard() || consecutiveFailures >= threshold)) {
                healthy = false;
                return true;
            }
            return false;
        }

        synchronized void recordSuccess() {
            healthy = true;
            consecutiveFailures = 0;
        }

        synchronized int consecutiveFailures() {
            return consecutiveFailures;
        }

        synchronized AccountHealthView view(Account account, Instant now, Duration cooldown) {
            boolean coolingDown = !healthy && lastFailureAt != null
                    && Duration.between(lastFailureAt, now).compareTo(cooldown) <= 0;
            return AccountHealthView.builder()
                    .name(account.getName())
                    .enabled(account.isEnabled())
                    .healthy(!coolingDown)
                    .eligible(account.isEnabled() && account.hasApiKey() && !coolingDown)
                    .consecutiveFailures(consecutiveFailures)
                    .lastFailureAt(lastFailureAt)
                    .lastFailureKind(lastFailureKind)
                    .eligibleAgainAt(coolingDown ? lastFailureAt.plus(cooldown) : null)
                    .build();
        }
    }
}
