package com.mouse.keeper.service;

import com.mouse.keeper.config.SiteCatalog;
import com.mouse.keeper.interfaces.ChallengeSession;
import com.mouse.keeper.manager.AccountPool;
import com.mouse.keeper.manager.SiteFailoverController;
import com.mouse.keeper.model.AccountHealthView;
import com.mouse.keeper.model.ChallengeCacheStatus;
import com.mouse.keeper.model.FailoverSnapshot;
import com.mouse.keeper.model.GatewayStatus;
import com.mouse.keeper.model.Site;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Assembles the health view from the public state of each component.
 */
@Service
@RequiredArgsConstructor
public class GatewayStatusService {

    private final SiteFailoverController failover;
    private final SiteCatalog siteCatalog;
    private final AccountPool accountPool;
    private final ChallengeCookieCache cookieCache;
    private final ChallengeSession session;
    private final CheckinService checkinService;
    private final ApiKeyValidationService apiKeyValidationService;
    private final Clock clock;

    public GatewayStatus status() {
        FailoverSnapshot snapshot = failover.snapshot();
        List<AccountHealthView> accounts = accountPool.snapshot();
        List<ChallengeCacheStatus> challenge = siteCatalog.inFailoverOrder().stream()
                .filter(Site::isRequiresChallenge)
                .map(cookieCache::status)
                .toList();
        int eligible = (int) accounts.stream().filter(AccountHealthView::isEligible).count();

        return GatewayStatus.builder()
                .status(eligible > 0 && !snapshot.isBackupsExhausted() ? "healthy" : "degraded")
                .timestamp(clock.instant())
                .activeSite(snapshot.getActiveSite())
                .sites(siteCatalog.inFailoverOrder())
                .failover(snapshot)
                .totalAccounts(accounts.size())
                .eligibleAccounts(eligible)
                .accounts(accounts)
                .challenge(challenge)
                .session(session.status())
                .checkin(checkinService.status())
                .apiKeyValidation(apiKeyValidationService.stats())
                .build();
    }
}
