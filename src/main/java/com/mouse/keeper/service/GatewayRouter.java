package com.mouse.keeper.service;

import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.enums.FailureKind;
import com.mouse.keeper.enums.GatewayErrorReason;
import com.mouse.keeper.exception.ChallengeCacheException;
import com.mouse.keeper.exception.GatewayException;
import com.mouse.keeper.exception.NoEligibleAccountException;
import com.mouse.keeper.exception.SitesExhaustedException;
import com.mouse.keeper.exception.UpstreamRejectedException;
import com.mouse.keeper.manager.AccountPool;
import com.mouse.keeper.manager.SiteFailoverController;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.InboundRequest;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.model.UpstreamResponse;
import com.mouse.keeper.utils.DecompressionUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for every forwarded API call and the only place that decides retries.
 * <p>
 * Each attempt reads the active site, gets its challenge cookies, picks an account not yet
 * tried and forwards. Account-level failures exclude the account and try again; site-level
 * failures invalidate the site's cookies, report the site and try again on whatever site is
 * active next. Only the three {@link GatewayErrorReason}s leave this class.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayRouter {

    private static final int DETAIL_LIMIT = 300;

    private final SiteFailoverController failover;
    private final ChallengeCookieCache cookieCache;
    private final AccountPool accountPool;
    private final UpstreamForwarder forwarder;
    private final UpstreamFailureClassifier classifier;
    private final KeeperProperties properties;

    /**
     * @return the upstream response to stream back; the caller must close it
     * @throws GatewayException when no attempt produced a deliverable response
     */
    public UpstreamResponse route(InboundRequest request) {
        int maxAttempts = properties.getRouter().getMaxAccountRetries();
        Set<String> tried = new LinkedHashSet<>();
        Throwable lastCause = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Site site = failover.activeSite();

            Map<String, String> cookies;
            try {
                cookies = cookieCache.getCookies(site);
            } catch (ChallengeCacheException e) {
                onChallengeUnavailable(site, e);
                lastCause = e;
                continue;
            }

            Account account;
            try {
                account = accountPool.selectAccount(tried);
            } catch (NoEligibleAccountException e) {
                if (tried.isEmpty()) {
                    throw new GatewayException(GatewayErrorReason.NO_ACCOUNT_AVAILABLE, e.getMessage(), e);
                }
                throw new GatewayException(GatewayErrorReason.ALL_ACCOUNTS_EXHAUSTED,
                        "Every eligible account failed, tried " + tried, lastCause != null ? lastCause : e);
            }

            log.info("[{}/{}] {} {} -> {} as {}", attempt, maxAttempts, request.getMethod(), request.getPath(),
                    site.getName(), account.getName());

            UpstreamResponse response;
            try {
                response = forwarder.forward(site, account, cookies, request);
            } catch (IOException e) {
                FailureKind kind = classifier.classify(e);
                lastCause = e;
                log.warn("[{}] {} for account {}: {}", site.getName(), kind, account.getName(), e.toString());
                if (kind.isSiteLevel()) {
                    onSiteFailure(site, kind + ": " + e.getMessage(), e);
                } else {
                    onAccountFailure(account, kind, tried);
                }
                continue;
            }

            FailureKind kind;
            String detail = null;
            try {
                String body = null;
                if (response.status() >= 400) {
                    body = DecompressionUtil.decode(response.bufferBody(), response.header("Content-Encoding"));
                    detail = abbreviate(body);
                }
                kind = classifier.classify(site, response.status(), response.header("Content-Type"), body);
            } catch (IOException e) {
                response.close();
                kind = classifier.classify(e);
                lastCause = e;
                log.warn("[{}] Reading error body failed for account {}: {}", site.getName(), account.getName(), e.toString());
                if (kind.isSiteLevel()) {
                    onSiteFailure(site, kind + ": " + e.getMessage(), e);
                } else {
                    onAccountFailure(account, kind, tried);
                }
                continue;
            }

            if (kind == FailureKind.DELIVERED) {
                accountPool.reportSuccess(account.getName());
                failover.reportSiteSuccess(site);
                return response;
            }

            response.close();
            lastCause = new UpstreamRejectedException(site.getName(), account.getName(), response.status(), kind, detail);
            log.warn("[{}] {} (HTTP {}) for account {}: {}", site.getName(), kind, response.status(),
                    account.getName(), detail);
            if (kind.isSiteLevel()) {
                onSiteFailure(site, kind + " (HTTP " + response.status() + ")", lastCause);
            } else {
                onAccountFailure(account, kind, tried);
            }
        }

        throw new GatewayException(GatewayErrorReason.ALL_ACCOUNTS_EXHAUSTED,
                "Gave up after " + maxAttempts + " attempts, tried accounts " + tried, lastCause);
    }

    private void onAccountFailure(Account account, FailureKind kind, Set<String> tried) {
        accountPool.reportFailure(account.getName(), kind);
        tried.add(account.getName());
    }

    /** The site's cookies are dropped and the site reported; accounts are not penalized. */
    private void onSiteFailure(Site site, String detail, Throwable cause) {
        cookieCache.invalidate(site);
        try {
            failover.reportSiteFailure(site, detail);
        } catch (SitesExhaustedException e) {
            e.addSuppressed(cause);
            throw new GatewayException(GatewayErrorReason.ALL_ACCOUNTS_EXHAUSTED,
                    "No site left to retry on: " + e.getMessage(), e);
        }
    }

    /**
     * Retrying helps only if the failure moved traffic to another site.
     */
    private void onChallengeUnavailable(Site site, ChallengeCacheException e) {
        log.error("[{}] Challenge unavailable: {}", site.getName(), e.getMessage());
        Site next;
        try {
            next = failover.reportSiteFailure(site, "challenge unavailable: " + e.getMessage());
        } catch (SitesExhaustedException exhausted) {
            exhausted.addSuppressed(e);
            throw new GatewayException(GatewayErrorReason.CHALLENGE_UNAVAILABLE,
                    "Challenge unavailable on " + site.getName() + " and no site left: " + e.getMessage(), exhausted);
        }
        if (next.getName().equals(site.getName())) {
            throw new GatewayException(GatewayErrorReason.CHALLENGE_UNAVAILABLE,
                    "Challenge unavailable on " + site.getName() + ": " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        return trimmed.length() > DETAIL_LIMIT ? trimmed.substring(0, DETAIL_LIMIT) + "..." : trimmed;
    }
}
