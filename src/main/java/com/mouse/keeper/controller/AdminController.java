package com.mouse.keeper.controller;

import com.mouse.keeper.interfaces.ChallengeSession;
import com.mouse.keeper.manager.AccountPool;
import com.mouse.keeper.manager.SiteFailoverController;
import com.mouse.keeper.model.Account;
import com.mouse.keeper.model.ChallengeCacheStatus;
import com.mouse.keeper.model.GatewayStatus;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.service.ApiKeyValidationService;
import com.mouse.keeper.service.ChallengeCookieCache;
import com.mouse.keeper.service.GatewayStatusService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator controls and the status view.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AdminController {

    private final GatewayStatusService statusService;
    private final SiteFailoverController failover;
    private final ChallengeCookieCache cookieCache;
    private final ChallengeSession session;
    private final AccountPool accountPool;
    private final ApiKeyValidationService apiKeyValidation;

    @GetMapping("/health")
    public ResponseEntity<GatewayStatus> health() {
        return ResponseEntity.ok(statusService.status());
    }

    @PostMapping("/refresh-challenge")
    public ResponseEntity<Map<String, Object>> refreshChallenge() {
        Site active = failover.activeSite();
        log.info("POST /refresh-challenge - site={}", active.getName());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("site", active.getName());
        if (!active.isRequiresChallenge()) {
            response.put("status", "skipped");
            response.put("message", "Active site does not require a challenge");
            return ResponseEntity.ok(response);
        }

        ChallengeCacheStatus status = cookieCache.refreshNow(active);
        response.put("status", "success");
        response.put("cookies", status.getCookieNames());
        response.put("ttlSeconds", status.getTtlSeconds());
        response.put("expiresAt", status.getExpiresAt());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/restart-browser")
    public ResponseEntity<Map<String, Object>> restartBrowser() {
        log.info("POST /restart-browser");
        session.restart();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "session", session.status()));
    }

    @PostMapping("/switch-to-primary")
    public ResponseEntity<Map<String, Object>> switchToPrimary() {
        log.info("POST /switch-to-primary");
        boolean switched = failover.switchToPrimary();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", switched ? "success" : "failed");
        response.put("activeSite", failover.activeSite().getName());
        if (!switched) {
            response.put("message", "Primary site is not healthy: " + failover.snapshot().getLastProbeResult());
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/force-switch-to-primary")
    public ResponseEntity<Map<String, Object>> forceSwitchToPrimary() {
        log.info("POST /force-switch-to-primary");
        failover.forceSwitchToPrimary();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "activeSite", failover.activeSite().getName()));
    }

    @PostMapping("/clear-api-key-cache")
    public ResponseEntity<Map<String, Object>> clearApiKeyCache() {
        apiKeyValidation.clearCache();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "timestamp", Instant.now()));
    }

    /** Re-reads accounts; the browser session and cached cookies are left alone. */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        List<Account> accounts = accountPool.reload();
        long usable = accounts.stream().filter(a -> a.isEnabled() && a.hasApiKey()).count();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "accounts", accounts.size(),
                "usable", usable));
    }
}
