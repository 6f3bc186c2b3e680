package com.mouse.keeper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view served by {@code GET /health}.
 */
@Value
@Builder
public class GatewayStatus {
    String status;
    Instant timestamp;
    Site activeSite;
    List<Site> sites;
    FailoverSnapshot failover;
    int totalAccounts;
    int eligibleAccounts;
    List<AccountHealthView> accounts;
    List<ChallengeCacheStatus> challenge;
    SessionStatus session;
    CheckinStatus checkin;
    ApiKeyValidationStats apiKeyValidation;
}
