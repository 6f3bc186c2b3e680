package com.mouse.keeper.model;

import com.mouse.keeper.enums.ChallengeState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ChallengeCacheStatus {
    String site;
    ChallengeState state;
    long ttlSeconds;
    List<String> cookieNames;
    Instant solvedAt;
    Instant refreshDeadline;
    Instant expiresAt;
    long hits;
    long misses;
    long solves;
    long failedSolves;
    String lastError;
}
