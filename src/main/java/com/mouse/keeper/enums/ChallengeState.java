package com.mouse.keeper.enums;

public enum ChallengeState {
    EMPTY,
    VALID,
    EXPIRING,
    EXPIRED,
    REFRESHING,
    NOT_REQUIRED
}
