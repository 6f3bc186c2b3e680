package com.mouse.keeper.enums;

/**
 * Outcome classes of one upstream attempt.
 */
public enum FailureKind {

    /** Upstream answered; pass the response through, whatever its status. */
    DELIVERED(false, false),

    AUTH_REJECTED(false, true),
    QUOTA_EXHAUSTED(false, true),
    RATE_LIMITED(false, false),
    SERVER_ERROR(false, false),

    SITE_UNREACHABLE(true, false),
    CHALLENGE_BLOCKED(true, false);

    private final boolean siteLevel;
    private final boolean hard;

    FailureKind(boolean siteLevel, boolean hard) {
        this.siteLevel = siteLevel;
        this.hard = hard;
    }

    public boolean isSiteLevel() {
        return siteLevel;
    }

    public boolean isAccountLevel() {
        return this != DELIVERED && !siteLevel;
    }

    /** Hard failures demote the account at once instead of counting towards the threshold. */
    public boolean isHard() {
        return hard;
    }
}
