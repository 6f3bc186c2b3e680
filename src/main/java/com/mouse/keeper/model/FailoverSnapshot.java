package com.mouse.keeper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Process-wide failover state. Replaced as a whole on every transition so readers
 * always see one consistent version.
 */
@Value
@Builder(toBuilder = true)
public class FailoverSnapshot {

    /** 0 is the primary, i &gt;= 1 is backup i - 1. */
    int activeIndex;
    Site activeSite;
    Instant lastSwitchTime;
    Instant lastPrimaryProbeTime;
    String lastProbeResult;
    int consecutivePrimaryProbeSuccesses;
    int consecutivePrimaryProbeFailures;
    int consecutiveActiveSiteFailures;
    long switchCount;
    long recoveryCount;
    boolean backupsExhausted;

    public boolean isOnPrimary() {
        return activeIndex == 0;
    }

    /** Index into the backup list, or -1 while on the primary. */
    public int backupIndex() {
        return activeIndex - 1;
    }
}
