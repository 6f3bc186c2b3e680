package com.mouse.keeper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CheckinStatus {
    boolean enabled;
    boolean running;
    Instant lastRun;
    Instant nextRun;
    int totalSuccess;
    int totalFailed;
    List<CheckinResult> results;
}
