package com.mouse.keeper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SessionStatus {
    boolean alive;
    boolean crashed;
    Instant startedAt;
    long uptimeSeconds;
    long restartCount;
    long errorCount;
    long solveCount;
}
