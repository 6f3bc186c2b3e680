package com.mouse.keeper.model;

import com.mouse.keeper.enums.FailureKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AccountHealthView {
    String name;
    boolean enabled;
    boolean healthy;
    boolean eligible;
    int consecutiveFailures;
    Instant lastFailureAt;
    FailureKind lastFailureKind;
    Instant eligibleAgainAt;
}
