package com.mouse.keeper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CheckinResult {
    String account;
    boolean success;
    String message;
    String siteUsed;
    Instant timestamp;
}
