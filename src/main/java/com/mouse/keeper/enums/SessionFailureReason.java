package com.mouse.keeper.enums;

public enum SessionFailureReason {
    CHALLENGE_TIMEOUT,
    EXTRACTION_FAILED,
    CRASHED
}
