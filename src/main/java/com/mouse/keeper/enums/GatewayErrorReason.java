package com.mouse.keeper.enums;

import org.springframework.http.HttpStatus;

/**
 * The only failure kinds a gateway caller ever sees besides upstream's own responses.
 */
public enum GatewayErrorReason {

    CHALLENGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "challenge_unavailable"),
    NO_ACCOUNT_AVAILABLE(HttpStatus.TOO_MANY_REQUESTS, "no_account_available"),
    ALL_ACCOUNTS_EXHAUSTED(HttpStatus.BAD_GATEWAY, "all_accounts_exhausted");

    private final HttpStatus status;
    private final String code;

    GatewayErrorReason(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
