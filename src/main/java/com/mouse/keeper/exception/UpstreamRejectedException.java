package com.mouse.keeper.exception;

import com.mouse.keeper.enums.FailureKind;
import lombok.Getter;

/**
 * An upstream answer that was not passed to the caller, kept as the cause of the final error.
 */
@Getter
public class UpstreamRejectedException extends RuntimeException {

    private final String site;
    private final String account;
    private final int status;
    private final FailureKind kind;

    public UpstreamRejectedException(String site, String account, int status, FailureKind kind, String detail) {
        super(kind + " from " + site + " for account " + account + " (HTTP " + status + ")"
                + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.site = site;
        this.account = account;
        this.status = status;
        this.kind = kind;
    }
}
