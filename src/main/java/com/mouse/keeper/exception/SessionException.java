package com.mouse.keeper.exception;

import com.mouse.keeper.enums.SessionFailureReason;
import lombok.Getter;

@Getter
public class SessionException extends RuntimeException {

    private final SessionFailureReason reason;

    public SessionException(SessionFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SessionException(SessionFailureReason reason, String message, Throwable e) {
        super(message, e);
        this.reason = reason;
    }
}
