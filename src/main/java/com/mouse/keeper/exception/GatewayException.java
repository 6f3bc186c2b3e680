package com.mouse.keeper.exception;

import com.mouse.keeper.enums.GatewayErrorReason;
import lombok.Getter;

@Getter
public class GatewayException extends RuntimeException {

    private final GatewayErrorReason reason;

    public GatewayException(GatewayErrorReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GatewayException(GatewayErrorReason reason, String message, Throwable lastCause) {
        super(message, lastCause);
        this.reason = reason;
    }
}
