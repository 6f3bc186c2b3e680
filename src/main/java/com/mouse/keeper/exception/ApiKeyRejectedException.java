package com.mouse.keeper.exception;

public class ApiKeyRejectedException extends RuntimeException {

    public ApiKeyRejectedException(String message) {
        super(message);
    }
}
