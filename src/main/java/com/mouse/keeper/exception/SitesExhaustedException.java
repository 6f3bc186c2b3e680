package com.mouse.keeper.exception;

public class SitesExhaustedException extends RuntimeException {

    public SitesExhaustedException(String message) {
        super(message);
    }

    public SitesExhaustedException(String message, Throwable e) {
        super(message, e);
    }
}
