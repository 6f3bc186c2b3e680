package com.mouse.keeper.exception;

public class NoEligibleAccountException extends RuntimeException {

    public NoEligibleAccountException() {
        super("No eligible account");
    }

    public NoEligibleAccountException(String message) {
        super(message);
    }
}
