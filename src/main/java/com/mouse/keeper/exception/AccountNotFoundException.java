package com.mouse.keeper.exception;

public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(String name) {
        super("Account not found: " + name);
    }
}
