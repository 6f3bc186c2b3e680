package com.mouse.keeper.exception;

public class AccountStorageException extends RuntimeException {

    public AccountStorageException(String message) {
        super(message);
    }

    public AccountStorageException(String message, Throwable e) {
        super(message, e);
    }
}
