package com.mouse.keeper.exception;

/**
 * No usable challenge cookies could be produced for a site (solve_failed).
 */
public class ChallengeCacheException extends RuntimeException {

    private final String site;

    public ChallengeCacheException(String site, String message, Throwable e) {
        super(message, e);
        this.site = site;
    }

    public String getSite() {
        return site;
    }
}
