package com.mouse.keeper.interfaces;

import com.mouse.keeper.exception.SessionException;
import com.mouse.keeper.model.Site;
import com.mouse.keeper.model.SessionStatus;

import java.util.Map;

/**
 * The narrow capability the rest of the gateway has over the automation session.
 */
public interface ChallengeSession {

    /**
     * Loads the site's challenge page and returns the cookies it produced.
     *
     * @throws SessionException on timeout, missing cookies or a dead session
     */
    Map<String, String> solve(Site site);

    /** Tears down the live session, if any, and starts a fresh one. */
    void restart();

    boolean isAlive();

    SessionStatus status();
}
