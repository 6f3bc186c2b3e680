package com.mouse.keeper.interfaces;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * One running browser. Lower-level faults (process gone, connection lost) surface as
 * unchecked exceptions.
 */
public interface BrowserHandle extends AutoCloseable {

    boolean isConnected();

    /**
     * Opens {@code url} in an isolated context, lets the challenge script run and returns
     * every cookie the context holds afterwards.
     *
     * @throws TimeoutException if the page did not settle within {@code timeout}
     */
    Map<String, String> collectCookies(String url, Duration timeout) throws TimeoutException;

    @Override
    void close();
}
