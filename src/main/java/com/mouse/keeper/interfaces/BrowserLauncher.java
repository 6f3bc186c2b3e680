package com.mouse.keeper.interfaces;

/**
 * Starts the external automation process.
 */
public interface BrowserLauncher {

    BrowserHandle launch();
}
