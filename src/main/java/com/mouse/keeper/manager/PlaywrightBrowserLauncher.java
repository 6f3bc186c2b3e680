package com.mouse.keeper.manager;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.Route;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.ServiceWorkerPolicy;
import com.microsoft.playwright.options.WaitUntilState;
import com.mouse.keeper.config.BrowserConfig;
import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.interfaces.BrowserHandle;
import com.mouse.keeper.interfaces.BrowserLauncher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Launches headless Chromium through Playwright. Only the session manager calls into
 * this, under its own locks, so Playwright objects are never used concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightBrowserLauncher implements BrowserLauncher {

    private final BrowserConfig browserConfig;
    private final KeeperProperties properties;

    @Override
    public BrowserHandle launch() {
        KeeperProperties.Proxy proxy = properties.getProxy();
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(properties.getSession().isHeadless())
                .setTimeout(properties.getSession().getLaunchTimeout().toMillis())
                .setArgs(browserConfig.launchArgs());
        if (proxy.isConfigured()) {
            options.setProxy(new Proxy(proxy.url()));
        }

        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(options);
            log.info("Chromium launched (headless={}, proxy={})",
                    properties.getSession().isHeadless(), proxy.isConfigured() ? proxy.url() : "none");
            return new PlaywrightHandle(playwright, browser);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    private class PlaywrightHandle implements BrowserHandle {

        private final Playwright playwright;
        private final Browser browser;
        private volatile boolean connected = true;

        PlaywrightHandle(Playwright playwright, Browser browser) {
            this.playwright = playwright;
            this.browser = browser;
            browser.onDisconnected(b -> {
                connected = false;
                log.warn("Browser disconnected");
            });
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public Map<String, String> collectCookies(String url, Duration timeout) throws TimeoutException {
            KeeperProperties.Challenge challenge = properties.getChallenge();
            BrowserContext context = null;
            Page page = null;
            try {
                context = browser.newContext(new Browser.NewContextOptions()
                        .setUserAgent(challenge.getUserAgent())
                        .setLocale("en-US")
                        .setIgnoreHTTPSErrors(true)
                        .setServiceWorkers(ServiceWorkerPolicy.BLOCK));
                context.addInitScript(browserConfig.stealthScript());
                for (String pattern : browserConfig.getBlockedResourcePatterns()) {
                    context.route(pattern, Route::abort);
                }

                page = context.newPage();
                page.setDefaultTimeout(timeout.toMillis());
                page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                        .setTimeout(timeout.toMillis()));

                // Challenge script sets its cookies asynchronously after load
                page.waitForTimeout(challenge.getPageWait().toMillis());

                Map<String, String> cookies = toMap(context.cookies());
                log.debug("Collected cookies from {}: {}", url, cookies.keySet());
                return cookies;
            } catch (TimeoutError e) {
                throw new TimeoutException("Challenge page did not settle within " + timeout + ": " + e.getMessage());
            } finally {
                safeClose(page);
                safeClose(context);
            }
        }

        @Override
        public void close() {
            connected = false;
            safeClose(browser);
            safeClose(playwright);
        }
    }

    private static Map<String, String> toMap(List<Cookie> cookies) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Cookie cookie : cookies) {
            result.put(cookie.name, cookie.value);
        }
        return result;
    }

    private static void safeClose(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.debug("Close failed for {}: {}", c.getClass().getSimpleName(), e.getMessage());
        }
    }
}
