package com.mouse.keeper.config;

import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Getter
@Configuration
public class BrowserConfig {

    private final List<String> browserFlags = Arrays.asList(
            // === Container stability ===
            "--no-sandbox",
            "--disable-setuid-sandbox",
            "--disable-dev-shm-usage",
            "--no-zygote",
            "--disable-gpu",
            "--disable-software-rasterizer",

            // === Stealth ===
            "--disable-blink-features=AutomationControlled",
            "--disable-infobars",
            "--lang=en-US",

            // === Noise reduction ===
            "--disable-extensions",
            "--disable-background-networking",
            "--disable-sync",
            "--disable-default-apps",
            "--mute-audio",
            "--no-first-run"
    );

    // Images, fonts and media never influence the challenge cookies
    private final List<String> blockedResourcePatterns = List.of(
            "**/*.{png,jpg,jpeg,gif,webp,svg,ico}",
            "**/*.{woff,woff2,ttf,otf}",
            "**/*.{mp4,webm,mp3}"
    );

    public List<String> launchArgs() {
        return new ArrayList<>(browserFlags);
    }

    public String stealthScript() {
        return """
                Object.defineProperty(navigator, 'webdriver', {
                    get: () => undefined,
                    configurable: true
                });
                delete navigator.__proto__.webdriver;
                window.chrome = { runtime: {} };
                Object.defineProperty(navigator, 'languages', {
                    get: () => ['en-US', 'en'],
                    configurable: true
                });
                """;
    }
}
