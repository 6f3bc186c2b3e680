package com.mouse.keeper.model;

import com.mouse.keeper.enums.SiteRole;
import lombok.Builder;
import lombok.Value;

/**
 * An upstream mirror. Immutable; built from configuration.
 */
@Value
@Builder
public class Site {

    String name;
    String url;
    SiteRole role;
    boolean requiresProxy;
    boolean requiresChallenge;
    int priority;
    String challengePath;

    public boolean isPrimary() {
        return role == SiteRole.PRIMARY;
    }

    public String resolve(String path) {
        String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        if (path == null || path.isEmpty()) {
            return base;
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }

    public String challengeUrl() {
        return resolve(challengePath);
    }
}
