package com.mouse.keeper.utils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

public final class CookieUtils {

    private CookieUtils() {
    }

    public static Map<String, String> parseCookieHeader(String header) {
        Map<String, String> cookies = new LinkedHashMap<>();
        if (header == null || header.isBlank()) {
            return cookies;
        }
        for (String part : header.split(";")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = part.substring(0, eq).trim();
            if (!name.isEmpty()) {
                cookies.put(name, part.substring(eq + 1).trim());
            }
        }
        return cookies;
    }

    public static String formatCookieHeader(Map<String, String> cookies) {
        if (cookies == null || cookies.isEmpty()) {
            return "";
        }
        return cookies.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
    }

    /**
     * Account cookies overlaid with challenge cookies; challenge values win on a name clash.
     */
    public static Map<String, String> merge(Map<String, String> accountCookies, Map<String, String> challengeCookies) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (accountCookies != null) {
            merged.putAll(accountCookies);
        }
        if (challengeCookies != null) {
            merged.putAll(challengeCookies);
        }
        return merged;
    }
}
