package com.mouse.keeper.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mouse.keeper.config.KeeperProperties;
import com.mouse.keeper.exception.ApiKeyRejectedException;
import com.mouse.keeper.model.ApiKeyValidationStats;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.Proxy;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Checks caller keys against the billing system before a request is routed.
 * Both verdicts are cached for {@code cache-ttl} in a bounded Caffeine cache; an unreachable
 * billing system rejects the call without caching anything.
 */
@Slf4j
@Service
public class ApiKeyValidationService {

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;
    private final KeeperProperties.ApiKeyValidation config;
    /** Key to verdict: {@code true} accepted, {@code false} rejected. */
    private final Cache<String, Boolean> cache;

    public ApiKeyValidationService(OkHttpClient okHttpClient, ObjectMapper objectMapper,
                                   KeeperProperties properties, Clock clock) {
        this.config = properties.getApiKeyValidation();
        this.client = okHttpClient.newBuilder()
                .callTimeout(config.getTimeout())
                .proxy(Proxy.NO_PROXY)
                .build();
        this.objectMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(config.getCacheTtl())
                .maximumSize(config.getMaxCacheSize())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    /**
     * Caller key from {@code x-api-key} or an {@code Authorization: Bearer} header.
     */
    public static String extractApiKey(String xApiKey, String authorization) {
        if (xApiKey != null && !xApiKey.isBlank()) {
            return xApiKey.trim();
        }
        if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String key = authorization.substring(7).trim();
            return key.isEmpty() ? null : key;
        }
        return null;
    }

    /**
     * @throws ApiKeyRejectedException if validation is enabled and the key is missing or not accepted
     */
    public void validate(String apiKey) {
        if (!config.isEnabled()) {
            return;
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ApiKeyRejectedException("API key is required");
        }

        Boolean cached = cache.getIfPresent(apiKey);
        if (cached != null) {
            if (!cached) {
                throw new ApiKeyRejectedException("Invalid API key (cached)");
            }
            return;
        }

        Request request = new Request.Builder()
                .url(stripTrailingSlash(config.getNewApiUrl()) + "/api/user/self")
                .header("Authorization", "Bearer " + apiKey)
                .get()
                .build();

        boolean valid;
        try (Response response = client.newCall(request).execute()) {
            valid = response.code() == 200 && isSuccessPayload(response.body());
            if (!valid) {
                log.warn("API key validation failed: status={}", response.code());
            }
        } catch (IOException e) {
            log.error("Failed to reach billing system for key validation: {}", e.getMessage());
            throw new ApiKeyRejectedException("Authentication service unavailable");
        }

        cache.put(apiKey, valid);
        if (!valid) {
            throw new ApiKeyRejectedException("Invalid API key");
        }
    }

    public void clearCache() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        cache.cleanUp();
        log.info("API key validation cache cleared ({} entries)", size);
    }

    public ApiKeyValidationStats stats() {
        cache.cleanUp();
        Map<String, Boolean> view = Map.copyOf(cache.asMap());
        long valid = view.values().stream().filter(Boolean::booleanValue).count();
        return ApiKeyValidationStats.builder()
                .enabled(config.isEnabled())
                .cacheSize(view.size())
                .validKeysCached(valid)
                .invalidKeysCached(view.size() - valid)
                .cacheTtlSeconds(config.getCacheTtl().getSeconds())
                .build();
    }

    private boolean isSuccessPayload(ResponseBody body) throws IOException {
        if (body == null) {
            return false;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body.string());
        } catch (JsonProcessingException e) {
            log.debug("Billing system answered with non-JSON body: {}", e.getOriginalMessage());
            return false;
        }
        JsonNode data = root.path("data");
        return root.path("success").asBoolean(false) && !data.isMissingNode() && !data.isNull() && !data.isEmpty();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
