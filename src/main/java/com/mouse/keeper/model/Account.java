package com.mouse.keeper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.mouse.keeper.deserializer.CookieMapDeserializer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One upstream credential set, as stored in the accounts file.
 * <p>
 * {@code enabled} is operator intent; runtime health lives in the pool.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Account {

    private String name;

    @Builder.Default
    private String provider = "anyrouter";

    @JsonProperty("api_user")
    private String apiUser;

    @ToString.Exclude
    @JsonProperty("api_key")
    private String apiKey;

    @ToString.Exclude
    @Builder.Default
    @JsonDeserialize(using = CookieMapDeserializer.class)
    private Map<String, String> cookies = new LinkedHashMap<>();

    @Builder.Default
    private boolean enabled = true;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String keyPreview() {
        if (apiKey == null) {
            return "";
        }
        return apiKey.length() > 8 ? apiKey.substring(0, 8) + "..." : apiKey;
    }
}
