package com.mouse.keeper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.mouse.keeper.deserializer.CookieMapDeserializer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial account edit; null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountUpdate {

    private String provider;

    @JsonProperty("api_user")
    private String apiUser;

    @JsonProperty("api_key")
    private String apiKey;

    @JsonDeserialize(using = CookieMapDeserializer.class)
    private Map<String, String> cookies;

    private Boolean enabled;
}
