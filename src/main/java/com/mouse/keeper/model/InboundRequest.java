package com.mouse.keeper.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A client API call as received, before credentials are injected.
 */
@Value
@Builder
public class InboundRequest {

    String method;
    /** Path including the API prefix, e.g. {@code /v1/messages}. */
    String path;
    String query;
    @Singular
    Map<String, List<String>> headers;
    byte[] body;

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public String firstHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
