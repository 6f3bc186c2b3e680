package com.mouse.keeper.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ApiKeyValidationStats {
    boolean enabled;
    int cacheSize;
    long validKeysCached;
    long invalidKeysCached;
    long cacheTtlSeconds;
}
