package com.mouse.keeper.model;

import lombok.Value;

@Value
public class ProbeResult {

    boolean healthy;
    String detail;

    public static ProbeResult healthy() {
        return new ProbeResult(true, "healthy");
    }

    public static ProbeResult unhealthy(String detail) {
        return new ProbeResult(false, detail);
    }
}
