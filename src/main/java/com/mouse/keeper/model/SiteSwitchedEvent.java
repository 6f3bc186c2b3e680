package com.mouse.keeper.model;

import lombok.Value;

/**
 * Published after the active site changed. {@code to} is null when every backup was exhausted.
 */
@Value
public class SiteSwitchedEvent {
    Site from;
    Site to;
    String reason;
}
