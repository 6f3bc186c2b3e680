package com.mouse.keeper.enums;

public enum SiteRole {
    PRIMARY,
    BACKUP
}
