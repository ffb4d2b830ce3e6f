package com.example.rabbitwatch.domain;

/**
 * Subscription tiers, lowest first.
 */
public enum Plan {
    FREE,
    DEVELOPER,
    STARTUP,
    BUSINESS;

    public boolean canModifyThresholds() {
        return this == STARTUP || this == BUSINESS;
    }

    /** The lowest tier only sees alert counts, never the alert list. */
    public boolean isLowestTier() {
        return this == FREE;
    }
}
