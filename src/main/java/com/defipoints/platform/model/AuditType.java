package com.defipoints.platform.model;

public enum AuditType {
    EPOCH_STARTED,
    EPOCH_ENDED,
    CONFIG_UPDATED,
    POINTS_AWARDED,
    POINTS_REMOVED,
    BLACKLISTED,
    UNBLACKLISTED,
    VP_TIER_CHANGED,
    NFT_PARTNERSHIP_CHANGED,
    USER_SETTLED
}
