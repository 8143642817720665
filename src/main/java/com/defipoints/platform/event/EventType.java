package com.defipoints.platform.event;

/**
 * Every event kind the dispatcher understands.
 */
public enum EventType {
    RESERVE_INITIALIZED,
    RESERVE_DATA_UPDATED,
    ASSET_PRICE_UPDATED,
    SUPPLY_MINTED,
    SUPPLY_BURNED,
    SUPPLY_TRANSFERRED,
    DEBT_MINTED,
    DEBT_BURNED,

    EPOCH_STARTED,
    EPOCH_ENDED,

    CONFIG_SNAPSHOT,
    DEPOSIT_RATE_UPDATED,
    BORROW_RATE_UPDATED,
    VP_RATE_UPDATED,
    LP_RATE_UPDATED,
    DAILY_BONUS_UPDATED,
    COOLDOWN_UPDATED,
    MIN_DAILY_BONUS_USD_UPDATED,

    ADDRESS_BLACKLISTED,
    ADDRESS_UNBLACKLISTED,
    POINTS_AWARDED,
    POINTS_REMOVED,
    VP_TIER_ADDED,
    VP_TIER_UPDATED,
    VP_TIER_REMOVED,

    NFT_PARTNERSHIP_ADDED,
    NFT_PARTNERSHIP_UPDATED,
    NFT_PARTNERSHIP_REMOVED,
    NFT_MULTIPLIER_PARAMS_UPDATED,
    PARTNER_NFT_TRANSFERRED,

    LOCK_DEPOSITED,
    LOCK_WITHDRAWN,
    LOCK_PERMANENT,
    LOCK_UNLOCKED_PERMANENT,
    LOCK_TRANSFERRED,

    KEEPER_VOTING_POWER_SYNCED,
    KEEPER_NFT_BALANCE_SYNCED,
    KEEPER_USER_SETTLED,

    LP_POSITION_UPDATED
}
