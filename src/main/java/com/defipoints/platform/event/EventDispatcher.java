package com.defipoints.platform.event;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.event.handler.AdminEventHandler;
import com.defipoints.platform.event.handler.ConfigEventHandler;
import com.defipoints.platform.event.handler.EpochEventHandler;
import com.defipoints.platform.event.handler.KeeperEventHandler;
import com.defipoints.platform.event.handler.LpEventHandler;
import com.defipoints.platform.event.handler.NftEventHandler;
import com.defipoints.platform.event.handler.ReserveEventHandler;
import com.defipoints.platform.event.handler.VotingLockEventHandler;
import com.defipoints.platform.exception.InvalidRequestException;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.repository.PointsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point for the ordered event stream. Events are applied one at a time under a
 * lock; anything at or behind the last applied {@code (blockNumber, logIndex)} is skipped.
 */
@Service
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final PointsStore store;
    private final PointsProperties properties;
    private final ReserveEventHandler reserveHandler;
    private final EpochEventHandler epochHandler;
    private final ConfigEventHandler configHandler;
    private final AdminEventHandler adminHandler;
    private final NftEventHandler nftHandler;
    private final VotingLockEventHandler lockHandler;
    private final KeeperEventHandler keeperHandler;
    private final LpEventHandler lpHandler;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public EventDispatcher(
            PointsStore store,
            PointsProperties properties,
            ReserveEventHandler reserveHandler,
            EpochEventHandler epochHandler,
            ConfigEventHandler configHandler,
            AdminEventHandler adminHandler,
            NftEventHandler nftHandler,
            VotingLockEventHandler lockHandler,
            KeeperEventHandler keeperHandler,
            LpEventHandler lpHandler) {
        this.store = store;
        this.properties = properties;
        this.reserveHandler = reserveHandler;
        this.epochHandler = epochHandler;
        this.configHandler = configHandler;
        this.adminHandler = adminHandler;
        this.nftHandler = nftHandler;
        this.lockHandler = lockHandler;
        this.keeperHandler = keeperHandler;
        this.lpHandler = lpHandler;
    }

    /**
     * Applies {@code event}. Returns false when the replay guard skipped it.
     */
    public boolean apply(ChainEvent event) {
        validate(event);
        lock.lock();
        try {
            if (isReplay(event)) {
                logger.info("Skipping replayed event {} at block {} log {}", event.getEventName(),
                    event.getBlockNumber(), event.getLogIndex());
                return false;
            }

            epochHandler.applyScheduledTransitions(event.getTimestamp(), event.getBlockNumber());
            route(event);
            advanceCursor(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} with no event being applied concurrently.
     */
    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private void route(ChainEvent event) {
        switch (event.getEventName()) {
            case RESERVE_INITIALIZED:
                reserveHandler.onReserveInitialized(event);
                break;
            case RESERVE_DATA_UPDATED:
                reserveHandler.onReserveDataUpdated(event);
                break;
            case ASSET_PRICE_UPDATED:
                reserveHandler.onAssetPriceUpdated(event);
                break;
            case SUPPLY_MINTED:
                reserveHandler.onSupplyMinted(event);
                break;
            case SUPPLY_BURNED:
                reserveHandler.onSupplyBurned(event);
                break;
            case SUPPLY_TRANSFERRED:
                reserveHandler.onSupplyTransferred(event);
                break;
            case DEBT_MINTED:
                reserveHandler.onDebtMinted(event);
                break;
            case DEBT_BURNED:
                reserveHandler.onDebtBurned(event);
                break;
            case EPOCH_STARTED:
                epochHandler.onEpochStarted(event);
                break;
            case EPOCH_ENDED:
                epochHandler.onEpochEnded(event);
                break;
            case CONFIG_SNAPSHOT:
                configHandler.onConfigSnapshot(event);
                break;
            case DEPOSIT_RATE_UPDATED:
                configHandler.onDepositRateUpdated(event);
                break;
            case BORROW_RATE_UPDATED:
                configHandler.onBorrowRateUpdated(event);
                break;
            case VP_RATE_UPDATED:
                configHandler.onVpRateUpdated(event);
                break;
            case LP_RATE_UPDATED:
                configHandler.onLpRateUpdated(event);
                break;
            case DAILY_BONUS_UPDATED:
                configHandler.onDailyBonusUpdated(event);
                break;
            case COOLDOWN_UPDATED:
                configHandler.onCooldownUpdated(event);
                break;
            case MIN_DAILY_BONUS_USD_UPDATED:
                configHandler.onMinDailyBonusUsdUpdated(event);
                break;
            case ADDRESS_BLACKLISTED:
                adminHandler.onAddressBlacklisted(event);
                break;
            case ADDRESS_UNBLACKLISTED:
                adminHandler.onAddressUnblacklisted(event);
                break;
            case POINTS_AWARDED:
                adminHandler.onPointsAwarded(event);
                break;
            case POINTS_REMOVED:
                adminHandler.onPointsRemoved(event);
                break;
            case VP_TIER_ADDED:
                adminHandler.onVpTierAdded(event);
                break;
            case VP_TIER_UPDATED:
                adminHandler.onVpTierUpdated(event);
                break;
            case VP_TIER_REMOVED:
                adminHandler.onVpTierRemoved(event);
                break;
            case NFT_PARTNERSHIP_ADDED:
                nftHandler.onPartnershipAdded(event);
                break;
            case NFT_PARTNERSHIP_UPDATED:
                nftHandler.onPartnershipUpdated(event);
                break;
            case NFT_PARTNERSHIP_REMOVED:
                nftHandler.onPartnershipRemoved(event);
                break;
            case NFT_MULTIPLIER_PARAMS_UPDATED:
                nftHandler.onMultiplierParamsUpdated(event);
                break;
            case PARTNER_NFT_TRANSFERRED:
                nftHandler.onPartnerNftTransferred(event);
                break;
            case LOCK_DEPOSITED:
                lockHandler.onLockDeposited(event);
                break;
            case LOCK_WITHDRAWN:
                lockHandler.onLockWithdrawn(event);
                break;
            case LOCK_PERMANENT:
                lockHandler.onLockPermanent(event);
                break;
            case LOCK_UNLOCKED_PERMANENT:
                lockHandler.onLockUnlockedPermanent(event);
                break;
            case LOCK_TRANSFERRED:
                lockHandler.onLockTransferred(event);
                break;
            case KEEPER_VOTING_POWER_SYNCED:
                keeperHandler.onVotingPowerSynced(event);
                break;
            case KEEPER_NFT_BALANCE_SYNCED:
                keeperHandler.onNftBalanceSynced(event);
                break;
            case KEEPER_USER_SETTLED:
                keeperHandler.onUserSettled(event);
                break;
            case LP_POSITION_UPDATED:
                lpHandler.onPositionUpdated(event);
                break;
            default:
                throw new InvalidRequestException("Unsupported event type: " + event.getEventName());
        }
    }

    private boolean isReplay(ChainEvent event) {
        if (!properties.getReplay().isGuardEnabled()) {
            return false;
        }
        LeaderboardState state = store.findState().orElse(null);
        if (state == null) {
            return false;
        }
        if (event.getBlockNumber() != state.getLastBlockNumber()) {
            return event.getBlockNumber() < state.getLastBlockNumber();
        }
        return event.getLogIndex() <= state.getLastLogIndex();
    }

    private void advanceCursor(ChainEvent event) {
        LeaderboardState state = store.findState().orElseGet(LeaderboardState::initial);
        state.setLastBlockNumber(event.getBlockNumber());
        state.setLastLogIndex(event.getLogIndex());
        store.saveState(state);
    }

    private static void validate(ChainEvent event) {
        if (event == null || event.getEventName() == null) {
            throw new InvalidRequestException("Event name cannot be null");
        }
        if (event.getBlockNumber() == null || event.getTimestamp() == null || event.getLogIndex() == null) {
            throw new InvalidRequestException("Block number, timestamp and log index are required");
        }
    }
}
