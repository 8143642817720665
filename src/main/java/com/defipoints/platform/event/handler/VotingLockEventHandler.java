package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.LockParams;
import com.defipoints.platform.event.params.LockTransferParams;
import com.defipoints.platform.model.VotingLock;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.service.MultiplierResolver;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.defipoints.platform.service.UserMultiplierService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Vote-escrow lock changes. The owner is settled under the old voting power before each change
 * and re-tiered after it.
 */
@Component
public class VotingLockEventHandler extends AbstractEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(VotingLockEventHandler.class);

    static final long SECONDS_PER_WEEK = 7L * 24 * 60 * 60;

    private final PointsStore store;
    private final PointsAccrualEngine engine;
    private final UserMultiplierService userMultiplierService;

    @Autowired
    public VotingLockEventHandler(
            PointsStore store,
            PointsAccrualEngine engine,
            UserMultiplierService userMultiplierService,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.store = store;
        this.engine = engine;
        this.userMultiplierService = userMultiplierService;
    }

    public void onLockDeposited(ChainEvent event) {
        LockParams params = bind(event, LockParams.class);
        VotingLock lock = getOrInitLock(event, params);
        BigInteger amount = require(params.getAmount(), "amount", event);
        String owner = normalizeAddress(params.getOwner());
        if (isUnowned(lock) && !isZeroAddress(owner)) {
            lock.setOwner(owner);
            userMultiplierService.trackLock(owner, lock.getTokenId());
        }

        settleOwner(event, lock);
        lock.setLockedAmount(lock.getLockedAmount().add(amount.max(BigInteger.ZERO)));
        if (params.getLockEnd() != null) {
            lock.setLockEnd(params.getLockEnd());
        }
        saveAndRefresh(event, lock);
    }

    public void onLockWithdrawn(ChainEvent event) {
        LockParams params = bind(event, LockParams.class);
        VotingLock lock = getOrInitLock(event, params);
        BigInteger amount = require(params.getAmount(), "amount", event);

        settleOwner(event, lock);
        lock.setLockedAmount(lock.getLockedAmount().subtract(amount).max(BigInteger.ZERO));
        saveAndRefresh(event, lock);
    }

    public void onLockPermanent(ChainEvent event) {
        LockParams params = bind(event, LockParams.class);
        VotingLock lock = getOrInitLock(event, params);

        settleOwner(event, lock);
        lock.setPermanent(true);
        lock.setLockEnd(0);
        if (params.getAmount() != null) {
            lock.setLockedAmount(params.getAmount());
        }
        saveAndRefresh(event, lock);
    }

    /**
     * Turns a permanent lock back into a decaying one ending at the last week boundary before
     * the maximum lock duration.
     */
    public void onLockUnlockedPermanent(ChainEvent event) {
        LockParams params = bind(event, LockParams.class);
        VotingLock lock = getOrInitLock(event, params);
        long unlockedAt = event.resolveTimestamp(params.getTimestamp());

        settleOwner(event, lock);
        lock.setPermanent(false);
        lock.setLockEnd(unlockEnd(unlockedAt));
        if (params.getAmount() != null) {
            lock.setLockedAmount(params.getAmount());
        }
        saveAndRefresh(event, lock);
    }

    public void onLockTransferred(ChainEvent event) {
        LockTransferParams params = bind(event, LockTransferParams.class);
        String tokenId = require(params.getTokenId(), "tokenId", event);
        String from = normalizeAddress(params.getFrom());
        String to = normalizeAddress(params.getTo());
        long timestamp = event.getTimestamp();

        VotingLock lock = store.findVotingLock(tokenId).orElseGet(() -> emptyLock(tokenId, timestamp));
        if (!isZeroAddress(from)) {
            engine.settleUser(from, null, timestamp, event.getBlockNumber(), false);
        }
        if (!isZeroAddress(to)) {
            engine.settleUser(to, null, timestamp, event.getBlockNumber(), false);
        }

        lock.setOwner(isZeroAddress(to) ? null : to);
        lock.setUpdatedAt(timestamp);
        store.saveVotingLock(lock);

        if (!isZeroAddress(from)) {
            userMultiplierService.untrackLock(from, tokenId);
            userMultiplierService.refreshState(from, timestamp);
        }
        if (!isZeroAddress(to)) {
            userMultiplierService.trackLock(to, tokenId);
            userMultiplierService.refreshState(to, timestamp);
        }
        logger.debug("Lock {} transferred from {} to {}", tokenId, from, to);
    }

    static long unlockEnd(long unlockedAt) {
        return Math.floorDiv(unlockedAt + MultiplierResolver.MAX_LOCK_SECONDS, SECONDS_PER_WEEK) * SECONDS_PER_WEEK;
    }

    private VotingLock getOrInitLock(ChainEvent event, LockParams params) {
        String tokenId = require(params.getTokenId(), "tokenId", event);
        return store.findVotingLock(tokenId).orElseGet(() -> emptyLock(tokenId, event.getTimestamp()));
    }

    private static VotingLock emptyLock(String tokenId, long timestamp) {
        return VotingLock.builder()
            .tokenId(tokenId)
            .lockedAmount(BigInteger.ZERO)
            .updatedAt(timestamp)
            .build();
    }

    private void settleOwner(ChainEvent event, VotingLock lock) {
        if (!isUnowned(lock)) {
            engine.settleUser(lock.getOwner(), null, event.getTimestamp(), event.getBlockNumber(), false);
        }
    }

    private void saveAndRefresh(ChainEvent event, VotingLock lock) {
        lock.setUpdatedAt(event.getTimestamp());
        store.saveVotingLock(lock);
        if (!isUnowned(lock)) {
            userMultiplierService.refreshState(lock.getOwner(), event.getTimestamp());
        }
        logger.debug("Lock {} now holds {} (end {}, permanent {})", lock.getTokenId(), lock.getLockedAmount(),
            lock.getLockEnd(), lock.isPermanent());
    }

    private static boolean isUnowned(VotingLock lock) {
        return lock.getOwner() == null || lock.getOwner().isEmpty();
    }
}
