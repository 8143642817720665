package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.event.params.BalanceParams;
import com.defipoints.platform.event.params.ReserveParams;
import com.defipoints.platform.event.params.SupplyTransferParams;
import com.defipoints.platform.math.FixedPointMath;
import com.defipoints.platform.model.DailyAction;
import com.defipoints.platform.model.Reserve;
import com.defipoints.platform.model.UserReserve;
import com.defipoints.platform.repository.PointsStore;
import com.defipoints.platform.service.EpochSettlementCoordinator;
import com.defipoints.platform.service.PointsAccrualEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Lending market events: reserve state, prices and the interest-bearing supply and debt balances.
 */
@Component
public class ReserveEventHandler extends AbstractEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(ReserveEventHandler.class);

    private static final int DEFAULT_DECIMALS = 18;

    private final PointsStore store;
    private final PointsAccrualEngine engine;
    private final EpochSettlementCoordinator coordinator;

    @Autowired
    public ReserveEventHandler(
            PointsStore store,
            PointsAccrualEngine engine,
            EpochSettlementCoordinator coordinator,
            ObjectMapper objectMapper) {
        super(objectMapper);
        this.store = store;
        this.engine = engine;
        this.coordinator = coordinator;
    }

    public void onReserveInitialized(ChainEvent event) {
        ReserveParams params = bind(event, ReserveParams.class);
        String reserveId = requireAddress(params.getReserve(), "reserve", event);

        Reserve reserve = store.findReserve(reserveId).orElseGet(() -> Reserve.builder()
            .id(reserveId)
            .liquidityIndex(FixedPointMath.RAY)
            .variableBorrowIndex(FixedPointMath.RAY)
            .liquidityRate(BigInteger.ZERO)
            .variableBorrowRate(BigInteger.ZERO)
            .priceIndex(BigInteger.ZERO)
            .priceIndexTimestamp(event.getTimestamp())
            .build());
        engine.advancePriceIndex(reserve, event.getTimestamp());
        reserve.setDecimals(params.getDecimals() != null ? params.getDecimals() : DEFAULT_DECIMALS);
        if (params.getPriceUsdE8() != null) {
            reserve.setPriceUsdE8(params.getPriceUsdE8());
        }
        reserve.setLastUpdateTimestamp(event.getTimestamp());
        store.saveReserve(reserve);
        logger.info("Initialized reserve {} with {} decimals", reserveId, reserve.getDecimals());
    }

    /**
     * Applies new indices and rates. An epoch-end snapshot still owed for this reserve is
     * taken from the old state first.
     */
    public void onReserveDataUpdated(ChainEvent event) {
        ReserveParams params = bind(event, ReserveParams.class);
        String reserveId = requireAddress(params.getReserve(), "reserve", event);
        Reserve reserve = store.findReserve(reserveId).orElse(null);
        if (reserve == null) {
            logger.warn("Skipping data update for unknown reserve {}", reserveId);
            return;
        }

        coordinator.snapshotIfMissing(reserve, event.getTimestamp());

        if (params.getLiquidityIndex() != null) {
            reserve.setLiquidityIndex(params.getLiquidityIndex());
        }
        if (params.getLiquidityRate() != null) {
            reserve.setLiquidityRate(params.getLiquidityRate());
        }
        if (params.getVariableBorrowIndex() != null) {
            reserve.setVariableBorrowIndex(params.getVariableBorrowIndex());
        }
        if (params.getVariableBorrowRate() != null) {
            reserve.setVariableBorrowRate(params.getVariableBorrowRate());
        }
        reserve.setLastUpdateTimestamp(event.getTimestamp());
        store.saveReserve(reserve);
        logger.debug("Updated reserve {} indices at {}", reserveId, event.getTimestamp());
    }

    /**
     * Closes the price index at the old price before the new one applies.
     */
    public void onAssetPriceUpdated(ChainEvent event) {
        ReserveParams params = bind(event, ReserveParams.class);
        String reserveId = requireAddress(params.getReserve(), "reserve", event);
        BigInteger price = require(params.getPriceUsdE8(), "priceUsdE8", event);
        Reserve reserve = store.findReserve(reserveId).orElse(null);
        if (reserve == null) {
            logger.warn("Skipping price update for unknown reserve {}", reserveId);
            return;
        }
        engine.advancePriceIndex(reserve, event.getTimestamp());
        reserve.setPriceUsdE8(price);
        store.saveReserve(reserve);
        logger.debug("Price of reserve {} set to {} at {}", reserveId, price, event.getTimestamp());
    }

    public void onSupplyMinted(ChainEvent event) {
        applyBalanceEvent(event, false, true);
    }

    public void onSupplyBurned(ChainEvent event) {
        applyBalanceEvent(event, false, false);
    }

    public void onDebtMinted(ChainEvent event) {
        applyBalanceEvent(event, true, true);
    }

    public void onDebtBurned(ChainEvent event) {
        applyBalanceEvent(event, true, false);
    }

    /**
     * Settle, mutate the scaled balance, then move the baseline so the next settlement starts
     * from the new amount.
     */
    private void applyBalanceEvent(ChainEvent event, boolean debt, boolean mint) {
        BalanceParams params = bind(event, BalanceParams.class);
        String userId = requireAddress(params.getUser(), "user", event);
        String reserveId = requireAddress(params.getReserve(), "reserve", event);
        BigInteger value = require(params.getValue(), "value", event);
        BigInteger balanceIncrease = params.getBalanceIncrease() != null ? params.getBalanceIncrease() : BigInteger.ZERO;
        BigInteger index = require(params.getIndex(), "index", event);
        long timestamp = event.getTimestamp();
        long blockNumber = event.getBlockNumber();

        Reserve reserve = store.findReserve(reserveId).orElse(null);
        if (reserve == null) {
            logger.warn("Skipping {} for unknown reserve {}", event.getEventName(), reserveId);
            return;
        }

        UserReserve userReserve = store.findUserReserve(userId, reserveId).orElse(null);
        if (userReserve == null) {
            if (!mint) {
                logger.warn("Skipping {} for user {} with no position in reserve {}", event.getEventName(), userId, reserveId);
                engine.settleUser(userId, null, timestamp, blockNumber, false);
                return;
            }
            userReserve = UserReserve.empty(userId, reserveId, timestamp);
            store.saveUserReserve(userReserve);
        }

        engine.settleUser(userId, reserveId, timestamp, blockNumber, false);

        BigInteger amount = mint ? value.subtract(balanceIncrease) : value.add(balanceIncrease);
        BigInteger scaledDelta = FixedPointMath.rayDiv(amount, index);
        BigInteger scaled = debt ? userReserve.getScaledVariableDebt() : userReserve.getScaledATokenBalance();
        BigInteger newScaled = (mint ? scaled.add(scaledDelta) : scaled.subtract(scaledDelta)).max(BigInteger.ZERO);
        BigInteger newCurrent = FixedPointMath.rayMul(newScaled, index);

        if (debt) {
            userReserve.setScaledVariableDebt(newScaled);
            userReserve.setCurrentVariableDebt(newCurrent);
        } else {
            userReserve.setScaledATokenBalance(newScaled);
            userReserve.setCurrentATokenBalance(newCurrent);
        }
        userReserve.setLastUpdateTimestamp(timestamp);
        store.saveUserReserve(userReserve);

        engine.syncBaseline(userId, reserveId, timestamp, blockNumber);

        DailyAction action = dailyActionFor(debt, mint);
        engine.recordDailyAmount(userId, action, engine.usdValue(reserve, amount), timestamp);
        engine.awardDailyBonus(userId, action, timestamp);

        logger.debug("Applied {} of {} for user {} on reserve {}", event.getEventName(), amount, userId, reserveId);
    }

    public void onSupplyTransferred(ChainEvent event) {
        SupplyTransferParams params = bind(event, SupplyTransferParams.class);
        String reserveId = requireAddress(params.getReserve(), "reserve", event);
        String from = normalizeAddress(params.getFrom());
        String to = normalizeAddress(params.getTo());
        BigInteger scaledAmount = require(params.getValue(), "value", event);
        BigInteger index = require(params.getIndex(), "index", event);
        long timestamp = event.getTimestamp();
        long blockNumber = event.getBlockNumber();

        Reserve reserve = store.findReserve(reserveId).orElse(null);
        if (reserve == null) {
            logger.warn("Skipping transfer for unknown reserve {}", reserveId);
            return;
        }
        if (from != null && from.equals(to)) {
            return;
        }

        UserReserve toReserve = null;
        if (!isZeroAddress(to)) {
            toReserve = store.findUserReserve(to, reserveId).orElse(null);
            if (toReserve == null) {
                toReserve = UserReserve.empty(to, reserveId, timestamp);
                store.saveUserReserve(toReserve);
            }
        }
        UserReserve fromReserve = isZeroAddress(from) ? null : store.findUserReserve(from, reserveId).orElse(null);

        if (!isZeroAddress(from)) {
            engine.settleUser(from, reserveId, timestamp, blockNumber, false);
        }
        if (!isZeroAddress(to)) {
            engine.settleUser(to, reserveId, timestamp, blockNumber, false);
        }

        BigInteger currentAmount = FixedPointMath.rayMul(scaledAmount, index);
        if (toReserve != null) {
            toReserve.setScaledATokenBalance(toReserve.getScaledATokenBalance().add(scaledAmount));
            toReserve.setCurrentATokenBalance(toReserve.getCurrentATokenBalance().add(currentAmount));
            toReserve.setLastUpdateTimestamp(timestamp);
            store.saveUserReserve(toReserve);
        }
        if (fromReserve != null) {
            fromReserve.setScaledATokenBalance(fromReserve.getScaledATokenBalance().subtract(scaledAmount).max(BigInteger.ZERO));
            fromReserve.setCurrentATokenBalance(fromReserve.getCurrentATokenBalance().subtract(currentAmount).max(BigInteger.ZERO));
            fromReserve.setLastUpdateTimestamp(timestamp);
            store.saveUserReserve(fromReserve);
        }

        if (!isZeroAddress(from)) {
            engine.syncBaseline(from, reserveId, timestamp, blockNumber);
        }
        if (!isZeroAddress(to)) {
            engine.syncBaseline(to, reserveId, timestamp, blockNumber);
            engine.recordDailyAmount(to, DailyAction.SUPPLY, engine.usdValue(reserve, currentAmount), timestamp);
            engine.awardDailyBonus(to, DailyAction.SUPPLY, timestamp);
        }
    }

    private static DailyAction dailyActionFor(boolean debt, boolean mint) {
        if (debt) {
            return mint ? DailyAction.BORROW : DailyAction.REPAY;
        }
        return mint ? DailyAction.SUPPLY : DailyAction.WITHDRAW;
    }
}
