package com.defipoints.platform.service;

import com.defipoints.platform.model.NftMultiplierConfig;
import com.defipoints.platform.model.VotingLock;
import com.defipoints.platform.model.VotingPowerTier;
import com.defipoints.platform.repository.PointsStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Multiplier arithmetic. All multipliers are basis points where 10000 means 1.0x.
 */
@Service
public class MultiplierResolver {

    public static final long BASIS_POINTS = 10_000L;
    public static final long MAX_COMBINED_MULTIPLIER_BPS = 100_000L;
    public static final long MAX_LOCK_SECONDS = 31_536_000L;

    private static final BigInteger BASIS = BigInteger.valueOf(BASIS_POINTS);

    private final PointsStore store;

    @Autowired
    public MultiplierResolver(PointsStore store) {
        this.store = store;
    }

    /**
     * {@code 10000 + sum(firstBonus * decay^i / 10000^i)} over {@code activeCount} collections,
     * capped at {@link #MAX_COMBINED_MULTIPLIER_BPS}.
     */
    public static long nftMultiplierBps(long activeCount, NftMultiplierConfig config) {
        if (activeCount <= 0 || config == null) {
            return BASIS_POINTS;
        }
        BigInteger cap = BigInteger.valueOf(MAX_COMBINED_MULTIPLIER_BPS);
        BigInteger decay = BigInteger.valueOf(config.getDecayRatioBps());
        BigInteger multiplier = BigInteger.valueOf(BASIS_POINTS);
        BigInteger bonus = BigInteger.valueOf(config.getFirstBonusBps());
        for (long i = 0; i < activeCount && multiplier.compareTo(cap) < 0; i++) {
            multiplier = multiplier.add(bonus);
            bonus = bonus.multiply(decay).divide(BASIS);
        }
        return multiplier.min(cap).longValue();
    }

    /**
     * Multiplier of the highest active tier whose threshold {@code votingPower} meets.
     */
    public static long vpMultiplierBps(BigInteger votingPower, List<VotingPowerTier> tiers) {
        VotingPowerTier tier = highestTierFor(votingPower, tiers);
        return tier != null ? tier.getMultiplierBps() : BASIS_POINTS;
    }

    public static int vpTierIndex(BigInteger votingPower, List<VotingPowerTier> tiers) {
        VotingPowerTier tier = highestTierFor(votingPower, tiers);
        return tier != null ? tier.getTierIndex() : 0;
    }

    /**
     * Additive composition of both bonuses, clamped to {@code [10000, 100000]}.
     */
    public static long combinedMultiplierBps(long nftMultiplierBps, long vpMultiplierBps) {
        long combined = nftMultiplierBps + vpMultiplierBps - BASIS_POINTS;
        if (combined > MAX_COMBINED_MULTIPLIER_BPS) {
            return MAX_COMBINED_MULTIPLIER_BPS;
        }
        return Math.max(combined, BASIS_POINTS);
    }

    /**
     * Linearly decaying voting power of a lock at {@code timestamp}. Permanent locks keep their full amount.
     */
    public static BigInteger votingPowerOf(VotingLock lock, long timestamp) {
        BigInteger amount = lock.getLockedAmount();
        if (amount == null || amount.signum() <= 0) {
            return BigInteger.ZERO;
        }
        if (lock.isPermanent()) {
            return amount;
        }
        if (lock.getLockEnd() <= timestamp) {
            return BigInteger.ZERO;
        }
        BigInteger remaining = BigInteger.valueOf(lock.getLockEnd() - timestamp);
        return amount.multiply(remaining).divide(BigInteger.valueOf(MAX_LOCK_SECONDS));
    }

    /**
     * Mean voting power of a lock over {@code [start, end]}: the midpoint of the start and end values
     * over the part of the interval the lock is live, prorated by that part's share of the interval.
     */
    public static BigInteger averageVotingPowerOf(VotingLock lock, long start, long end) {
        if (end <= start) {
            return votingPowerOf(lock, end);
        }
        BigInteger amount = lock.getLockedAmount();
        if (amount == null || amount.signum() <= 0) {
            return BigInteger.ZERO;
        }
        if (lock.isPermanent()) {
            return amount;
        }
        if (lock.getLockEnd() <= start) {
            return BigInteger.ZERO;
        }

        long effectiveEnd = Math.min(end, lock.getLockEnd());
        BigInteger midpoint = votingPowerOf(lock, start).add(votingPowerOf(lock, effectiveEnd))
            .divide(BigInteger.TWO);
        long activeDuration = effectiveEnd - start;
        long totalDuration = end - start;
        if (end <= lock.getLockEnd() || activeDuration == totalDuration) {
            return midpoint;
        }
        return midpoint.multiply(BigInteger.valueOf(activeDuration)).divide(BigInteger.valueOf(totalDuration));
    }

    public static BigInteger applyMultiplier(BigInteger rawPoints, long multiplierBps) {
        return rawPoints.multiply(BigInteger.valueOf(multiplierBps)).divide(BigInteger.valueOf(BASIS_POINTS));
    }

    public long nftMultiplierFor(long activeCollections) {
        return nftMultiplierBps(activeCollections, store.findNftMultiplierConfig().orElse(null));
    }

    public long vpMultiplierFor(BigInteger votingPower) {
        return vpMultiplierBps(votingPower, activeTiers());
    }

    public int vpTierIndexFor(BigInteger votingPower) {
        return vpTierIndex(votingPower, activeTiers());
    }

    private List<VotingPowerTier> activeTiers() {
        return store.findAllVotingPowerTiers().stream()
            .filter(VotingPowerTier::isActive)
            .collect(Collectors.toList());
    }

    private static VotingPowerTier highestTierFor(BigInteger votingPower, List<VotingPowerTier> tiers) {
        if (votingPower == null || tiers == null || tiers.isEmpty()) {
            return null;
        }
        List<VotingPowerTier> ordered = tiers.stream()
            .filter(VotingPowerTier::isActive)
            .sorted(Comparator.comparing(VotingPowerTier::getMinVotingPower))
            .collect(Collectors.toList());

        VotingPowerTier matched = null;
        for (VotingPowerTier tier : ordered) {
            if (votingPower.compareTo(tier.getMinVotingPower()) < 0) {
                break;
            }
            matched = tier;
        }
        return matched;
    }
}
