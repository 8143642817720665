package com.defipoints.platform.service;

import com.defipoints.platform.model.NftPartnership;
import com.defipoints.platform.model.UserLeaderboardState;
import com.defipoints.platform.model.UserNftOwnership;
import com.defipoints.platform.model.UserReserveList;
import com.defipoints.platform.model.VotingLock;
import com.defipoints.platform.repository.ChainReader;
import com.defipoints.platform.repository.PointsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Maintains the per-user multiplier inputs: voting power from locks and partner NFT ownership.
 */
@Service
public class UserMultiplierService {

    private static final Logger logger = LoggerFactory.getLogger(UserMultiplierService.class);

    private final PointsStore store;
    private final MultiplierResolver multiplierResolver;
    private final ChainReader chainReader;

    @Autowired
    public UserMultiplierService(PointsStore store, MultiplierResolver multiplierResolver, ChainReader chainReader) {
        this.store = store;
        this.multiplierResolver = multiplierResolver;
        this.chainReader = chainReader;
    }

    public UserLeaderboardState getOrCreateState(String userId, long timestamp) {
        return store.findUserState(userId).orElseGet(() -> {
            UserLeaderboardState state = UserLeaderboardState.initial(userId, timestamp);
            store.saveUserState(state);
            return state;
        });
    }

    public UserReserveList getOrCreatePositions(String userId) {
        return store.findUserReserveList(userId).orElseGet(() -> {
            UserReserveList list = UserReserveList.empty(userId);
            store.saveUserReserveList(list);
            return list;
        });
    }

    public BigInteger currentVotingPower(String userId, long timestamp) {
        BigInteger total = BigInteger.ZERO;
        for (VotingLock lock : locksOf(userId)) {
            total = total.add(MultiplierResolver.votingPowerOf(lock, timestamp));
        }
        return total;
    }

    public BigInteger averageVotingPower(String userId, long start, long end) {
        if (end <= start) {
            return currentVotingPower(userId, end);
        }
        BigInteger total = BigInteger.ZERO;
        for (VotingLock lock : locksOf(userId)) {
            total = total.add(MultiplierResolver.averageVotingPowerOf(lock, start, end));
        }
        return total;
    }

    /**
     * Recomputes voting power, tier and every multiplier of the user at {@code timestamp}.
     */
    public UserLeaderboardState refreshState(String userId, long timestamp) {
        UserLeaderboardState state = getOrCreateState(userId, timestamp);

        BigInteger votingPower = currentVotingPower(userId, timestamp);
        long activeCollections = countActiveCollections(userId, timestamp);
        long nftMultiplier = multiplierResolver.nftMultiplierFor(activeCollections);
        long vpMultiplier = multiplierResolver.vpMultiplierFor(votingPower);

        state.setVotingPower(votingPower);
        state.setVpTierIndex(multiplierResolver.vpTierIndexFor(votingPower));
        state.setVpMultiplierBps(vpMultiplier);
        state.setNftCount(activeCollections);
        state.setNftMultiplierBps(nftMultiplier);
        state.setCombinedMultiplierBps(MultiplierResolver.combinedMultiplierBps(nftMultiplier, vpMultiplier));
        state.setLastUpdate(timestamp);
        store.saveUserState(state);
        return state;
    }

    /**
     * Overrides the stored voting power with a keeper-reported value. Lasts until the next
     * lock-driven refresh.
     */
    public UserLeaderboardState applyVotingPower(String userId, BigInteger votingPower, long timestamp) {
        UserLeaderboardState state = getOrCreateState(userId, timestamp);
        long vpMultiplier = multiplierResolver.vpMultiplierFor(votingPower);
        long nftMultiplier = multiplierResolver.nftMultiplierFor(state.getNftCount());

        state.setVotingPower(votingPower);
        state.setVpTierIndex(multiplierResolver.vpTierIndexFor(votingPower));
        state.setVpMultiplierBps(vpMultiplier);
        state.setNftMultiplierBps(nftMultiplier);
        state.setCombinedMultiplierBps(MultiplierResolver.combinedMultiplierBps(nftMultiplier, vpMultiplier));
        state.setLastUpdate(timestamp);
        store.saveUserState(state);
        return state;
    }

    public void trackLock(String userId, String tokenId) {
        UserReserveList list = getOrCreatePositions(userId);
        if (!list.getLockTokenIds().contains(tokenId)) {
            list.getLockTokenIds().add(tokenId);
            store.saveUserReserveList(list);
        }
    }

    public void untrackLock(String userId, String tokenId) {
        UserReserveList list = getOrCreatePositions(userId);
        if (list.getLockTokenIds().remove(tokenId)) {
            store.saveUserReserveList(list);
        }
    }

    public void trackLpPosition(String userId, String positionId) {
        UserReserveList list = getOrCreatePositions(userId);
        if (!list.getLpPositionIds().contains(positionId)) {
            list.getLpPositionIds().add(positionId);
            store.saveUserReserveList(list);
        }
    }

    public void untrackLpPosition(String userId, String positionId) {
        UserReserveList list = getOrCreatePositions(userId);
        if (list.getLpPositionIds().remove(positionId)) {
            store.saveUserReserveList(list);
        }
    }

    /**
     * Combined multiplier using the user's average voting power over {@code [start, end]}.
     */
    public long averageCombinedMultiplierBps(String userId, long start, long end) {
        UserLeaderboardState state = getOrCreateState(userId, end);
        long vpMultiplier = multiplierResolver.vpMultiplierFor(averageVotingPower(userId, start, end));
        return MultiplierResolver.combinedMultiplierBps(state.getNftMultiplierBps(), vpMultiplier);
    }

    /**
     * Baselines ownership of every live partnership the user has no record for. A failed or empty
     * read leaves the user's known state untouched.
     */
    public void syncNftOwnershipFromChain(String userId, long timestamp) {
        for (NftPartnership partnership : store.findAllNftPartnerships()) {
            if (!partnership.isLiveAt(timestamp)) {
                continue;
            }
            if (store.findNftOwnership(userId, partnership.getCollection()).isPresent()) {
                continue;
            }

            Optional<Long> balance = readBalanceSafely(partnership.getCollection(), userId);
            if (balance.isEmpty()) {
                continue;
            }
            long value = Math.max(0L, balance.get());
            store.saveNftOwnership(UserNftOwnership.builder()
                .userId(userId)
                .collection(partnership.getCollection())
                .balance(value)
                .hasNft(value > 0)
                .lastCheckedAt(timestamp)
                .build());
            logger.debug("Baselined NFT ownership for user {} in {}: {}", userId, partnership.getCollection(), value);
        }
    }

    public long nftBalance(String userId, String collection) {
        return store.findNftOwnership(userId, collection)
            .map(UserNftOwnership::getBalance)
            .orElse(0L);
    }

    /**
     * Stores the user's balance in {@code collection}, clamped at zero. Returns whether the user
     * went from holding none to some, or back.
     */
    public boolean updateNftBalance(String userId, String collection, long balance, long timestamp) {
        long previous = nftBalance(userId, collection);
        long value = Math.max(0L, balance);
        store.saveNftOwnership(UserNftOwnership.builder()
            .userId(userId)
            .collection(collection)
            .balance(value)
            .hasNft(value > 0)
            .lastCheckedAt(timestamp)
            .build());
        return (previous > 0) != (value > 0);
    }

    public long countActiveCollections(String userId, long timestamp) {
        long count = 0;
        for (NftPartnership partnership : store.findAllNftPartnerships()) {
            if (!partnership.isLiveAt(timestamp)) {
                continue;
            }
            boolean owns = store.findNftOwnership(userId, partnership.getCollection())
                .map(UserNftOwnership::isHasNft)
                .orElse(false);
            if (owns) {
                count++;
            }
        }
        return count;
    }

    private Optional<Long> readBalanceSafely(String collection, String userId) {
        try {
            return chainReader.readBalance(collection, userId);
        } catch (Exception e) {
            logger.warn("Chain read failed for collection {} and user {}, keeping known state", collection, userId, e);
            return Optional.empty();
        }
    }

    private List<VotingLock> locksOf(String userId) {
        List<String> tokenIds = store.findUserReserveList(userId)
            .map(UserReserveList::getLockTokenIds)
            .orElse(List.of());
        return tokenIds.stream()
            .map(store::findVotingLock)
            .flatMap(Optional::stream)
            .filter(lock -> userId.equals(lock.getOwner()))
            .toList();
    }
}
