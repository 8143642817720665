package com.defipoints.platform.controller;

import com.defipoints.platform.dto.UserPointsResponse;
import com.defipoints.platform.model.UserEpochStats;
import com.defipoints.platform.model.UserLeaderboardState;
import com.defipoints.platform.service.LeaderboardQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

import static com.defipoints.platform.service.PointsAccrualEngine.toPoints;

@RestController
@RequestMapping("/api/v1/users")
public class UserPointsController {

    private static final Logger logger = LoggerFactory.getLogger(UserPointsController.class);

    private final LeaderboardQueryService queryService;

    @Autowired
    public UserPointsController(LeaderboardQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Get a user's points in the current epoch and over its lifetime.
     * GET /api/v1/users/{userId}/points
     */
    @GetMapping("/{userId}/points")
    public ResponseEntity<UserPointsResponse> getUserPoints(@PathVariable String userId) {
        logger.info("Received GET request for user points - userId: {}", userId);

        try {
            Optional<UserEpochStats> stats = queryService.getCurrentEpochStats(userId);
            Optional<UserLeaderboardState> state = queryService.getUserState(userId);

            UserPointsResponse.UserPointsResponseBuilder response = UserPointsResponse.builder()
                .userId(userId.trim().toLowerCase())
                .epochNumber(queryService.currentEpochNumber())
                .combinedMultiplierBps(state.map(UserLeaderboardState::getCombinedMultiplierBps).orElse(10_000L))
                .lifetimePoints(state.map(s -> toPoints(s.getLifetimePoints())).orElse(0.0))
                .lifetimePointsWithMultiplier(state.map(s -> toPoints(s.getLifetimePointsWithMultiplier())).orElse(0.0))
                .retrievedAt(Instant.now());

            stats.ifPresent(s -> response
                .depositPoints(toPoints(s.getDepositPoints()))
                .borrowPoints(toPoints(s.getBorrowPoints()))
                .lpPoints(toPoints(s.getLpPoints()))
                .votingPowerPoints(toPoints(s.getDailyVpPoints()))
                .dailyBonusPoints(toPoints(dailyBonusTotal(s)))
                .manualPoints(toPoints(s.getManualAwardPoints()))
                .totalPoints(toPoints(s.getTotalPoints()))
                .totalPointsWithMultiplier(toPoints(s.getTotalPointsWithMultiplier())));

            return ResponseEntity.ok(response.build());
        } catch (Exception e) {
            logger.error("Error retrieving user points - userId: {}, error: {}", userId, e.getMessage(), e);
            throw e;
        }
    }

    private static BigInteger dailyBonusTotal(UserEpochStats stats) {
        return stats.getDailySupplyPoints()
            .add(stats.getDailyBorrowPoints())
            .add(stats.getDailyRepayPoints())
            .add(stats.getDailyWithdrawPoints());
    }
}
