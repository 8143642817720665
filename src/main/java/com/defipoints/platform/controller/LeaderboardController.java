package com.defipoints.platform.controller;

import com.defipoints.platform.dto.BucketsResponse;
import com.defipoints.platform.dto.TopNResponse;
import com.defipoints.platform.dto.UserRankResponse;
import com.defipoints.platform.model.RankedUser;
import com.defipoints.platform.model.ScoreBucket;
import com.defipoints.platform.model.UserRanking;
import com.defipoints.platform.service.LeaderboardQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/leaderboards")
public class LeaderboardController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    private final LeaderboardQueryService queryService;

    @Autowired
    public LeaderboardController(LeaderboardQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Get top N users of a scope.
     * GET /api/v1/leaderboards/{scope}/top?limit=N
     */
    @GetMapping("/{scope}/top")
    public ResponseEntity<TopNResponse> getTopN(
            @PathVariable String scope,
            @RequestParam(defaultValue = "10") int limit) {

        logger.info("Received GET request for top N users - scope: {}, limit: {}", scope, limit);

        try {
            List<RankedUser> rankedUsers = queryService.getTopN(scope, limit);
            long totalUsers = queryService.getTotalUsers(scope);

            TopNResponse response = TopNResponse.builder()
                .scope(scope)
                .epochNumber(queryService.resolveEpoch(scope))
                .users(rankedUsers)
                .totalUsers(totalUsers)
                .retrievedAt(Instant.now())
                .build();

            logger.info("Successfully retrieved top {} users - scope: {}, totalUsers: {}, returnedUsers: {}",
                limit, scope, totalUsers, rankedUsers.size());

            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving top N users - scope: {}, limit: {}, error: {}",
                scope, limit, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Get a user's rank, exact inside the top K and estimated below it.
     * GET /api/v1/leaderboards/{scope}/users/{userId}
     */
    @GetMapping("/{scope}/users/{userId}")
    public ResponseEntity<UserRankResponse> getUserRank(
            @PathVariable String scope,
            @PathVariable String userId) {

        logger.info("Received GET request for user rank - scope: {}, userId: {}", scope, userId);

        try {
            UserRanking ranking = queryService.getUserRank(scope, userId);

            UserRankResponse response = UserRankResponse.builder()
                .scope(scope)
                .epochNumber(ranking.getEpochNumber())
                .userId(ranking.getUserId())
                .points(ranking.getPoints())
                .rank(ranking.getRank())
                .exact(ranking.isExact())
                .bucketIndex(ranking.getBucketIndex())
                .retrievedAt(Instant.now())
                .build();

            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving user rank - scope: {}, userId: {}, error: {}",
                scope, userId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Get the score histogram of a scope.
     * GET /api/v1/leaderboards/{scope}/buckets
     */
    @GetMapping("/{scope}/buckets")
    public ResponseEntity<BucketsResponse> getBuckets(@PathVariable String scope) {
        logger.info("Received GET request for buckets - scope: {}", scope);

        try {
            List<BucketsResponse.Band> bands = queryService.getBuckets(scope).stream()
                .map(LeaderboardController::toBand)
                .toList();

            BucketsResponse response = BucketsResponse.builder()
                .scope(scope)
                .epochNumber(queryService.resolveEpoch(scope))
                .buckets(bands)
                .totalUsers(queryService.getTotalUsers(scope))
                .retrievedAt(Instant.now())
                .build();

            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving buckets - scope: {}, error: {}", scope, e.getMessage(), e);
            throw e;
        }
    }

    private static BucketsResponse.Band toBand(ScoreBucket bucket) {
        return BucketsResponse.Band.builder()
            .index(bucket.getIndex())
            .lower(bucket.getLower())
            .upper(bucket.getUpper())
            .count(bucket.getCount())
            .build();
    }
}
