package com.defipoints.platform.repository;

import com.defipoints.platform.model.RankedUser;

import java.util.List;
import java.util.Optional;

public interface RedisRepository {
    void publishTopK(String leaderboardId, List<RankedUser> entries);
    List<RankedUser> getTopN(String leaderboardId, int limit);
    Optional<RankedUser> getUserRank(String leaderboardId, String userId);
    Long getTotalUsers(String leaderboardId);
    boolean isAvailable();
}
