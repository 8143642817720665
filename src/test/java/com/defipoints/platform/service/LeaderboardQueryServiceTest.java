package com.defipoints.platform.service;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.exception.InvalidRequestException;
import com.defipoints.platform.exception.LeaderboardNotFoundException;
import com.defipoints.platform.model.LeaderboardEpoch;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.model.RankedUser;
import com.defipoints.platform.model.ScoreBucket;
import com.defipoints.platform.model.UserRanking;
import com.defipoints.platform.repository.RedisRepository;
import com.defipoints.platform.repository.impl.InMemoryPointsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardQueryServiceTest {

    @Mock
    private RedisRepository redisRepository;

    @Mock
    private LeaderboardFacade leaderboardFacade;

    private InMemoryPointsStore store;
    private RankingStructure rankingStructure;
    private PointsProperties properties;
    private LeaderboardQueryService queryService;

    @BeforeEach
    void setUp() {
        store = new InMemoryPointsStore();
        rankingStructure = new RankingStructure(store);
        properties = new PointsProperties();
        queryService = new LeaderboardQueryService(store, rankingStructure, redisRepository, leaderboardFacade,
            properties);
    }

    @Test
    void testResolveEpoch_Scopes() {
        // Arrange
        startEpoch(1);

        // Act & Assert
        assertEquals(1L, queryService.resolveEpoch("global"));
        assertEquals(1L, queryService.resolveEpoch(" GLOBAL "));
        assertEquals(RankingStructure.ALL_TIME_SCOPE, queryService.resolveEpoch("all-time"));
        assertEquals(1L, queryService.resolveEpoch("1"));
    }

    @Test
    void testResolveEpoch_InvalidScopes() {
        startEpoch(1);

        assertThrows(InvalidRequestException.class, () -> queryService.resolveEpoch(" "));
        assertThrows(InvalidRequestException.class, () -> queryService.resolveEpoch(null));
        assertThrows(InvalidRequestException.class, () -> queryService.resolveEpoch("weekly"));
        assertThrows(LeaderboardNotFoundException.class, () -> queryService.resolveEpoch("7"));
        assertThrows(LeaderboardNotFoundException.class, () -> queryService.resolveEpoch("0"));
    }

    @Test
    void testResolveEpoch_GlobalBeforeFirstEpoch() {
        LeaderboardNotFoundException exception = assertThrows(LeaderboardNotFoundException.class,
            () -> queryService.resolveEpoch("global"));
        assertEquals("No epoch has started yet", exception.getMessage());
    }

    @Test
    void testGetTopN_GlobalFromRedis() {
        // Arrange
        startEpoch(1);
        List<RankedUser> cached = List.of(RankedUser.builder().userId("0xcached").rank(1).points(9.0).build());
        when(leaderboardFacade.isMirrorDirty()).thenReturn(false);
        when(redisRepository.isAvailable()).thenReturn(true);
        when(redisRepository.getTopN(LeaderboardFacade.GLOBAL_MIRROR_ID, 10)).thenReturn(cached);

        // Act
        List<RankedUser> result = queryService.getTopN("global", 10);

        // Assert
        assertEquals(cached, result);
    }

    @Test
    void testGetTopN_GlobalFallsBackWhenRedisFails() {
        // Arrange
        startEpoch(1);
        rankingStructure.upsert(1, "0xalice", 5.0, 200, true);
        rankingStructure.upsert(1, "0xbob", 8.0, 200, true);
        when(leaderboardFacade.isMirrorDirty()).thenReturn(false);
        when(redisRepository.isAvailable()).thenReturn(true);
        when(redisRepository.getTopN(anyString(), anyInt())).thenThrow(new RuntimeException("Redis down"));

        // Act
        List<RankedUser> result = queryService.getTopN("global", 10);

        // Assert
        assertEquals(2, result.size());
        assertEquals("0xbob", result.get(0).getUserId());
        assertEquals(1, result.get(0).getRank());
        assertEquals("0xalice", result.get(1).getUserId());
    }

    @Test
    void testGetTopN_DirtyMirrorSkipsRedis() {
        // Arrange
        startEpoch(1);
        rankingStructure.upsert(1, "0xalice", 5.0, 200, true);
        when(leaderboardFacade.isMirrorDirty()).thenReturn(true);

        // Act
        List<RankedUser> result = queryService.getTopN("global", 10);

        // Assert
        assertEquals(1, result.size());
        verifyNoInteractions(redisRepository);
    }

    @Test
    void testGetTopN_EpochScopeReadsStore() {
        // Arrange
        startEpoch(1);
        for (int i = 0; i < 5; i++) {
            rankingStructure.upsert(1, "0xuser" + i, i + 1, 200, true);
        }

        // Act
        List<RankedUser> result = queryService.getTopN("1", 3);

        // Assert
        assertEquals(3, result.size());
        assertEquals("0xuser4", result.get(0).getUserId());
        verifyNoInteractions(redisRepository);
    }

    @Test
    void testGetTopN_InvalidLimit() {
        assertThrows(InvalidRequestException.class, () -> queryService.getTopN("all-time", 0));
        assertThrows(InvalidRequestException.class, () -> queryService.getTopN("all-time", 101));
    }

    @Test
    void testGetUserRank_InTopK() {
        // Arrange
        startEpoch(1);
        rankingStructure.upsert(1, "0xalice", 5.0, 200, true);
        rankingStructure.upsert(1, "0xbob", 8.0, 200, true);

        // Act
        UserRanking ranking = queryService.getUserRank("1", "0xALICE");

        // Assert
        assertEquals("0xalice", ranking.getUserId());
        assertEquals(2L, ranking.getRank());
        assertTrue(ranking.isExact());
        assertEquals(5.0, ranking.getPoints());
        assertEquals(RankingStructure.bucketIndexFor(5.0), ranking.getBucketIndex());
    }

    @Test
    void testGetUserRank_UnknownUser() {
        startEpoch(1);

        UserRanking ranking = queryService.getUserRank("global", "0xnobody");

        assertNull(ranking.getRank());
        assertFalse(ranking.isExact());
        assertEquals(0.0, ranking.getPoints());
    }

    @Test
    void testGetTotalUsersAndBuckets() {
        // Arrange
        startEpoch(1);
        rankingStructure.upsert(1, "0xalice", 5.0, 200, true);
        rankingStructure.upsert(1, "0xbob", 5.5, 200, true);

        // Act
        long total = queryService.getTotalUsers("global");
        List<ScoreBucket> buckets = queryService.getBuckets("1");

        // Assert
        assertEquals(2L, total);
        assertEquals(1, buckets.size());
        assertEquals(2, buckets.get(0).getCount());
    }

    private void startEpoch(long epochNumber) {
        store.saveEpoch(LeaderboardEpoch.builder().epochNumber(epochNumber).startTime(100).active(true).build());
        store.saveState(LeaderboardState.builder().currentEpochNumber(epochNumber).active(true).build());
    }
}
