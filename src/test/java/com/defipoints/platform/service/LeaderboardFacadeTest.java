package com.defipoints.platform.service;

import com.defipoints.platform.config.PointsProperties;
import com.defipoints.platform.model.BlacklistEntry;
import com.defipoints.platform.model.LeaderboardEpoch;
import com.defipoints.platform.model.LeaderboardState;
import com.defipoints.platform.model.RankedUser;
import com.defipoints.platform.model.TopK;
import com.defipoints.platform.repository.RedisRepository;
import com.defipoints.platform.repository.impl.InMemoryPointsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardFacadeTest {

    @Mock
    private RedisRepository redisRepository;

    @Captor
    private ArgumentCaptor<List<RankedUser>> captor;

    private InMemoryPointsStore store;
    private RankingStructure rankingStructure;
    private PointsProperties properties;
    private LeaderboardFacade leaderboardFacade;

    @BeforeEach
    void setUp() {
        store = new InMemoryPointsStore();
        rankingStructure = new RankingStructure(store);
        properties = new PointsProperties();
        leaderboardFacade = new LeaderboardFacade(store, rankingStructure, redisRepository, properties);

        store.saveEpoch(LeaderboardEpoch.builder().epochNumber(1).startTime(100).active(true).build());
        store.saveState(LeaderboardState.builder().currentEpochNumber(1).active(true).build());
    }

    @Test
    void testUpdateLeaderboard_PublishesGlobalMirror() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(true);

        // Act
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);

        // Assert
        verify(redisRepository).publishTopK(eq(LeaderboardFacade.GLOBAL_MIRROR_ID), captor.capture());
        assertEquals(1, captor.getValue().size());
        assertEquals("0xalice", captor.getValue().get(0).getUserId());
        assertEquals(1, captor.getValue().get(0).getRank());
        assertEquals(42.0, captor.getValue().get(0).getPoints());
        assertFalse(leaderboardFacade.isMirrorDirty());
    }

    @Test
    void testUpdateLeaderboard_RedisUnavailableMarksDirty() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(false);

        // Act
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);

        // Assert
        assertTrue(leaderboardFacade.isMirrorDirty());
        verify(redisRepository, never()).publishTopK(anyString(), anyList());
        assertEquals(1, rankingStructure.topEntries(TopK.GLOBAL_KEY).size());
    }

    @Test
    void testUpdateLeaderboard_PublishFailureMarksDirty() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(true);
        doThrow(new RuntimeException("Connection reset")).when(redisRepository).publishTopK(anyString(), anyList());

        // Act
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);

        // Assert
        assertTrue(leaderboardFacade.isMirrorDirty());
    }

    @Test
    void testRepublishIfDirty_ClearsFlagOnceRedisRecovers() {
        // Arrange
        when(redisRepository.isAvailable()).thenReturn(false, true);
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);

        // Act
        leaderboardFacade.republishIfDirty();

        // Assert
        verify(redisRepository).publishTopK(eq(LeaderboardFacade.GLOBAL_MIRROR_ID), anyList());
        assertFalse(leaderboardFacade.isMirrorDirty());
    }

    @Test
    void testRepublishIfDirty_NothingToDo() {
        leaderboardFacade.republishIfDirty();

        verifyNoInteractions(redisRepository);
    }

    @Test
    void testUpdateLeaderboard_BlacklistedUserSkipped() {
        // Arrange
        store.saveBlacklistEntry(BlacklistEntry.builder().userId("0xalice").blacklisted(true).updatedAt(150).build());

        // Act
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);
        leaderboardFacade.updateAllTimeLeaderboard("0xalice", 42.0, 200);

        // Assert
        assertTrue(rankingStructure.topEntries(TopK.key(1)).isEmpty());
        assertTrue(rankingStructure.topEntries(TopK.key(RankingStructure.ALL_TIME_SCOPE)).isEmpty());
        verifyNoInteractions(redisRepository);
    }

    @Test
    void testUpdateLeaderboard_NoEpochSkipped() {
        // Arrange
        store.saveState(LeaderboardState.initial());

        // Act
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);

        // Assert
        assertTrue(rankingStructure.topEntries(TopK.key(1)).isEmpty());
        verifyNoInteractions(redisRepository);
    }

    @Test
    void testUpdateLeaderboard_RedisMirrorDisabled() {
        // Arrange
        properties.getMirror().setRedisEnabled(false);

        // Act
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);

        // Assert
        assertEquals(1, rankingStructure.topEntries(TopK.key(1)).size());
        verifyNoInteractions(redisRepository);
    }

    @Test
    void testRemoveUserFromLeaderboards() {
        // Arrange
        properties.getMirror().setRedisEnabled(false);
        leaderboardFacade.updateLeaderboard("0xalice", 42.0, 200);
        leaderboardFacade.updateAllTimeLeaderboard("0xalice", 42.0, 200);

        // Act
        leaderboardFacade.removeUserFromLeaderboards("0xalice", 300);

        // Assert
        assertTrue(rankingStructure.topEntries(TopK.key(1)).isEmpty());
        assertTrue(rankingStructure.topEntries(TopK.GLOBAL_KEY).isEmpty());
        assertTrue(rankingStructure.topEntries(TopK.key(RankingStructure.ALL_TIME_SCOPE)).isEmpty());
    }
}
