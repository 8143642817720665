package com.defipoints.platform.event.handler;

import com.defipoints.platform.PointsPlatformFixture;
import com.defipoints.platform.event.EventType;
import com.defipoints.platform.event.params.KeeperParams;
import com.defipoints.platform.event.params.NftMultiplierParams;
import com.defipoints.platform.event.params.NftPartnershipParams;
import com.defipoints.platform.event.params.NftTransferParams;
import com.defipoints.platform.model.NftPartnership;
import com.defipoints.platform.model.UserLeaderboardState;
import com.defipoints.platform.model.UserNftOwnership;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NftEventHandlerTest {

    private static final String COLLECTION = "0xcollection";
    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";

    private PointsPlatformFixture platform;

    @BeforeEach
    void setUp() {
        platform = new PointsPlatformFixture();
        platform.apply(EventType.NFT_PARTNERSHIP_ADDED, 10, NftPartnershipParams.builder()
            .collection("0xCOLLECTION")
            .name("Partner")
            .firstBonusBps(1_000L)
            .decayRatioBps(5_000L)
            .build());
    }

    @Test
    void testPartnershipAdded_StoresNormalizedCollection() {
        NftPartnership partnership = platform.store.findNftPartnership(COLLECTION).orElseThrow();

        assertEquals("Partner", partnership.getName());
        assertTrue(partnership.isActive());
        assertTrue(partnership.isLiveAt(10));
        assertEquals(1_000L, platform.store.findNftMultiplierConfig().orElseThrow().getFirstBonusBps());
    }

    @Test
    void testTransfer_MintGrantsMultiplier() {
        // Act
        transfer(AbstractEventHandler.ZERO_ADDRESS, ALICE, 100);

        // Assert
        UserLeaderboardState state = platform.store.findUserState(ALICE).orElseThrow();
        assertEquals(1L, state.getNftCount());
        assertEquals(11_000L, state.getNftMultiplierBps());
        assertEquals(11_000L, state.getCombinedMultiplierBps());
        assertEquals(1L, platform.store.findNftOwnership(ALICE, COLLECTION).orElseThrow().getBalance());
    }

    @Test
    void testTransfer_LastTokenOutKeepsRecord() {
        // Arrange
        transfer(AbstractEventHandler.ZERO_ADDRESS, ALICE, 100);

        // Act
        transfer(ALICE, BOB, 200);

        // Assert
        UserNftOwnership aliceOwnership = platform.store.findNftOwnership(ALICE, COLLECTION).orElseThrow();
        assertEquals(0L, aliceOwnership.getBalance());
        assertFalse(aliceOwnership.isHasNft());
        assertEquals(10_000L, platform.store.findUserState(ALICE).orElseThrow().getNftMultiplierBps());
        assertEquals(11_000L, platform.store.findUserState(BOB).orElseThrow().getNftMultiplierBps());
    }

    @Test
    void testTransfer_SecondTokenDoesNotChangeMultiplier() {
        // Arrange
        transfer(AbstractEventHandler.ZERO_ADDRESS, ALICE, 100);

        // Act
        transfer(AbstractEventHandler.ZERO_ADDRESS, ALICE, 200);

        // Assert
        assertEquals(2L, platform.store.findNftOwnership(ALICE, COLLECTION).orElseThrow().getBalance());
        assertEquals(1L, platform.store.findUserState(ALICE).orElseThrow().getNftCount());
    }

    @Test
    void testKeeperBalanceSync_OverridesBalance() {
        // Arrange
        transfer(AbstractEventHandler.ZERO_ADDRESS, BOB, 100);

        // Act
        platform.apply(EventType.KEEPER_NFT_BALANCE_SYNCED, 200, KeeperParams.builder()
            .user(BOB)
            .collection(COLLECTION)
            .balance(0L)
            .build());

        // Assert
        assertFalse(platform.store.findNftOwnership(BOB, COLLECTION).orElseThrow().isHasNft());
        assertEquals(0L, platform.store.findUserState(BOB).orElseThrow().getNftCount());
    }

    @Test
    void testMultiplierParamsUpdated_AppliesOnNextRefresh() {
        // Arrange
        transfer(AbstractEventHandler.ZERO_ADDRESS, ALICE, 100);

        // Act
        platform.apply(EventType.NFT_MULTIPLIER_PARAMS_UPDATED, 150, NftMultiplierParams.builder()
            .firstBonusBps(2_000L)
            .decayRatioBps(5_000L)
            .build());
        platform.userMultiplierService.refreshState(ALICE, 200);

        // Assert
        assertEquals(12_000L, platform.store.findUserState(ALICE).orElseThrow().getNftMultiplierBps());
    }

    @Test
    void testPartnershipRemoved_StopsCounting() {
        // Arrange
        transfer(AbstractEventHandler.ZERO_ADDRESS, ALICE, 100);

        // Act
        platform.apply(EventType.NFT_PARTNERSHIP_REMOVED, 150,
            NftPartnershipParams.builder().collection(COLLECTION).build());
        platform.userMultiplierService.refreshState(ALICE, 200);

        // Assert
        assertFalse(platform.store.findNftPartnership(COLLECTION).orElseThrow().isActive());
        assertEquals(0L, platform.store.findUserState(ALICE).orElseThrow().getNftCount());
        assertEquals(10_000L, platform.store.findUserState(ALICE).orElseThrow().getNftMultiplierBps());
    }

    private void transfer(String from, String to, long timestamp) {
        platform.apply(EventType.PARTNER_NFT_TRANSFERRED, timestamp, NftTransferParams.builder()
            .collection(COLLECTION)
            .from(from)
            .to(to)
            .build());
    }
}
