package com.defipoints.platform.repository.impl;

import com.defipoints.platform.model.RankedUser;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.resps.Tuple;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JedisRedisRepositoryTest {

    @Test
    void testToRankedUsers_OrdersByScoreDescending() {
        List<RankedUser> ranked = JedisRedisRepository.toRankedUsers(List.of(
            new Tuple("0xalice", 10.0),
            new Tuple("0xbob", 30.0),
            new Tuple("0xcarol", 20.0)));

        assertEquals(3, ranked.size());
        assertEquals("0xbob", ranked.get(0).getUserId());
        assertEquals(1, ranked.get(0).getRank());
        assertEquals("0xcarol", ranked.get(1).getUserId());
        assertEquals(2, ranked.get(1).getRank());
        assertEquals("0xalice", ranked.get(2).getUserId());
        assertEquals(10.0, ranked.get(2).getPoints());
    }

    @Test
    void testToRankedUsers_TieBreaking() {
        // Equal scores fall back to the lexicographically smaller address
        List<RankedUser> ranked = JedisRedisRepository.toRankedUsers(List.of(
            new Tuple("0xbbb", 5.0),
            new Tuple("0xaaa", 5.0)));

        assertEquals("0xaaa", ranked.get(0).getUserId());
        assertEquals("0xbbb", ranked.get(1).getUserId());
        assertEquals(2, ranked.get(1).getRank());
    }

    @Test
    void testToRankedUsers_Empty() {
        assertTrue(JedisRedisRepository.toRankedUsers(List.of()).isEmpty());
    }

    @Test
    void testReadsWithoutConnection() {
        // The pool is only created by init(), so a bare instance behaves like an unreachable Redis
        JedisRedisRepository repository = new JedisRedisRepository();

        assertFalse(repository.isAvailable());
        assertTrue(repository.getTopN("", 10).isEmpty());
        assertTrue(repository.getUserRank("global", " ").isEmpty());
        assertEquals(0L, repository.getTotalUsers(null));
    }
}
