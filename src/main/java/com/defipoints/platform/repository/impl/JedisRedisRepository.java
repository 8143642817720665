package com.defipoints.platform.repository.impl;

import com.defipoints.platform.model.RankedUser;
import com.defipoints.platform.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.resps.Tuple;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mirrors a ranked TopK into a Redis sorted set {@code leaderboard:{id}}. The set only ever
 * holds the published head, so reads fetch it whole and re-apply the userId tie-break that
 * Redis ordering does not provide.
 */
@Repository
public class JedisRedisRepository implements RedisRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisRedisRepository.class);

    private static final String LEADERBOARD_KEY_PREFIX = "leaderboard:";

    private static final Comparator<Tuple> RANKING_ORDER = Comparator
        .comparingDouble(Tuple::getScore).reversed()
        .thenComparing(Tuple::getElement);

    private JedisPool jedisPool;
    private volatile boolean available = false;

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.ssl:false}")
    private boolean redisSsl;

    @Value("${redis.timeout:2000}")
    private int timeout;

    @PostConstruct
    public void init() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(16);
            poolConfig.setMaxIdle(8);
            poolConfig.setMinIdle(1);
            poolConfig.setTestOnBorrow(true);

            DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout);

            if (redisSsl) {
                clientConfigBuilder.ssl(true);
            }

            if (redisPassword != null && !redisPassword.isEmpty()) {
                clientConfigBuilder.password(redisPassword);
            }

            jedisPool = new JedisPool(poolConfig, new HostAndPort(redisHost, redisPort), clientConfigBuilder.build());

            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
                available = true;
                logger.info("Connected to Redis at {}:{}{}", redisHost, redisPort, redisSsl ? " (SSL enabled)" : "");
            }
        } catch (Exception e) {
            logger.warn("Redis mirror unavailable at {}:{}: {}", redisHost, redisPort, e.getMessage());
            available = false;
        }
    }

    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }

    @Override
    public boolean isAvailable() {
        if (jedisPool == null) {
            return false;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            available = true;
            return true;
        } catch (Exception e) {
            if (available) {
                logger.warn("Lost connection to Redis: {}", e.getMessage());
            }
            available = false;
            return false;
        }
    }

    @Override
    public void publishTopK(String leaderboardId, List<RankedUser> entries) {
        if (leaderboardId == null || leaderboardId.trim().isEmpty()) {
            throw new IllegalArgumentException("LeaderboardId cannot be null or empty");
        }

        String key = LEADERBOARD_KEY_PREFIX + leaderboardId;
        Map<String, Double> members = new LinkedHashMap<>();
        for (RankedUser entry : entries) {
            members.put(entry.getUserId(), entry.getPoints());
        }

        try (Jedis jedis = jedisPool.getResource()) {
            Transaction transaction = jedis.multi();
            transaction.del(key);
            if (!members.isEmpty()) {
                transaction.zadd(key, members);
            }
            transaction.exec();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to publish leaderboard " + leaderboardId + " to Redis", e);
        }
    }

    @Override
    public List<RankedUser> getTopN(String leaderboardId, int limit) {
        if (leaderboardId == null || leaderboardId.trim().isEmpty() || limit <= 0) {
            return new ArrayList<>();
        }

        List<RankedUser> ranked = readRanked(leaderboardId);
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
    }

    @Override
    public Optional<RankedUser> getUserRank(String leaderboardId, String userId) {
        if (leaderboardId == null || leaderboardId.trim().isEmpty() || userId == null || userId.trim().isEmpty()) {
            return Optional.empty();
        }

        return readRanked(leaderboardId).stream()
            .filter(user -> user.getUserId().equals(userId))
            .findFirst();
    }

    @Override
    public Long getTotalUsers(String leaderboardId) {
        if (leaderboardId == null || leaderboardId.trim().isEmpty()) {
            return 0L;
        }

        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.zcard(LEADERBOARD_KEY_PREFIX + leaderboardId);
        } catch (Exception e) {
            logger.warn("Failed to get member count from Redis for {}: {}", leaderboardId, e.getMessage());
            return 0L;
        }
    }

    private List<RankedUser> readRanked(String leaderboardId) {
        try (Jedis jedis = jedisPool.getResource()) {
            List<Tuple> tuples = jedis.zrevrangeWithScores(LEADERBOARD_KEY_PREFIX + leaderboardId, 0, -1);
            return toRankedUsers(tuples);
        } catch (Exception e) {
            logger.warn("Failed to read leaderboard {} from Redis: {}", leaderboardId, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Orders sorted-set members by score descending then member ascending and assigns 1-based ranks.
     */
    static List<RankedUser> toRankedUsers(List<Tuple> tuples) {
        List<Tuple> ordered = new ArrayList<>(tuples);
        ordered.sort(RANKING_ORDER);

        List<RankedUser> rankedUsers = new ArrayList<>();
        int rank = 1;
        for (Tuple tuple : ordered) {
            rankedUsers.add(RankedUser.builder()
                .userId(tuple.getElement())
                .rank(rank++)
                .points(tuple.getScore())
                .build());
        }
        return rankedUsers;
    }
}
