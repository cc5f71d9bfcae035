package com.example.cachesync.cache;

import com.example.cachesync.error.NetworkException;
import com.example.cachesync.error.TransportCode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.Lifecycle;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis-backed cache store. The connection is verified once, by whichever caller gets there first.
 */
@Slf4j
@Component
public class RedisCacheStoreClient implements CacheStoreClient {

    private final StringRedisTemplate redis;
    private final Object connectLock = new Object();
    private volatile boolean connected;

    public RedisCacheStoreClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        execute("SET " + key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
        log.debug("Stored {} with ttl {}s", key, ttl.toSeconds());
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(execute("GET " + key, () -> redis.opsForValue().get(key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute("EXISTS " + key, () -> redis.hasKey(key)));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long seconds = execute("TTL " + key, () -> redis.getExpire(key));
        // -2 missing key, -1 no expiry
        if (seconds == null || seconds < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds(seconds));
    }

    @Override
    public List<String> keys(String prefix, int limit) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(Math.max(limit, 100))
                .build();
        return execute("SCAN " + prefix + "*", () -> {
            List<String> keys = new ArrayList<>();
            try (RedisConnection connection = connectionFactory().getConnection();
                 Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext() && keys.size() < limit) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        });
    }

    boolean isConnected() {
        return connected;
    }

    private <T> T execute(String command, Supplier<T> operation) {
        try {
            ensureConnected();
            return operation.get();
        } catch (RedisConnectionFailureException e) {
            connected = false;
            log.error("Redis connection failed during {}: {}", command, e.getMessage());
            throw new NetworkException("Cache store unavailable: " + e.getMessage(),
                    transportCode(e, TransportCode.CONNECTION_REFUSED), e);
        } catch (QueryTimeoutException e) {
            log.error("Redis command {} timed out: {}", command, e.getMessage());
            throw new NetworkException("Cache store command timed out: " + e.getMessage(),
                    transportCode(e, TransportCode.TIMEOUT), e);
        }
    }

    private void ensureConnected() {
        if (connected) {
            return;
        }
        synchronized (connectLock) {
            if (connected) {
                return;
            }
            try (RedisConnection connection = connectionFactory().getConnection()) {
                connection.ping();
            }
            connected = true;
            log.info("Connected to Redis cache store");
        }
    }

    private RedisConnectionFactory connectionFactory() {
        RedisConnectionFactory factory = redis.getConnectionFactory();
        if (factory == null) {
            throw new IllegalStateException("StringRedisTemplate has no connection factory");
        }
        return factory;
    }

    private static TransportCode transportCode(Throwable error, TransportCode fallback) {
        TransportCode detected = TransportCode.detect(error.getCause());
        return detected != null ? detected : fallback;
    }

    @PreDestroy
    public void close() {
        synchronized (connectLock) {
            if (!connected) {
                return;
            }
            connected = false;
            if (redis.getConnectionFactory() instanceof Lifecycle lifecycle && lifecycle.isRunning()) {
                lifecycle.stop();
            }
            log.info("Closed Redis cache store connection");
        }
    }
}
