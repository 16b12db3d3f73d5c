package ai.classtalk.backend.service;

import ai.classtalk.backend.model.dto.SessionResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis-backed session cache with a fixed TTL.
 *
 * Cache errors never fail a request: reads fall through to the database and
 * failed writes are only logged. A failed eviction is logged at error level
 * because a stale entry may then be served until the TTL expires.
 */
@Service
@ConditionalOnProperty(name = "app.session.cache.enabled", havingValue = "true")
public class RedisSessionCache implements SessionCache {

    private static final Logger logger = LoggerFactory.getLogger(RedisSessionCache.class);

    private static final String KEY_PREFIX = "session:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter errorCounter;

    @Autowired
    public RedisSessionCache(@Qualifier("sessionRedisTemplate") RedisTemplate<String, String> sessionRedisTemplate,
                             ObjectMapper objectMapper,
                             MeterRegistry meterRegistry,
                             @Value("${app.session.cache.ttl-seconds:300}") long ttlSeconds) {
        this.redisTemplate = sessionRedisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(ttlSeconds);

        this.hitCounter = Counter.builder("session_cache_operations_total")
                .description("Session cache operations")
                .tag("operation", "hit")
                .register(meterRegistry);
        this.missCounter = Counter.builder("session_cache_operations_total")
                .description("Session cache operations")
                .tag("operation", "miss")
                .register(meterRegistry);
        this.errorCounter = Counter.builder("session_cache_operations_total")
                .description("Session cache operations")
                .tag("operation", "error")
                .register(meterRegistry);

        logger.info("RedisSessionCache initialized - TTL: {} seconds", ttlSeconds);
    }

    @Override
    public Optional<SessionResponse> get(UUID sessionId) {
        try {
            String cached = redisTemplate.opsForValue().get(key(sessionId));
            if (cached == null) {
                missCounter.increment();
                return Optional.empty();
            }
            hitCounter.increment();
            return Optional.of(objectMapper.readValue(cached, SessionResponse.class));
        } catch (DataAccessException | JsonProcessingException e) {
            errorCounter.increment();
            logger.warn("Session cache read failed for {}, falling back to database: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(UUID sessionId, SessionResponse session) {
        try {
            redisTemplate.opsForValue().set(key(sessionId), objectMapper.writeValueAsString(session), ttl);
        } catch (DataAccessException | JsonProcessingException e) {
            errorCounter.increment();
            logger.warn("Session cache write failed for {}: {}", sessionId, e.getMessage());
        }
    }

    @Override
    public void evict(UUID sessionId) {
        try {
            redisTemplate.delete(key(sessionId));
            logger.debug("Evicted session {} from cache", sessionId);
        } catch (DataAccessException e) {
            errorCounter.increment();
            logger.error("Session cache eviction failed for {}; entry may be stale for up to {}: {}",
                    sessionId, ttl, e.getMessage());
        }
    }

    private String key(UUID sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
