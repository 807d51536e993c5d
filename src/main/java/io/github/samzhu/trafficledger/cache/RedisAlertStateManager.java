package io.github.samzhu.trafficledger.cache;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.trafficledger.exception.TierUnavailableException;
import io.github.samzhu.trafficledger.exception.TierUnavailableException.Tier;
import io.github.samzhu.trafficledger.exception.TrafficLedgerException;

/**
 * Redis 版告警狀態管理。
 *
 * <p>Key 格式：{@code alert_state:{resourceType}:{resourceId}}，值為 {@link AlertStateData} 的 JSON。
 * 狀態轉換以 Lua script 執行，確保多實例下的原子性。
 */
public class RedisAlertStateManager implements AlertStateManager {

    static final String KEY_PREFIX = "alert_state:";

    private static final RedisScript<Long> TO_FIRING = new DefaultRedisScript<>("""
        local existing = redis.call('GET', KEYS[1])
        if existing then
            local data = cjson.decode(existing)
            if data.state == 'firing' then
                return 0
            end
        end
        redis.call('SET', KEYS[1], ARGV[1], 'EX', tonumber(ARGV[2]))
        return 1
        """, Long.class);

    private static final RedisScript<String> TO_NORMAL = new DefaultRedisScript<>("""
        local existing = redis.call('GET', KEYS[1])
        if not existing then
            return false
        end
        redis.call('DEL', KEYS[1])
        return existing
        """, String.class);

    private static final RedisScript<Long> MARK_NOTIFIED = new DefaultRedisScript<>("""
        local existing = redis.call('GET', KEYS[1])
        if not existing then
            return 0
        end
        local data = cjson.decode(existing)
        data.last_notified_at = ARGV[1]
        data.notify_count = (data.notify_count or 0) + 1
        redis.call('SET', KEYS[1], cjson.encode(data), 'EX', tonumber(ARGV[2]))
        return 1
        """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String ttlSeconds = String.valueOf(STATE_TTL.toSeconds());

    public RedisAlertStateManager(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    String key(String resourceType, long resourceId) {
        return KEY_PREFIX + resourceType + ":" + resourceId;
    }

    @Override
    public Optional<AlertStateData> getState(String resourceType, long resourceId) {
        String json = call("getState", () -> redisTemplate.opsForValue().get(key(resourceType, resourceId)));
        return Optional.ofNullable(json).map(this::read);
    }

    @Override
    public boolean transitionToFiring(String resourceType, long resourceId, Instant now) {
        String json = write(AlertStateData.firing(now));
        Long result = call("transitionToFiring", () -> redisTemplate.execute(TO_FIRING,
            List.of(key(resourceType, resourceId)), json, ttlSeconds));
        return result != null && result == 1L;
    }

    @Override
    public Optional<Instant> transitionToNormal(String resourceType, long resourceId) {
        String previous = call("transitionToNormal", () -> redisTemplate.execute(TO_NORMAL,
            List.of(key(resourceType, resourceId))));
        if (previous == null) {
            return Optional.empty();
        }
        AlertStateData state = read(previous);
        return state.state() == AlertState.FIRING ? Optional.ofNullable(state.firedAt()) : Optional.empty();
    }

    @Override
    public void markNotified(String resourceType, long resourceId, Instant now) {
        call("markNotified", () -> redisTemplate.execute(MARK_NOTIFIED,
            List.of(key(resourceType, resourceId)), now.toString(), ttlSeconds));
    }

    @Override
    public void clearState(String resourceType, long resourceId) {
        call("clearState", () -> redisTemplate.delete(key(resourceType, resourceId)));
    }

    private AlertStateData read(String json) {
        try {
            return objectMapper.readValue(json, AlertStateData.class);
        } catch (JsonProcessingException e) {
            throw new TrafficLedgerException("Failed to parse alert state", e);
        }
    }

    private String write(AlertStateData data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new TrafficLedgerException("Failed to serialize alert state", e);
        }
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.HOT, operation + " failed", e);
        }
    }
}
