package io.github.samzhu.trafficledger.cache;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import io.github.samzhu.trafficledger.exception.TierUnavailableException;
import io.github.samzhu.trafficledger.exception.TierUnavailableException.Tier;

/**
 * Redis 版訂閱配額快取。
 *
 * <p>Key 格式：{@code subscription:quota:{subscriptionId}}，Hash 欄位
 * {@code limit}、{@code period_start}、{@code period_end}（epoch 秒）、
 * {@code plan_type}、{@code suspended}（0/1），空值標記為 {@code _null=1}。
 */
public class RedisSubscriptionQuotaCache implements SubscriptionQuotaCache {

    private static final Logger log = LoggerFactory.getLogger(RedisSubscriptionQuotaCache.class);

    static final String KEY_PREFIX = "subscription:quota:";
    private static final String FIELD_LIMIT = "limit";
    private static final String FIELD_PERIOD_START = "period_start";
    private static final String FIELD_PERIOD_END = "period_end";
    private static final String FIELD_PLAN_TYPE = "plan_type";
    private static final String FIELD_SUSPENDED = "suspended";
    private static final String FIELD_NULL_MARKER = "_null";

    private static final RedisScript<Long> SET_SUSPENDED_IF_PRESENT = new DefaultRedisScript<>("""
        if redis.call('EXISTS', KEYS[1]) == 0 then
            return 0
        end
        redis.call('HSET', KEYS[1], 'suspended', ARGV[1])
        return 1
        """, Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisSubscriptionQuotaCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    String key(long subscriptionId) {
        return KEY_PREFIX + subscriptionId;
    }

    @Override
    public Optional<CachedQuota> getQuota(long subscriptionId) {
        Map<Object, Object> fields;
        try {
            fields = redisTemplate.opsForHash().entries(key(subscriptionId));
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.HOT, "getQuota failed", e);
        }
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        if ("1".equals(fields.get(FIELD_NULL_MARKER))) {
            return Optional.of(CachedQuota.notFoundMarker());
        }
        return Optional.of(new CachedQuota(
            parseLong(fields.get(FIELD_LIMIT)),
            Instant.ofEpochSecond(parseLong(fields.get(FIELD_PERIOD_START))),
            Instant.ofEpochSecond(parseLong(fields.get(FIELD_PERIOD_END))),
            (String) fields.get(FIELD_PLAN_TYPE),
            "1".equals(fields.get(FIELD_SUSPENDED)),
            false));
    }

    @Override
    public void setQuota(long subscriptionId, CachedQuota quota) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_LIMIT, String.valueOf(quota.limit()));
        fields.put(FIELD_PERIOD_START, String.valueOf(quota.periodStart().getEpochSecond()));
        fields.put(FIELD_PERIOD_END, String.valueOf(quota.periodEnd().getEpochSecond()));
        fields.put(FIELD_PLAN_TYPE, quota.planType() == null ? "" : quota.planType());
        fields.put(FIELD_SUSPENDED, quota.suspended() ? "1" : "0");
        String key = key(subscriptionId);
        try {
            redisTemplate.opsForHash().putAll(key, fields);
            redisTemplate.expire(key, SubscriptionQuotaCache.ttlWithJitter());
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.HOT, "setQuota failed", e);
        }
        log.debug("Subscription quota cached: subscriptionId={}, limit={}, planType={}",
            subscriptionId, quota.limit(), quota.planType());
    }

    @Override
    public void invalidateQuota(long subscriptionId) {
        try {
            redisTemplate.delete(key(subscriptionId));
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.HOT, "invalidateQuota failed", e);
        }
    }

    @Override
    public void setSuspended(long subscriptionId, boolean suspended) {
        try {
            redisTemplate.execute(SET_SUSPENDED_IF_PRESENT, List.of(key(subscriptionId)), suspended ? "1" : "0");
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.HOT, "setSuspended failed", e);
        }
    }

    @Override
    public void setNullMarker(long subscriptionId) {
        String key = key(subscriptionId);
        try {
            redisTemplate.opsForHash().put(key, FIELD_NULL_MARKER, "1");
            redisTemplate.expire(key, NULL_MARKER_TTL);
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.HOT, "setNullMarker failed", e);
        }
    }

    private static long parseLong(Object value) {
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
