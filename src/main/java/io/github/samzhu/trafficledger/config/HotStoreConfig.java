package io.github.samzhu.trafficledger.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.trafficledger.cache.AlertStateManager;
import io.github.samzhu.trafficledger.cache.InMemoryAlertStateManager;
import io.github.samzhu.trafficledger.cache.InMemorySubscriptionQuotaCache;
import io.github.samzhu.trafficledger.cache.RedisAlertStateManager;
import io.github.samzhu.trafficledger.cache.RedisSubscriptionQuotaCache;
import io.github.samzhu.trafficledger.cache.SubscriptionQuotaCache;
import io.github.samzhu.trafficledger.hot.HotCounterStore;
import io.github.samzhu.trafficledger.hot.InMemoryHotCounterStore;
import io.github.samzhu.trafficledger.hot.RedisHotCounterStore;

/**
 * 熱資料層實作選擇。
 *
 * <p>依 {@code ledger.hot.store} 決定：
 * <ul>
 *   <li>{@code redis}（預設）- 多實例共用，Lua script 保證原子性</li>
 *   <li>{@code memory} - 單機開發與測試用</li>
 * </ul>
 */
@Configuration
public class HotStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(HotStoreConfig.class);

    @Configuration
    @ConditionalOnProperty(prefix = "ledger.hot", name = "store", havingValue = "redis", matchIfMissing = true)
    static class RedisHotStoreConfig {

        @Bean
        public HotCounterStore hotCounterStore(StringRedisTemplate redisTemplate, LedgerProperties properties) {
            log.info("Using Redis hot store: prefix={}, ttl={}", properties.hot().keyPrefix(), properties.hot().ttl());
            return new RedisHotCounterStore(redisTemplate, properties.hot().keyPrefix(), properties.hot().ttl());
        }

        @Bean
        public SubscriptionQuotaCache subscriptionQuotaCache(StringRedisTemplate redisTemplate) {
            return new RedisSubscriptionQuotaCache(redisTemplate);
        }

        @Bean
        public AlertStateManager alertStateManager(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
            return new RedisAlertStateManager(redisTemplate, objectMapper);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "ledger.hot", name = "store", havingValue = "memory")
    static class InMemoryHotStoreConfig {

        @Bean
        public HotCounterStore hotCounterStore(Clock clock, LedgerProperties properties) {
            log.warn("Using in-memory hot store: counters are not shared across instances");
            return new InMemoryHotCounterStore(clock, properties.hot().ttl());
        }

        @Bean
        public SubscriptionQuotaCache subscriptionQuotaCache(Clock clock) {
            return new InMemorySubscriptionQuotaCache(clock);
        }

        @Bean
        public AlertStateManager alertStateManager(Clock clock) {
            return new InMemoryAlertStateManager(clock);
        }
    }
}
