package io.github.samzhu.trafficledger.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 訂閱配額的讀取快取，供流量限制檢查使用。
 *
 * <ul>
 *   <li>一般項目 TTL 為 60 分鐘加上 0-20 分鐘隨機值，避免同時失效</li>
 *   <li>不存在的訂閱寫入空值標記，TTL 2 分鐘，避免穿透</li>
 * </ul>
 */
public interface SubscriptionQuotaCache {

    Duration BASE_TTL = Duration.ofMinutes(60);
    Duration TTL_JITTER = Duration.ofMinutes(20);
    Duration NULL_MARKER_TTL = Duration.ofMinutes(2);

    /**
     * @return 快取項目；未命中時為 empty，空值標記時 {@link CachedQuota#notFound()} 為 true
     */
    Optional<CachedQuota> getQuota(long subscriptionId);

    void setQuota(long subscriptionId, CachedQuota quota);

    void invalidateQuota(long subscriptionId);

    /**
     * 更新暫停狀態，僅在項目已存在時生效，不會建立不完整的項目。
     */
    void setSuspended(long subscriptionId, boolean suspended);

    void setNullMarker(long subscriptionId);

    static Duration ttlWithJitter() {
        return BASE_TTL.plusMillis(ThreadLocalRandom.current().nextLong(TTL_JITTER.toMillis()));
    }
}
