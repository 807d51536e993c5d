package io.github.samzhu.trafficledger.cache;

import java.time.Instant;

/**
 * 快取中的訂閱配額。
 *
 * @param limit 流量上限（位元組）
 * @param periodStart 計費週期起點
 * @param periodEnd 計費週期終點
 * @param planType 方案類型：node / forward / hybrid
 * @param suspended 訂閱是否已暫停
 * @param notFound 空值標記：訂閱已確認不存在或未啟用
 */
public record CachedQuota(
    long limit,
    Instant periodStart,
    Instant periodEnd,
    String planType,
    boolean suspended,
    boolean notFound
) {
    public static CachedQuota notFoundMarker() {
        return new CachedQuota(0L, null, null, null, false, true);
    }

    public CachedQuota withSuspended(boolean value) {
        return new CachedQuota(limit, periodStart, periodEnd, planType, value, notFound);
    }
}
