package io.github.samzhu.trafficledger.cold;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

import io.github.samzhu.trafficledger.model.AggregationResult;
import io.github.samzhu.trafficledger.model.Granularity;
import io.github.samzhu.trafficledger.model.GroupDimension;
import io.github.samzhu.trafficledger.model.GroupedTraffic;
import io.github.samzhu.trafficledger.model.TrendPoint;
import io.github.samzhu.trafficledger.model.UsageRow;

/**
 * 冷資料層：以小時為單位的持久化流量彙總。
 *
 * <p>時間區間一律為 [from, to)。所有方法在儲存層不可用時拋出
 * {@link io.github.samzhu.trafficledger.exception.TierUnavailableException}。
 */
public interface ColdAggregateStore {

    /**
     * 將增量累加到指定小時的彙總。增量皆為 0 時不做任何事。
     *
     * @param resourceType 資源類型
     * @param resourceId 資源 ID
     * @param subscriptionId 訂閱 ID，0 表示無訂閱
     * @param periodStart 小時起點
     */
    void accumulate(String resourceType, long resourceId, long subscriptionId, Instant periodStart,
                    long uploadDelta, long downloadDelta);

    /**
     * 依維度分組加總，依總量遞減排序，最多 {@code maxRows} 列。
     *
     * @param resourceType 資源類型篩選，null 表示全部
     */
    AggregationResult<GroupedTraffic> sumByGroup(GroupDimension dimension, String resourceType,
                                                 Instant from, Instant to, int maxRows);

    /**
     * 指定訂閱各自的加總，無資料的訂閱不出現在結果中。
     *
     * @param resourceType 資源類型篩選，null 表示全部
     */
    List<GroupedTraffic> sumBySubscriptions(Collection<Long> subscriptionIds, String resourceType,
                                            Instant from, Instant to);

    /**
     * 取總量最高的前 N 個群組。
     */
    List<GroupedTraffic> topN(GroupDimension dimension, String resourceType, Instant from, Instant to, int limit);

    /**
     * 依粒度（營業時區）彙總的時間序列，依時間遞增排列。
     */
    List<TrendPoint> trend(String resourceType, Instant from, Instant to, Granularity granularity);

    /**
     * 讀取指定小時的所有彙總列。
     */
    List<UsageRow> findByPeriod(Instant periodStart);
}
