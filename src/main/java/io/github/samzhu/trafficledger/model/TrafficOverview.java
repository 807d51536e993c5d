package io.github.samzhu.trafficledger.model;

import java.util.List;

/**
 * 管理後台的流量總覽。
 *
 * @param total 區間總流量
 * @param topSubscriptions 流量最高的訂閱
 * @param topNodes 流量最高的節點
 * @param topForwardRules 流量最高的轉發規則
 * @param dailyTrend 每日趨勢
 */
public record TrafficOverview(
    TrafficSummary total,
    List<RankedTraffic> topSubscriptions,
    List<RankedTraffic> topNodes,
    List<RankedTraffic> topForwardRules,
    List<TrendPoint> dailyTrend
) {
}
