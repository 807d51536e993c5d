package io.github.samzhu.trafficledger.model;

import java.util.Comparator;

/**
 * 單一群組的流量彙總。
 *
 * @param groupId 依維度不同為訂閱 ID、資源 ID 或 0（平台）
 * @param traffic 流量
 */
public record GroupedTraffic(long groupId, TrafficSummary traffic) {

    /**
     * 排行順序：總量遞減，同量時以群組 ID 遞增，確保結果可重現。
     */
    public static final Comparator<GroupedTraffic> RANKING =
        Comparator.comparingLong((GroupedTraffic g) -> g.traffic().total()).reversed()
            .thenComparingLong(GroupedTraffic::groupId);

    public GroupedTraffic(long groupId, long upload, long download) {
        this(groupId, new TrafficSummary(upload, download));
    }
}
