package io.github.samzhu.trafficledger.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 節點 Agent 回報的流量資料（CloudEvent data）。
 *
 * <p>JSON 範例：
 * <pre>
 * {
 *   "agentId": "agent-hk-01",
 *   "reportedAt": "2025-01-07T04:00:05Z",
 *   "items": [
 *     {"subscriptionId": 1, "resourceType": "node", "resourceId": 100,
 *      "uploadBytes": 1000, "downloadBytes": 2000}
 *   ]
 * }
 * </pre>
 *
 * @param agentId 回報來源
 * @param reportedAt 回報時間（僅供記錄，計入的小時桶以接收端時間為準）
 * @param items 各資源的增量
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrafficReport(
    String agentId,
    Instant reportedAt,
    List<Item> items
) {
    public TrafficReport {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * 單一資源的流量增量。
     *
     * @param subscriptionId 訂閱 ID，null 或 0 表示無訂閱
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
        Long subscriptionId,
        String resourceType,
        long resourceId,
        long uploadBytes,
        long downloadBytes
    ) {}
}
