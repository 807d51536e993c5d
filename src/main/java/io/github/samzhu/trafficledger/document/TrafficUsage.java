package io.github.samzhu.trafficledger.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.model.UsageRow;

/**
 * 每小時流量彙總文件（冷資料層）。
 *
 * <p>每個 (小時, 訂閱, 資源類型, 資源) 一筆，由壓縮流程以 {@code $inc} upsert 累加。
 *
 * <p>文件 ID 與熱資料層鍵值相同：{@code {yyyyMMddHH}:{sub}:{type}:{id}}，
 * 例如 {@code 2025010712:1:node:100}。
 *
 * @param periodStart 小時起點（營業時區）
 * @param subscriptionId 訂閱 ID，0 表示無訂閱
 */
@Document(collection = "traffic_usage")
@CompoundIndex(name = "period_type_idx", def = "{'periodStart': 1, 'resourceType': 1}")
public record TrafficUsage(
    @Id String id,
    Instant periodStart,
    long subscriptionId,
    String resourceType,
    long resourceId,
    long upload,
    long download,
    Instant lastUpdatedAt
) {
    public static String createId(ResourceKey key) {
        return key.encode();
    }

    public UsageRow toRow() {
        return new UsageRow(subscriptionId, resourceType, resourceId, periodStart, upload, download);
    }
}
