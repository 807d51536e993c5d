package io.github.samzhu.trafficledger.model;

import java.time.Instant;

/**
 * 冷資料層中的一筆小時彙總。
 */
public record UsageRow(
    long subscriptionId,
    String resourceType,
    long resourceId,
    Instant periodStart,
    long upload,
    long download
) {
}
