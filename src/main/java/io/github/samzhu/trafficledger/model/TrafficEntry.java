package io.github.samzhu.trafficledger.model;

/**
 * 一筆流量回報。
 *
 * @param subscriptionId 訂閱 ID，0 表示無訂閱
 * @param resourceType 資源類型標籤
 * @param resourceId 資源 ID
 * @param uploadBytes 上傳位元組增量
 * @param downloadBytes 下載位元組增量
 */
public record TrafficEntry(
    long subscriptionId,
    String resourceType,
    long resourceId,
    long uploadBytes,
    long downloadBytes
) {

    public boolean isEmpty() {
        return uploadBytes == 0 && downloadBytes == 0;
    }
}
