package io.github.samzhu.trafficledger.model;

/**
 * 批次累加時的單筆增量。
 */
public record CounterDelta(ResourceKey key, long upload, long download) {
}
