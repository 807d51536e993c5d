package io.github.samzhu.trafficledger.model;

/**
 * 趨勢查詢的時間粒度。
 */
public enum Granularity {
    HOUR,
    DAY,
    MONTH
}
