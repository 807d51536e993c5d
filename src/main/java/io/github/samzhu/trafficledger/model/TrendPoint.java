package io.github.samzhu.trafficledger.model;

import java.time.Instant;

/**
 * 趨勢序列中的一個點。
 *
 * @param period 週期起點（依粒度截斷，營業時區）
 */
public record TrendPoint(Instant period, long upload, long download) {

    public long total() {
        return upload + download;
    }
}
