package io.github.samzhu.trafficledger.model;

import java.util.List;

/**
 * 冷資料層聚合結果。
 *
 * <p>列數受 {@code ledger.query.max-rows} 上限保護；
 * {@code trueCount} 為未截斷前的實際群組數，可用於判斷結果是否完整。
 */
public record AggregationResult<T>(List<T> rows, long trueCount) {

    public AggregationResult {
        rows = List.copyOf(rows);
    }

    public static <T> AggregationResult<T> empty() {
        return new AggregationResult<>(List.of(), 0L);
    }

    public boolean truncated() {
        return trueCount > rows.size();
    }
}
