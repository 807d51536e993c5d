package io.github.samzhu.trafficledger.model;

import java.time.Duration;

/**
 * 單次壓縮的執行結果。
 *
 * @param flushed 成功寫入冷資料層的鍵數
 * @param skipped 無增量、直接釋放的鍵數
 * @param failed 冷資料層寫入失敗、保留重試的鍵數
 * @param purged 因資源不存在或鍵值無效而清除的鍵數
 * @param deferred 因期限到達或中斷而未處理的鍵數
 * @param uploadBytes 本次寫入的上傳位元組
 * @param downloadBytes 本次寫入的下載位元組
 * @param elapsed 執行時間
 */
public record CompactionReport(
    int flushed,
    int skipped,
    int failed,
    int purged,
    int deferred,
    long uploadBytes,
    long downloadBytes,
    Duration elapsed
) {

    public static CompactionReport empty() {
        return new CompactionReport(0, 0, 0, 0, 0, 0L, 0L, Duration.ZERO);
    }
}
