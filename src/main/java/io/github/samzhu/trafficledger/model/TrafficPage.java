package io.github.samzhu.trafficledger.model;

import java.util.List;

/**
 * 分頁查詢結果。
 *
 * @param items 本頁資料
 * @param totalGroups 合併後的群組總數（身分解析前）
 * @param page 頁碼，從 1 起算
 * @param pageSize 每頁筆數
 * @param truncated 冷資料層結果是否因列數上限被截斷
 */
public record TrafficPage(List<RankedTraffic> items, long totalGroups, int page, int pageSize, boolean truncated) {

    public TrafficPage {
        items = List.copyOf(items);
    }
}
