package io.github.samzhu.trafficledger.model;

/**
 * 分組或排行查詢的單筆結果。
 *
 * @param rank 名次，從 1 起算（分頁時接續前頁）
 * @param groupId 群組 ID
 * @param name 顯示名稱
 */
public record RankedTraffic(int rank, long groupId, String name, long upload, long download) {

    public long total() {
        return upload + download;
    }
}
