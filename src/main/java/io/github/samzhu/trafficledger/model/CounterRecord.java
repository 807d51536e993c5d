package io.github.samzhu.trafficledger.model;

/**
 * 熱資料層中單一鍵值的計數快照。
 *
 * <p>{@code upload}/{@code download} 為該小時桶的累計值，
 * {@code lastFlushed*} 為已寫入冷資料層的標記。兩者差值即尚未 flush 的增量。
 */
public record CounterRecord(
    ResourceKey key,
    long upload,
    long download,
    long lastFlushedUpload,
    long lastFlushedDownload
) {

    /**
     * 尚未 flush 的上傳增量。標記超前（例如重建後）時視為 0。
     */
    public long uploadDelta() {
        return Math.max(0L, upload - lastFlushedUpload);
    }

    public long downloadDelta() {
        return Math.max(0L, download - lastFlushedDownload);
    }

    public boolean hasUnflushed() {
        return uploadDelta() > 0 || downloadDelta() > 0;
    }

    public long total() {
        return upload + download;
    }
}
