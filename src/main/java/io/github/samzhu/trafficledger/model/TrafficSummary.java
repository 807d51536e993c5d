package io.github.samzhu.trafficledger.model;

/**
 * 上傳/下載位元組彙總。
 */
public record TrafficSummary(long upload, long download) {

    public static final TrafficSummary ZERO = new TrafficSummary(0L, 0L);

    public long total() {
        return upload + download;
    }

    public TrafficSummary plus(long deltaUpload, long deltaDownload) {
        return new TrafficSummary(upload + deltaUpload, download + deltaDownload);
    }

    public TrafficSummary plus(TrafficSummary other) {
        return plus(other.upload, other.download);
    }
}
