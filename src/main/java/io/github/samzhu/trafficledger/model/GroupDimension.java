package io.github.samzhu.trafficledger.model;

/**
 * 分組查詢的維度。
 *
 * <p>{@link #PLATFORM} 將所有資料彙總為單一群組，群組 ID 固定為 0。
 */
public enum GroupDimension {

    SUBSCRIPTION("subscriptionId"),
    RESOURCE("resourceId"),
    PLATFORM(null);

    private final String field;

    GroupDimension(String field) {
        this.field = field;
    }

    /**
     * 對應的 MongoDB 欄位名稱，平台維度為 null。
     */
    public String field() {
        return field;
    }

    /**
     * 依維度取出群組 ID。
     */
    public long groupIdOf(long subscriptionId, long resourceId) {
        return switch (this) {
            case SUBSCRIPTION -> subscriptionId;
            case RESOURCE -> resourceId;
            case PLATFORM -> 0L;
        };
    }
}
