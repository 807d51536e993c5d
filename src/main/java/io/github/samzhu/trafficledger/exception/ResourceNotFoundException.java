package io.github.samzhu.trafficledger.exception;

/**
 * 資源已不存在，由 {@link io.github.samzhu.trafficledger.service.ResourceDirectory} 判定。
 *
 * <p>通常發生在資源（例如轉發規則）被刪除後，熱資料層仍留有尚未 flush 的計數。
 * 壓縮流程遇到此例外時視為終止條件：直接清除該 key 的快取，不再重試。
 */
public class ResourceNotFoundException extends TrafficLedgerException {

    private final String resourceType;
    private final long resourceId;

    public ResourceNotFoundException(String resourceType, long resourceId) {
        super(String.format("Resource not found: type='%s', id=%d", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public long getResourceId() {
        return resourceId;
    }
}
