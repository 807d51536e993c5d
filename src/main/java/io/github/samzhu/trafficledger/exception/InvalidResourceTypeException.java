package io.github.samzhu.trafficledger.exception;

/**
 * 資源類型包含鍵值分隔字元。
 *
 * <p>資源類型會直接編入 Redis key 與 MongoDB 文件 ID，
 * 若包含 {@code :} 將使鍵值無法正確解析。
 */
public class InvalidResourceTypeException extends ValidationException {

    private final String resourceType;

    public InvalidResourceTypeException(String resourceType) {
        super(String.format("Invalid resource type '%s': must not contain ':'", resourceType));
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}
