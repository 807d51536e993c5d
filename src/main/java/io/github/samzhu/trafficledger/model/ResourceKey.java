package io.github.samzhu.trafficledger.model;

import io.github.samzhu.trafficledger.exception.InvalidResourceTypeException;
import io.github.samzhu.trafficledger.exception.ValidationException;

/**
 * 熱資料層的計數鍵。
 *
 * <p>編碼格式：{@code {bucket}:{subscriptionId}:{resourceType}:{resourceId}}，
 * 例如 {@code 2025010712:1:node:100}。
 * 同一編碼也用作 MongoDB 文件 ID，因此資源類型不得包含分隔字元。
 *
 * @param bucket 小時桶 {@code yyyyMMddHH}
 * @param subscriptionId 訂閱 ID，0 表示無訂閱（管理員資源）
 * @param resourceType 資源類型標籤
 * @param resourceId 資源 ID
 */
public record ResourceKey(String bucket, long subscriptionId, String resourceType, long resourceId) {

    public static final char DELIMITER = ':';

    public ResourceKey {
        if (bucket == null || bucket.length() != 10 || !bucket.chars().allMatch(Character::isDigit)) {
            throw new ValidationException("Invalid hour bucket: " + bucket);
        }
        validateResourceType(resourceType);
        if (subscriptionId < 0 || resourceId < 0) {
            throw new ValidationException("Ids must not be negative");
        }
    }

    /**
     * 驗證資源類型可安全編入鍵值。
     *
     * @throws ValidationException 為 null 或空白
     * @throws InvalidResourceTypeException 包含分隔字元
     */
    public static void validateResourceType(String resourceType) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new ValidationException("Resource type must not be blank");
        }
        if (resourceType.indexOf(DELIMITER) >= 0) {
            throw new InvalidResourceTypeException(resourceType);
        }
    }

    public String encode() {
        return bucket + DELIMITER + subscriptionId + DELIMITER + resourceType + DELIMITER + resourceId;
    }

    /**
     * 解析編碼後的鍵值。
     *
     * @throws ValidationException 格式錯誤
     */
    public static ResourceKey decode(String encoded) {
        if (encoded == null) {
            throw new ValidationException("Resource key must not be null");
        }
        String[] parts = encoded.split(String.valueOf(DELIMITER), -1);
        if (parts.length != 4) {
            throw new ValidationException("Malformed resource key: " + encoded);
        }
        try {
            return new ResourceKey(parts[0], Long.parseLong(parts[1]), parts[2], Long.parseLong(parts[3]));
        } catch (NumberFormatException e) {
            throw new ValidationException("Malformed resource key: " + encoded);
        }
    }

    public boolean sameResource(String type, long id) {
        return resourceType.equals(type) && resourceId == id;
    }
}
