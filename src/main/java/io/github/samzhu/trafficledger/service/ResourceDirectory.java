package io.github.samzhu.trafficledger.service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.github.samzhu.trafficledger.model.GroupDimension;

/**
 * 群組 ID 到顯示名稱的解析。
 *
 * <p>查詢結果中無法解析的 ID（例如已刪除的訂閱）會被捨棄；
 * 壓縮時無法解析的資源視為已刪除，其熱資料直接清除。
 * 實際部署時由面板服務提供實作；預設實作以 ID 字串作為名稱。
 */
public interface ResourceDirectory {

    /**
     * 批次解析名稱。
     *
     * @param dimension 群組維度
     * @param resourceType 資源類型，僅 {@link GroupDimension#RESOURCE} 使用，可為 null
     * @param ids 群組 ID
     * @return 可解析的 ID 與名稱；缺少的 ID 視為已刪除
     */
    Map<Long, String> resolveNames(GroupDimension dimension, String resourceType, Collection<Long> ids);

    /**
     * 資源是否仍存在，壓縮寫入冷資料層前使用。
     */
    default boolean exists(String resourceType, long resourceId) {
        return !resolveNames(GroupDimension.RESOURCE, resourceType, List.of(resourceId)).isEmpty();
    }

    static ResourceDirectory identity() {
        return (dimension, resourceType, ids) -> {
            Map<Long, String> names = new LinkedHashMap<>();
            for (Long id : ids) {
                names.put(id, dimension == GroupDimension.PLATFORM ? "platform" : String.valueOf(id));
            }
            return names;
        };
    }
}
