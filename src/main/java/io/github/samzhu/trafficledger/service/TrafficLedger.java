package io.github.samzhu.trafficledger.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.hot.HotCounterStore;
import io.github.samzhu.trafficledger.model.CounterDelta;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.model.ResourceType;
import io.github.samzhu.trafficledger.model.TrafficEntry;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * 流量帳本的寫入與生命週期入口。
 *
 * <p>所有寫入都落在「現在」所屬的小時桶（依注入的 {@link Clock} 與營業時區計算）。
 * 驗證在任何寫入前完成，驗證失敗時不會有部分寫入。
 */
@Service
public class TrafficLedger {

    private static final Logger log = LoggerFactory.getLogger(TrafficLedger.class);

    private final HotCounterStore hotStore;
    private final BusinessTime businessTime;
    private final Clock clock;
    private final long maxBytesPerReport;

    public TrafficLedger(HotCounterStore hotStore, BusinessTime businessTime, Clock clock,
                         LedgerProperties properties) {
        this.hotStore = hotStore;
        this.businessTime = businessTime;
        this.clock = clock;
        this.maxBytesPerReport = properties.maxBytesPerReport();
    }

    /**
     * 累加一筆流量到當前小時桶。
     *
     * @param subscriptionId 訂閱 ID，0 表示無訂閱
     * @param resourceType 資源類型
     * @param resourceId 資源 ID
     * @param uploadBytes 上傳增量
     * @param downloadBytes 下載增量
     * @throws ValidationException 輸入不合法
     */
    public void increment(long subscriptionId, String resourceType, long resourceId,
                          long uploadBytes, long downloadBytes) {
        TrafficEntry entry = new TrafficEntry(subscriptionId, resourceType, resourceId, uploadBytes, downloadBytes);
        validate(entry);
        if (entry.isEmpty()) {
            return;
        }
        ResourceKey key = new ResourceKey(currentBucket(), subscriptionId, resourceType, resourceId);
        hotStore.increment(key, uploadBytes, downloadBytes);
    }

    public void increment(long subscriptionId, ResourceType resourceType, long resourceId,
                          long uploadBytes, long downloadBytes) {
        increment(subscriptionId, resourceType.tag(), resourceId, uploadBytes, downloadBytes);
    }

    /**
     * 批次累加，整批以單一原子操作寫入熱資料層。
     *
     * <p>任何一筆驗證失敗時整批拒絕；增量皆為 0 的項目略過。
     *
     * @return 實際寫入的筆數
     */
    public int batchIncrement(List<TrafficEntry> entries) {
        entries.forEach(this::validate);
        return writeBatch(entries);
    }

    /**
     * 寫入已合併的回報。
     *
     * <p>合併後的增量可合法超過單筆上限，僅檢查資源類型、ID 與增量正負。
     *
     * @return 實際寫入的筆數
     * @see TrafficBufferService#flushBuffer()
     */
    public int incrementMerged(List<TrafficEntry> mergedEntries) {
        mergedEntries.forEach(this::validateStructure);
        return writeBatch(mergedEntries);
    }

    private int writeBatch(List<TrafficEntry> entries) {
        String bucket = currentBucket();
        List<CounterDelta> deltas = new ArrayList<>(entries.size());
        for (TrafficEntry entry : entries) {
            if (entry.isEmpty()) {
                continue;
            }
            ResourceKey key = new ResourceKey(bucket, entry.subscriptionId(), entry.resourceType(), entry.resourceId());
            deltas.add(new CounterDelta(key, entry.uploadBytes(), entry.downloadBytes()));
        }
        if (!deltas.isEmpty()) {
            hotStore.incrementAll(deltas);
        }
        log.debug("Batch increment: bucket={}, entries={}, written={}", bucket, entries.size(), deltas.size());
        return deltas.size();
    }

    /**
     * 驗證單筆回報。
     *
     * @throws ValidationException 資源類型不合法、ID 或增量為負、增量超過上限
     */
    public void validate(TrafficEntry entry) {
        validateStructure(entry);
        if (entry.uploadBytes() > maxBytesPerReport || entry.downloadBytes() > maxBytesPerReport) {
            throw new ValidationException(String.format(
                "Traffic delta exceeds %d bytes per report: %s", maxBytesPerReport, entry));
        }
    }

    private void validateStructure(TrafficEntry entry) {
        ResourceKey.validateResourceType(entry.resourceType());
        if (entry.subscriptionId() < 0 || entry.resourceId() < 0) {
            throw new ValidationException("Ids must not be negative: " + entry);
        }
        if (entry.uploadBytes() < 0 || entry.downloadBytes() < 0) {
            throw new ValidationException("Traffic deltas must not be negative: " + entry);
        }
    }

    /**
     * 以冷資料層的值重建熱資料層計數，已存在的欄位不會被覆寫。
     */
    public void initFromColdTier(ResourceKey key, long uploadBytes, long downloadBytes) {
        if (uploadBytes < 0 || downloadBytes < 0) {
            throw new ValidationException("Baseline must not be negative: " + key.encode());
        }
        hotStore.initFromColdTier(key, uploadBytes, downloadBytes);
    }

    /**
     * 讀取單鍵目前的計數。
     */
    public Optional<CounterRecord> get(ResourceKey key) {
        return hotStore.get(key);
    }

    /**
     * 刪除單鍵的熱資料。
     */
    public void cleanupResource(ResourceKey key) {
        hotStore.cleanupResource(key);
    }

    /**
     * 刪除某資源在所有熱小時桶中的計數（資源被刪除時呼叫）。
     *
     * <p>尚未 flush 的增量會一併捨棄。
     *
     * @return 刪除的鍵數
     */
    public int cleanupResource(String resourceType, long resourceId) {
        ResourceKey.validateResourceType(resourceType);
        List<CounterRecord> records = hotStore.getRange(hotStore.indexedBuckets());
        int removed = 0;
        for (CounterRecord record : records) {
            if (record.key().sameResource(resourceType, resourceId)) {
                hotStore.cleanupResource(record.key());
                removed++;
            }
        }
        log.info("Cleaned up hot counters for resource: type={}, id={}, keys={}", resourceType, resourceId, removed);
        return removed;
    }

    public String currentBucket() {
        return businessTime.bucketOf(clock.instant());
    }
}
