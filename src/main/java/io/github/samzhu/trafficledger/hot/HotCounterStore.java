package io.github.samzhu.trafficledger.hot;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.github.samzhu.trafficledger.model.CommitResult;
import io.github.samzhu.trafficledger.model.CounterDelta;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;

/**
 * 熱資料層：以小時桶為單位的即時流量計數。
 *
 * <p>每個 {@link ResourceKey} 對應一筆計數，包含累計值與 flush 標記。
 * 實作必須保證：
 * <ul>
 *   <li>單鍵的讀取-修改-寫入為原子操作，併發累加不遺失</li>
 *   <li>有增量的鍵一定存在於待處理索引中，直到增量寫入冷資料層為止</li>
 *   <li>所有鍵值有 TTL，過期後自動消失</li>
 * </ul>
 *
 * <p>所有方法在儲存層不可用時拋出
 * {@link io.github.samzhu.trafficledger.exception.TierUnavailableException}。
 */
public interface HotCounterStore {

    /**
     * 原子累加並加入待處理索引與小時桶索引，同時刷新 TTL。
     */
    void increment(ResourceKey key, long upload, long download);

    /**
     * 批次累加，整批為單一原子操作。
     */
    void incrementAll(Collection<CounterDelta> deltas);

    /**
     * 讀取單鍵計數，不存在時回傳 empty。
     */
    Optional<CounterRecord> get(ResourceKey key);

    /**
     * 讀取小時桶內所有計數。僅適用於已結束的小時桶。
     */
    List<CounterRecord> getAll(String bucket);

    /**
     * 讀取多個小時桶的計數快照，供分析查詢使用。
     *
     * <p>快照為盡力而為：讀取期間的新增量可能部分可見。
     */
    List<CounterRecord> getRange(Collection<String> buckets);

    /**
     * 原子取出並刪除小時桶內所有計數。
     */
    List<CounterRecord> getAndCleanup(String bucket);

    /**
     * 刪除小時桶內所有計數，回傳刪除筆數。
     */
    int cleanup(String bucket);

    /**
     * 目前仍有索引的小時桶。
     */
    Set<String> indexedBuckets();

    /**
     * 待處理索引中的所有鍵（編碼後字串，可能含無法解析的成員）。
     */
    Set<String> pendingKeys();

    /**
     * 自待處理索引移除成員，不影響計數本身。
     */
    void discardPending(String member);

    /**
     * 若目前無增量則自待處理索引移除。
     *
     * @return true 表示已移除；false 表示讀取後有新增量，保留待處理
     */
    boolean releaseIfSettled(ResourceKey key);

    /**
     * 將 flush 標記推進到已寫入冷資料層的值。
     *
     * <p>標記一律設為 {@code observed} 的累計值；僅當目前累計值仍等於
     * {@code observed} 時才自待處理索引移除，否則保留等待下次壓縮。
     *
     * @param key 鍵
     * @param observed flush 前讀取的快照
     * @return 提交結果
     */
    CommitResult compareAndCommit(ResourceKey key, CounterRecord observed);

    /**
     * 以冷資料層的值重建計數，僅設定不存在的欄位（累計值與標記皆設為 baseline）。
     */
    void initFromColdTier(ResourceKey key, long upload, long download);

    /**
     * 刪除單鍵計數並自所有索引移除。
     */
    void cleanupResource(ResourceKey key);
}
