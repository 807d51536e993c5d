package io.github.samzhu.trafficledger.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.trafficledger.cold.ColdAggregateStore;
import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.exception.ResourceNotFoundException;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.hot.HotCounterStore;
import io.github.samzhu.trafficledger.model.CommitResult;
import io.github.samzhu.trafficledger.model.CompactionReport;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * 壓縮服務，定時將熱資料層的增量寫入冷資料層。
 *
 * <p>每個待處理鍵的處理流程：
 * <ol>
 *   <li>讀取計數快照，計算 {@code 累計值 - flush 標記}（負值視為 0）</li>
 *   <li>無增量：比較後自待處理索引移除</li>
 *   <li>有增量：累加到冷資料層對應小時</li>
 *   <li>成功後將 flush 標記推進到快照值；期間若有新增量則保留待處理</li>
 * </ol>
 *
 * <p>冷資料層寫入失敗時不動標記，下次排程會以相同增量重試，因此每筆增量
 * 恰好寫入冷資料層一次。寫入前透過 {@link ResourceDirectory} 確認資源仍存在，
 * 已刪除的資源直接清除該鍵，不寫入冷資料層。
 *
 * <p>同一時間只會有一個壓縮執行；排程觸發時若前一次仍在執行則略過。
 * {@link HotBucketJanitor} 也透過 {@link #runExclusive(Supplier)} 與壓縮互斥。
 */
@Service
public class CompactionService {

    private static final Logger log = LoggerFactory.getLogger(CompactionService.class);

    private final HotCounterStore hotStore;
    private final ColdAggregateStore coldStore;
    private final ResourceDirectory resourceDirectory;
    private final BusinessTime businessTime;
    private final Clock clock;
    private final LedgerProperties.CompactionConfig config;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();

    public CompactionService(HotCounterStore hotStore, ColdAggregateStore coldStore,
                             ResourceDirectory resourceDirectory, BusinessTime businessTime,
                             Clock clock, LedgerProperties properties) {
        this.hotStore = hotStore;
        this.coldStore = coldStore;
        this.resourceDirectory = resourceDirectory;
        this.businessTime = businessTime;
        this.clock = clock;
        this.config = properties.compaction();
    }

    /**
     * 定時壓縮任務，預設每分鐘執行。
     */
    @Scheduled(cron = "${ledger.compaction.cron:0 * * * * *}")
    public void scheduledCompaction() {
        if (!config.enabled()) {
            return;
        }
        try {
            compact();
        } catch (RuntimeException e) {
            log.error("Compaction failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 以設定的時間上限執行一次壓縮。
     */
    public CompactionReport compact() {
        return compact(clock.instant().plus(config.maxDuration()));
    }

    /**
     * 執行一次壓縮。
     *
     * <p>到達 {@code deadline} 或執行緒被中斷時停止，剩餘的鍵留待下次處理。
     *
     * @param deadline 截止時間
     * @return 執行結果；前一次仍在執行時回傳空結果
     */
    public CompactionReport compact(Instant deadline) {
        return runExclusive(() -> doCompact(deadline)).orElseGet(() -> {
            log.info("Compaction already running, skipping");
            return CompactionReport.empty();
        });
    }

    /**
     * 在壓縮鎖內執行工作，與壓縮互斥。
     *
     * @return 工作結果；鎖已被佔用時回傳 empty
     */
    public <T> Optional<T> runExclusive(Supplier<T> task) {
        if (!running.compareAndSet(false, true)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(task.get());
        } finally {
            running.set(false);
        }
    }

    private CompactionReport doCompact(Instant deadline) {
        Instant start = clock.instant();
        List<String> members = hotStore.pendingKeys().stream().sorted().toList();
        // 已不在待處理索引中的鍵（過期或被清除）不再累計失敗次數
        consecutiveFailures.keySet().retainAll(members);
        if (members.isEmpty()) {
            log.debug("No pending hot counters to compact");
            return CompactionReport.empty();
        }

        int flushed = 0;
        int skipped = 0;
        int failed = 0;
        int purged = 0;
        long uploadBytes = 0;
        long downloadBytes = 0;
        int processed = 0;

        for (String member : members) {
            if (Thread.currentThread().isInterrupted() || !clock.instant().isBefore(deadline)) {
                log.warn("Compaction stopped early: processed={}, remaining={}", processed, members.size() - processed);
                break;
            }
            processed++;

            ResourceKey key;
            try {
                key = ResourceKey.decode(member);
            } catch (ValidationException e) {
                log.warn("Discarding malformed pending key: {}", member);
                hotStore.discardPending(member);
                purged++;
                continue;
            }

            FlushResult result = flushKey(key);
            switch (result.outcome()) {
                case FLUSHED, UNCOMMITTED -> {
                    flushed++;
                    uploadBytes += result.uploadBytes();
                    downloadBytes += result.downloadBytes();
                }
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
                case PURGED -> purged++;
            }
        }

        Duration elapsed = Duration.between(start, clock.instant());
        CompactionReport report = new CompactionReport(flushed, skipped, failed, purged,
            members.size() - processed, uploadBytes, downloadBytes, elapsed);
        log.info("Compaction completed: flushed={}, skipped={}, failed={}, purged={}, deferred={}, "
                + "upload={}B, download={}B in {}ms",
            report.flushed(), report.skipped(), report.failed(), report.purged(), report.deferred(),
            report.uploadBytes(), report.downloadBytes(), elapsed.toMillis());
        return report;
    }

    /**
     * 單鍵 flush 結果。
     */
    record FlushResult(Outcome outcome, long uploadBytes, long downloadBytes) {

        enum Outcome {
            FLUSHED,
            /** 冷資料層已寫入，但 flush 標記未推進 */
            UNCOMMITTED,
            SKIPPED,
            FAILED,
            PURGED
        }

        static FlushResult of(Outcome outcome) {
            return new FlushResult(outcome, 0L, 0L);
        }
    }

    /**
     * 將單鍵的增量寫入冷資料層並推進標記。呼叫端必須持有壓縮鎖。
     */
    FlushResult flushKey(ResourceKey key) {
        String member = key.encode();
        Optional<CounterRecord> snapshot = hotStore.get(key);
        if (snapshot.isEmpty()) {
            // 已過期或被清除
            hotStore.discardPending(member);
            consecutiveFailures.remove(member);
            return FlushResult.of(FlushResult.Outcome.SKIPPED);
        }

        CounterRecord record = snapshot.get();
        if (!record.hasUnflushed()) {
            hotStore.releaseIfSettled(key);
            return FlushResult.of(FlushResult.Outcome.SKIPPED);
        }

        try {
            requireResource(key);
            coldStore.accumulate(key.resourceType(), key.resourceId(), key.subscriptionId(),
                businessTime.parseBucket(key.bucket()), record.uploadDelta(), record.downloadDelta());
        } catch (ResourceNotFoundException e) {
            log.info("Resource no longer exists, purging hot counter: {}", member);
            hotStore.cleanupResource(key);
            consecutiveFailures.remove(member);
            return FlushResult.of(FlushResult.Outcome.PURGED);
        } catch (RuntimeException e) {
            int failures = consecutiveFailures.merge(member, 1, Integer::sum);
            if (failures >= config.failureWarnThreshold()) {
                log.warn("Hot counter failed to flush {} times in a row: key={}, error={}",
                    failures, member, e.getMessage());
            } else {
                log.debug("Failed to flush hot counter: key={}, error={}", member, e.getMessage());
            }
            return FlushResult.of(FlushResult.Outcome.FAILED);
        }
        consecutiveFailures.remove(member);

        try {
            CommitResult result = hotStore.compareAndCommit(key, record);
            if (result == CommitResult.ADVANCED) {
                log.debug("Hot counter advanced during flush, keeping pending: {}", member);
            }
        } catch (RuntimeException e) {
            // 冷資料層已寫入但標記未推進，下次壓縮會重複寫入此增量
            log.error("Failed to advance flush markers after cold write: key={}", member, e);
            return new FlushResult(FlushResult.Outcome.UNCOMMITTED, record.uploadDelta(), record.downloadDelta());
        }
        return new FlushResult(FlushResult.Outcome.FLUSHED, record.uploadDelta(), record.downloadDelta());
    }

    private void requireResource(ResourceKey key) {
        if (!resourceDirectory.exists(key.resourceType(), key.resourceId())) {
            throw new ResourceNotFoundException(key.resourceType(), key.resourceId());
        }
    }

    /**
     * 目前連續失敗中的鍵與次數。
     */
    public Map<String, Integer> getConsecutiveFailures() {
        return Map.copyOf(consecutiveFailures);
    }

    public boolean isRunning() {
        return running.get();
    }
}
