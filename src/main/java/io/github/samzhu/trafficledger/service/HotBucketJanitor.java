package io.github.samzhu.trafficledger.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.trafficledger.cold.ColdAggregateStore;
import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.hot.HotCounterStore;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * 過期小時桶清理服務。
 *
 * <p>保留期之外的小時桶已不參與分析查詢，清理流程：
 * <ol>
 *   <li>找出比熱邊界再早一小時以上的小時桶</li>
 *   <li>逐鍵 flush 尚未寫入的增量（與壓縮相同邏輯）</li>
 *   <li>全部結清後以 {@link HotCounterStore#getAndCleanup(String)} 原子刪除整個小時桶</li>
 * </ol>
 *
 * <p>任何一鍵 flush 失敗時保留該小時桶，下次再試；TTL 為最後防線。
 * 整個流程持有壓縮鎖，與 {@link CompactionService} 互斥。
 */
@Service
public class HotBucketJanitor {

    private static final Logger log = LoggerFactory.getLogger(HotBucketJanitor.class);

    private final HotCounterStore hotStore;
    private final ColdAggregateStore coldStore;
    private final CompactionService compactionService;
    private final BusinessTime businessTime;
    private final Clock clock;
    private final Duration retention;
    private final boolean enabled;

    public HotBucketJanitor(HotCounterStore hotStore, ColdAggregateStore coldStore,
                            CompactionService compactionService, BusinessTime businessTime, Clock clock,
                            LedgerProperties properties) {
        this.hotStore = hotStore;
        this.coldStore = coldStore;
        this.compactionService = compactionService;
        this.businessTime = businessTime;
        this.clock = clock;
        this.retention = properties.hot().retention();
        this.enabled = properties.janitor().enabled();
    }

    @Scheduled(cron = "${ledger.janitor.cron:0 15 * * * *}")
    public void scheduledCleanup() {
        if (!enabled) {
            return;
        }
        try {
            drainExpiredBuckets();
        } catch (RuntimeException e) {
            log.error("Hot bucket cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * 清理所有已過保留期的小時桶。
     *
     * @return 刪除的小時桶數；壓縮執行中時回傳 0
     */
    public int drainExpiredBuckets() {
        Instant horizon = businessTime.truncateToHour(clock.instant().minus(retention)).minus(1, ChronoUnit.HOURS);
        List<String> expired = hotStore.indexedBuckets().stream()
            .filter(bucket -> isBefore(bucket, horizon))
            .sorted()
            .toList();
        if (expired.isEmpty()) {
            return 0;
        }

        return compactionService.runExclusive(() -> {
            int drained = 0;
            for (String bucket : expired) {
                if (drainBucket(bucket)) {
                    drained++;
                }
            }
            log.info("Hot bucket cleanup completed: drained={}, candidates={}", drained, expired.size());
            return drained;
        }).orElseGet(() -> {
            log.info("Compaction running, hot bucket cleanup deferred");
            return 0;
        });
    }

    private boolean drainBucket(String bucket) {
        for (CounterRecord record : hotStore.getAll(bucket)) {
            if (!record.hasUnflushed()) {
                continue;
            }
            CompactionService.FlushResult.Outcome outcome = compactionService.flushKey(record.key()).outcome();
            if (outcome == CompactionService.FlushResult.Outcome.FAILED
                    || outcome == CompactionService.FlushResult.Outcome.UNCOMMITTED) {
                // 標記未推進時清除桶會把已寫入的增量當作殘留再寫一次
                log.warn("Keeping hot bucket {}: key {} was not committed ({})",
                    bucket, record.key().encode(), outcome);
                return false;
            }
        }

        List<CounterRecord> removed = hotStore.getAndCleanup(bucket);
        Instant period = businessTime.parseBucket(bucket);
        for (CounterRecord residual : removed) {
            if (!residual.hasUnflushed()) {
                continue;
            }
            try {
                coldStore.accumulate(residual.key().resourceType(), residual.key().resourceId(),
                    residual.key().subscriptionId(), period, residual.uploadDelta(), residual.downloadDelta());
            } catch (RuntimeException e) {
                log.error("Lost residual traffic while draining bucket {}: key={}, upload={}, download={}",
                    bucket, residual.key().encode(), residual.uploadDelta(), residual.downloadDelta(), e);
            }
        }
        log.debug("Drained hot bucket {}: {} counters", bucket, removed.size());
        return true;
    }

    private boolean isBefore(String bucket, Instant horizon) {
        try {
            return businessTime.parseBucket(bucket).isBefore(horizon);
        } catch (ValidationException e) {
            log.warn("Ignoring malformed bucket index: {}", bucket);
            return false;
        }
    }
}
