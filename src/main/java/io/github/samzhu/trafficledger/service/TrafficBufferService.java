package io.github.samzhu.trafficledger.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.model.TrafficEntry;

/**
 * 流量回報緩衝服務，將大量小筆回報合併後批次寫入熱資料層。
 *
 * <p>以下條件觸發寫入：
 * <ul>
 *   <li>緩衝筆數達到 {@code ledger.buffer.size}</li>
 *   <li>Cron 定時觸發（{@code ledger.buffer.flush-cron}，預設每 5 秒）</li>
 *   <li>應用程式關閉時</li>
 * </ul>
 *
 * <p>寫入前依 (訂閱, 資源類型, 資源) 合併增量；熱資料層不可用時整批重新放回緩衝區。
 * 回報在加入緩衝區前即完成單筆驗證，合併後的總量不受單筆上限限制。
 *
 * @see TrafficLedger#incrementMerged(List)
 */
@Service
public class TrafficBufferService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TrafficBufferService.class);

    private final TrafficLedger ledger;
    private final BlockingQueue<TrafficEntry> buffer = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final int batchSize;

    public TrafficBufferService(TrafficLedger ledger, LedgerProperties properties) {
        this.ledger = ledger;
        this.batchSize = properties.buffer().size();
    }

    /**
     * 驗證後加入緩衝區。
     *
     * @throws ValidationException 回報不合法
     */
    public void add(TrafficEntry entry) {
        ledger.validate(entry);
        if (entry.isEmpty()) {
            return;
        }
        buffer.add(entry);

        if (buffer.size() >= batchSize) {
            log.debug("Buffer size reached {}, triggering flush", batchSize);
            flushBuffer();
        }
    }

    /**
     * 合併緩衝區內容並寫入熱資料層。
     *
     * @return 寫入的合併後筆數
     */
    public synchronized int flushBuffer() {
        List<TrafficEntry> batch = new ArrayList<>(buffer.size());
        buffer.drainTo(batch);
        if (batch.isEmpty()) {
            return 0;
        }

        List<TrafficEntry> merged = merge(batch);
        long startTime = System.currentTimeMillis();
        try {
            int written = ledger.incrementMerged(merged);
            log.debug("Flush completed: {} reports merged into {} counters in {}ms",
                batch.size(), written, System.currentTimeMillis() - startTime);
            return written;
        } catch (ValidationException e) {
            // 重試同一批不會成功，丟棄以免阻塞後續寫入
            log.error("Dropping {} merged traffic reports that failed validation: {}",
                merged.size(), e.getMessage());
            return 0;
        } catch (RuntimeException e) {
            log.error("Failed to flush {} traffic reports, re-adding to buffer for retry: {}",
                batch.size(), e.getMessage(), e);
            buffer.addAll(merged);
            return 0;
        }
    }

    static List<TrafficEntry> merge(List<TrafficEntry> entries) {
        Map<String, long[]> sums = new LinkedHashMap<>();
        Map<String, TrafficEntry> firstSeen = new LinkedHashMap<>();
        for (TrafficEntry entry : entries) {
            String key = entry.subscriptionId() + ":" + entry.resourceType() + ":" + entry.resourceId();
            firstSeen.putIfAbsent(key, entry);
            long[] sum = sums.computeIfAbsent(key, k -> new long[2]);
            sum[0] += entry.uploadBytes();
            sum[1] += entry.downloadBytes();
        }
        List<TrafficEntry> merged = new ArrayList<>(sums.size());
        sums.forEach((key, sum) -> {
            TrafficEntry first = firstSeen.get(key);
            merged.add(new TrafficEntry(first.subscriptionId(), first.resourceType(), first.resourceId(),
                sum[0], sum[1]));
        });
        return merged;
    }

    @Scheduled(cron = "${ledger.buffer.flush-cron:*/5 * * * * *}")
    public void scheduledFlush() {
        if (running.get()) {
            flushBuffer();
        } else {
            log.debug("Scheduled flush skipped: service not running");
        }
    }

    // ===== SmartLifecycle Implementation =====

    @Override
    public void start() {
        running.set(true);
        log.info("TrafficBufferService started: batchSize={}", batchSize);
    }

    @Override
    public void stop() {
        log.info("TrafficBufferService stopping, flushing remaining {} reports...", buffer.size());
        running.set(false);
        flushBuffer();
        log.info("TrafficBufferService stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 在 Spring Cloud Stream bindings 之後關閉
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }

    public int getBufferSize() {
        return buffer.size();
    }
}
