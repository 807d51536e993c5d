package io.github.samzhu.trafficledger.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.trafficledger.cold.ColdAggregateStore;
import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.model.UsageRow;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * 熱資料層重建服務。
 *
 * <p>Redis 資料遺失（例如主機重建）後，以冷資料層的小時彙總重建熱資料層，
 * 讓保留期內的分析查詢恢復正確。重建的計數其累計值與 flush 標記相同，
 * 不會再次寫入冷資料層；已存在的欄位不會被覆寫。
 */
@Service
public class HotTierRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(HotTierRecoveryService.class);

    private final ColdAggregateStore coldStore;
    private final TrafficLedger ledger;
    private final BusinessTime businessTime;
    private final Clock clock;
    private final Duration retention;

    public HotTierRecoveryService(ColdAggregateStore coldStore, TrafficLedger ledger, BusinessTime businessTime,
                                  Clock clock, LedgerProperties properties) {
        this.coldStore = coldStore;
        this.ledger = ledger;
        this.businessTime = businessTime;
        this.clock = clock;
        this.retention = properties.hot().retention();
    }

    /**
     * 重建單一小時。
     *
     * @param hour 該小時內任意時間點
     * @return 重建的鍵數
     */
    public int reseedHour(Instant hour) {
        Instant periodStart = businessTime.truncateToHour(hour);
        String bucket = businessTime.bucketOf(periodStart);
        List<UsageRow> rows = coldStore.findByPeriod(periodStart);
        for (UsageRow row : rows) {
            ResourceKey key = new ResourceKey(bucket, row.subscriptionId(), row.resourceType(), row.resourceId());
            ledger.initFromColdTier(key, row.upload(), row.download());
        }
        log.debug("Reseeded hot bucket {}: {} counters", bucket, rows.size());
        return rows.size();
    }

    /**
     * 重建整個熱保留期。
     *
     * @return 重建的鍵數
     */
    public int reseedHotWindow() {
        Instant now = clock.instant();
        Instant cursor = businessTime.truncateToHour(now.minus(retention));
        Instant end = businessTime.truncateToHour(now);
        int total = 0;
        while (!cursor.isAfter(end)) {
            total += reseedHour(cursor);
            cursor = cursor.plus(1, ChronoUnit.HOURS);
        }
        log.info("Hot tier reseeded from cold tier: {} counters", total);
        return total;
    }
}
