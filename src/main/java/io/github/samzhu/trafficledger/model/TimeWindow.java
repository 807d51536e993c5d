package io.github.samzhu.trafficledger.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * 已正規化並依熱/冷邊界切分的查詢區間。
 *
 * <p>正規化規則：
 * <ul>
 *   <li>{@code from} 截斷至所屬小時起點</li>
 *   <li>{@code to} 延伸至所屬營業日結束，以互斥上界 {@code toExclusive} 表示</li>
 * </ul>
 *
 * <p>熱邊界 = 截斷至小時的 {@code now - retention}。
 * 熱資料層負責 [max(from, 邊界), min(toExclusive, 當前小時結束))，
 * 冷資料層負責 [from, min(toExclusive, 邊界))，兩段互不重疊。
 */
public record TimeWindow(Instant from, Instant toExclusive, Instant hotBoundary, Instant hotEnd) {

    /**
     * 驗證並切分查詢區間。
     *
     * @throws ValidationException 區間為 null 或顛倒
     */
    public static TimeWindow resolve(Instant from, Instant to, Instant now, Duration retention,
                                     BusinessTime businessTime) {
        if (from == null || to == null) {
            throw new ValidationException("Time window bounds must not be null");
        }
        if (from.isAfter(to)) {
            throw new ValidationException(String.format("Inverted time window: from=%s, to=%s", from, to));
        }
        Instant normalizedFrom = businessTime.truncateToHour(from);
        Instant toExclusive = businessTime.startOfNextDay(to);
        Instant boundary = businessTime.truncateToHour(now.minus(retention));
        Instant currentHourEnd = businessTime.truncateToHour(now).plus(1, ChronoUnit.HOURS);
        Instant hotEnd = toExclusive.isBefore(currentHourEnd) ? toExclusive : currentHourEnd;
        return new TimeWindow(normalizedFrom, toExclusive, boundary, hotEnd);
    }

    public Instant hotFrom() {
        return from.isAfter(hotBoundary) ? from : hotBoundary;
    }

    public Instant coldTo() {
        return toExclusive.isBefore(hotBoundary) ? toExclusive : hotBoundary;
    }

    public boolean includesHot() {
        return hotFrom().isBefore(hotEnd);
    }

    public boolean includesCold() {
        return from.isBefore(coldTo());
    }

    /**
     * 熱資料層需讀取的小時桶。
     */
    public List<String> hotBuckets(BusinessTime businessTime) {
        return includesHot() ? businessTime.bucketsBetween(hotFrom(), hotEnd) : List.of();
    }
}
