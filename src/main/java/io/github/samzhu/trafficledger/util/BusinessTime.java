package io.github.samzhu.trafficledger.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.model.Granularity;

/**
 * 營業時區的時間計算工具。
 *
 * <p>所有小時桶、日界線與月界線都以營業時區（預設 Asia/Shanghai）計算，
 * 而非 UTC。小時桶以 {@code yyyyMMddHH} 字串表示，字典序即時間序。
 */
public final class BusinessTime {

    public static final String DEFAULT_ZONE = "Asia/Shanghai";

    private static final DateTimeFormatter BUCKET_FORMAT = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.YEAR, 4)
        .appendValue(ChronoField.MONTH_OF_YEAR, 2)
        .appendValue(ChronoField.DAY_OF_MONTH, 2)
        .appendValue(ChronoField.HOUR_OF_DAY, 2)
        .toFormatter();

    private final ZoneId zone;

    public BusinessTime(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * 依時區 ID 建立；空白時使用預設營業時區。
     *
     * @param zoneId 時區 ID，例如 {@code Asia/Shanghai}
     * @return BusinessTime
     * @throws IllegalArgumentException 時區 ID 無法解析
     */
    public static BusinessTime of(String zoneId) {
        String id = (zoneId == null || zoneId.isBlank()) ? DEFAULT_ZONE : zoneId;
        try {
            return new BusinessTime(ZoneId.of(id));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid business timezone: " + id, e);
        }
    }

    public ZoneId zone() {
        return zone;
    }

    public Instant truncateToHour(Instant instant) {
        return instant.atZone(zone).truncatedTo(ChronoUnit.HOURS).toInstant();
    }

    public Instant startOfDay(Instant instant) {
        return instant.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
    }

    /**
     * 當日最後一刻（23:59:59.999999999）。
     */
    public Instant endOfDay(Instant instant) {
        return startOfNextDay(instant).minusNanos(1);
    }

    public Instant startOfNextDay(Instant instant) {
        return instant.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }

    public Instant startOfMonth(Instant instant) {
        return instant.atZone(zone).toLocalDate().withDayOfMonth(1).atStartOfDay(zone).toInstant();
    }

    /**
     * 依粒度截斷至週期起點。
     */
    public Instant truncate(Instant instant, Granularity granularity) {
        return switch (granularity) {
            case HOUR -> truncateToHour(instant);
            case DAY -> startOfDay(instant);
            case MONTH -> startOfMonth(instant);
        };
    }

    public LocalDate toBusinessDate(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    /**
     * 取得時間點所屬小時桶的字串表示。
     *
     * @param instant 任意時間點
     * @return {@code yyyyMMddHH}
     */
    public String bucketOf(Instant instant) {
        return BUCKET_FORMAT.format(instant.atZone(zone));
    }

    /**
     * 解析小時桶字串為該小時的起點。
     *
     * @param bucket {@code yyyyMMddHH}
     * @return 該小時起點
     * @throws ValidationException 格式錯誤
     */
    public Instant parseBucket(String bucket) {
        if (bucket == null) {
            throw new ValidationException("Hour bucket must not be null");
        }
        try {
            LocalDateTime local = LocalDateTime.parse(bucket + "00", new DateTimeFormatterBuilder()
                .append(BUCKET_FORMAT)
                .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                .toFormatter());
            return ZonedDateTime.of(local, zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid hour bucket: " + bucket);
        }
    }

    /**
     * 列出 [from, toExclusive) 之間的所有小時桶，依時間遞增排列。
     */
    public List<String> bucketsBetween(Instant from, Instant toExclusive) {
        List<String> buckets = new ArrayList<>();
        Instant cursor = truncateToHour(from);
        while (cursor.isBefore(toExclusive)) {
            buckets.add(bucketOf(cursor));
            cursor = cursor.plus(1, ChronoUnit.HOURS);
        }
        return buckets;
    }
}
