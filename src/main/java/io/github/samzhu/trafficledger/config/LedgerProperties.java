package io.github.samzhu.trafficledger.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 流量帳本的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link HotConfig} - 熱資料層（Redis 或記憶體）的保留期與 TTL</li>
 *   <li>{@link CompactionConfig} - 熱資料寫入冷資料層的排程</li>
 *   <li>{@link BufferConfig} - 流量回報的緩衝設定</li>
 *   <li>{@link JanitorConfig} - 過期小時桶的清理排程</li>
 *   <li>{@link QueryConfig} - 分析查詢的上限與分頁預設值</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * ledger:
 *   timezone: Asia/Shanghai
 *   hot:
 *     store: redis
 *     retention: 24h
 *     ttl: 49h
 *   compaction:
 *     cron: "0 * * * * *"
 *     max-duration: 50s
 *   query:
 *     max-rows: 100000
 * </pre>
 *
 * @param timezone 營業時區，小時桶與日界線皆依此計算
 * @param maxBytesPerReport 單筆回報的位元組上限，防止異常值污染統計
 */
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
    String timezone,
    HotConfig hot,
    CompactionConfig compaction,
    BufferConfig buffer,
    JanitorConfig janitor,
    QueryConfig query,
    long maxBytesPerReport
) {
    public static final long DEFAULT_MAX_BYTES_PER_REPORT = 1L << 40;

    public LedgerProperties {
        if (timezone == null || timezone.isBlank()) {
            timezone = "Asia/Shanghai";
        }
        if (hot == null) {
            hot = HotConfig.defaults();
        }
        if (compaction == null) {
            compaction = CompactionConfig.defaults();
        }
        if (buffer == null) {
            buffer = BufferConfig.defaults();
        }
        if (janitor == null) {
            janitor = JanitorConfig.defaults();
        }
        if (query == null) {
            query = QueryConfig.defaults();
        }
        if (maxBytesPerReport <= 0) {
            maxBytesPerReport = DEFAULT_MAX_BYTES_PER_REPORT;
        }
    }

    /**
     * 建立全預設值的設定，主要供測試使用。
     */
    public static LedgerProperties defaults() {
        return new LedgerProperties(null, null, null, null, null, null, 0L);
    }

    /**
     * 熱資料層設定。
     *
     * <p>{@code retention} 決定查詢時的熱/冷邊界；{@code ttl} 必須大於保留期，
     * 讓小時桶在邊界之外仍存活一段時間，供壓縮與清理完成。
     *
     * @param store 實作選擇：{@code redis} 或 {@code memory}
     * @param retention 熱資料保留期，預設 24 小時
     * @param ttl 鍵值存活時間，預設 49 小時
     * @param keyPrefix Redis key 前綴，預設 {@code traffic}
     */
    public record HotConfig(
        String store,
        Duration retention,
        Duration ttl,
        String keyPrefix
    ) {
        public HotConfig {
            if (store == null || store.isBlank()) {
                store = "redis";
            }
            if (retention == null || retention.isNegative() || retention.isZero()) {
                retention = Duration.ofHours(24);
            }
            if (ttl == null || ttl.compareTo(retention) <= 0) {
                ttl = retention.multipliedBy(2).plusHours(1);
            }
            if (keyPrefix == null || keyPrefix.isBlank()) {
                keyPrefix = "traffic";
            }
        }

        public static HotConfig defaults() {
            return new HotConfig("redis", Duration.ofHours(24), Duration.ofHours(49), "traffic");
        }
    }

    /**
     * 壓縮排程設定。
     *
     * @param enabled 是否啟用排程，預設 true
     * @param cron 排程 Cron 表達式，預設每分鐘
     * @param maxDuration 單次執行的時間上限，預設 50 秒
     * @param failureWarnThreshold 同一鍵連續失敗達此次數時記錄 warn，預設 5
     */
    public record CompactionConfig(
        Boolean enabled,
        String cron,
        Duration maxDuration,
        int failureWarnThreshold
    ) {
        public CompactionConfig {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (cron == null || cron.isBlank()) {
                cron = "0 * * * * *";
            }
            if (maxDuration == null || maxDuration.isNegative() || maxDuration.isZero()) {
                maxDuration = Duration.ofSeconds(50);
            }
            if (failureWarnThreshold <= 0) {
                failureWarnThreshold = 5;
            }
        }

        public static CompactionConfig defaults() {
            return new CompactionConfig(true, "0 * * * * *", Duration.ofSeconds(50), 5);
        }
    }

    /**
     * 流量回報緩衝設定。
     *
     * @param size 緩衝筆數達此值時立即寫入，預設 1000
     * @param flushCron 定時寫入 Cron 表達式，預設每 5 秒
     */
    public record BufferConfig(
        int size,
        String flushCron
    ) {
        public BufferConfig {
            if (size <= 0) {
                size = 1000;
            }
            if (flushCron == null || flushCron.isBlank()) {
                flushCron = "*/5 * * * * *";
            }
        }

        public static BufferConfig defaults() {
            return new BufferConfig(1000, "*/5 * * * * *");
        }
    }

    /**
     * 過期小時桶清理設定。
     *
     * @param enabled 是否啟用，預設 true
     * @param cron 排程 Cron 表達式，預設每小時 15 分
     */
    public record JanitorConfig(
        Boolean enabled,
        String cron
    ) {
        public JanitorConfig {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (cron == null || cron.isBlank()) {
                cron = "0 15 * * * *";
            }
        }

        public static JanitorConfig defaults() {
            return new JanitorConfig(true, "0 15 * * * *");
        }
    }

    /**
     * 分析查詢設定。
     *
     * @param maxRows 冷資料層單次聚合的列數上限
     * @param defaultPageSize 預設每頁筆數
     * @param maxPageSize 每頁筆數上限
     * @param defaultRankingLimit 排行預設筆數
     * @param maxRankingLimit 排行筆數上限
     * @param timeout 總覽查詢的整體逾時
     * @param parallelism 總覽查詢的平行度
     */
    public record QueryConfig(
        int maxRows,
        int defaultPageSize,
        int maxPageSize,
        int defaultRankingLimit,
        int maxRankingLimit,
        Duration timeout,
        int parallelism
    ) {
        public QueryConfig {
            if (maxRows <= 0) {
                maxRows = 100_000;
            }
            if (defaultPageSize <= 0) {
                defaultPageSize = 20;
            }
            if (maxPageSize <= 0) {
                maxPageSize = 100;
            }
            if (defaultRankingLimit <= 0) {
                defaultRankingLimit = 10;
            }
            if (maxRankingLimit <= 0) {
                maxRankingLimit = 100;
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                timeout = Duration.ofSeconds(10);
            }
            if (parallelism <= 0) {
                parallelism = 4;
            }
        }

        public static QueryConfig defaults() {
            return new QueryConfig(100_000, 20, 100, 10, 100, Duration.ofSeconds(10), 4);
        }
    }
}
