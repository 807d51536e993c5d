package io.github.samzhu.trafficledger.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.trafficledger.cold.ColdAggregateStore;
import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.exception.TierUnavailableException;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.hot.HotCounterStore;
import io.github.samzhu.trafficledger.model.AggregationResult;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.Granularity;
import io.github.samzhu.trafficledger.model.GroupDimension;
import io.github.samzhu.trafficledger.model.GroupedTraffic;
import io.github.samzhu.trafficledger.model.RankedTraffic;
import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.model.TimeWindow;
import io.github.samzhu.trafficledger.model.TrafficPage;
import io.github.samzhu.trafficledger.model.TrafficSummary;
import io.github.samzhu.trafficledger.model.TrendPoint;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * 流量分析查詢服務，合併熱/冷資料層的結果。
 *
 * <p>查詢區間依 {@link TimeWindow} 切分：保留期內的小時讀熱資料層，
 * 之前的讀冷資料層，兩段不重疊，因此合併時可直接相加。
 *
 * <p>錯誤處理不對稱：
 * <ul>
 *   <li>熱資料層失敗 - 該段視為 0，記錄 warn，查詢繼續</li>
 *   <li>冷資料層失敗 - 整個查詢失敗</li>
 * </ul>
 *
 * <p>排行以總量遞減排序，同量時以群組 ID 遞增；分頁與取前 N 名皆在合併後進行。
 * 無法解析名稱的群組（例如已刪除）會在分頁後捨棄。
 */
@Service
public class TrafficQueryService {

    private static final Logger log = LoggerFactory.getLogger(TrafficQueryService.class);

    private final HotCounterStore hotStore;
    private final ColdAggregateStore coldStore;
    private final ResourceDirectory resourceDirectory;
    private final BusinessTime businessTime;
    private final Clock clock;
    private final Duration retention;
    private final LedgerProperties.QueryConfig queryConfig;

    public TrafficQueryService(HotCounterStore hotStore, ColdAggregateStore coldStore,
                               ResourceDirectory resourceDirectory, BusinessTime businessTime, Clock clock,
                               LedgerProperties properties) {
        this.hotStore = hotStore;
        this.coldStore = coldStore;
        this.resourceDirectory = resourceDirectory;
        this.businessTime = businessTime;
        this.clock = clock;
        this.retention = properties.hot().retention();
        this.queryConfig = properties.query();
    }

    /**
     * 區間總流量。
     *
     * @param resourceType 資源類型篩選，null 表示全部
     */
    public TrafficSummary getTotal(String resourceType, Instant from, Instant to) {
        TimeWindow window = resolve(from, to, resourceType);
        Map<Long, TrafficSummary> merged = new HashMap<>();
        mergeHot(merged, GroupDimension.PLATFORM, resourceType, window);
        if (window.includesCold()) {
            AggregationResult<GroupedTraffic> cold = coldStore.sumByGroup(GroupDimension.PLATFORM, resourceType,
                window.from(), window.coldTo(), 1);
            cold.rows().forEach(row -> merged.merge(row.groupId(), row.traffic(), TrafficSummary::plus));
        }
        return merged.getOrDefault(0L, TrafficSummary.ZERO);
    }

    /**
     * 指定訂閱各自的區間總流量，供配額檢查與使用量統計使用。
     *
     * @param subscriptionIds 訂閱 ID
     * @param resourceType 資源類型篩選，null 表示全部
     * @return 依傳入順序，每個訂閱一筆；無流量者為 {@link TrafficSummary#ZERO}
     */
    public Map<Long, TrafficSummary> getTotalBySubscriptionIds(Collection<Long> subscriptionIds, String resourceType,
                                                               Instant from, Instant to) {
        if (subscriptionIds == null || subscriptionIds.isEmpty()) {
            return Map.of();
        }
        Set<Long> ids = new LinkedHashSet<>(subscriptionIds);
        TimeWindow window = resolve(from, to, resourceType);

        Map<Long, TrafficSummary> merged = new HashMap<>();
        mergeHot(merged, GroupDimension.SUBSCRIPTION, resourceType, window,
            key -> ids.contains(key.subscriptionId()));
        if (window.includesCold()) {
            coldStore.sumBySubscriptions(ids, resourceType, window.from(), window.coldTo())
                .forEach(row -> merged.merge(row.groupId(), row.traffic(), TrafficSummary::plus));
        }

        Map<Long, TrafficSummary> totals = new LinkedHashMap<>();
        ids.forEach(id -> totals.put(id, merged.getOrDefault(id, TrafficSummary.ZERO)));
        return totals;
    }

    /**
     * 依訂閱分組，分頁回傳。
     */
    public TrafficPage getGroupedBySubscription(String resourceType, Instant from, Instant to,
                                                int page, int pageSize) {
        return grouped(GroupDimension.SUBSCRIPTION, resourceType, from, to, page, pageSize);
    }

    /**
     * 依資源分組，分頁回傳。
     *
     * @param resourceType 資源類型，必填（不同類型的資源 ID 可能重複）
     */
    public TrafficPage getGroupedByResource(String resourceType, Instant from, Instant to, int page, int pageSize) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new ValidationException("Resource type is required when grouping by resource");
        }
        return grouped(GroupDimension.RESOURCE, resourceType, from, to, page, pageSize);
    }

    /**
     * 取總量最高的前 N 個群組。
     *
     * @param limit 筆數，0 以下使用預設值，超過上限時截斷為上限
     */
    public List<RankedTraffic> getTopN(GroupDimension dimension, String resourceType, Instant from, Instant to,
                                       int limit) {
        if (dimension == GroupDimension.RESOURCE && (resourceType == null || resourceType.isBlank())) {
            throw new ValidationException("Resource type is required when ranking resources");
        }
        int n = limit <= 0 ? queryConfig.defaultRankingLimit() : Math.min(limit, queryConfig.maxRankingLimit());
        TimeWindow window = resolve(from, to, resourceType);

        List<GroupedTraffic> ranked;
        if (!window.includesHot()) {
            // 單一來源，冷資料層的排序即為最終排序
            ranked = coldStore.topN(dimension, resourceType, window.from(), window.coldTo(), n);
        } else {
            Map<Long, TrafficSummary> merged = new HashMap<>();
            mergeHot(merged, dimension, resourceType, window);
            if (window.includesCold()) {
                mergeCold(merged, dimension, resourceType, window);
            }
            ranked = sort(merged);
            if (ranked.size() > n) {
                ranked = ranked.subList(0, n);
            }
        }
        return label(dimension, resourceType, ranked, 1);
    }

    /**
     * 依粒度的流量趨勢，依時間遞增排列。
     */
    public List<TrendPoint> getTrend(String resourceType, Instant from, Instant to, Granularity granularity) {
        TimeWindow window = resolve(from, to, resourceType);
        Map<Instant, TrafficSummary> points = new TreeMap<>();

        if (window.includesHot()) {
            try {
                for (CounterRecord record : hotStore.getRange(window.hotBuckets(businessTime))) {
                    if (resourceType != null && !resourceType.equals(record.key().resourceType())) {
                        continue;
                    }
                    Instant period = businessTime.truncate(businessTime.parseBucket(record.key().bucket()), granularity);
                    points.merge(period, new TrafficSummary(record.upload(), record.download()), TrafficSummary::plus);
                }
            } catch (TierUnavailableException | DataAccessException e) {
                log.warn("Hot tier unavailable for trend query, treating hot range as zero: {}", e.getMessage());
            }
        }
        if (window.includesCold()) {
            for (TrendPoint point : coldStore.trend(resourceType, window.from(), window.coldTo(), granularity)) {
                points.merge(point.period(), new TrafficSummary(point.upload(), point.download()),
                    TrafficSummary::plus);
            }
        }

        List<TrendPoint> trend = new ArrayList<>(points.size());
        points.forEach((period, traffic) -> trend.add(new TrendPoint(period, traffic.upload(), traffic.download())));
        return trend;
    }

    private TrafficPage grouped(GroupDimension dimension, String resourceType, Instant from, Instant to,
                                int page, int pageSize) {
        int safePage = Math.max(page, 1);
        int size = pageSize <= 0 ? queryConfig.defaultPageSize() : Math.min(pageSize, queryConfig.maxPageSize());
        TimeWindow window = resolve(from, to, resourceType);

        Map<Long, TrafficSummary> merged = new HashMap<>();
        mergeHot(merged, dimension, resourceType, window);
        boolean truncated = window.includesCold() && mergeCold(merged, dimension, resourceType, window);

        List<GroupedTraffic> sorted = sort(merged);
        int offset = (int) Math.min((long) (safePage - 1) * size, sorted.size());
        List<GroupedTraffic> slice = sorted.subList(offset, Math.min(offset + size, sorted.size()));
        return new TrafficPage(label(dimension, resourceType, slice, offset + 1), sorted.size(), safePage, size,
            truncated);
    }

    private TimeWindow resolve(Instant from, Instant to, String resourceType) {
        if (resourceType != null) {
            ResourceKey.validateResourceType(resourceType);
        }
        return TimeWindow.resolve(from, to, clock.instant(), retention, businessTime);
    }

    private void mergeHot(Map<Long, TrafficSummary> merged, GroupDimension dimension, String resourceType,
                          TimeWindow window) {
        mergeHot(merged, dimension, resourceType, window, key -> true);
    }

    private void mergeHot(Map<Long, TrafficSummary> merged, GroupDimension dimension, String resourceType,
                          TimeWindow window, Predicate<ResourceKey> filter) {
        if (!window.includesHot()) {
            return;
        }
        try {
            for (CounterRecord record : hotStore.getRange(window.hotBuckets(businessTime))) {
                if (resourceType != null && !resourceType.equals(record.key().resourceType())) {
                    continue;
                }
                if (!filter.test(record.key())) {
                    continue;
                }
                long groupId = dimension.groupIdOf(record.key().subscriptionId(), record.key().resourceId());
                merged.merge(groupId, new TrafficSummary(record.upload(), record.download()), TrafficSummary::plus);
            }
        } catch (TierUnavailableException | DataAccessException e) {
            log.warn("Hot tier unavailable, treating hot range as zero: dimension={}, error={}",
                dimension, e.getMessage());
        }
    }

    /**
     * @return 冷資料層結果是否被截斷
     */
    private boolean mergeCold(Map<Long, TrafficSummary> merged, GroupDimension dimension, String resourceType,
                              TimeWindow window) {
        AggregationResult<GroupedTraffic> cold = coldStore.sumByGroup(dimension, resourceType,
            window.from(), window.coldTo(), queryConfig.maxRows());
        cold.rows().forEach(row -> merged.merge(row.groupId(), row.traffic(), TrafficSummary::plus));
        return cold.truncated();
    }

    private static List<GroupedTraffic> sort(Map<Long, TrafficSummary> merged) {
        List<GroupedTraffic> sorted = new ArrayList<>(merged.size());
        merged.forEach((id, traffic) -> sorted.add(new GroupedTraffic(id, traffic)));
        sorted.sort(GroupedTraffic.RANKING);
        return sorted;
    }

    private List<RankedTraffic> label(GroupDimension dimension, String resourceType, List<GroupedTraffic> groups,
                                      int firstRank) {
        if (groups.isEmpty()) {
            return List.of();
        }
        Map<Long, String> names = resourceDirectory.resolveNames(dimension, resourceType,
            groups.stream().map(GroupedTraffic::groupId).toList());
        List<RankedTraffic> items = new ArrayList<>(groups.size());
        int rank = firstRank;
        for (GroupedTraffic group : groups) {
            String name = names.get(group.groupId());
            if (name == null) {
                log.debug("Dropping unresolved group: dimension={}, id={}", dimension, group.groupId());
                continue;
            }
            items.add(new RankedTraffic(rank++, group.groupId(), name,
                group.traffic().upload(), group.traffic().download()));
        }
        return items;
    }
}
