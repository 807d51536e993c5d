package io.github.samzhu.trafficledger.cold;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.ArithmeticOperators;
import org.springframework.data.mongodb.core.aggregation.GroupOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import io.github.samzhu.trafficledger.document.TrafficUsage;
import io.github.samzhu.trafficledger.exception.TierUnavailableException;
import io.github.samzhu.trafficledger.exception.TierUnavailableException.Tier;
import io.github.samzhu.trafficledger.model.AggregationResult;
import io.github.samzhu.trafficledger.model.Granularity;
import io.github.samzhu.trafficledger.model.GroupDimension;
import io.github.samzhu.trafficledger.model.GroupedTraffic;
import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.model.TrendPoint;
import io.github.samzhu.trafficledger.model.UsageRow;
import io.github.samzhu.trafficledger.repository.TrafficUsageRepository;
import io.github.samzhu.trafficledger.util.BusinessTime;

/**
 * MongoDB 版冷資料層，資料存放於 {@code traffic_usage} 集合。
 *
 * <p>寫入使用 {@code $inc} upsert，重複寫入同一增量會重複累加，
 * 因此「只寫一次」由壓縮流程的 flush 標記保證，而非此層。
 *
 * <p>分組查詢使用 Aggregation Pipeline：
 * <pre>
 * $match (periodStart, resourceType) → $group (維度欄位) → $project total
 *   → $sort (total desc, _id asc) → $limit maxRows
 * </pre>
 * 結果達到上限時，另以 {@code $count} pipeline 取得實際群組數。
 */
@Component
public class MongoColdAggregateStore implements ColdAggregateStore {

    private static final Logger log = LoggerFactory.getLogger(MongoColdAggregateStore.class);

    private final MongoTemplate mongoTemplate;
    private final TrafficUsageRepository repository;
    private final BusinessTime businessTime;
    private final Clock clock;

    public MongoColdAggregateStore(MongoTemplate mongoTemplate, TrafficUsageRepository repository,
                                   BusinessTime businessTime, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.repository = repository;
        this.businessTime = businessTime;
        this.clock = clock;
    }

    @Override
    public void accumulate(String resourceType, long resourceId, long subscriptionId, Instant periodStart,
                           long uploadDelta, long downloadDelta) {
        if (uploadDelta == 0 && downloadDelta == 0) {
            return;
        }
        Instant hour = businessTime.truncateToHour(periodStart);
        ResourceKey key = new ResourceKey(businessTime.bucketOf(hour), subscriptionId, resourceType, resourceId);

        Query query = Query.query(Criteria.where("_id").is(TrafficUsage.createId(key)));
        Update update = new Update()
            .inc("upload", uploadDelta)
            .inc("download", downloadDelta)
            .set("lastUpdatedAt", clock.instant())
            .setOnInsert("periodStart", hour)
            .setOnInsert("subscriptionId", subscriptionId)
            .setOnInsert("resourceType", resourceType)
            .setOnInsert("resourceId", resourceId);

        call("accumulate", () -> mongoTemplate.upsert(query, update, TrafficUsage.class));
        log.debug("Accumulated traffic: key={}, upload={}, download={}", key.encode(), uploadDelta, downloadDelta);
    }

    @Override
    public AggregationResult<GroupedTraffic> sumByGroup(GroupDimension dimension, String resourceType,
                                                        Instant from, Instant to, int maxRows) {
        List<GroupedTraffic> rows = aggregateGroups(dimension, resourceType, from, to, maxRows);
        long trueCount = rows.size();
        if (rows.size() >= maxRows) {
            trueCount = countGroups(dimension, resourceType, from, to);
            if (trueCount > rows.size()) {
                log.warn("Cold aggregation truncated: dimension={}, type={}, rows={}, trueCount={}",
                    dimension, resourceType, rows.size(), trueCount);
            }
        }
        return new AggregationResult<>(rows, trueCount);
    }

    @Override
    public List<GroupedTraffic> sumBySubscriptions(Collection<Long> subscriptionIds, String resourceType,
                                                   Instant from, Instant to) {
        if (subscriptionIds.isEmpty()) {
            return List.of();
        }
        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(windowCriteria(resourceType, from, to).and("subscriptionId").in(subscriptionIds)),
            groupBy(GroupDimension.SUBSCRIPTION).sum("upload").as("upload").sum("download").as("download")
        );
        List<Document> results = call("sumBySubscriptions", () ->
            mongoTemplate.aggregate(aggregation, TrafficUsage.class, Document.class).getMappedResults());
        return results.stream()
            .map(doc -> new GroupedTraffic(longValue(doc.get("_id")),
                longValue(doc.get("upload")), longValue(doc.get("download"))))
            .toList();
    }

    @Override
    public List<GroupedTraffic> topN(GroupDimension dimension, String resourceType, Instant from, Instant to,
                                     int limit) {
        return aggregateGroups(dimension, resourceType, from, to, limit);
    }

    @Override
    public List<TrendPoint> trend(String resourceType, Instant from, Instant to, Granularity granularity) {
        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(windowCriteria(resourceType, from, to)),
            Aggregation.group("periodStart").sum("upload").as("upload").sum("download").as("download"),
            Aggregation.sort(Sort.by(Sort.Direction.ASC, "_id"))
        );
        List<Document> hourly = call("trend", () ->
            mongoTemplate.aggregate(aggregation, TrafficUsage.class, Document.class).getMappedResults());

        // 小時彙總在營業時區下再截斷為日/月
        Map<Instant, long[]> buckets = new TreeMap<>();
        for (Document doc : hourly) {
            Instant hour = toInstant(doc.get("_id"));
            if (hour == null) {
                continue;
            }
            long[] sums = buckets.computeIfAbsent(businessTime.truncate(hour, granularity), k -> new long[2]);
            sums[0] += longValue(doc.get("upload"));
            sums[1] += longValue(doc.get("download"));
        }
        List<TrendPoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((period, sums) -> points.add(new TrendPoint(period, sums[0], sums[1])));
        return points;
    }

    @Override
    public List<UsageRow> findByPeriod(Instant periodStart) {
        return call("findByPeriod", () -> repository.findByPeriodStart(businessTime.truncateToHour(periodStart)))
            .stream()
            .map(TrafficUsage::toRow)
            .toList();
    }

    private List<GroupedTraffic> aggregateGroups(GroupDimension dimension, String resourceType,
                                                 Instant from, Instant to, int limit) {
        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(windowCriteria(resourceType, from, to)),
            groupBy(dimension).sum("upload").as("upload").sum("download").as("download"),
            Aggregation.project("upload", "download")
                .and(ArithmeticOperators.Add.valueOf("upload").add("download")).as("total"),
            Aggregation.sort(Sort.by(Sort.Direction.DESC, "total").and(Sort.by(Sort.Direction.ASC, "_id"))),
            Aggregation.limit(limit)
        );
        List<Document> results = call("sumByGroup", () ->
            mongoTemplate.aggregate(aggregation, TrafficUsage.class, Document.class).getMappedResults());

        return results.stream()
            .map(doc -> new GroupedTraffic(
                dimension == GroupDimension.PLATFORM ? 0L : longValue(doc.get("_id")),
                longValue(doc.get("upload")),
                longValue(doc.get("download"))))
            .toList();
    }

    private long countGroups(GroupDimension dimension, String resourceType, Instant from, Instant to) {
        List<AggregationOperation> operations = List.of(
            Aggregation.match(windowCriteria(resourceType, from, to)),
            groupBy(dimension),
            Aggregation.count().as("n")
        );
        Document result = call("countGroups", () -> mongoTemplate
            .aggregate(Aggregation.newAggregation(operations), TrafficUsage.class, Document.class)
            .getUniqueMappedResult());
        return result == null ? 0L : longValue(result.get("n"));
    }

    private static GroupOperation groupBy(GroupDimension dimension) {
        return dimension == GroupDimension.PLATFORM
            ? Aggregation.group()
            : Aggregation.group(dimension.field());
    }

    private static Criteria windowCriteria(String resourceType, Instant from, Instant to) {
        Criteria criteria = Criteria.where("periodStart").gte(from).lt(to);
        if (resourceType != null) {
            criteria = criteria.and("resourceType").is(resourceType);
        }
        return criteria;
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.COLD, operation + " failed", e);
        }
    }

    private static long longValue(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }
}
