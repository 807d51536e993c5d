package io.github.samzhu.trafficledger.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.trafficledger.document.TrafficUsage;

/**
 * 小時流量彙總資料存取介面。
 *
 * <p>寫入一律透過 {@link io.github.samzhu.trafficledger.cold.MongoColdAggregateStore}
 * 以 MongoTemplate upsert 完成；此介面僅用於依小時讀取。
 */
public interface TrafficUsageRepository extends MongoRepository<TrafficUsage, String> {

    List<TrafficUsage> findByPeriodStart(Instant periodStart);
}
