package io.github.samzhu.trafficledger.service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.exception.TrafficLedgerException;
import io.github.samzhu.trafficledger.model.Granularity;
import io.github.samzhu.trafficledger.model.GroupDimension;
import io.github.samzhu.trafficledger.model.RankedTraffic;
import io.github.samzhu.trafficledger.model.ResourceType;
import io.github.samzhu.trafficledger.model.TrafficOverview;
import io.github.samzhu.trafficledger.model.TrafficSummary;
import io.github.samzhu.trafficledger.model.TrendPoint;

/**
 * 流量總覽服務，平行執行多個獨立的分析查詢。
 *
 * <p>任一查詢失敗時立即取消其餘查詢並回報該錯誤；整體受 {@code ledger.query.timeout} 限制。
 */
@Service
public class TrafficOverviewService {

    private static final Logger log = LoggerFactory.getLogger(TrafficOverviewService.class);

    private final TrafficQueryService queryService;
    private final ExecutorService executor;
    private final Duration timeout;
    private final int rankingLimit;

    public TrafficOverviewService(TrafficQueryService queryService,
                                  @Qualifier("trafficQueryExecutor") ExecutorService executor,
                                  LedgerProperties properties) {
        this.queryService = queryService;
        this.executor = executor;
        this.timeout = properties.query().timeout();
        this.rankingLimit = properties.query().defaultRankingLimit();
    }

    /**
     * 取得區間流量總覽。
     *
     * @throws TrafficLedgerException 任一查詢失敗或整體逾時
     */
    public TrafficOverview getOverview(Instant from, Instant to) {
        CompletableFuture<TrafficSummary> total = CompletableFuture.supplyAsync(
            () -> queryService.getTotal(null, from, to), executor);
        CompletableFuture<List<RankedTraffic>> subscriptions = CompletableFuture.supplyAsync(
            () -> queryService.getTopN(GroupDimension.SUBSCRIPTION, null, from, to, rankingLimit), executor);
        CompletableFuture<List<RankedTraffic>> nodes = CompletableFuture.supplyAsync(
            () -> queryService.getTopN(GroupDimension.RESOURCE, ResourceType.NODE.tag(), from, to, rankingLimit),
            executor);
        CompletableFuture<List<RankedTraffic>> rules = CompletableFuture.supplyAsync(
            () -> queryService.getTopN(GroupDimension.RESOURCE, ResourceType.FORWARD_RULE.tag(), from, to,
                rankingLimit),
            executor);
        CompletableFuture<List<TrendPoint>> trend = CompletableFuture.supplyAsync(
            () -> queryService.getTrend(null, from, to, Granularity.DAY), executor);

        List<CompletableFuture<?>> futures = List.of(total, subscriptions, nodes, rules, trend);
        // 第一個失敗即結束等待
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        futures.forEach(f -> f.whenComplete((result, error) -> {
            if (error != null) {
                firstFailure.completeExceptionally(error);
            }
        }));

        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(total, subscriptions, nodes, rules, trend), firstFailure)
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new TrafficOverview(total.join(), subscriptions.join(), nodes.join(), rules.join(), trend.join());
        } catch (TimeoutException e) {
            throw new TrafficLedgerException("Traffic overview timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            log.warn("Traffic overview query failed, cancelling remaining queries: {}", cause.getMessage());
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TrafficLedgerException("Traffic overview query failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrafficLedgerException("Traffic overview interrupted", e);
        } finally {
            futures.forEach(f -> f.cancel(true));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
