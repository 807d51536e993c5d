package io.github.samzhu.trafficledger.hot;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import io.github.samzhu.trafficledger.model.CommitResult;
import io.github.samzhu.trafficledger.model.CounterDelta;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;

/**
 * 以真實 Redis 執行熱資料層的 Lua script。
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisHotCounterStoreContainerTest {

    @Container
    static GenericContainer<?> redis =
        new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static final ResourceKey KEY = new ResourceKey("2025010712", 1L, "node", 100L);
    private static final ResourceKey OTHER = new ResourceKey("2025010712", 2L, "forward_rule", 7L);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisHotCounterStore store;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        store = new RedisHotCounterStore(redisTemplate, "traffic", Duration.ofHours(49));
    }

    @Test
    void shouldAccumulateAndIndexWithExpiry() {
        // When
        store.increment(KEY, 1000, 2000);
        store.incrementAll(List.of(new CounterDelta(KEY, 500, 300), new CounterDelta(OTHER, 5, 6)));

        // Then
        assertThat(store.get(KEY)).contains(new CounterRecord(KEY, 1500, 2300, 0, 0));
        assertThat(store.get(OTHER)).contains(new CounterRecord(OTHER, 5, 6, 0, 0));
        assertThat(store.pendingKeys()).containsExactlyInAnyOrder(KEY.encode(), OTHER.encode());
        assertThat(store.indexedBuckets()).containsExactly("2025010712");
        assertThat(store.getAll("2025010712")).hasSize(2);
        assertThat(redisTemplate.getExpire(store.recordKey(KEY.encode()))).isPositive();
        assertThat(redisTemplate.getExpire(store.indexKey("2025010712"))).isPositive();
        assertThat(redisTemplate.getExpire(store.pendingKey())).isPositive();
    }

    @Test
    void shouldSettleWhenNothingArrivedSinceSnapshot() {
        // Given
        store.increment(KEY, 1000, 2000);
        CounterRecord snapshot = store.get(KEY).orElseThrow();

        // When
        CommitResult result = store.compareAndCommit(KEY, snapshot);

        // Then
        assertThat(result).isEqualTo(CommitResult.SETTLED);
        assertThat(store.get(KEY)).contains(new CounterRecord(KEY, 1000, 2000, 1000, 2000));
        assertThat(store.pendingKeys()).isEmpty();
    }

    @Test
    void shouldStayPendingWhenIncrementArrivesAfterSnapshot() {
        // Given
        store.increment(KEY, 1000, 2000);
        CounterRecord snapshot = store.get(KEY).orElseThrow();
        store.increment(KEY, 10, 0);

        // When
        CommitResult result = store.compareAndCommit(KEY, snapshot);

        // Then
        assertThat(result).isEqualTo(CommitResult.ADVANCED);
        CounterRecord record = store.get(KEY).orElseThrow();
        assertThat(record.uploadDelta()).isEqualTo(10);
        assertThat(record.downloadDelta()).isZero();
        assertThat(store.pendingKeys()).containsExactly(KEY.encode());
    }

    @Test
    void shouldReportVanishedAndDropPendingWhenRecordGone() {
        // Given
        store.increment(KEY, 1, 1);
        CounterRecord snapshot = store.get(KEY).orElseThrow();
        redisTemplate.delete(store.recordKey(KEY.encode()));

        // When / Then
        assertThat(store.compareAndCommit(KEY, snapshot)).isEqualTo(CommitResult.VANISHED);
        assertThat(store.pendingKeys()).isEmpty();
    }

    @Test
    void shouldReleaseOnlyWhenSettled() {
        // Given
        store.increment(KEY, 100, 100);

        // When / Then
        assertThat(store.releaseIfSettled(KEY)).isFalse();
        assertThat(store.pendingKeys()).containsExactly(KEY.encode());

        store.compareAndCommit(KEY, new CounterRecord(KEY, 100, 100, 0, 0));
        store.increment(KEY, 0, 0);
        assertThat(store.releaseIfSettled(KEY)).isTrue();
        assertThat(store.pendingKeys()).isEmpty();
    }

    @Test
    void shouldReturnAndRemoveWholeBucket() {
        // Given
        store.increment(KEY, 1500, 2300);
        store.compareAndCommit(KEY, new CounterRecord(KEY, 1000, 2000, 0, 0));
        store.increment(OTHER, 5, 6);

        // When
        List<CounterRecord> removed = store.getAndCleanup("2025010712");

        // Then
        assertThat(removed).containsExactlyInAnyOrder(
            new CounterRecord(KEY, 1500, 2300, 1000, 2000),
            new CounterRecord(OTHER, 5, 6, 0, 0));
        assertThat(store.get(KEY)).isEmpty();
        assertThat(store.get(OTHER)).isEmpty();
        assertThat(store.pendingKeys()).isEmpty();
        assertThat(store.indexedBuckets()).isEmpty();
    }

    @Test
    void shouldSeedFromColdTierOnlyWhenAbsent() {
        // Given
        store.increment(OTHER, 5, 6);

        // When
        store.initFromColdTier(KEY, 1000, 2000);
        store.initFromColdTier(KEY, 1, 1);
        store.initFromColdTier(OTHER, 999, 999);

        // Then: 重建的值視為已寫入冷資料層
        assertThat(store.get(KEY)).contains(new CounterRecord(KEY, 1000, 2000, 1000, 2000));
        assertThat(store.get(OTHER).orElseThrow().upload()).isEqualTo(5);
        assertThat(store.pendingKeys()).containsExactly(OTHER.encode());
        assertThat(store.getAll("2025010712")).hasSize(2);
    }

    @Test
    void shouldRemoveSingleResource() {
        // Given
        store.increment(KEY, 1, 1);
        store.increment(OTHER, 1, 1);

        // When
        store.cleanupResource(KEY);

        // Then
        assertThat(store.get(KEY)).isEmpty();
        assertThat(store.pendingKeys()).containsExactly(OTHER.encode());
        assertThat(store.getAll("2025010712")).extracting(CounterRecord::key).containsExactly(OTHER);
    }

    @Test
    void shouldCleanupBucketWithoutReturningRecords() {
        // Given
        store.increment(KEY, 1, 1);
        store.increment(OTHER, 1, 1);

        // When
        int removed = store.cleanup("2025010712");

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(store.pendingKeys()).isEmpty();
        assertThat(store.indexedBuckets()).isEmpty();
    }
}
