package io.github.samzhu.trafficledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.exception.InvalidResourceTypeException;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.hot.InMemoryHotCounterStore;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.model.ResourceType;
import io.github.samzhu.trafficledger.model.TrafficEntry;
import io.github.samzhu.trafficledger.support.MutableClock;
import io.github.samzhu.trafficledger.util.BusinessTime;

class TrafficLedgerTest {

    // 2025-01-07 12:30 (Asia/Shanghai)
    private static final Instant NOW = Instant.parse("2025-01-07T04:30:00Z");

    private MutableClock clock;
    private InMemoryHotCounterStore hotStore;
    private TrafficLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        hotStore = new InMemoryHotCounterStore(clock, Duration.ofHours(49));
        ledger = new TrafficLedger(hotStore, BusinessTime.of("Asia/Shanghai"), clock, LedgerProperties.defaults());
    }

    @Test
    void shouldWriteIntoCurrentBusinessHour() {
        // When
        ledger.increment(1L, ResourceType.NODE, 100L, 1000, 2000);
        ledger.increment(1L, ResourceType.NODE, 100L, 500, 300);

        // Then
        assertThat(ledger.currentBucket()).isEqualTo("2025010712");
        CounterRecord record = ledger.get(new ResourceKey("2025010712", 1L, "node", 100L)).orElseThrow();
        assertThat(record.upload()).isEqualTo(1500);
        assertThat(record.download()).isEqualTo(2300);
        assertThat(hotStore.pendingKeys()).containsExactly("2025010712:1:node:100");
    }

    @Test
    void shouldMoveToNextBucketWhenHourChanges() {
        // Given
        ledger.increment(1L, "node", 100L, 10, 10);

        // When: 跨越營業時區的整點
        clock.advance(Duration.ofMinutes(30));
        ledger.increment(1L, "node", 100L, 5, 5);

        // Then
        assertThat(ledger.get(new ResourceKey("2025010712", 1L, "node", 100L)).orElseThrow().upload()).isEqualTo(10);
        assertThat(ledger.get(new ResourceKey("2025010713", 1L, "node", 100L)).orElseThrow().upload()).isEqualTo(5);
    }

    @Test
    void shouldRejectResourceTypeContainingDelimiter() {
        assertThatThrownBy(() -> ledger.increment(1L, "no:de", 100L, 10, 10))
            .isInstanceOf(InvalidResourceTypeException.class);

        assertThat(hotStore.pendingKeys()).isEmpty();
        assertThat(hotStore.indexedBuckets()).isEmpty();
    }

    @Test
    void shouldRejectNegativeAndOversizedDeltas() {
        assertThatThrownBy(() -> ledger.increment(1L, "node", 100L, -1, 0))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.increment(1L, "node", 100L, LedgerProperties.DEFAULT_MAX_BYTES_PER_REPORT + 1, 0))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ledger.increment(-1L, "node", 100L, 1, 0))
            .isInstanceOf(ValidationException.class);

        assertThat(hotStore.pendingKeys()).isEmpty();
    }

    @Test
    void shouldSkipZeroDelta() {
        ledger.increment(1L, "node", 100L, 0, 0);

        assertThat(hotStore.pendingKeys()).isEmpty();
        assertThat(ledger.get(new ResourceKey("2025010712", 1L, "node", 100L))).isEmpty();
    }

    @Test
    void shouldRejectWholeBatchWhenAnyEntryInvalid() {
        // Given
        List<TrafficEntry> entries = List.of(
            new TrafficEntry(1L, "node", 100L, 10, 10),
            new TrafficEntry(1L, "bad:type", 101L, 10, 10));

        // When / Then
        assertThatThrownBy(() -> ledger.batchIncrement(entries)).isInstanceOf(ValidationException.class);
        assertThat(hotStore.pendingKeys()).isEmpty();
    }

    @Test
    void shouldBatchIncrementAndSkipEmptyEntries() {
        // Given
        List<TrafficEntry> entries = List.of(
            new TrafficEntry(1L, "node", 100L, 10, 20),
            new TrafficEntry(0L, "forward_rule", 7L, 5, 0),
            new TrafficEntry(2L, "node", 200L, 0, 0));

        // When
        int written = ledger.batchIncrement(entries);

        // Then
        assertThat(written).isEqualTo(2);
        assertThat(hotStore.pendingKeys())
            .containsExactlyInAnyOrder("2025010712:1:node:100", "2025010712:0:forward_rule:7");
    }

    @Test
    void shouldAcceptMergedTotalsAboveReportCapButRejectNegatives() {
        // Given
        TrafficLedger capped = new TrafficLedger(hotStore, BusinessTime.of("Asia/Shanghai"), clock,
            new LedgerProperties(null, null, null, null, null, null, 1000L));
        List<TrafficEntry> merged = List.of(new TrafficEntry(1L, "node", 100L, 1200, 0));

        // When / Then
        assertThatThrownBy(() -> capped.batchIncrement(merged)).isInstanceOf(ValidationException.class);
        assertThat(capped.incrementMerged(merged)).isEqualTo(1);
        assertThat(hotStore.get(new ResourceKey("2025010712", 1L, "node", 100L)).orElseThrow().upload())
            .isEqualTo(1200);
        assertThatThrownBy(() -> capped.incrementMerged(List.of(new TrafficEntry(1L, "node", 100L, -1, 0))))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldCleanupResourceAcrossBuckets() {
        // Given
        ledger.increment(1L, "node", 100L, 10, 10);
        clock.advance(Duration.ofHours(2));
        ledger.increment(1L, "node", 100L, 10, 10);
        ledger.increment(1L, "node", 101L, 10, 10);

        // When
        int removed = ledger.cleanupResource("node", 100L);

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(hotStore.pendingKeys()).containsExactly("2025010714:1:node:101");
    }

    @Test
    void shouldRejectNegativeBaseline() {
        ResourceKey key = new ResourceKey("2025010712", 1L, "node", 100L);

        assertThatThrownBy(() -> ledger.initFromColdTier(key, -1, 0)).isInstanceOf(ValidationException.class);
    }
}
