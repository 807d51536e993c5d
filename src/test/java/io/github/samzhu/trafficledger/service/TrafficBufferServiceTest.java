package io.github.samzhu.trafficledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.trafficledger.config.LedgerProperties;
import io.github.samzhu.trafficledger.config.LedgerProperties.BufferConfig;
import io.github.samzhu.trafficledger.exception.TierUnavailableException;
import io.github.samzhu.trafficledger.exception.TierUnavailableException.Tier;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.hot.InMemoryHotCounterStore;
import io.github.samzhu.trafficledger.model.ResourceKey;
import io.github.samzhu.trafficledger.model.TrafficEntry;
import io.github.samzhu.trafficledger.support.MutableClock;
import io.github.samzhu.trafficledger.util.BusinessTime;

class TrafficBufferServiceTest {

    private static LedgerProperties withBufferSize(int size) {
        return new LedgerProperties(null, null, null, new BufferConfig(size, null), null, null, 0L);
    }

    @Test
    void shouldMergeEntriesOfSameResource() {
        // Given
        List<TrafficEntry> entries = List.of(
            new TrafficEntry(1L, "node", 100L, 1000, 2000),
            new TrafficEntry(1L, "forward_rule", 100L, 1, 1),
            new TrafficEntry(1L, "node", 100L, 500, 300));

        // When
        List<TrafficEntry> merged = TrafficBufferService.merge(entries);

        // Then
        assertThat(merged).containsExactly(
            new TrafficEntry(1L, "node", 100L, 1500, 2300),
            new TrafficEntry(1L, "forward_rule", 100L, 1, 1));
    }

    @Test
    void shouldFlushMergedEntriesIntoHotStore() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2025-01-07T04:30:00Z"));
        InMemoryHotCounterStore hotStore = new InMemoryHotCounterStore(clock, Duration.ofHours(49));
        LedgerProperties properties = LedgerProperties.defaults();
        TrafficLedger ledger = new TrafficLedger(hotStore, BusinessTime.of("Asia/Shanghai"), clock, properties);
        TrafficBufferService bufferService = new TrafficBufferService(ledger, properties);

        bufferService.add(new TrafficEntry(1L, "node", 100L, 1000, 2000));
        bufferService.add(new TrafficEntry(1L, "node", 100L, 500, 300));

        // When
        int written = bufferService.flushBuffer();

        // Then
        assertThat(written).isEqualTo(1);
        assertThat(bufferService.getBufferSize()).isZero();
        assertThat(hotStore.get(new ResourceKey("2025010712", 1L, "node", 100L)).orElseThrow().total())
            .isEqualTo(3800);
    }

    @Test
    void shouldRejectInvalidEntryBeforeBuffering() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2025-01-07T04:30:00Z"));
        TrafficLedger ledger = new TrafficLedger(new InMemoryHotCounterStore(clock, Duration.ofHours(49)),
            BusinessTime.of("Asia/Shanghai"), clock, LedgerProperties.defaults());
        TrafficBufferService bufferService = new TrafficBufferService(ledger, LedgerProperties.defaults());

        // When / Then
        assertThatThrownBy(() -> bufferService.add(new TrafficEntry(1L, "node", 100L, -5, 0)))
            .isInstanceOf(ValidationException.class);
        assertThat(bufferService.getBufferSize()).isZero();
    }

    @Test
    void shouldFlushWhenBufferSizeReached() {
        // Given
        TrafficLedger ledger = mock(TrafficLedger.class);
        when(ledger.incrementMerged(anyList())).thenReturn(2);
        TrafficBufferService bufferService = new TrafficBufferService(ledger, withBufferSize(2));

        // When
        bufferService.add(new TrafficEntry(1L, "node", 100L, 10, 0));
        verify(ledger, never()).incrementMerged(anyList());
        bufferService.add(new TrafficEntry(2L, "node", 200L, 10, 0));

        // Then
        verify(ledger).incrementMerged(List.of(
            new TrafficEntry(1L, "node", 100L, 10, 0),
            new TrafficEntry(2L, "node", 200L, 10, 0)));
        assertThat(bufferService.getBufferSize()).isZero();
    }

    @Test
    void shouldRequeueBatchWhenHotTierUnavailable() {
        // Given
        TrafficLedger ledger = mock(TrafficLedger.class);
        doThrow(new TierUnavailableException(Tier.HOT, "connection refused", null))
            .when(ledger).incrementMerged(anyList());
        TrafficBufferService bufferService = new TrafficBufferService(ledger, LedgerProperties.defaults());
        bufferService.add(new TrafficEntry(1L, "node", 100L, 10, 0));
        bufferService.add(new TrafficEntry(1L, "node", 100L, 5, 0));

        // When
        int written = bufferService.flushBuffer();

        // Then: 合併後的一筆放回緩衝區
        assertThat(written).isZero();
        assertThat(bufferService.getBufferSize()).isEqualTo(1);
    }

    @Test
    void shouldFlushRemainingEntriesOnStop() {
        // Given
        TrafficLedger ledger = mock(TrafficLedger.class);
        TrafficBufferService bufferService = new TrafficBufferService(ledger, LedgerProperties.defaults());
        bufferService.start();
        bufferService.add(new TrafficEntry(1L, "node", 100L, 10, 0));

        // When
        bufferService.stop();

        // Then
        verify(ledger).incrementMerged(List.of(new TrafficEntry(1L, "node", 100L, 10, 0)));
        assertThat(bufferService.isRunning()).isFalse();
    }

    @Test
    void shouldWriteMergedTotalsAboveSingleReportCap() {
        // Given: 每筆都在 1000 上限內，合併後超過
        MutableClock clock = new MutableClock(Instant.parse("2025-01-07T04:30:00Z"));
        InMemoryHotCounterStore hotStore = new InMemoryHotCounterStore(clock, Duration.ofHours(49));
        LedgerProperties properties = new LedgerProperties(null, null, null, null, null, null, 1000L);
        TrafficLedger ledger = new TrafficLedger(hotStore, BusinessTime.of("Asia/Shanghai"), clock, properties);
        TrafficBufferService bufferService = new TrafficBufferService(ledger, properties);
        bufferService.add(new TrafficEntry(1L, "node", 100L, 600, 0));
        bufferService.add(new TrafficEntry(1L, "node", 100L, 600, 0));
        bufferService.add(new TrafficEntry(2L, "node", 200L, 10, 10));

        // When
        int written = bufferService.flushBuffer();

        // Then
        assertThat(written).isEqualTo(2);
        assertThat(bufferService.getBufferSize()).isZero();
        assertThat(hotStore.get(new ResourceKey("2025010712", 1L, "node", 100L)).orElseThrow().total())
            .isEqualTo(1200);
        assertThat(hotStore.get(new ResourceKey("2025010712", 2L, "node", 200L)).orElseThrow().total())
            .isEqualTo(20);
    }

    @Test
    void shouldDropBatchThatFailsValidationInsteadOfRequeueing() {
        // Given
        TrafficLedger ledger = mock(TrafficLedger.class);
        doThrow(new ValidationException("Invalid resource type"))
            .when(ledger).incrementMerged(anyList());
        TrafficBufferService bufferService = new TrafficBufferService(ledger, LedgerProperties.defaults());
        bufferService.add(new TrafficEntry(1L, "node", 100L, 10, 0));

        // When
        int written = bufferService.flushBuffer();

        // Then
        assertThat(written).isZero();
        assertThat(bufferService.getBufferSize()).isZero();
    }
}
