package io.github.samzhu.trafficledger.cache;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 單機記憶體版訂閱配額快取，TTL 依注入的 {@link Clock} 判斷。
 */
public class InMemorySubscriptionQuotaCache implements SubscriptionQuotaCache {

    private record Entry(CachedQuota quota, Instant expiresAt) {}

    private final Clock clock;
    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();

    public InMemorySubscriptionQuotaCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CachedQuota> getQuota(long subscriptionId) {
        Entry entry = entries.get(subscriptionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(subscriptionId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.quota());
    }

    @Override
    public void setQuota(long subscriptionId, CachedQuota quota) {
        entries.put(subscriptionId, new Entry(quota, clock.instant().plus(SubscriptionQuotaCache.ttlWithJitter())));
    }

    @Override
    public void invalidateQuota(long subscriptionId) {
        entries.remove(subscriptionId);
    }

    @Override
    public void setSuspended(long subscriptionId, boolean suspended) {
        Instant now = clock.instant();
        entries.computeIfPresent(subscriptionId, (id, entry) -> {
            if (!now.isBefore(entry.expiresAt())) {
                return null;
            }
            return new Entry(entry.quota().withSuspended(suspended), entry.expiresAt());
        });
    }

    @Override
    public void setNullMarker(long subscriptionId) {
        entries.put(subscriptionId, new Entry(CachedQuota.notFoundMarker(), clock.instant().plus(NULL_MARKER_TTL)));
    }
}
