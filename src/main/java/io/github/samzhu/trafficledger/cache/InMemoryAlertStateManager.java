package io.github.samzhu.trafficledger.cache;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 單機記憶體版告警狀態管理，轉換透過 {@link ConcurrentHashMap#compute} 保持原子性。
 */
public class InMemoryAlertStateManager implements AlertStateManager {

    private record Entry(AlertStateData data, Instant expiresAt) {}

    private final Clock clock;
    private final Map<String, Entry> states = new ConcurrentHashMap<>();

    public InMemoryAlertStateManager(Clock clock) {
        this.clock = clock;
    }

    private static String key(String resourceType, long resourceId) {
        return resourceType + ":" + resourceId;
    }

    @Override
    public Optional<AlertStateData> getState(String resourceType, long resourceId) {
        return Optional.ofNullable(live(states.get(key(resourceType, resourceId)))).map(Entry::data);
    }

    @Override
    public boolean transitionToFiring(String resourceType, long resourceId, Instant now) {
        boolean[] fired = {false};
        states.compute(key(resourceType, resourceId), (k, existing) -> {
            Entry current = live(existing);
            if (current != null && current.data().state() == AlertState.FIRING) {
                return current;
            }
            fired[0] = true;
            return new Entry(AlertStateData.firing(now), clock.instant().plus(STATE_TTL));
        });
        return fired[0];
    }

    @Override
    public Optional<Instant> transitionToNormal(String resourceType, long resourceId) {
        Entry previous = live(states.remove(key(resourceType, resourceId)));
        if (previous == null || previous.data().state() != AlertState.FIRING) {
            return Optional.empty();
        }
        return Optional.ofNullable(previous.data().firedAt());
    }

    @Override
    public void markNotified(String resourceType, long resourceId, Instant now) {
        states.computeIfPresent(key(resourceType, resourceId), (k, existing) -> {
            Entry current = live(existing);
            return current == null ? null
                : new Entry(current.data().notified(now), clock.instant().plus(STATE_TTL));
        });
    }

    @Override
    public void clearState(String resourceType, long resourceId) {
        states.remove(key(resourceType, resourceId));
    }

    private Entry live(Entry entry) {
        if (entry == null || !clock.instant().isBefore(entry.expiresAt())) {
            return null;
        }
        return entry;
    }
}
