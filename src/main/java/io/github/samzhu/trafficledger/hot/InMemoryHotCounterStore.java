package io.github.samzhu.trafficledger.hot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.trafficledger.model.CommitResult;
import io.github.samzhu.trafficledger.model.CounterDelta;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;

/**
 * 單機記憶體版熱資料層，用於開發與測試。
 *
 * <p>單鍵操作透過 {@link ConcurrentHashMap#compute} 達成原子性，
 * 待處理索引的增刪在同一個 compute 內完成；小時桶層級的操作（取出並刪除）
 * 以寫鎖與單鍵操作互斥。TTL 依注入的 {@link Clock} 判斷，過期鍵在讀取時移除。
 * 待處理索引整體與計數共用 TTL，每次累加時延長。
 */
public class InMemoryHotCounterStore implements HotCounterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryHotCounterStore.class);

    private final Clock clock;
    private final Duration ttl;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, BucketIndex> bucketIndexes = new ConcurrentHashMap<>();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private volatile Instant pendingExpiresAt;
    private final ReadWriteLock bucketLock = new ReentrantReadWriteLock();

    public InMemoryHotCounterStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    private static final class Counter {
        long upload;
        long download;
        long lastFlushedUpload;
        long lastFlushedDownload;
        Instant expiresAt;
    }

    private static final class BucketIndex {
        final Set<String> members = ConcurrentHashMap.newKeySet();
        volatile Instant expiresAt;
    }

    @Override
    public void increment(ResourceKey key, long upload, long download) {
        bucketLock.readLock().lock();
        try {
            apply(key, upload, download);
        } finally {
            bucketLock.readLock().unlock();
        }
    }

    @Override
    public void incrementAll(Collection<CounterDelta> deltas) {
        // 整批持寫鎖，對其他操作而言為單一原子步驟
        bucketLock.writeLock().lock();
        try {
            for (CounterDelta delta : deltas) {
                apply(delta.key(), delta.upload(), delta.download());
            }
        } finally {
            bucketLock.writeLock().unlock();
        }
    }

    private void apply(ResourceKey key, long upload, long download) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String member = key.encode();
        counters.compute(member, (k, counter) -> {
            Counter c = (counter == null || isExpired(counter.expiresAt, now)) ? new Counter() : counter;
            c.upload += upload;
            c.download += download;
            c.expiresAt = expiresAt;
            pending.add(member);
            pendingExpiresAt = expiresAt;
            return c;
        });
        BucketIndex index = bucketIndexes.compute(key.bucket(), (b, existing) ->
            (existing == null || isExpired(existing.expiresAt, now)) ? new BucketIndex() : existing);
        index.members.add(member);
        index.expiresAt = expiresAt;
    }

    @Override
    public Optional<CounterRecord> get(ResourceKey key) {
        return Optional.ofNullable(snapshot(key));
    }

    @Override
    public List<CounterRecord> getAll(String bucket) {
        return getRange(List.of(bucket));
    }

    @Override
    public List<CounterRecord> getRange(Collection<String> buckets) {
        List<CounterRecord> records = new ArrayList<>();
        for (String bucket : buckets) {
            for (String member : liveMembers(bucket)) {
                CounterRecord record = snapshot(ResourceKey.decode(member));
                if (record != null) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    @Override
    public List<CounterRecord> getAndCleanup(String bucket) {
        bucketLock.writeLock().lock();
        try {
            List<CounterRecord> records = getAll(bucket);
            removeBucket(bucket);
            return records;
        } finally {
            bucketLock.writeLock().unlock();
        }
    }

    @Override
    public int cleanup(String bucket) {
        bucketLock.writeLock().lock();
        try {
            return removeBucket(bucket);
        } finally {
            bucketLock.writeLock().unlock();
        }
    }

    private int removeBucket(String bucket) {
        BucketIndex index = bucketIndexes.remove(bucket);
        if (index == null) {
            return 0;
        }
        int removed = 0;
        for (String member : index.members) {
            if (counters.remove(member) != null) {
                removed++;
            }
            pending.remove(member);
        }
        log.debug("Cleaned up hot bucket {}: {} counters", bucket, removed);
        return removed;
    }

    @Override
    public Set<String> indexedBuckets() {
        Instant now = clock.instant();
        bucketIndexes.entrySet().removeIf(e -> isExpired(e.getValue().expiresAt, now));
        return new HashSet<>(bucketIndexes.keySet());
    }

    @Override
    public Set<String> pendingKeys() {
        bucketLock.writeLock().lock();
        try {
            if (isExpired(pendingExpiresAt, clock.instant())) {
                pending.clear();
                pendingExpiresAt = null;
            }
            return new HashSet<>(pending);
        } finally {
            bucketLock.writeLock().unlock();
        }
    }

    @Override
    public void discardPending(String member) {
        pending.remove(member);
    }

    @Override
    public boolean releaseIfSettled(ResourceKey key) {
        String member = key.encode();
        boolean[] released = {false};
        withReadLock(() -> counters.compute(member, (k, c) -> {
            Counter live = liveOrNull(c);
            if (live == null || (live.upload <= live.lastFlushedUpload && live.download <= live.lastFlushedDownload)) {
                pending.remove(member);
                released[0] = true;
            }
            return live;
        }));
        return released[0];
    }

    @Override
    public CommitResult compareAndCommit(ResourceKey key, CounterRecord observed) {
        String member = key.encode();
        CommitResult[] result = {CommitResult.VANISHED};
        Instant expiresAt = clock.instant().plus(ttl);
        withReadLock(() -> counters.compute(member, (k, c) -> {
            Counter live = liveOrNull(c);
            if (live == null) {
                pending.remove(member);
                result[0] = CommitResult.VANISHED;
                return null;
            }
            live.lastFlushedUpload = observed.upload();
            live.lastFlushedDownload = observed.download();
            live.expiresAt = expiresAt;
            if (live.upload == observed.upload() && live.download == observed.download()) {
                pending.remove(member);
                result[0] = CommitResult.SETTLED;
            } else {
                result[0] = CommitResult.ADVANCED;
            }
            return live;
        }));
        return result[0];
    }

    @Override
    public void initFromColdTier(ResourceKey key, long upload, long download) {
        String member = key.encode();
        Instant now = clock.instant();
        withReadLock(() -> {
            counters.compute(member, (k, c) -> {
                Counter live = liveOrNull(c);
                if (live != null) {
                    return live;
                }
                Counter seeded = new Counter();
                seeded.upload = upload;
                seeded.download = download;
                seeded.lastFlushedUpload = upload;
                seeded.lastFlushedDownload = download;
                seeded.expiresAt = now.plus(ttl);
                return seeded;
            });
            BucketIndex index = bucketIndexes.computeIfAbsent(key.bucket(), b -> new BucketIndex());
            index.members.add(member);
            index.expiresAt = now.plus(ttl);
            return null;
        });
    }

    @Override
    public void cleanupResource(ResourceKey key) {
        String member = key.encode();
        withReadLock(() -> {
            counters.compute(member, (k, c) -> {
                pending.remove(member);
                return null;
            });
            BucketIndex index = bucketIndexes.get(key.bucket());
            if (index != null) {
                index.members.remove(member);
            }
            return null;
        });
    }

    private CounterRecord snapshot(ResourceKey key) {
        String member = key.encode();
        CounterRecord[] holder = {null};
        counters.computeIfPresent(member, (k, c) -> {
            Counter live = liveOrNull(c);
            if (live != null) {
                holder[0] = new CounterRecord(key, live.upload, live.download,
                    live.lastFlushedUpload, live.lastFlushedDownload);
            }
            return live;
        });
        return holder[0];
    }

    private Set<String> liveMembers(String bucket) {
        BucketIndex index = bucketIndexes.get(bucket);
        if (index == null) {
            return Set.of();
        }
        if (isExpired(index.expiresAt, clock.instant())) {
            bucketIndexes.remove(bucket, index);
            return Set.of();
        }
        return new HashSet<>(index.members);
    }

    private Counter liveOrNull(Counter counter) {
        if (counter == null || isExpired(counter.expiresAt, clock.instant())) {
            return null;
        }
        return counter;
    }

    private static boolean isExpired(Instant expiresAt, Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    private <T> T withReadLock(Supplier<T> action) {
        bucketLock.readLock().lock();
        try {
            return action.get();
        } finally {
            bucketLock.readLock().unlock();
        }
    }
}
