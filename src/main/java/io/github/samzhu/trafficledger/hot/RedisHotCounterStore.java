package io.github.samzhu.trafficledger.hot;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import io.github.samzhu.trafficledger.exception.TierUnavailableException;
import io.github.samzhu.trafficledger.exception.TierUnavailableException.Tier;
import io.github.samzhu.trafficledger.exception.ValidationException;
import io.github.samzhu.trafficledger.model.CommitResult;
import io.github.samzhu.trafficledger.model.CounterDelta;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;

/**
 * Redis 版熱資料層。
 *
 * <p>每個會同時修改計數與索引的操作都以單一 Lua script 執行，確保原子性。
 *
 * <p>Key 格式：
 * <ul>
 *   <li>{@code {prefix}:h:{bucket}:{sub}:{type}:{id}} - Hash，欄位
 *       {@code upload}、{@code download}、{@code last_flushed_upload}、{@code last_flushed_download}</li>
 *   <li>{@code {prefix}:index:{bucket}} - Set，小時桶內的所有成員</li>
 *   <li>{@code {prefix}:pending} - Set，尚有增量未寫入冷資料層的成員，每次累加時延長 TTL</li>
 * </ul>
 * 成員為 {@link ResourceKey#encode()} 的字串。
 */
public class RedisHotCounterStore implements HotCounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisHotCounterStore.class);

    static final String FIELD_UPLOAD = "upload";
    static final String FIELD_DOWNLOAD = "download";
    static final String FIELD_FLUSHED_UPLOAD = "last_flushed_upload";
    static final String FIELD_FLUSHED_DOWNLOAD = "last_flushed_download";

    private static final byte[][] FIELDS = {
        FIELD_UPLOAD.getBytes(StandardCharsets.UTF_8),
        FIELD_DOWNLOAD.getBytes(StandardCharsets.UTF_8),
        FIELD_FLUSHED_UPLOAD.getBytes(StandardCharsets.UTF_8),
        FIELD_FLUSHED_DOWNLOAD.getBytes(StandardCharsets.UTF_8)
    };

    /**
     * 批次累加。
     *
     * <p>KEYS[1] = pending，之後每兩個為 (計數, 小時桶索引)；
     * ARGV[1] = TTL 秒數，之後每三個為 (成員, 上傳, 下載)。
     */
    static final String INCREMENT_SCRIPT = """
        local ttl = tonumber(ARGV[1])
        local n = (#KEYS - 1) / 2
        for i = 1, n do
            local rec = KEYS[2 * i]
            local idx = KEYS[2 * i + 1]
            local base = 2 + (i - 1) * 3
            local member = ARGV[base]
            redis.call('HINCRBY', rec, 'upload', ARGV[base + 1])
            redis.call('HINCRBY', rec, 'download', ARGV[base + 2])
            redis.call('EXPIRE', rec, ttl)
            redis.call('SADD', idx, member)
            redis.call('EXPIRE', idx, ttl)
            redis.call('SADD', KEYS[1], member)
        end
        redis.call('EXPIRE', KEYS[1], ttl)
        return n
        """;

    /**
     * 無增量時自 pending 移除。KEYS = [計數, pending]，ARGV = [成員]。
     */
    static final String RELEASE_IF_SETTLED_SCRIPT = """
        local v = redis.call('HMGET', KEYS[1], 'upload', 'download', 'last_flushed_upload', 'last_flushed_download')
        if not v[1] and not v[2] then
            redis.call('SREM', KEYS[2], ARGV[1])
            return 1
        end
        local up = tonumber(v[1]) or 0
        local down = tonumber(v[2]) or 0
        local fu = tonumber(v[3]) or 0
        local fd = tonumber(v[4]) or 0
        if up <= fu and down <= fd then
            redis.call('SREM', KEYS[2], ARGV[1])
            return 1
        end
        return 0
        """;

    /**
     * 推進 flush 標記。KEYS = [計數, pending]，ARGV = [成員, 已寫入上傳, 已寫入下載, TTL]。
     * 回傳 0 = 已不存在，1 = 已結清，2 = 有新增量。
     */
    static final String COMMIT_SCRIPT = """
        if redis.call('EXISTS', KEYS[1]) == 0 then
            redis.call('SREM', KEYS[2], ARGV[1])
            return 0
        end
        redis.call('HSET', KEYS[1], 'last_flushed_upload', ARGV[2], 'last_flushed_download', ARGV[3])
        redis.call('EXPIRE', KEYS[1], tonumber(ARGV[4]))
        local v = redis.call('HMGET', KEYS[1], 'upload', 'download')
        if (tonumber(v[1]) or 0) == tonumber(ARGV[2]) and (tonumber(v[2]) or 0) == tonumber(ARGV[3]) then
            redis.call('SREM', KEYS[2], ARGV[1])
            return 1
        end
        return 2
        """;

    /**
     * 取出並刪除整個小時桶。KEYS = [小時桶索引, pending]，ARGV = [計數 key 前綴]。
     * 回傳扁平陣列：成員, 上傳, 下載, 已寫入上傳, 已寫入下載, ...
     *
     * <p>多值回傳透過 connection 直接 eval，結果元素為 {@code byte[]}。
     */
    static final String GET_AND_CLEANUP_SCRIPT = """
        local members = redis.call('SMEMBERS', KEYS[1])
        local out = {}
        for _, m in ipairs(members) do
            local rec = ARGV[1] .. m
            local v = redis.call('HMGET', rec, 'upload', 'download', 'last_flushed_upload', 'last_flushed_download')
            if v[1] or v[2] then
                table.insert(out, m)
                table.insert(out, v[1] or '0')
                table.insert(out, v[2] or '0')
                table.insert(out, v[3] or '0')
                table.insert(out, v[4] or '0')
            end
            redis.call('DEL', rec)
            redis.call('SREM', KEYS[2], m)
        end
        redis.call('DEL', KEYS[1])
        return out
        """;

    /**
     * 刪除整個小時桶。KEYS = [小時桶索引, pending]，ARGV = [計數 key 前綴]。
     */
    static final String CLEANUP_BUCKET_SCRIPT = """
        local members = redis.call('SMEMBERS', KEYS[1])
        local removed = 0
        for _, m in ipairs(members) do
            removed = removed + redis.call('DEL', ARGV[1] .. m)
            redis.call('SREM', KEYS[2], m)
        end
        redis.call('DEL', KEYS[1])
        return removed
        """;

    /**
     * 以冷資料層的值重建。KEYS = [計數, 小時桶索引]，ARGV = [成員, 上傳, 下載, TTL]。
     */
    static final String INIT_SCRIPT = """
        redis.call('HSETNX', KEYS[1], 'upload', ARGV[2])
        redis.call('HSETNX', KEYS[1], 'download', ARGV[3])
        redis.call('HSETNX', KEYS[1], 'last_flushed_upload', ARGV[2])
        redis.call('HSETNX', KEYS[1], 'last_flushed_download', ARGV[3])
        redis.call('EXPIRE', KEYS[1], tonumber(ARGV[4]))
        redis.call('SADD', KEYS[2], ARGV[1])
        redis.call('EXPIRE', KEYS[2], tonumber(ARGV[4]))
        return 1
        """;

    /**
     * 刪除單鍵。KEYS = [計數, 小時桶索引, pending]，ARGV = [成員]。
     */
    static final String CLEANUP_RESOURCE_SCRIPT = """
        redis.call('DEL', KEYS[1])
        redis.call('SREM', KEYS[2], ARGV[1])
        redis.call('SREM', KEYS[3], ARGV[1])
        return 1
        """;

    private static final RedisScript<Long> INCREMENT = new DefaultRedisScript<>(INCREMENT_SCRIPT, Long.class);
    private static final RedisScript<Long> RELEASE_IF_SETTLED =
        new DefaultRedisScript<>(RELEASE_IF_SETTLED_SCRIPT, Long.class);
    private static final RedisScript<Long> COMMIT = new DefaultRedisScript<>(COMMIT_SCRIPT, Long.class);
    private static final RedisScript<Long> CLEANUP_BUCKET = new DefaultRedisScript<>(CLEANUP_BUCKET_SCRIPT, Long.class);
    private static final RedisScript<Long> INIT = new DefaultRedisScript<>(INIT_SCRIPT, Long.class);
    private static final RedisScript<Long> CLEANUP_RESOURCE =
        new DefaultRedisScript<>(CLEANUP_RESOURCE_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String prefix;
    private final String ttlSeconds;

    public RedisHotCounterStore(StringRedisTemplate redisTemplate, String keyPrefix, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.prefix = keyPrefix;
        this.ttlSeconds = String.valueOf(ttl.toSeconds());
    }

    String recordKey(String member) {
        return prefix + ":h:" + member;
    }

    String indexKey(String bucket) {
        return prefix + ":index:" + bucket;
    }

    String pendingKey() {
        return prefix + ":pending";
    }

    @Override
    public void increment(ResourceKey key, long upload, long download) {
        incrementAll(List.of(new CounterDelta(key, upload, download)));
    }

    @Override
    public void incrementAll(Collection<CounterDelta> deltas) {
        if (deltas.isEmpty()) {
            return;
        }
        List<String> keys = new ArrayList<>(1 + deltas.size() * 2);
        List<String> args = new ArrayList<>(1 + deltas.size() * 3);
        keys.add(pendingKey());
        args.add(ttlSeconds);
        for (CounterDelta delta : deltas) {
            String member = delta.key().encode();
            keys.add(recordKey(member));
            keys.add(indexKey(delta.key().bucket()));
            args.add(member);
            args.add(String.valueOf(delta.upload()));
            args.add(String.valueOf(delta.download()));
        }
        call("increment", () -> redisTemplate.execute(INCREMENT, keys, args.toArray()));
    }

    @Override
    public Optional<CounterRecord> get(ResourceKey key) {
        List<Object> values = call("get", () -> redisTemplate.opsForHash()
            .multiGet(recordKey(key.encode()),
                List.<Object>of(FIELD_UPLOAD, FIELD_DOWNLOAD, FIELD_FLUSHED_UPLOAD, FIELD_FLUSHED_DOWNLOAD)));
        return Optional.ofNullable(toRecord(key, values));
    }

    @Override
    public List<CounterRecord> getAll(String bucket) {
        return getRange(List.of(bucket));
    }

    @Override
    public List<CounterRecord> getRange(Collection<String> buckets) {
        if (buckets.isEmpty()) {
            return List.of();
        }
        List<String> bucketList = List.copyOf(buckets);
        List<Object> memberSets = call("getRange", () -> redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            for (String bucket : bucketList) {
                connection.setCommands().sMembers(bytes(indexKey(bucket)));
            }
            return null;
        }));

        List<ResourceKey> keys = new ArrayList<>();
        for (Object memberSet : memberSets) {
            if (memberSet instanceof Collection<?> members) {
                for (Object member : members) {
                    decodeOrNull(String.valueOf(member)).ifPresent(keys::add);
                }
            }
        }
        if (keys.isEmpty()) {
            return List.of();
        }

        List<Object> hashes = call("getRange", () -> redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            for (ResourceKey key : keys) {
                connection.hashCommands().hMGet(bytes(recordKey(key.encode())), FIELDS);
            }
            return null;
        }));

        List<CounterRecord> records = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size() && i < hashes.size(); i++) {
            if (hashes.get(i) instanceof List<?> values) {
                CounterRecord record = toRecord(keys.get(i), values);
                if (record != null) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    @Override
    public List<CounterRecord> getAndCleanup(String bucket) {
        byte[] script = bytes(GET_AND_CLEANUP_SCRIPT);
        byte[][] keysAndArgs = {bytes(indexKey(bucket)), bytes(pendingKey()), bytes(recordKey(""))};
        List<Object> flat = call("getAndCleanup", () -> redisTemplate.execute(
            (RedisCallback<List<Object>>) connection ->
                connection.scriptingCommands().eval(script, ReturnType.MULTI, 2, keysAndArgs)));
        List<CounterRecord> records = new ArrayList<>();
        if (flat == null) {
            return records;
        }
        for (int i = 0; i + 4 < flat.size(); i += 5) {
            String member = text(flat.get(i));
            Optional<ResourceKey> key = decodeOrNull(member);
            if (key.isEmpty()) {
                continue;
            }
            records.add(new CounterRecord(key.get(),
                parseLong(flat.get(i + 1)), parseLong(flat.get(i + 2)),
                parseLong(flat.get(i + 3)), parseLong(flat.get(i + 4))));
        }
        return records;
    }

    @Override
    public int cleanup(String bucket) {
        Long removed = call("cleanup", () -> redisTemplate.execute(CLEANUP_BUCKET,
            List.of(indexKey(bucket), pendingKey()), recordKey("")));
        return removed == null ? 0 : removed.intValue();
    }

    @Override
    public Set<String> indexedBuckets() {
        String indexPrefix = indexKey("");
        return call("indexedBuckets", () -> {
            Set<String> buckets = new HashSet<>();
            ScanOptions options = ScanOptions.scanOptions().match(indexPrefix + "*").count(100).build();
            try (Cursor<String> cursor = redisTemplate.scan(options)) {
                while (cursor.hasNext()) {
                    buckets.add(cursor.next().substring(indexPrefix.length()));
                }
            }
            return buckets;
        });
    }

    @Override
    public Set<String> pendingKeys() {
        Set<String> members = call("pendingKeys", () -> redisTemplate.opsForSet().members(pendingKey()));
        return members == null ? Set.of() : members;
    }

    @Override
    public void discardPending(String member) {
        call("discardPending", () -> redisTemplate.opsForSet().remove(pendingKey(), member));
    }

    @Override
    public boolean releaseIfSettled(ResourceKey key) {
        String member = key.encode();
        Long released = call("releaseIfSettled", () -> redisTemplate.execute(RELEASE_IF_SETTLED,
            List.of(recordKey(member), pendingKey()), member));
        return released != null && released == 1L;
    }

    @Override
    public CommitResult compareAndCommit(ResourceKey key, CounterRecord observed) {
        String member = key.encode();
        Long result = call("compareAndCommit", () -> redisTemplate.execute(COMMIT,
            List.of(recordKey(member), pendingKey()),
            member, String.valueOf(observed.upload()), String.valueOf(observed.download()), ttlSeconds));
        if (result == null || result == 0L) {
            return CommitResult.VANISHED;
        }
        return result == 1L ? CommitResult.SETTLED : CommitResult.ADVANCED;
    }

    @Override
    public void initFromColdTier(ResourceKey key, long upload, long download) {
        String member = key.encode();
        call("initFromColdTier", () -> redisTemplate.execute(INIT,
            List.of(recordKey(member), indexKey(key.bucket())),
            member, String.valueOf(upload), String.valueOf(download), ttlSeconds));
    }

    @Override
    public void cleanupResource(ResourceKey key) {
        String member = key.encode();
        call("cleanupResource", () -> redisTemplate.execute(CLEANUP_RESOURCE,
            List.of(recordKey(member), indexKey(key.bucket()), pendingKey()), member));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TierUnavailableException(Tier.HOT, operation + " failed", e);
        }
    }

    private static CounterRecord toRecord(ResourceKey key, List<?> values) {
        if (values == null || values.size() < 4 || (values.get(0) == null && values.get(1) == null)) {
            return null;
        }
        return new CounterRecord(key,
            parseLong(values.get(0)), parseLong(values.get(1)),
            parseLong(values.get(2)), parseLong(values.get(3)));
    }

    private static Optional<ResourceKey> decodeOrNull(String member) {
        try {
            return Optional.of(ResourceKey.decode(member));
        } catch (ValidationException e) {
            log.warn("Skipping malformed hot member: {}", member);
            return Optional.empty();
        }
    }

    private static long parseLong(Object value) {
        return value == null ? 0L : Long.parseLong(text(value));
    }

    private static String text(Object value) {
        if (value instanceof byte[] raw) {
            return new String(raw, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
