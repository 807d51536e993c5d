package io.github.samzhu.trafficledger.hot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import io.github.samzhu.trafficledger.exception.TierUnavailableException;
import io.github.samzhu.trafficledger.model.CommitResult;
import io.github.samzhu.trafficledger.model.CounterDelta;
import io.github.samzhu.trafficledger.model.CounterRecord;
import io.github.samzhu.trafficledger.model.ResourceKey;

class RedisHotCounterStoreTest {

    private static final ResourceKey KEY = new ResourceKey("2025010712", 1L, "node", 100L);

    private StringRedisTemplate redisTemplate;
    private RedisHotCounterStore store;
    private final AtomicReference<Object[]> lastCall = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        store = new RedisHotCounterStore(redisTemplate, "traffic", Duration.ofHours(49));
    }

    private void answerScripts(Object result) {
        doAnswer(invocation -> {
            lastCall.set(invocation.getArguments());
            return result;
        }).when(redisTemplate).execute(any(RedisScript.class), anyList(), any(Object[].class));
    }

    @Test
    void shouldBuildKeysForBatchIncrement() {
        answerScripts(2L);
        ResourceKey other = new ResourceKey("2025010712", 0L, "forward_rule", 7L);

        store.incrementAll(List.of(new CounterDelta(KEY, 1000, 2000), new CounterDelta(other, 5, 6)));

        Object[] args = lastCall.get();
        assertThat((List<Object>) args[1]).containsExactly(
            "traffic:pending",
            "traffic:h:2025010712:1:node:100", "traffic:index:2025010712",
            "traffic:h:2025010712:0:forward_rule:7", "traffic:index:2025010712");
        assertThat(Arrays.asList(args).subList(2, args.length)).containsExactly(
            String.valueOf(Duration.ofHours(49).toSeconds()),
            "2025010712:1:node:100", "1000", "2000",
            "2025010712:0:forward_rule:7", "5", "6");
    }

    @Test
    void shouldMapCommitResults() {
        CounterRecord observed = new CounterRecord(KEY, 10, 20, 0, 0);

        answerScripts(1L);
        assertThat(store.compareAndCommit(KEY, observed)).isEqualTo(CommitResult.SETTLED);
        assertThat(Arrays.asList(lastCall.get()).subList(2, 6))
            .containsExactly("2025010712:1:node:100", "10", "20", String.valueOf(Duration.ofHours(49).toSeconds()));

        answerScripts(2L);
        assertThat(store.compareAndCommit(KEY, observed)).isEqualTo(CommitResult.ADVANCED);

        answerScripts(0L);
        assertThat(store.compareAndCommit(KEY, observed)).isEqualTo(CommitResult.VANISHED);
    }

    @Test
    void shouldParseGetAndCleanupResult() {
        List<Object> reply = List.of(
            bytes("2025010712:1:node:100"), bytes("1500"), bytes("2300"), bytes("1000"), bytes("2000"),
            bytes("garbage"), bytes("1"), bytes("1"), bytes("0"), bytes("0"));
        doAnswer(invocation -> reply).when(redisTemplate).execute(any(RedisCallback.class));

        List<CounterRecord> records = store.getAndCleanup("2025010712");

        assertThat(records).containsExactly(new CounterRecord(KEY, 1500, 2300, 1000, 2000));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldWrapRedisFailuresAsHotTierUnavailable() {
        doThrow(new RedisConnectionFailureException("connection refused"))
            .when(redisTemplate).execute(any(RedisScript.class), anyList(), any(Object[].class));

        assertThatThrownBy(() -> store.increment(KEY, 1, 1))
            .isInstanceOf(TierUnavailableException.class)
            .satisfies(e -> assertThat(((TierUnavailableException) e).getTier())
                .isEqualTo(TierUnavailableException.Tier.HOT));
    }
}
