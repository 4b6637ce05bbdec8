package com.callstt.processing;

import com.callstt.processing.adapter.RedisQueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisQueueStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    private RedisQueueStore store;

    @BeforeEach
    void setUp() {
        store = new RedisQueueStore(redisTemplate);
    }

    @Test
    void rightPushUnlessMemberRunsCheckAndPushAsOneScript() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("stt:jobs", "stt:jobs:processed")),
                eq("C1|u|stub"), eq("{payload}")))
                .thenReturn(1L);

        boolean pushed = store.rightPushUnlessMember("stt:jobs", "stt:jobs:processed", "C1|u|stub", "{payload}");

        assertThat(pushed).isTrue();
    }

    @Test
    void rightPushUnlessMemberReportsSkippedPush() {
        when(redisTemplate.execute(any(RedisScript.class), any(List.class), eq("C1|u|stub"), eq("{payload}")))
                .thenReturn(0L);

        assertThat(store.rightPushUnlessMember("stt:jobs", "stt:jobs:processed", "C1|u|stub", "{payload}")).isFalse();
    }

    @Test
    void pushUnlessMemberScriptChecksProcessedSetBeforePush() {
        ArgumentCaptor<RedisScript<Long>> script = ArgumentCaptor.forClass(RedisScript.class);
        when(redisTemplate.execute(script.capture(), any(List.class), eq("m"), eq("v"))).thenReturn(1L);

        store.rightPushUnlessMember("q", "s", "m", "v");

        assertThat(script.getValue().getScriptAsString()).contains("SISMEMBER").contains("RPUSH");
        assertThat(script.getValue().getResultType()).isEqualTo(Long.class);
    }

    @Test
    void blockingLeftPopDelegatesTimeoutToBlpop() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.leftPop("stt:jobs", Duration.ofSeconds(5))).thenReturn("{job}");

        assertThat(store.blockingLeftPop("stt:jobs", Duration.ofSeconds(5))).contains("{job}");
    }

    @Test
    void leftPopReturnsEmptyForEmptyList() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.leftPop("stt:jobs")).thenReturn(null);

        assertThat(store.leftPop("stt:jobs")).isEmpty();
    }

    @Test
    void rangeReadsWholeList() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.range("stt:jobs:dlq", 0, -1)).thenReturn(List.of("a", "b"));

        assertThat(store.range("stt:jobs:dlq")).containsExactly("a", "b");
    }

    @Test
    void setOperationsUseProcessedKey() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.isMember("stt:jobs:processed", "k")).thenReturn(true);

        store.addMember("stt:jobs:processed", "k");

        assertThat(store.isMember("stt:jobs:processed", "k")).isTrue();
        verify(setOperations).add("stt:jobs:processed", "k");
    }

    @Test
    void moveBackPassesAllThreeKeysToReplayScript() {
        ArgumentCaptor<RedisScript<Long>> script = ArgumentCaptor.forClass(RedisScript.class);
        when(redisTemplate.execute(script.capture(),
                eq(List.of("stt:jobs:dlq", "stt:jobs:processed", "stt:jobs")),
                eq("{entry}"), eq("C1|u|stub"), eq("{job}")))
                .thenReturn(1L);

        boolean moved = store.moveBack("stt:jobs:dlq", "{entry}", "stt:jobs:processed", "C1|u|stub",
                "stt:jobs", "{job}");

        assertThat(moved).isTrue();
        assertThat(script.getValue().getScriptAsString()).contains("LREM").contains("SREM").contains("RPUSH");
    }

    @Test
    void moveBackReportsLostRace() {
        when(redisTemplate.execute(any(RedisScript.class), any(List.class), eq("{entry}"), eq("k"), eq("{job}")))
                .thenReturn(0L);

        assertThat(store.moveBack("dlq", "{entry}", "set", "k", "queue", "{job}")).isFalse();
    }
}
