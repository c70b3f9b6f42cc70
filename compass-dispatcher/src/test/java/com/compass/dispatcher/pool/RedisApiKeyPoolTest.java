package com.compass.dispatcher.pool;

import com.compass.common.exception.KeyPoolExhaustedException;
import com.compass.dispatcher.config.DispatcherProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisApiKeyPoolTest {

    private static final String POOL = "compass:ai:key:pool";
    private static final String FAILED = "compass:ai:key:failed";

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ListOperations<String, String> listOps;
    @Mock
    private ZSetOperations<String, String> zSetOps;

    private RedisApiKeyPool pool;

    @BeforeEach
    void setUp() {
        pool = new RedisApiKeyPool(redisTemplate, new DispatcherProperties());
    }

    @Test
    void borrowThrowsWhenPopTimesOut() {
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(listOps.leftPop(eq(POOL), any(Duration.class))).thenReturn(null);

        assertThatThrownBy(() -> pool.borrowKey()).isInstanceOf(KeyPoolExhaustedException.class);
    }

    @Test
    void addKeySkipsKeysAlreadyInEitherQueue() {
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(listOps.indexOf(POOL, "sk-known-00000001")).thenReturn(null);
        when(zSetOps.score(FAILED, "sk-known-00000001")).thenReturn(1.0);

        assertThat(pool.addKey("sk-known-00000001")).isFalse();
        verify(listOps, never()).rightPush(anyString(), anyString());
    }

    @Test
    void markFailedRecordsTimestampInSortedSet() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);

        pool.markFailed("sk-flaky-00000001");

        verify(zSetOps).add(eq(FAILED), eq("sk-flaky-00000001"), anyDouble());
    }

    @Test
    void recoveryOnlyPushesBackKeysThisInstanceRemoved() {
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(zSetOps.rangeByScore(eq(FAILED), eq(0.0), anyDouble()))
                .thenReturn(new LinkedHashSet<>(List.of("sk-mine-000000001", "sk-theirs-0000002")));
        when(zSetOps.remove(FAILED, "sk-mine-000000001")).thenReturn(1L);
        when(zSetOps.remove(FAILED, "sk-theirs-0000002")).thenReturn(0L);

        int recovered = pool.recoverFailedKeys();

        assertThat(recovered).isEqualTo(1);
        verify(listOps).rightPush(POOL, "sk-mine-000000001");
        verify(listOps, never()).rightPush(POOL, "sk-theirs-0000002");
    }
}
