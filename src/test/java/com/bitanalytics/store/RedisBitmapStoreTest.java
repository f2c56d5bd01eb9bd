package com.bitanalytics.store;

import com.bitanalytics.schema.BitOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStringCommands;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RedisBitmapStore")
class RedisBitmapStoreTest {

    private StringRedisTemplate redis;
    private RedisStringCommands stringCommands;
    private RedisBitmapStore store;

    private static byte[] b(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        stringCommands = mock(RedisStringCommands.class);
        RedisConnection connection = mock(RedisConnection.class);
        when(connection.stringCommands()).thenReturn(stringCommands);

        when(redis.execute(any(RedisCallback.class))).thenAnswer(inv ->
                ((RedisCallback<Object>) inv.getArgument(0)).doInRedis(connection));
        when(redis.executePipelined(any(RedisCallback.class))).thenAnswer(inv -> {
            ((RedisCallback<Object>) inv.getArgument(0)).doInRedis(connection);
            return List.of();
        });
        store = new RedisBitmapStore(redis);
    }

    @Test
    @DisplayName("setBits issues one SETBIT per key inside a single pipeline")
    void setBitsPipelined() {
        store.setBits(List.of("k1", "k2", "k3"), 42L);

        verify(redis).executePipelined(any(RedisCallback.class));
        verify(stringCommands).setBit(b("k1"), 42L, true);
        verify(stringCommands).setBit(b("k2"), 42L, true);
        verify(stringCommands).setBit(b("k3"), 42L, true);
    }

    @Test
    @DisplayName("setBits with no keys does not touch redis")
    void setBitsEmpty() {
        store.setBits(List.of(), 1L);
        verify(redis, never()).executePipelined(any(RedisCallback.class));
    }

    @Test
    @DisplayName("getBit maps null and false to false")
    void getBit() {
        when(stringCommands.getBit(b("k"), 7L)).thenReturn(true);
        when(stringCommands.getBit(b("k"), 8L)).thenReturn(null);

        assertThat(store.getBit("k", 7L)).isTrue();
        assertThat(store.getBit("k", 8L)).isFalse();
        assertThat(store.getBit("missing", 7L)).isFalse();
    }

    @Test
    @DisplayName("bitCount returns 0 when redis replies null")
    void bitCount() {
        when(stringCommands.bitCount(b("k"))).thenReturn(5L);

        assertThat(store.bitCount("k")).isEqualTo(5L);
        assertThat(store.bitCount("missing")).isZero();
    }

    @Test
    @DisplayName("bitOp forwards operator, destination and ordered sources")
    void bitOp() {
        when(stringCommands.bitOp(RedisStringCommands.BitOperation.XOR, b("dest"), b("a"), b("b"))).thenReturn(3L);

        long length = store.bitOp(BitOperator.XOR, "dest", List.of("a", "b"));

        assertThat(length).isEqualTo(3L);
        verify(stringCommands).bitOp(RedisStringCommands.BitOperation.XOR, b("dest"), b("a"), b("b"));
    }

    @Test
    @DisplayName("exists uses raw key existence")
    void exists() {
        when(redis.hasKey("k")).thenReturn(true);
        when(redis.hasKey("missing")).thenReturn(false);

        assertThat(store.exists("k")).isTrue();
        assertThat(store.exists("missing")).isFalse();
    }

    @Test
    @DisplayName("delete skips redis for an empty key set")
    void delete() {
        when(redis.delete(List.of("a", "b"))).thenReturn(2L);

        assertThat(store.delete(List.of("a", "b"))).isEqualTo(2L);
        assertThat(store.delete(Set.of())).isZero();
        verify(redis, never()).delete(Set.<String>of());
    }

    @Test
    @DisplayName("keys returns an empty set for a null reply")
    void keys() {
        when(redis.keys("bitanalytics_*")).thenReturn(Set.of("bitanalytics_a_2014-1"));
        when(redis.keys("none*")).thenReturn(null);

        assertThat(store.keys("bitanalytics_*")).containsExactly("bitanalytics_a_2014-1");
        assertThat(store.keys("none*")).isEmpty();
    }

    @Test
    @DisplayName("connection failures propagate unchanged")
    void connectionFailurePropagates() {
        RedisConnectionFailureException down = new RedisConnectionFailureException("down");
        when(redis.hasKey(anyString())).thenThrow(down);

        assertThatThrownBy(() -> store.exists("k")).isSameAs(down);
    }
}
