package com.bitanalytics.store;

import com.bitanalytics.schema.BitOperator;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 基于 Redis 字符串位图的存储实现。
 * <p>
 * 位命令通过 {@link RedisCallback} 直接下发字节键；批量置位走管道，降低 RTT。
 * 单条命令的原子性由 Redis 保证，客户端不加锁、不重试。
 */
@Component
public class RedisBitmapStore implements BitmapStore {

    private final StringRedisTemplate redis;

    public RedisBitmapStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    /**
     * 管道批量 SETBIT：多个桶的置位合并到一次往返。
     */
    @Override
    public void setBits(List<String> keys, long offset) {
        if (keys.isEmpty()) {
            return;
        }
        redis.executePipelined((RedisCallback<Object>) connection -> {
            for (String key : keys) {
                connection.stringCommands().setBit(bytes(key), offset, true);
            }
            return null;
        });
    }

    @Override
    public boolean getBit(String key, long offset) {
        Boolean bit = redis.execute((RedisCallback<Boolean>) connection ->
                connection.stringCommands().getBit(bytes(key), offset));
        return Boolean.TRUE.equals(bit);
    }

    @Override
    public long bitCount(String key) {
        Long count = redis.execute((RedisCallback<Long>) connection ->
                connection.stringCommands().bitCount(bytes(key)));
        return count == null ? 0L : count;
    }

    @Override
    public long bitOp(BitOperator operator, String destKey, List<String> sourceKeys) {
        byte[][] sources = new byte[sourceKeys.size()][];
        for (int i = 0; i < sources.length; i++) {
            sources[i] = bytes(sourceKeys.get(i));
        }
        Long length = redis.execute((RedisCallback<Long>) connection ->
                connection.stringCommands().bitOp(operator.getRedisOperation(), bytes(destKey), sources));
        return length == null ? 0L : length;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0L;
        }
        Long deleted = redis.delete(keys);
        return deleted == null ? 0L : deleted;
    }

    /**
     * 说明：使用 KEYS 枚举（O(总键数)），生产环境键量大时建议改为 SCAN。
     */
    @Override
    public Set<String> keys(String pattern) {
        Set<String> keys = redis.keys(pattern);
        return keys == null ? Collections.emptySet() : keys;
    }

    private static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }
}
