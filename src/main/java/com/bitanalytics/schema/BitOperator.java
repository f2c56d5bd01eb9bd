package com.bitanalytics.schema;

import org.springframework.data.redis.connection.RedisStringCommands;

/**
 * 位运算符：与 Redis BITOP 的 AND / OR / XOR 一一对应。
 */
public enum BitOperator {
    AND(RedisStringCommands.BitOperation.AND),
    OR(RedisStringCommands.BitOperation.OR),
    XOR(RedisStringCommands.BitOperation.XOR);

    private final RedisStringCommands.BitOperation redisOperation;

    BitOperator(RedisStringCommands.BitOperation redisOperation) {
        this.redisOperation = redisOperation;
    }

    public RedisStringCommands.BitOperation getRedisOperation() {
        return redisOperation;
    }
}
