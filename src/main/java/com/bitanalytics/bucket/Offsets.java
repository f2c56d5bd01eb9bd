package com.bitanalytics.bucket;

import com.bitanalytics.exception.BusinessException;

/**
 * 位偏移校验：标识直接作为位偏移，Redis 按最高偏移分配内存，需限制上界。
 */
public final class Offsets {

    private Offsets() {}

    public static long check(long identifier, long maxOffset) {
        if (identifier < 0 || identifier > maxOffset) {
            throw BusinessException.invalidArgument(
                    "identifier out of range [0, " + maxOffset + "]: " + identifier);
        }
        return identifier;
    }
}
