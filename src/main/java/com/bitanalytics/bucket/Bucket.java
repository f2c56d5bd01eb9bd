package com.bitanalytics.bucket;

/**
 * 位图桶的统一读取契约：事件桶与位运算结果桶都实现它，位运算结果可继续作为运算数。
 */
public interface Bucket {

    /** 底层 Redis 键 */
    String getKey();

    /**
     * 标识是否已标记（GETBIT）。
     * 键不存在或位未置位均返回 false。
     */
    boolean isPresent(long identifier);

    /** 已标记的标识数（BITCOUNT），键不存在时为 0 */
    long count();

    /**
     * 键是否存在。
     * 注意：与 count() > 0 不等价，全零的位运算结果也返回 true。
     */
    boolean exists();

    /** 删除底层键，不存在时无操作 */
    void delete();
}
