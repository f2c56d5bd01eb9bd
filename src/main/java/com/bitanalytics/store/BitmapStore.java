package com.bitanalytics.store;

import com.bitanalytics.schema.BitOperator;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 位图存储抽象：提供按位读写、计数、位运算与键管理能力。
 * <p>
 * 所有方法同步阻塞；存储不可达时直接抛出 {@link org.springframework.dao.DataAccessException}，不做重试。
 * 不存在的键按全零位图处理。
 */
public interface BitmapStore {

    /**
     * 在多个键的同一偏移处置位（SETBIT key offset 1），一次往返批量发送。
     * 非事务：各键独立生效，中途失败不回滚。
     *
     * @param keys   位图键列表。
     * @param offset 位偏移。
     */
    void setBits(List<String> keys, long offset);

    /**
     * 读取位（GETBIT）。
     *
     * @return 位为 1 返回 true；键不存在或位为 0 返回 false。
     */
    boolean getBit(String key, long offset);

    /**
     * 统计位图中 1 的个数（BITCOUNT），键不存在时为 0。
     */
    long bitCount(String key);

    /**
     * 位运算（BITOP op destKey srcKeys...），立即执行并写入目标键。
     *
     * @return 目标键的字节长度。
     */
    long bitOp(BitOperator operator, String destKey, List<String> sourceKeys);

    /**
     * 键是否存在（原始存在性，不关心位内容）。
     */
    boolean exists(String key);

    /**
     * 删除键，不存在的键忽略。
     *
     * @return 实际删除的键数量。
     */
    long delete(Collection<String> keys);

    /**
     * 按通配模式列出键。
     */
    Set<String> keys(String pattern);
}
