package com.bitanalytics.bucket;

import com.bitanalytics.schema.BitOperator;
import com.bitanalytics.store.BitmapStore;

import java.util.List;
import java.util.Objects;

/**
 * 位运算结果桶：只读，可删除，可作为下一次位运算的运算数。
 * 键落在 bitanalytics_bitop_ 前缀下，由调用方 delete() 或批量清理回收。
 */
public final class DerivedBucket implements Bucket {

    private final BitmapStore store;
    private final String key;
    private final BitOperator operator;
    private final List<String> sourceKeys;
    private final long maxOffset;

    public DerivedBucket(BitmapStore store, String key, BitOperator operator, List<String> sourceKeys, long maxOffset) {
        this.store = Objects.requireNonNull(store, "store");
        this.key = Objects.requireNonNull(key, "key");
        this.operator = operator;
        this.sourceKeys = List.copyOf(sourceKeys);
        this.maxOffset = maxOffset;
    }

    @Override
    public boolean isPresent(long identifier) {
        return store.getBit(key, Offsets.check(identifier, maxOffset));
    }

    @Override
    public long count() {
        return store.bitCount(key);
    }

    @Override
    public boolean exists() {
        return store.exists(key);
    }

    @Override
    public void delete() {
        store.delete(List.of(key));
    }

    @Override
    public String getKey() {
        return key;
    }

    public BitOperator getOperator() {
        return operator;
    }

    public List<String> getSourceKeys() {
        return sourceKeys;
    }

    @Override
    public String toString() {
        return "DerivedBucket[" + key + "]";
    }
}
