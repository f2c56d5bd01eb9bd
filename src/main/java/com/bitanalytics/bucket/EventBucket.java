package com.bitanalytics.bucket;

import com.bitanalytics.schema.Granularity;
import com.bitanalytics.store.BitmapStore;

import java.util.List;
import java.util.Objects;

/**
 * 事件桶：绑定单个 (事件, 粒度, 时间) 键的位图句柄。
 * 位只会经 markPresent 从 0 变为 1，除整桶删除外不清零。
 */
public final class EventBucket implements Bucket {

    private final BitmapStore store;
    private final String key;
    private final String eventName;
    private final Granularity granularity;
    private final long maxOffset;

    public EventBucket(BitmapStore store, String key, String eventName, Granularity granularity, long maxOffset) {
        this.store = Objects.requireNonNull(store, "store");
        this.key = Objects.requireNonNull(key, "key");
        this.eventName = eventName;
        this.granularity = granularity;
        this.maxOffset = maxOffset;
    }

    /**
     * 标记标识出现（SETBIT key id 1），幂等，立即持久化。
     */
    public void markPresent(long identifier) {
        store.setBits(List.of(key), Offsets.check(identifier, maxOffset));
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

    public String getEventName() {
        return eventName;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    @Override
    public String toString() {
        return "EventBucket[" + key + "]";
    }
}
