package com.bitanalytics.bucket;

import com.bitanalytics.config.BitAnalyticsProperties;
import com.bitanalytics.schema.BitOperator;
import com.bitanalytics.schema.EventKeys;
import com.bitanalytics.schema.Granularity;
import com.bitanalytics.store.BitmapStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 桶工厂：一次性注入存储与键，构造完整可用的桶。
 */
@Component
public class BucketFactory {

    private final BitmapStore store;
    private final long maxOffset;

    public BucketFactory(BitmapStore store, BitAnalyticsProperties properties) {
        this.store = store;
        this.maxOffset = properties.getMaxOffset();
    }

    public EventBucket month(String eventName, int year, int month) {
        return new EventBucket(store, EventKeys.monthKey(eventName, year, month), eventName, Granularity.MONTH, maxOffset);
    }

    public EventBucket week(String eventName, int isoYear, int isoWeek) {
        return new EventBucket(store, EventKeys.weekKey(eventName, isoYear, isoWeek), eventName, Granularity.WEEK, maxOffset);
    }

    public EventBucket day(String eventName, int year, int month, int day) {
        return new EventBucket(store, EventKeys.dayKey(eventName, year, month, day), eventName, Granularity.DAY, maxOffset);
    }

    public EventBucket hour(String eventName, int year, int month, int day, int hour) {
        return new EventBucket(store, EventKeys.hourKey(eventName, year, month, day, hour), eventName, Granularity.HOUR, maxOffset);
    }

    public DerivedBucket derived(BitOperator operator, String destKey, List<String> sourceKeys) {
        return new DerivedBucket(store, destKey, operator, sourceKeys, maxOffset);
    }

    public long getMaxOffset() {
        return maxOffset;
    }
}
