package com.bitanalytics.service.impl;

import com.bitanalytics.bucket.BucketFactory;
import com.bitanalytics.bucket.EventBucket;
import com.bitanalytics.bucket.Offsets;
import com.bitanalytics.config.BitAnalyticsProperties;
import com.bitanalytics.exception.BusinessException;
import com.bitanalytics.schema.EventKeys;
import com.bitanalytics.service.EventRecorder;
import com.bitanalytics.store.BitmapStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 事件标记服务实现。
 *
 * <p>职责：</p>
 * - 将一次事件映射到月 / ISO 周 / 日（可选小时）四类桶；
 * - 管道批量 SETBIT，一次往返完成多桶置位；
 * - 提供按粒度的桶查询与全量删除。
 */
@Slf4j
@Service
public class EventRecorderImpl implements EventRecorder {

    private final BitmapStore store;
    private final BucketFactory buckets;
    private final BitAnalyticsProperties properties;
    private final Clock clock;

    public EventRecorderImpl(BitmapStore store, BucketFactory buckets, BitAnalyticsProperties properties, Clock clock) {
        this.store = store;
        this.buckets = buckets;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<String> markEvent(String eventName, long identifier) {
        return markEvent(eventName, identifier, clock.instant(), properties.isTrackHourly());
    }

    @Override
    public List<String> markEvent(String eventName, long identifier, Instant timestamp) {
        return markEvent(eventName, identifier, timestamp, properties.isTrackHourly());
    }

    @Override
    public List<String> markEvent(String eventName, long identifier, Instant timestamp, boolean includeHourly) {
        if (timestamp == null) {
            throw BusinessException.invalidArgument("timestamp is required");
        }
        Offsets.check(identifier, buckets.getMaxOffset());

        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        int year = utc.getYear();
        int month = utc.getMonthValue();
        int day = utc.getDayOfMonth();
        // 周桶使用 ISO 周年而非日历年，跨年周（如 12-29 属于次年第 1 周）归属正确
        int isoYear = utc.get(IsoFields.WEEK_BASED_YEAR);
        int isoWeek = utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);

        List<String> keys = new ArrayList<>(4);
        keys.add(EventKeys.monthKey(eventName, year, month));
        keys.add(EventKeys.weekKey(eventName, isoYear, isoWeek));
        keys.add(EventKeys.dayKey(eventName, year, month, day));
        if (includeHourly) {
            keys.add(EventKeys.hourKey(eventName, year, month, day, utc.getHour()));
        }

        store.setBits(keys, identifier);
        log.debug("Marked event={} identifier={} keys={}", eventName, identifier, keys);
        return keys;
    }

    @Override
    public EventBucket monthEvents(String eventName, int year, int month) {
        return buckets.month(eventName, year, month);
    }

    @Override
    public EventBucket weekEvents(String eventName, int isoYear, int isoWeek) {
        return buckets.week(eventName, isoYear, isoWeek);
    }

    @Override
    public EventBucket dayEvents(String eventName, int year, int month, int day) {
        return buckets.day(eventName, year, month, day);
    }

    @Override
    public EventBucket hourEvents(String eventName, int year, int month, int day, int hour) {
        return buckets.hour(eventName, year, month, day, hour);
    }

    @Override
    public long deleteAllEvents() {
        Set<String> keys = store.keys(EventKeys.ALL_KEYS_PATTERN);
        long deleted = store.delete(keys);
        log.info("Deleted all event keys: {}", deleted);
        return deleted;
    }
}
