package com.bitanalytics.service;

import com.bitanalytics.bucket.EventBucket;

import java.time.Instant;
import java.util.List;

public interface EventRecorder {
    /**
     * 以当前 UTC 时间标记事件，小时桶是否标记取配置 bitanalytics.track-hourly。
     * @return 本次置位的桶键
     */
    List<String> markEvent(String eventName, long identifier);

    List<String> markEvent(String eventName, long identifier, Instant timestamp);

    /**
     * 标记事件：在月、ISO 周、日（可选小时）桶上一次管道置位。
     * 非原子：并发读者可能先看到部分桶生效；中途失败不回滚。
     * @param eventName 事件名，如 active、tasks:completed
     * @param identifier 标识（位偏移）
     * @param timestamp 参考时间，按 UTC 解析
     * @param includeHourly 是否标记小时桶
     * @return 本次置位的桶键（月、周、日、时）
     */
    List<String> markEvent(String eventName, long identifier, Instant timestamp, boolean includeHourly);

    EventBucket monthEvents(String eventName, int year, int month);

    EventBucket weekEvents(String eventName, int isoYear, int isoWeek);

    EventBucket dayEvents(String eventName, int year, int month, int day);

    EventBucket hourEvents(String eventName, int year, int month, int day, int hour);

    /**
     * 删除所有 bitanalytics_ 前缀的键（含位运算临时键）。
     * @return 删除的键数量
     */
    long deleteAllEvents();
}
