package com.bitanalytics.schema;

import com.bitanalytics.exception.BusinessException;

import java.util.List;

/**
 * Redis Key 生成工具。
 *
 * <p>键格式（无零填充）：</p>
 * - 月：bitanalytics_{event}_{year}-{month}
 * - 周：bitanalytics_{event}_W{isoYear}-{isoWeek}
 * - 日：bitanalytics_{event}_{year}-{month}-{day}
 * - 时：bitanalytics_{event}_{year}-{month}-{day}-{hour}
 * - 位运算临时键：bitanalytics_bitop_{OP}_{key1}-{key2}-...
 */
public final class EventKeys {
    public static final String PREFIX = "bitanalytics_";
    public static final String RESERVED_EVENT_NAME = "bitop";
    public static final String BITOP_PREFIX = PREFIX + RESERVED_EVENT_NAME + "_";
    public static final char DELIMITER = '_';

    // 批量扫描用的通配模式
    public static final String ALL_KEYS_PATTERN = PREFIX + "*";
    public static final String BITOP_KEYS_PATTERN = BITOP_PREFIX + "*";

    private EventKeys() {}

    public static String monthKey(String eventName, int year, int month) {
        return buildKey(PREFIX, eventName, Granularity.MONTH, year, month);
    }

    public static String weekKey(String eventName, int isoYear, int isoWeek) {
        return buildKey(PREFIX, eventName, Granularity.WEEK, isoYear, isoWeek);
    }

    public static String dayKey(String eventName, int year, int month, int day) {
        return buildKey(PREFIX, eventName, Granularity.DAY, year, month, day);
    }

    public static String hourKey(String eventName, int year, int month, int day, int hour) {
        return buildKey(PREFIX, eventName, Granularity.HOUR, year, month, day, hour);
    }

    /**
     * 生成事件桶键。
     * @param prefix 键前缀
     * @param eventName 事件名，不能为空且不能包含分隔符 '_'
     * @param granularity 时间粒度
     * @param timeParts 与粒度对应的时间分量（年在前）
     * @return 桶键
     * @throws BusinessException 参数不合法（INVALID_ARGUMENT）
     */
    public static String buildKey(String prefix, String eventName, Granularity granularity, int... timeParts) {
        validateEventName(eventName);
        if (granularity == null) {
            throw BusinessException.invalidArgument("granularity is required");
        }
        if (timeParts == null || timeParts.length != granularity.getPartCount()) {
            throw BusinessException.invalidArgument(
                    "granularity " + granularity + " expects " + granularity.getPartCount() + " time parts");
        }
        validateTimeParts(granularity, timeParts);

        StringBuilder sb = new StringBuilder(prefix).append(eventName).append(DELIMITER);
        if (granularity == Granularity.WEEK) {
            sb.append('W'); // 周后缀与月后缀数值可能相同，以 W 区分
        }
        for (int i = 0; i < timeParts.length; i++) {
            if (i > 0) {
                sb.append('-');
            }
            sb.append(timeParts[i]);
        }
        return sb.toString();
    }

    /**
     * 位运算结果键：运算符 + 按传入顺序拼接的源键。
     * 顺序敏感：AND(A,B) 与 AND(B,A) 落在不同的键上。
     */
    public static String bitOpKey(BitOperator operator, List<String> sourceKeys) {
        return BITOP_PREFIX + operator.name() + DELIMITER + String.join("-", sourceKeys);
    }

    private static void validateEventName(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            throw BusinessException.invalidArgument("event name must not be empty");
        }
        if (eventName.indexOf(DELIMITER) >= 0) {
            throw BusinessException.invalidArgument("event name must not contain '" + DELIMITER + "': " + eventName);
        }
        // 事件名不含 '_'，只有恰为 bitop 时事件桶才会落入临时键前缀
        if (RESERVED_EVENT_NAME.equals(eventName)) {
            throw BusinessException.invalidArgument("event name '" + RESERVED_EVENT_NAME + "' is reserved");
        }
    }

    private static void validateTimeParts(Granularity granularity, int[] parts) {
        checkRange("year", parts[0], 0, 9999);
        switch (granularity) {
            case WEEK -> checkRange("week", parts[1], 1, 53);
            case MONTH -> checkRange("month", parts[1], 1, 12);
            case DAY -> {
                checkRange("month", parts[1], 1, 12);
                checkRange("day", parts[2], 1, 31);
            }
            case HOUR -> {
                checkRange("month", parts[1], 1, 12);
                checkRange("day", parts[2], 1, 31);
                checkRange("hour", parts[3], 0, 23);
            }
        }
    }

    private static void checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw BusinessException.invalidArgument(name + " out of range [" + min + ", " + max + "]: " + value);
        }
    }
}
