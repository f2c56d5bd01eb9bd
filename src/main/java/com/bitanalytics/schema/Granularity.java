package com.bitanalytics.schema;

/**
 * 事件桶的时间粒度。
 * 每种粒度决定键后缀由哪些时间分量组成，以及各分量的取值范围。
 */
public enum Granularity {
    /** 年-月-日-时 */
    HOUR(4),
    /** 年-月-日 */
    DAY(3),
    /** ISO 周年-ISO 周序号，后缀带 W 前缀 */
    WEEK(2),
    /** 年-月 */
    MONTH(2);

    private final int partCount;

    Granularity(int partCount) {
        this.partCount = partCount;
    }

    /** 键后缀所需的时间分量个数 */
    public int getPartCount() {
        return partCount;
    }
}
