package com.bitanalytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "bitanalytics")
@Data
public class BitAnalyticsProperties {
    /** 未显式指定时是否同时标记小时桶（小时桶数量大，默认关闭） */
    private boolean trackHourly = false;
    /** 标识（位偏移）上限，Redis 单个字符串最大 512MB 即 2^32 位 */
    private long maxOffset = 4_294_967_295L;
    private Cleanup cleanup = new Cleanup();

    @Data
    public static class Cleanup {
        private boolean enabled = false;
        private long intervalMs = 3_600_000L;
    }
}
