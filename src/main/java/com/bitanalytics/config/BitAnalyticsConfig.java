package com.bitanalytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * 位图分析模块配置：提供 UTC 时钟，并启用调度（临时键清理任务按需开启）。
 */
@Configuration
@EnableScheduling
public class BitAnalyticsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC(); // 所有桶按 UTC 划分
    }
}
