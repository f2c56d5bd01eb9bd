package com.bitanalytics.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 位运算临时键定时清理，默认关闭（bitanalytics.cleanup.enabled=true 开启）。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "bitanalytics.cleanup", name = "enabled", havingValue = "true")
public class TemporaryKeyCleanupJob {

    private final BitOperationEngine engine;

    public TemporaryKeyCleanupJob(BitOperationEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${bitanalytics.cleanup.interval-ms:3600000}")
    public void cleanup() {
        try {
            long deleted = engine.deleteTemporaryKeys();
            log.info("Scheduled bitop cleanup removed {} keys", deleted);
        } catch (Exception e) {
            // 下一轮重试
            log.warn("Scheduled bitop cleanup failed: {}", e.getMessage());
        }
    }
}
