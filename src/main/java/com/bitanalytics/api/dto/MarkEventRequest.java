package com.bitanalytics.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

/**
 * 事件标记请求体。
 */
@Data
public class MarkEventRequest {
    @NotBlank
    private String event;       // 如: active、tasks:completed
    @NotNull
    @Min(0)
    private Long identifier;    // 用户ID，即位偏移
    private Instant timestamp;  // 为空取当前 UTC 时间
    private Boolean trackHourly; // 为空取配置默认值
}
