package com.bitanalytics.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 桶查询响应体：键、计数、是否存在，以及（传入标识时）该标识是否已标记。
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BucketResponse {
    private String key;
    private long count;
    private boolean exists;
    private Boolean present;
}
