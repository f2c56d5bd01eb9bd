package com.bitanalytics.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
public class BitOpResponse {
    private String key;
    private long count;
    private boolean exists;
    private boolean kept;
    private Map<Long, Boolean> present;
}
