package com.bitanalytics.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class MarkEventResponse {
    private String event;
    private long identifier;
    private List<String> keys;
}
