package com.bitanalytics.api.dto;

import com.bitanalytics.schema.BitOperator;
import com.bitanalytics.schema.Granularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * 位运算运算数：事件桶（event + granularity + 时间分量），或嵌套运算（operator + operands）。
 */
@Data
public class OperandRequest {
    private String event;
    private Granularity granularity;
    private Integer year;   // 周粒度时为 ISO 周年
    private Integer month;
    private Integer week;
    private Integer day;
    private Integer hour;

    private BitOperator operator;
    @Valid
    @Size(max = 16)
    private List<OperandRequest> operands;

    public boolean isNested() {
        return operator != null;
    }
}
