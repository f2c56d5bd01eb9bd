package com.bitanalytics.api.dto;

import com.bitanalytics.schema.BitOperator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * 位运算请求体。
 */
@Data
public class BitOpRequest {
    @NotNull
    private BitOperator operator;
    @NotEmpty
    @Valid
    @Size(max = 16)
    private List<OperandRequest> operands;
    private List<Long> identifiers; // 需要判定是否在结果中的标识
    private boolean keep;           // 是否保留结果键（嵌套中间键总是删除）
}
