package com.bitanalytics.service;

import com.bitanalytics.api.dto.BitOpRequest;
import com.bitanalytics.api.dto.BitOpResponse;

public interface BitOpQueryService {
    /**
     * 解析（可嵌套的）运算数并执行位运算，返回计数与标识判定结果。
     * 中间结果键在返回前删除；最终结果键按 keep 决定是否保留。
     */
    BitOpResponse evaluate(BitOpRequest request);
}
