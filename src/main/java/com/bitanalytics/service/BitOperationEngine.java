package com.bitanalytics.service;

import com.bitanalytics.bucket.Bucket;
import com.bitanalytics.bucket.DerivedBucket;
import com.bitanalytics.schema.BitOperator;

import java.util.List;

public interface BitOperationEngine {
    /**
     * 立即执行 BITOP 并返回结果桶。
     * 结果键按运算符与源键顺序生成，可嵌套使用。
     * @param operator AND / OR / XOR
     * @param sources 源桶，至少一个
     */
    DerivedBucket combine(BitOperator operator, List<? extends Bucket> sources);

    DerivedBucket and(Bucket first, Bucket... rest);

    DerivedBucket or(Bucket first, Bucket... rest);

    DerivedBucket xor(Bucket first, Bucket... rest);

    /**
     * 删除所有位运算临时键（bitanalytics_bitop_*）。
     * @return 删除的键数量
     */
    long deleteTemporaryKeys();
}
