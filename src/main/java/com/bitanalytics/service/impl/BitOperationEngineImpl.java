package com.bitanalytics.service.impl;

import com.bitanalytics.bucket.Bucket;
import com.bitanalytics.bucket.BucketFactory;
import com.bitanalytics.bucket.DerivedBucket;
import com.bitanalytics.exception.BusinessException;
import com.bitanalytics.schema.BitOperator;
import com.bitanalytics.schema.EventKeys;
import com.bitanalytics.service.BitOperationEngine;
import com.bitanalytics.store.BitmapStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * 位运算引擎实现（BITOP AND / OR / XOR）。
 *
 * <p>每次运算立即落盘到 bitanalytics_bitop_ 临时键，结果桶与事件桶同一契约，可继续嵌套。
 * 跨命令无原子性：嵌套运算之间源桶可能被并发写入。</p>
 */
@Slf4j
@Service
public class BitOperationEngineImpl implements BitOperationEngine {

    private final BitmapStore store;
    private final BucketFactory buckets;

    public BitOperationEngineImpl(BitmapStore store, BucketFactory buckets) {
        this.store = store;
        this.buckets = buckets;
    }

    @Override
    public DerivedBucket combine(BitOperator operator, List<? extends Bucket> sources) {
        if (operator == null) {
            throw BusinessException.invalidArgument("operator is required");
        }
        if (sources == null || sources.isEmpty()) {
            throw BusinessException.invalidArgument("at least one source bucket is required");
        }
        List<String> sourceKeys = new ArrayList<>(sources.size());
        for (Bucket source : sources) {
            if (source == null) {
                throw BusinessException.invalidArgument("source bucket must not be null");
            }
            sourceKeys.add(source.getKey());
        }

        String destKey = EventKeys.bitOpKey(operator, sourceKeys);
        store.bitOp(operator, destKey, sourceKeys);
        log.debug("BITOP {} into {} from {}", operator, destKey, sourceKeys);
        return buckets.derived(operator, destKey, sourceKeys);
    }

    @Override
    public DerivedBucket and(Bucket first, Bucket... rest) {
        return combine(BitOperator.AND, operands(first, rest));
    }

    @Override
    public DerivedBucket or(Bucket first, Bucket... rest) {
        return combine(BitOperator.OR, operands(first, rest));
    }

    @Override
    public DerivedBucket xor(Bucket first, Bucket... rest) {
        return combine(BitOperator.XOR, operands(first, rest));
    }

    @Override
    public long deleteTemporaryKeys() {
        Set<String> keys = store.keys(EventKeys.BITOP_KEYS_PATTERN);
        long deleted = store.delete(keys);
        log.info("Deleted temporary bitop keys: {}", deleted);
        return deleted;
    }

    private static List<Bucket> operands(Bucket first, Bucket... rest) {
        List<Bucket> list = new ArrayList<>(1 + (rest == null ? 0 : rest.length));
        list.add(first);
        if (rest != null) {
            list.addAll(Arrays.asList(rest));
        }
        return list;
    }
}
