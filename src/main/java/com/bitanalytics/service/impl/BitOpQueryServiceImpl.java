package com.bitanalytics.service.impl;

import com.bitanalytics.api.dto.BitOpRequest;
import com.bitanalytics.api.dto.BitOpResponse;
import com.bitanalytics.api.dto.OperandRequest;
import com.bitanalytics.bucket.Bucket;
import com.bitanalytics.bucket.DerivedBucket;
import com.bitanalytics.exception.BusinessException;
import com.bitanalytics.schema.BitOperator;
import com.bitanalytics.schema.EventKeys;
import com.bitanalytics.service.BitOpQueryService;
import com.bitanalytics.service.BitOperationEngine;
import com.bitanalytics.service.EventRecorder;
import com.bitanalytics.store.BitmapStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 位运算查询服务实现：把请求体中的运算树解析为桶，再交给位运算引擎执行。
 *
 * <p>临时键由运算符与源键确定，不同请求会共用同一键；只回收本次请求新建的键，
 * 已存在的键（他人 keep 的结果或并发请求正在读取的结果）保持不动。</p>
 */
@Service
public class BitOpQueryServiceImpl implements BitOpQueryService {

    /** 单层运算数上限 */
    public static final int MAX_OPERANDS = 16;
    /** 运算树最大深度（顶层为 1）；结果键内嵌源键，深度过大会产生超长键 */
    public static final int MAX_DEPTH = 4;

    private final EventRecorder recorder;
    private final BitOperationEngine engine;
    private final BitmapStore store;

    public BitOpQueryServiceImpl(EventRecorder recorder, BitOperationEngine engine, BitmapStore store) {
        this.recorder = recorder;
        this.engine = engine;
        this.store = store;
    }

    @Override
    public BitOpResponse evaluate(BitOpRequest request) {
        Set<String> created = new LinkedHashSet<>();
        DerivedBucket result = null;
        try {
            List<Bucket> sources = resolveAll(request.getOperands(), 1, created);
            result = combine(request.getOperator(), sources, created);

            Map<Long, Boolean> present = new LinkedHashMap<>();
            if (request.getIdentifiers() != null) {
                for (Long id : request.getIdentifiers()) {
                    if (id == null) {
                        throw BusinessException.invalidArgument("identifier must not be null");
                    }
                    present.put(id, result.isPresent(id));
                }
            }
            return new BitOpResponse(result.getKey(), result.count(), result.exists(), request.isKeep(), present);
        } finally {
            if (result != null && request.isKeep()) {
                created.remove(result.getKey());
            }
            store.delete(created);
        }
    }

    /**
     * 执行一次位运算，并在目标键此前不存在时登记为本次请求创建。
     */
    private DerivedBucket combine(BitOperator operator, List<Bucket> sources, Set<String> created) {
        if (operator == null) {
            throw BusinessException.invalidArgument("operator is required");
        }
        List<String> sourceKeys = new ArrayList<>(sources.size());
        for (Bucket source : sources) {
            sourceKeys.add(source.getKey());
        }
        boolean existed = store.exists(EventKeys.bitOpKey(operator, sourceKeys));
        DerivedBucket derived = engine.combine(operator, sources);
        if (!existed) {
            created.add(derived.getKey());
        }
        return derived;
    }

    private List<Bucket> resolveAll(List<OperandRequest> operands, int depth, Set<String> created) {
        if (operands == null || operands.isEmpty()) {
            throw BusinessException.invalidArgument("at least one operand is required");
        }
        if (operands.size() > MAX_OPERANDS) {
            throw BusinessException.invalidArgument("at most " + MAX_OPERANDS + " operands per operation");
        }
        if (depth > MAX_DEPTH) {
            throw BusinessException.invalidArgument("operations nest at most " + MAX_DEPTH + " levels deep");
        }
        List<Bucket> buckets = new ArrayList<>(operands.size());
        for (OperandRequest operand : operands) {
            if (operand == null) {
                throw BusinessException.invalidArgument("operand must not be null");
            }
            buckets.add(resolve(operand, depth, created));
        }
        return buckets;
    }

    private Bucket resolve(OperandRequest operand, int depth, Set<String> created) {
        if (operand.isNested()) {
            return combine(operand.getOperator(), resolveAll(operand.getOperands(), depth + 1, created), created);
        }
        if (operand.getGranularity() == null) {
            throw BusinessException.invalidArgument("operand needs either operator or granularity");
        }
        String event = operand.getEvent();
        int year = required("year", operand.getYear());
        return switch (operand.getGranularity()) {
            case MONTH -> recorder.monthEvents(event, year, required("month", operand.getMonth()));
            case WEEK -> recorder.weekEvents(event, year, required("week", operand.getWeek()));
            case DAY -> recorder.dayEvents(event, year,
                    required("month", operand.getMonth()),
                    required("day", operand.getDay()));
            case HOUR -> recorder.hourEvents(event, year,
                    required("month", operand.getMonth()),
                    required("day", operand.getDay()),
                    required("hour", operand.getHour()));
        };
    }

    private static int required(String name, Integer value) {
        if (value == null) {
            throw BusinessException.invalidArgument(name + " is required");
        }
        return value;
    }
}
