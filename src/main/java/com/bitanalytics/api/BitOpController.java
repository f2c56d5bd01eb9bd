package com.bitanalytics.api;

import com.bitanalytics.api.dto.BitOpRequest;
import com.bitanalytics.api.dto.BitOpResponse;
import com.bitanalytics.api.dto.DeleteResponse;
import com.bitanalytics.service.BitOpQueryService;
import com.bitanalytics.service.BitOperationEngine;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 位运算接口：AND / OR / XOR 组合桶（支持嵌套），以及临时键清理。
 */
@RestController
@RequestMapping("/api/v1/bitop")
public class BitOpController {

    private final BitOpQueryService queryService;
    private final BitOperationEngine engine;

    public BitOpController(BitOpQueryService queryService, BitOperationEngine engine) {
        this.queryService = queryService;
        this.engine = engine;
    }

    @PostMapping
    public ResponseEntity<BitOpResponse> evaluate(@Valid @RequestBody BitOpRequest req) {
        return ResponseEntity.ok(queryService.evaluate(req));
    }

    @DeleteMapping("/temporary")
    public ResponseEntity<DeleteResponse> deleteTemporary() {
        return ResponseEntity.ok(new DeleteResponse(engine.deleteTemporaryKeys()));
    }
}
