package com.eventledger.ledger.api;

import com.eventledger.core.replay.AggregateRebuilder;
import com.eventledger.core.replay.RebuildReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/admin/rebuild/{aggregateType}
 * Recomputes every stored aggregate of the type from its live events.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/rebuild")
public class RebuildController {

    private final AggregateRebuilder rebuilder;
    private final int defaultChunkSize;

    public RebuildController(AggregateRebuilder rebuilder,
                             @Value("${eventledger.rebuild.chunk-size:500}") int defaultChunkSize) {
        this.rebuilder = rebuilder;
        this.defaultChunkSize = defaultChunkSize;
    }

    @PostMapping("/{aggregateType}")
    public ResponseEntity<RebuildReport> rebuild(@PathVariable String aggregateType,
                                                 @RequestParam(required = false) Integer chunkSize) {
        int size = chunkSize != null ? chunkSize : defaultChunkSize;
        log.info("Rebuild requested: aggregateType={}, chunkSize={}", aggregateType, size);
        return ResponseEntity.ok(rebuilder.rebuild(aggregateType, size));
    }
}
