package io.doers.escrow.api;

import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.dlq.DeadLetterQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for reviewing contracts the scheduled sweeps could not process.
 */
@RestController
@RequestMapping("/api/escrow/dlq")
public class DLQController {

    private static final Logger log = LoggerFactory.getLogger(DLQController.class);

    private final DeadLetterQueueService dlqService;
    private final EscrowProperties props;

    public DLQController(DeadLetterQueueService dlqService, EscrowProperties props) {
        this.dlqService = dlqService;
        this.props = props;
    }

    /**
     * GET /api/escrow/dlq?operation=auto-confirm
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> getUnresolvedEntries(
            @RequestParam(required = false) String operation) {
        return ResponseEntity.ok(dlqService.getUnresolvedEntries(operation));
    }

    /**
     * GET /api/escrow/dlq/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        int unresolvedCount = dlqService.getUnresolvedCount();
        return ResponseEntity.ok(Map.of(
            "unresolvedCount", unresolvedCount,
            "status", unresolvedCount > props.getDlqWarningThreshold() ? "WARNING" : "OK"
        ));
    }

    /**
     * POST /api/escrow/dlq/{dlqId}/resolve  {"resolvedBy": "...", "notes": "..."}
     */
    @PostMapping("/{dlqId}/resolve")
    public ResponseEntity<Map<String, Object>> resolveEntry(
            @PathVariable String dlqId,
            @RequestBody Map<String, String> request) {
        UUID id;
        try {
            id = UUID.fromString(dlqId);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid dlqId: {}", dlqId, e);
            return ResponseEntity.badRequest().build();
        }
        String resolvedBy = request.getOrDefault("resolvedBy", "system");
        String notes = request.getOrDefault("notes", "");

        if (!dlqService.markResolved(id, resolvedBy, notes)) {
            return ResponseEntity.status(409).body(Map.of(
                "dlqId", dlqId,
                "error", "entry not found or already resolved"
            ));
        }
        return ResponseEntity.ok(Map.of(
            "dlqId", dlqId,
            "status", "resolved"
        ));
    }
}
