package io.doers.escrow.api;

import io.doers.escrow.ledger.LedgerReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Balance versus ledger reconciliation. Runs are audited.
 */
@RestController
@RequestMapping("/api/admin/reconciliation")
public class ReconciliationController {

    private final LedgerReconciliationService reconciliationService;

    public ReconciliationController(LedgerReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    /**
     * GET /api/admin/reconciliation/balances
     */
    @GetMapping("/balances")
    public ResponseEntity<Map<String, Object>> reconcileBalances(
            @RequestHeader(name = ApiResponses.USER_HEADER, required = false) String userHeader) {
        String userId = userHeader != null ? userHeader : "api-user";
        return ResponseEntity.ok(reconciliationService.reconcileBalances(userId));
    }
}
