package io.doers.escrow.ledger;

import io.doers.escrow.audit.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only comparison of every user's visible balance against the sum of their
 * completed ledger rows. Drift is reported, never corrected here: corrections go
 * through the ledger like any other balance change.
 */
@Service
public class LedgerReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(LedgerReconciliationService.class);

    private final JdbcTemplate jdbc;
    private final AuditService auditService;
    private final Clock clock;

    public LedgerReconciliationService(JdbcTemplate jdbc, AuditService auditService, Clock clock) {
        this.jdbc = jdbc;
        this.auditService = auditService;
        this.clock = clock;
    }

    public Map<String, Object> reconcileBalances(String userId) {
        UUID reconciliationId = UUID.randomUUID();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("reconciliationId", reconciliationId.toString());
        report.put("generatedAt", clock.instant().toString());

        List<Map<String, Object>> drift = jdbc.queryForList("""
            SELECT u.user_id, u.balance, COALESCE(l.ledger_total, 0) AS ledger_total
            FROM user_accounts u
            LEFT JOIN (
                SELECT user_id,
                       SUM(CASE WHEN transaction_type IN ('payment', 'refund', 'bonus') THEN amount ELSE -amount END)
                           AS ledger_total
                FROM balance_transactions
                WHERE status = 'completed'
                GROUP BY user_id
            ) l ON l.user_id = u.user_id
            WHERE u.balance <> COALESCE(l.ledger_total, 0)
            ORDER BY u.user_id
            """);
        report.put("driftedAccounts", drift);

        List<Map<String, Object>> pendingList = jdbc.queryForList("""
            SELECT COUNT(1) AS pending_count, COALESCE(SUM(amount), 0) AS pending_amount
            FROM balance_transactions
            WHERE status = 'pending'
            """);
        Map<String, Object> pending = pendingList.isEmpty() ? new LinkedHashMap<>() : pendingList.get(0);
        report.put("pendingPayouts", pending);

        Integer accounts = jdbc.queryForObject("SELECT COUNT(1) FROM user_accounts", Integer.class);
        report.put("accountsChecked", accounts != null ? accounts : 0);

        if (!drift.isEmpty()) {
            for (Map<String, Object> row : drift) {
                log.warn("Balance drift detected: userId={} balance={} ledger={}",
                    row.get("user_id"), row.get("balance"), row.get("ledger_total"));
            }
        }
        log.info("Ledger reconciliation complete: reconciliationId={} accounts={} drifted={}",
            reconciliationId, report.get("accountsChecked"), drift.size());

        Map<String, Object> auditDetails = new HashMap<>();
        auditDetails.put("accountsChecked", report.get("accountsChecked"));
        auditDetails.put("drifted", drift.size());
        Object pendingAmount = pending.get("pending_amount");
        auditDetails.put("pendingAmount", pendingAmount instanceof BigDecimal
            ? ((BigDecimal) pendingAmount).toPlainString() : String.valueOf(pendingAmount));
        auditService.logReconciliation(reconciliationId, auditDetails, userId);
        return report;
    }
}
