package io.doers.escrow.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail for every money-moving operation.
 *
 * Event Types:
 * - CONTRACT: lifecycle transitions
 * - PAYMENT: capture, release and refund
 * - BALANCE: ledger confirmations and reversals
 * - SCHEDULER: sweep runs
 * - DLQ: dead letter queue operations
 * - RECONCILIATION: ledger reconciliation runs
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(JdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Log an audit event.
     * Non-blocking: failures are logged but don't throw exceptions.
     */
    public void logEvent(String eventType, String entityType, UUID entityId,
                         String action, String userId, Map<String, Object> details) {
        try {
            jdbc.update("""
                INSERT INTO escrow_audit_log
                (event_type, entity_type, entity_id, action, user_id, details, created_on)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                eventType,
                entityType,
                entityId,
                action,
                userId,
                serializeDetails(details),
                Timestamp.from(clock.instant())
            );
        } catch (DataAccessException e) {
            log.warn("Failed to log audit event (non-blocking): eventType={} entityId={} error={}",
                eventType, entityId, e.getMessage());
            log.debug("Audit logging failure details", e);
        }
    }

    private String serializeDetails(Map<String, Object> details) {
        if (details == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (Exception e) {
            log.warn("Failed to serialize audit details to JSON", e);
            return null;
        }
    }

    // ========================================================================
    // Convenience methods
    // ========================================================================

    public void logContractTransition(UUID contractId, String fromStatus, String toStatus, String actor) {
        Map<String, Object> details = new HashMap<>();
        details.put("from", fromStatus);
        details.put("to", toStatus);
        logEvent("CONTRACT", "CONTRACT", contractId, "TRANSITION", actor, details);
    }

    public void logAutoConfirmed(UUID contractId, BigDecimal payoutAmount) {
        Map<String, Object> details = new HashMap<>();
        details.put("payoutAmount", payoutAmount);
        logEvent("CONTRACT", "CONTRACT", contractId, "AUTO_CONFIRMED", "system", details);
    }

    public void logPaymentCaptured(UUID paymentId, String captureId, BigDecimal amount) {
        Map<String, Object> details = new HashMap<>();
        details.put("captureId", captureId);
        details.put("amount", amount);
        logEvent("PAYMENT", "PAYMENT", paymentId, "CAPTURED_TO_ESCROW", "gateway", details);
    }

    public void logPaymentFailed(UUID paymentId, String reason) {
        Map<String, Object> details = new HashMap<>();
        details.put("failureReason", reason);
        logEvent("PAYMENT", "PAYMENT", paymentId, "CAPTURE_FAILED", "gateway", details);
    }

    public void logEscrowReleased(UUID paymentId, UUID contractId, String actor) {
        Map<String, Object> details = new HashMap<>();
        details.put("contractId", contractId != null ? contractId.toString() : null);
        logEvent("PAYMENT", "PAYMENT", paymentId, "ESCROW_RELEASED", actor, details);
    }

    public void logRefund(UUID paymentId, BigDecimal amount, String newStatus, String reason, String actor) {
        Map<String, Object> details = new HashMap<>();
        details.put("amount", amount);
        details.put("status", newStatus);
        details.put("reason", reason);
        logEvent("PAYMENT", "PAYMENT", paymentId, "REFUNDED", actor, details);
    }

    public void logBalanceConfirmed(UUID transactionId, UUID userId, BigDecimal newBalance, String actor) {
        Map<String, Object> details = new HashMap<>();
        details.put("userId", userId != null ? userId.toString() : null);
        details.put("newBalance", newBalance);
        logEvent("BALANCE", "BALANCE_TRANSACTION", transactionId, "CONFIRMED", actor, details);
    }

    public void logBalanceReversed(UUID transactionId, String reason, String actor) {
        Map<String, Object> details = new HashMap<>();
        details.put("reason", reason);
        logEvent("BALANCE", "BALANCE_TRANSACTION", transactionId, "REVERSED", actor, details);
    }

    public void logSweepCompleted(String sweepName, int processed, int skipped, int failed) {
        Map<String, Object> details = new HashMap<>();
        details.put("sweep", sweepName);
        details.put("processed", processed);
        details.put("skipped", skipped);
        details.put("failed", failed);
        logEvent("SCHEDULER", "SWEEP", null, "COMPLETED", "system", details);
    }

    public void logDLQCreated(UUID dlqId, UUID contractId, String errorType, String errorMessage) {
        Map<String, Object> details = new HashMap<>();
        details.put("contractId", contractId != null ? contractId.toString() : null);
        details.put("errorType", errorType);
        details.put("errorMessage", errorMessage);
        logEvent("DLQ", "DLQ", dlqId, "DLQ_CREATED", "system", details);
    }

    public void logDLQResolved(UUID dlqId, String resolvedBy, String resolutionNotes) {
        Map<String, Object> details = new HashMap<>();
        details.put("resolvedBy", resolvedBy);
        details.put("resolutionNotes", resolutionNotes);
        logEvent("DLQ", "DLQ", dlqId, "DLQ_RESOLVED", resolvedBy, details);
    }

    public void logReconciliation(UUID reconciliationId, Map<String, Object> results, String userId) {
        logEvent("RECONCILIATION", "RECONCILIATION", reconciliationId, "RECONCILIATION_COMPLETED", userId, results);
    }
}
