package io.doers.escrow.dlq;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.doers.escrow.audit.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Contracts a scheduled sweep failed to process, kept for manual review and replay.
 */
@Service
public class DeadLetterQueueService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueService.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final AuditService auditService;
    private final Clock clock;

    public DeadLetterQueueService(JdbcTemplate jdbc, ObjectMapper objectMapper, AuditService auditService,
                                  Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Record a failed contract. Never throws: a broken DLQ must not stop the sweep.
     */
    public void addToDLQ(UUID contractId, String operation, Object payload, Throwable error, String errorType) {
        try {
            String payloadJson = payload != null ? objectMapper.writeValueAsString(payload) : null;
            String errorMessage = error != null ? error.getMessage() : "Unknown error";
            UUID dlqId = UUID.randomUUID();

            jdbc.update("""
                INSERT INTO escrow_dead_letter_queue
                (dlq_id, contract_id, operation, error_type, error_message, error_stack_trace, payload, created_on)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                dlqId,
                contractId,
                operation,
                errorType != null ? errorType : "UNKNOWN",
                errorMessage,
                getStackTrace(error),
                payloadJson,
                Timestamp.from(clock.instant())
            );

            log.warn("Added to DLQ: contractId={} operation={} errorType={} error={}",
                contractId, operation, errorType, errorMessage);
            auditService.logDLQCreated(dlqId, contractId, errorType, errorMessage);
        } catch (Exception e) {
            log.error("Failed to add to DLQ: contractId={} operation={}", contractId, operation, e);
        }
    }

    public List<Map<String, Object>> getUnresolvedEntries(String operation) {
        if (operation == null) {
            return jdbc.queryForList("""
                SELECT dlq_id, contract_id, operation, error_type, error_message, created_on, retry_count, last_retry_on
                FROM escrow_dead_letter_queue
                WHERE resolved = FALSE
                ORDER BY created_on DESC
                """);
        }
        return jdbc.queryForList("""
            SELECT dlq_id, contract_id, operation, error_type, error_message, created_on, retry_count, last_retry_on
            FROM escrow_dead_letter_queue
            WHERE operation = ? AND resolved = FALSE
            ORDER BY created_on DESC
            """,
            operation
        );
    }

    public int getUnresolvedCount() {
        try {
            Integer count = jdbc.queryForObject(
                "SELECT COUNT(1) FROM escrow_dead_letter_queue WHERE resolved = FALSE",
                Integer.class
            );
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            log.error("Failed to get DLQ count", e);
            return 0;
        }
    }

    /**
     * @return true if an unresolved entry was marked resolved
     */
    public boolean markResolved(UUID dlqId, String resolvedBy, String resolutionNotes) {
        int rows = jdbc.update("""
            UPDATE escrow_dead_letter_queue
            SET resolved = TRUE, resolved_on = ?, resolved_by = ?, resolution_notes = ?
            WHERE dlq_id = ? AND resolved = FALSE
            """,
            Timestamp.from(clock.instant()),
            resolvedBy,
            resolutionNotes,
            dlqId
        );
        if (rows == 1) {
            log.info("Marked DLQ entry as resolved: dlqId={} resolvedBy={}", dlqId, resolvedBy);
            auditService.logDLQResolved(dlqId, resolvedBy, resolutionNotes);
        }
        return rows == 1;
    }

    private String getStackTrace(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
