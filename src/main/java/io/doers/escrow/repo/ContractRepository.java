package io.doers.escrow.repo;

import io.doers.escrow.model.CancelledByRole;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.ContractPaymentStatus;
import io.doers.escrow.model.ContractStatus;
import io.doers.escrow.model.EscrowStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static io.doers.escrow.repo.SqlTimestamps.instant;
import static io.doers.escrow.repo.SqlTimestamps.ts;
import static io.doers.escrow.repo.SqlTimestamps.uuid;

/**
 * Contract rows. Every mutation is a single conditional UPDATE narrowed to the expected
 * prior state; callers inspect the affected-row count to learn whether they won.
 */
@Repository
public class ContractRepository {

  private static final String COLUMNS = """
      c.contract_id, c.job_id, c.client_id, c.doer_id, c.price, c.commission, c.commission_rate,
      c.total_price, c.status, c.escrow_status, c.payment_status, c.allocated_amount,
      c.percentage_of_budget, c.terms_accepted_by_client, c.terms_accepted_by_doer,
      c.client_confirmed, c.client_confirmed_at, c.doer_confirmed, c.doer_confirmed_at,
      c.awaiting_confirmation_at, c.confirmation_reminder_sent, c.auto_confirmed, c.started_at,
      c.completed_at, c.cancelled_at, c.cancelled_by_id, c.cancelled_by_role, c.cancellation_reason,
      c.disputed_at, c.disputed_by_id, c.created_on, c.updated_on
      """;

  private static final RowMapper<Contract> MAPPER = (rs, i) -> {
    Contract c = new Contract();
    c.setContractId(uuid(rs, "contract_id"));
    c.setJobId(uuid(rs, "job_id"));
    c.setClientId(uuid(rs, "client_id"));
    c.setDoerId(uuid(rs, "doer_id"));
    c.setPrice(rs.getBigDecimal("price"));
    c.setCommission(rs.getBigDecimal("commission"));
    c.setCommissionRate(rs.getBigDecimal("commission_rate"));
    c.setTotalPrice(rs.getBigDecimal("total_price"));
    c.setStatus(ContractStatus.fromCode(rs.getString("status")));
    c.setEscrowStatus(EscrowStatus.fromCode(rs.getString("escrow_status")));
    c.setPaymentStatus(ContractPaymentStatus.fromCode(rs.getString("payment_status")));
    c.setAllocatedAmount(rs.getBigDecimal("allocated_amount"));
    c.setPercentageOfBudget(rs.getBigDecimal("percentage_of_budget"));
    c.setTermsAcceptedByClient(rs.getBoolean("terms_accepted_by_client"));
    c.setTermsAcceptedByDoer(rs.getBoolean("terms_accepted_by_doer"));
    c.setClientConfirmed(rs.getBoolean("client_confirmed"));
    c.setClientConfirmedAt(instant(rs, "client_confirmed_at"));
    c.setDoerConfirmed(rs.getBoolean("doer_confirmed"));
    c.setDoerConfirmedAt(instant(rs, "doer_confirmed_at"));
    c.setAwaitingConfirmationAt(instant(rs, "awaiting_confirmation_at"));
    c.setConfirmationReminderSent(rs.getBoolean("confirmation_reminder_sent"));
    c.setAutoConfirmed(rs.getBoolean("auto_confirmed"));
    c.setStartedAt(instant(rs, "started_at"));
    c.setCompletedAt(instant(rs, "completed_at"));
    c.setCancelledAt(instant(rs, "cancelled_at"));
    c.setCancelledById(uuid(rs, "cancelled_by_id"));
    c.setCancelledByRole(CancelledByRole.fromCode(rs.getString("cancelled_by_role")));
    c.setCancellationReason(rs.getString("cancellation_reason"));
    c.setDisputedAt(instant(rs, "disputed_at"));
    c.setDisputedById(uuid(rs, "disputed_by_id"));
    c.setCreatedOn(instant(rs, "created_on"));
    c.setUpdatedOn(instant(rs, "updated_on"));
    return c;
  };

  private final JdbcTemplate jdbc;

  public ContractRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public void insert(Contract c) {
    jdbc.update("""
        INSERT INTO contracts
        (contract_id, job_id, client_id, doer_id, price, commission, commission_rate, total_price,
         status, escrow_status, payment_status, allocated_amount, percentage_of_budget,
         created_on, updated_on)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
        c.getContractId(), c.getJobId(), c.getClientId(), c.getDoerId(),
        c.getPrice(), c.getCommission(), c.getCommissionRate(), c.getTotalPrice(),
        c.getStatus().getCode(), c.getEscrowStatus().getCode(), c.getPaymentStatus().getCode(),
        c.getAllocatedAmount(), c.getPercentageOfBudget(),
        ts(c.getCreatedOn()), ts(c.getUpdatedOn()));
  }

  public Optional<Contract> findById(UUID contractId) {
    List<Contract> rows = jdbc.query(
        "SELECT " + COLUMNS + " FROM contracts c WHERE c.contract_id = ?", MAPPER, contractId);
    return rows.stream().findFirst();
  }

  public List<Contract> findByJobId(UUID jobId) {
    return jdbc.query(
        "SELECT " + COLUMNS + " FROM contracts c WHERE c.job_id = ? ORDER BY c.created_on", MAPPER, jobId);
  }

  // ------------------------------------------------------------------
  // Terms and start
  // ------------------------------------------------------------------

  public int acceptTerms(UUID contractId, boolean byClient, Instant now) {
    String column = byClient ? "terms_accepted_by_client" : "terms_accepted_by_doer";
    return jdbc.update(
        "UPDATE contracts SET " + column + " = TRUE, updated_on = ? " +
        "WHERE contract_id = ? AND status = 'pending' AND " + column + " = FALSE",
        ts(now), contractId);
  }

  public int markAcceptedIfBothTermsAccepted(UUID contractId, Instant now) {
    return jdbc.update("""
        UPDATE contracts SET status = 'accepted', updated_on = ?
        WHERE contract_id = ? AND status = 'pending'
          AND terms_accepted_by_client = TRUE AND terms_accepted_by_doer = TRUE
        """,
        ts(now), contractId);
  }

  public int start(UUID contractId, Instant now) {
    return jdbc.update("""
        UPDATE contracts SET status = 'in_progress', started_at = ?, updated_on = ?
        WHERE contract_id = ? AND status = 'accepted'
        """,
        ts(now), ts(now), contractId);
  }

  // ------------------------------------------------------------------
  // Confirmation and completion
  // ------------------------------------------------------------------

  public int recordConfirmation(UUID contractId, boolean byClient, Instant now) {
    String flag = byClient ? "client_confirmed" : "doer_confirmed";
    return jdbc.update(
        "UPDATE contracts SET " + flag + " = TRUE, " + flag + "_at = COALESCE(" + flag + "_at, ?), updated_on = ? " +
        "WHERE contract_id = ? AND status IN ('in_progress', 'awaiting_confirmation') AND " + flag + " = FALSE",
        ts(now), ts(now), contractId);
  }

  /**
   * in_progress -> awaiting_confirmation. Keeps an existing awaiting timestamp.
   */
  public int moveToAwaitingConfirmation(UUID contractId, Instant now) {
    return jdbc.update("""
        UPDATE contracts
        SET status = 'awaiting_confirmation',
            awaiting_confirmation_at = COALESCE(awaiting_confirmation_at, ?),
            updated_on = ?
        WHERE contract_id = ? AND status = 'in_progress'
        """,
        ts(now), ts(now), contractId);
  }

  /**
   * awaiting_confirmation -> completed once both parties confirmed. The escrow columns are
   * moved separately, only when a held payment was actually released. A contract without
   * escrow funds keeps its payment status.
   */
  public int completeConfirmed(UUID contractId, Instant now) {
    return jdbc.update("""
        UPDATE contracts
        SET status = 'completed', completed_at = ?,
            payment_status = CASE WHEN escrow_status IN ('held', 'released') THEN 'pending_payout' ELSE payment_status END,
            updated_on = ?
        WHERE contract_id = ? AND status = 'awaiting_confirmation'
          AND client_confirmed = TRUE AND doer_confirmed = TRUE
        """,
        ts(now), ts(now), contractId);
  }

  /**
   * Forced completion after the grace window. Existing confirmation timestamps are preserved.
   */
  public int autoConfirm(UUID contractId, Instant deadline, Instant now) {
    return jdbc.update("""
        UPDATE contracts
        SET client_confirmed = TRUE, client_confirmed_at = COALESCE(client_confirmed_at, ?),
            doer_confirmed = TRUE, doer_confirmed_at = COALESCE(doer_confirmed_at, ?),
            auto_confirmed = TRUE, status = 'completed', completed_at = ?,
            payment_status = CASE WHEN escrow_status IN ('held', 'released') THEN 'pending_payout' ELSE payment_status END,
            updated_on = ?
        WHERE contract_id = ? AND status = 'awaiting_confirmation'
          AND awaiting_confirmation_at <= ?
          AND (client_confirmed = FALSE OR doer_confirmed = FALSE)
        """,
        ts(now), ts(now), ts(now), ts(now), contractId, ts(deadline));
  }

  // ------------------------------------------------------------------
  // Cancel and dispute
  // ------------------------------------------------------------------

  public int cancel(UUID contractId, UUID cancelledById, CancelledByRole role, String reason, Instant now) {
    return jdbc.update("""
        UPDATE contracts
        SET status = 'cancelled', cancelled_at = ?, cancelled_by_id = ?, cancelled_by_role = ?,
            cancellation_reason = ?, updated_on = ?
        WHERE contract_id = ?
          AND status IN ('pending', 'accepted', 'in_progress', 'awaiting_confirmation', 'disputed')
        """,
        ts(now), cancelledById, role.getCode(), reason, ts(now), contractId);
  }

  public int dispute(UUID contractId, UUID disputedById, Instant now) {
    return jdbc.update("""
        UPDATE contracts
        SET status = 'disputed', escrow_status = 'disputed', disputed_at = ?, disputed_by_id = ?, updated_on = ?
        WHERE contract_id = ? AND status IN ('in_progress', 'awaiting_confirmation')
        """,
        ts(now), disputedById, ts(now), contractId);
  }

  // ------------------------------------------------------------------
  // Escrow mirror
  // ------------------------------------------------------------------

  public int markEscrowHeld(UUID contractId, Instant now) {
    return jdbc.update("""
        UPDATE contracts SET escrow_status = 'held', payment_status = 'escrow', updated_on = ?
        WHERE contract_id = ? AND escrow_status = 'pending'
        """,
        ts(now), contractId);
  }

  public int markEscrowReleased(UUID contractId, Instant now) {
    return jdbc.update("""
        UPDATE contracts SET escrow_status = 'released', updated_on = ?
        WHERE contract_id = ? AND escrow_status IN ('held', 'disputed')
        """,
        ts(now), contractId);
  }

  public int updateEscrowState(UUID contractId, EscrowStatus escrowStatus, ContractPaymentStatus paymentStatus,
                               Instant now) {
    return jdbc.update(
        "UPDATE contracts SET escrow_status = ?, payment_status = ?, updated_on = ? WHERE contract_id = ?",
        escrowStatus.getCode(), paymentStatus.getCode(), ts(now), contractId);
  }

  // ------------------------------------------------------------------
  // Scheduler queries
  // ------------------------------------------------------------------

  public List<Contract> findDueForAutoConfirm(Instant deadline, int limit) {
    return jdbc.query(
        "SELECT " + COLUMNS + """
        FROM contracts c
        WHERE c.status = 'awaiting_confirmation'
          AND c.awaiting_confirmation_at <= ?
          AND (c.client_confirmed = FALSE OR c.doer_confirmed = FALSE)
        ORDER BY c.awaiting_confirmation_at
        LIMIT ?
        """,
        MAPPER, ts(deadline), limit);
  }

  public List<Contract> findDueForReminder(Instant now, int limit) {
    return jdbc.query(
        "SELECT " + COLUMNS + """
        FROM contracts c
        JOIN jobs j ON j.job_id = c.job_id
        WHERE j.end_date <= ?
          AND c.status IN ('accepted', 'in_progress', 'awaiting_confirmation')
          AND (c.confirmation_reminder_sent = FALSE OR c.status = 'in_progress')
          AND (c.client_confirmed = FALSE OR c.doer_confirmed = FALSE)
        ORDER BY j.end_date
        LIMIT ?
        """,
        MAPPER, ts(now), limit);
  }

  public int markReminderSent(UUID contractId, Instant now) {
    return jdbc.update("""
        UPDATE contracts SET confirmation_reminder_sent = TRUE, updated_on = ?
        WHERE contract_id = ? AND confirmation_reminder_sent = FALSE
        """,
        ts(now), contractId);
  }
}
