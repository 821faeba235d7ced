package io.doers.escrow.repo;

import io.doers.escrow.model.Payment;
import io.doers.escrow.model.PaymentStatus;
import io.doers.escrow.model.PaymentType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static io.doers.escrow.repo.SqlTimestamps.instant;
import static io.doers.escrow.repo.SqlTimestamps.ts;
import static io.doers.escrow.repo.SqlTimestamps.uuid;

@Repository
public class PaymentRepository {

  private static final String COLUMNS = """
      payment_id, contract_id, payer_id, recipient_id, amount, currency, status, payment_type,
      is_escrow, platform_fee, platform_fee_percentage, gateway_order_id, gateway_capture_id,
      escrow_released_at, escrow_released_by, refunded_amount, refund_reason, refunded_at,
      refunded_by, failure_reason, metadata, created_on, updated_on
      """;

  private static final RowMapper<Payment> MAPPER = (rs, i) -> {
    Payment p = new Payment();
    p.setPaymentId(uuid(rs, "payment_id"));
    p.setContractId(uuid(rs, "contract_id"));
    p.setPayerId(uuid(rs, "payer_id"));
    p.setRecipientId(uuid(rs, "recipient_id"));
    p.setAmount(rs.getBigDecimal("amount"));
    p.setCurrency(rs.getString("currency"));
    p.setStatus(PaymentStatus.fromCode(rs.getString("status")));
    p.setPaymentType(PaymentType.fromCode(rs.getString("payment_type")));
    p.setEscrow(rs.getBoolean("is_escrow"));
    p.setPlatformFee(rs.getBigDecimal("platform_fee"));
    p.setPlatformFeePercentage(rs.getBigDecimal("platform_fee_percentage"));
    p.setGatewayOrderId(rs.getString("gateway_order_id"));
    p.setGatewayCaptureId(rs.getString("gateway_capture_id"));
    p.setEscrowReleasedAt(instant(rs, "escrow_released_at"));
    p.setEscrowReleasedBy(uuid(rs, "escrow_released_by"));
    p.setRefundedAmount(rs.getBigDecimal("refunded_amount"));
    p.setRefundReason(rs.getString("refund_reason"));
    p.setRefundedAt(instant(rs, "refunded_at"));
    p.setRefundedBy(uuid(rs, "refunded_by"));
    p.setFailureReason(rs.getString("failure_reason"));
    p.setMetadata(rs.getString("metadata"));
    p.setCreatedOn(instant(rs, "created_on"));
    p.setUpdatedOn(instant(rs, "updated_on"));
    return p;
  };

  private final JdbcTemplate jdbc;

  public PaymentRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public void insert(Payment p) {
    jdbc.update("""
        INSERT INTO payments
        (payment_id, contract_id, payer_id, recipient_id, amount, currency, status, payment_type,
         is_escrow, platform_fee, platform_fee_percentage, gateway_order_id, refunded_amount,
         metadata, created_on, updated_on)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?, ?)
        """,
        p.getPaymentId(), p.getContractId(), p.getPayerId(), p.getRecipientId(), p.getAmount(),
        p.getCurrency(), p.getStatus().getCode(), p.getPaymentType().getCode(), p.isEscrow(),
        p.getPlatformFee(), p.getPlatformFeePercentage(), p.getGatewayOrderId(), p.getMetadata(),
        ts(p.getCreatedOn()), ts(p.getUpdatedOn()));
  }

  public Optional<Payment> findById(UUID paymentId) {
    return jdbc.query("SELECT " + COLUMNS + " FROM payments WHERE payment_id = ?", MAPPER, paymentId)
        .stream().findFirst();
  }

  /**
   * Row lock held until the surrounding transaction ends. Serializes capture and refund
   * of one payment across nodes while the gateway call is in flight.
   */
  public Optional<Payment> lockById(UUID paymentId) {
    return jdbc.query("SELECT " + COLUMNS + " FROM payments WHERE payment_id = ? FOR UPDATE", MAPPER, paymentId)
        .stream().findFirst();
  }

  public Optional<Payment> findByGatewayOrderId(String gatewayOrderId) {
    return jdbc.query("SELECT " + COLUMNS + " FROM payments WHERE gateway_order_id = ?", MAPPER, gatewayOrderId)
        .stream().findFirst();
  }

  public List<Payment> findByContractId(UUID contractId) {
    return jdbc.query("SELECT " + COLUMNS + " FROM payments WHERE contract_id = ? ORDER BY created_on",
        MAPPER, contractId);
  }

  public Optional<Payment> findEscrowByContractId(UUID contractId) {
    return jdbc.query("""
        SELECT %s FROM payments
        WHERE contract_id = ? AND is_escrow = TRUE AND payment_type = 'escrow_deposit'
        ORDER BY created_on DESC
        """.formatted(COLUMNS), MAPPER, contractId)
        .stream().findFirst();
  }

  public int markProcessing(UUID paymentId, Instant now) {
    return jdbc.update(
        "UPDATE payments SET status = 'processing', updated_on = ? WHERE payment_id = ? AND status = 'pending'",
        ts(now), paymentId);
  }

  public int markHeld(UUID paymentId, String captureId, Instant now) {
    return jdbc.update("""
        UPDATE payments SET status = 'held_escrow', gateway_capture_id = ?, updated_on = ?
        WHERE payment_id = ? AND status IN ('pending', 'processing')
        """,
        captureId, ts(now), paymentId);
  }

  public int markFailed(UUID paymentId, String failureReason, Instant now) {
    return jdbc.update("""
        UPDATE payments SET status = 'failed', failure_reason = ?, updated_on = ?
        WHERE payment_id = ? AND status IN ('pending', 'processing')
        """,
        failureReason, ts(now), paymentId);
  }

  /**
   * held_escrow | partial_refund -> completed. What is left after partial refunds goes to
   * the recipient. Zero rows means someone else released or fully refunded first.
   */
  public int release(UUID paymentId, UUID releasedBy, Instant now) {
    return jdbc.update("""
        UPDATE payments
        SET status = 'completed', escrow_released_at = ?, escrow_released_by = ?, updated_on = ?
        WHERE payment_id = ? AND status IN ('held_escrow', 'partial_refund')
        """,
        ts(now), releasedBy, ts(now), paymentId);
  }

  /**
   * Adds a refund on top of what was already refunded. The expected refunded amount
   * guards against two refunds computed from the same snapshot.
   */
  public int applyRefund(UUID paymentId, BigDecimal expectedRefunded, BigDecimal refundAmount,
                         PaymentStatus newStatus, String reason, UUID refundedBy, Instant now) {
    return jdbc.update("""
        UPDATE payments
        SET refunded_amount = refunded_amount + ?, status = ?, refund_reason = ?,
            refunded_at = ?, refunded_by = ?, updated_on = ?
        WHERE payment_id = ? AND status IN ('held_escrow', 'partial_refund') AND refunded_amount = ?
        """,
        refundAmount, newStatus.getCode(), reason, ts(now), refundedBy, ts(now), paymentId, expectedRefunded);
  }
}
