package io.doers.escrow.model;

import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

@Data
public class Payment {
  private UUID paymentId;
  private UUID contractId;
  private UUID payerId;
  private UUID recipientId;
  private BigDecimal amount;
  private String currency;
  private PaymentStatus status;
  private PaymentType paymentType;
  private boolean isEscrow;
  private BigDecimal platformFee;
  private BigDecimal platformFeePercentage;
  private String gatewayOrderId;
  private String gatewayCaptureId;
  private Instant escrowReleasedAt;
  private UUID escrowReleasedBy;
  private BigDecimal refundedAmount;
  private String refundReason;
  private Instant refundedAt;
  private UUID refundedBy;
  private String failureReason;
  private String metadata;            // JSON text
  private Instant createdOn;
  private Instant updatedOn;

  public BigDecimal refundableAmount() {
    BigDecimal refunded = refundedAmount != null ? refundedAmount : BigDecimal.ZERO;
    return amount.subtract(refunded);
  }

  /**
   * The part of {@code value} still backed by this payment after refunds, rounded down to
   * cents. Equals {@code value} when nothing was refunded.
   */
  public BigDecimal retainedShareOf(BigDecimal value) {
    if (refundedAmount == null || refundedAmount.signum() == 0) {
      return value;
    }
    return value.multiply(refundableAmount()).divide(amount, 2, RoundingMode.DOWN);
  }
}
