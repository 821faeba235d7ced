package io.doers.escrow.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
public class BalanceTransaction {
  private UUID transactionId;
  private UUID userId;
  private BalanceTransactionType type;
  private BigDecimal amount;
  private BigDecimal previousBalance;
  private BigDecimal newBalance;
  private String relatedModel;
  private UUID relatedId;
  private BalanceTransactionStatus status;
  private String description;
  private UUID processedBy;
  private Instant processedAt;
  private Instant createdOn;

  /**
   * Signed effect this row has on the balance once completed.
   */
  public BigDecimal signedAmount() {
    return type.isCredit() ? amount : amount.negate();
  }
}
