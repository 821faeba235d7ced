package io.doers.escrow.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
public class Contract {
  private UUID contractId;
  private UUID jobId;
  private UUID clientId;
  private UUID doerId;

  // money snapshot taken at creation, never updated
  private BigDecimal price;
  private BigDecimal commission;
  private BigDecimal commissionRate;
  private BigDecimal totalPrice;

  private ContractStatus status;
  private EscrowStatus escrowStatus;
  private ContractPaymentStatus paymentStatus;

  private BigDecimal allocatedAmount;
  private BigDecimal percentageOfBudget;

  private boolean termsAcceptedByClient;
  private boolean termsAcceptedByDoer;
  private boolean clientConfirmed;
  private Instant clientConfirmedAt;
  private boolean doerConfirmed;
  private Instant doerConfirmedAt;
  private Instant awaitingConfirmationAt;
  private boolean confirmationReminderSent;
  private boolean autoConfirmed;

  private Instant startedAt;
  private Instant completedAt;
  private Instant cancelledAt;
  private UUID cancelledById;
  private CancelledByRole cancelledByRole;
  private String cancellationReason;
  private Instant disputedAt;
  private UUID disputedById;

  private Instant createdOn;
  private Instant updatedOn;

  /**
   * Amount owed to the doer on completion: the frozen allocation when present, else the price.
   */
  public BigDecimal payoutAmount() {
    return allocatedAmount != null ? allocatedAmount : price;
  }
}
