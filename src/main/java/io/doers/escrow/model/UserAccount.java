package io.doers.escrow.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Balance and commission-related state of a marketplace user.
 */
@Data
public class UserAccount {
  private UUID userId;
  private BigDecimal balance;
  private MembershipTier membershipTier;
  private boolean familyPlan;
  private String referralCode;
  private UUID referredBy;
  private int completedReferrals;
  private boolean hasReferralDiscount;
  private Instant referralDiscountExpiresAt;
  private BigDecimal currentCommissionRate;
  private Instant updatedOn;

  public boolean hasActiveReferralDiscount(Instant asOf) {
    return hasReferralDiscount
        && referralDiscountExpiresAt != null
        && referralDiscountExpiresAt.isAfter(asOf);
  }
}
