package io.doers.escrow.repo;

import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.UserAccount;
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
public class UserAccountRepository {

  private static final String COLUMNS = """
      user_id, balance, membership_tier, family_plan, referral_code, referred_by, completed_referrals,
      has_referral_discount, referral_discount_expires_at, current_commission_rate, updated_on
      """;

  private static final RowMapper<UserAccount> MAPPER = (rs, i) -> {
    UserAccount u = new UserAccount();
    u.setUserId(uuid(rs, "user_id"));
    u.setBalance(rs.getBigDecimal("balance"));
    u.setMembershipTier(MembershipTier.fromCode(rs.getString("membership_tier")));
    u.setFamilyPlan(rs.getBoolean("family_plan"));
    u.setReferralCode(rs.getString("referral_code"));
    u.setReferredBy(uuid(rs, "referred_by"));
    u.setCompletedReferrals(rs.getInt("completed_referrals"));
    u.setHasReferralDiscount(rs.getBoolean("has_referral_discount"));
    u.setReferralDiscountExpiresAt(instant(rs, "referral_discount_expires_at"));
    u.setCurrentCommissionRate(rs.getBigDecimal("current_commission_rate"));
    u.setUpdatedOn(instant(rs, "updated_on"));
    return u;
  };

  private final JdbcTemplate jdbc;

  public UserAccountRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public void insert(UserAccount u) {
    jdbc.update("""
        INSERT INTO user_accounts
        (user_id, balance, membership_tier, family_plan, referral_code, referred_by, completed_referrals,
         has_referral_discount, referral_discount_expires_at, current_commission_rate, updated_on)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
        u.getUserId(), u.getBalance(), u.getMembershipTier().getCode(), u.isFamilyPlan(), u.getReferralCode(),
        u.getReferredBy(), u.getCompletedReferrals(), u.isHasReferralDiscount(),
        ts(u.getReferralDiscountExpiresAt()), u.getCurrentCommissionRate(), ts(u.getUpdatedOn()));
  }

  public Optional<UserAccount> findById(UUID userId) {
    return jdbc.query("SELECT " + COLUMNS + " FROM user_accounts WHERE user_id = ?", MAPPER, userId)
        .stream().findFirst();
  }

  /**
   * Optimistic balance write: only applies if the balance is still the one the caller read.
   * Only the balance ledger calls this.
   */
  public int updateBalance(UUID userId, BigDecimal expectedBalance, BigDecimal newBalance, Instant now) {
    return jdbc.update(
        "UPDATE user_accounts SET balance = ?, updated_on = ? WHERE user_id = ? AND balance = ?",
        newBalance, ts(now), userId, expectedBalance);
  }

  public List<UserAccount> findExpiredReferralDiscounts(Instant now, MembershipTier tier) {
    return jdbc.query("SELECT " + COLUMNS + """
        FROM user_accounts
        WHERE has_referral_discount = TRUE
          AND referral_discount_expires_at <= ?
          AND membership_tier = ?
        """, MAPPER, ts(now), tier.getCode());
  }

  public int clearReferralDiscount(UUID userId, BigDecimal defaultRate, Instant now) {
    return jdbc.update("""
        UPDATE user_accounts
        SET has_referral_discount = FALSE, current_commission_rate = ?, updated_on = ?
        WHERE user_id = ? AND has_referral_discount = TRUE AND referral_discount_expires_at <= ?
        """,
        defaultRate, ts(now), userId, ts(now));
  }
}
