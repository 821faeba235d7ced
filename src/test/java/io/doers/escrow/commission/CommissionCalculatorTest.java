package io.doers.escrow.commission;

import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.UserAccount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CommissionCalculator")
class CommissionCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    private static final BigDecimal TEN_THOUSAND = new BigDecimal("10000");

    private final CommissionCalculator calculator = new CommissionCalculator(new EscrowProperties());

    private static UserAccount payer(MembershipTier tier) {
        UserAccount u = new UserAccount();
        u.setMembershipTier(tier);
        u.setBalance(BigDecimal.ZERO);
        return u;
    }

    @Nested
    @DisplayName("Tier defaults")
    class TierDefaults {

        @Test
        @DisplayName("free tier pays 8%: 10,000 -> 800 commission, 10,800 total")
        void freeTier() {
            CommissionQuote quote = calculator.calculate(payer(MembershipTier.FREE), TEN_THOUSAND, NOW);

            assertThat(quote.getRate()).isEqualByComparingTo("8");
            assertThat(quote.getCommission()).isEqualByComparingTo("800");
            assertThat(quote.getTotalPrice()).isEqualByComparingTo("10800");
            assertThat(quote.getRateSource()).isEqualTo(CommissionQuote.RateSource.TIER_DEFAULT);
        }

        @Test
        void proAndSuperProPayLess() {
            assertThat(calculator.calculate(payer(MembershipTier.PRO), TEN_THOUSAND, NOW).getCommission())
                .isEqualByComparingTo("300");
            assertThat(calculator.calculate(payer(MembershipTier.SUPER_PRO), TEN_THOUSAND, NOW).getCommission())
                .isEqualByComparingTo("200");
        }

        @Test
        void unknownTierFallsBackToFreeRate() {
            assertThat(calculator.tierRate(null)).isEqualByComparingTo("8");
        }

        @Test
        void familyPlanPaysNoCommission() {
            UserAccount family = payer(MembershipTier.FREE);
            family.setFamilyPlan(true);

            CommissionQuote quote = calculator.calculate(family, TEN_THOUSAND, NOW);

            assertThat(quote.getCommission()).isEqualByComparingTo("0");
            assertThat(quote.getTotalPrice()).isEqualByComparingTo("10000");
            assertThat(quote.getRateSource()).isEqualTo(CommissionQuote.RateSource.FAMILY_PLAN);
        }
    }

    @Nested
    @DisplayName("Referral discount")
    class ReferralDiscount {

        @Test
        @DisplayName("active discount overrides to 3%: 10,000 -> 300 commission, 10,300 total")
        void activeDiscount() {
            UserAccount u = payer(MembershipTier.FREE);
            u.setHasReferralDiscount(true);
            u.setReferralDiscountExpiresAt(NOW.plus(Duration.ofDays(10)));

            CommissionQuote quote = calculator.calculate(u, TEN_THOUSAND, NOW);

            assertThat(quote.getRate()).isEqualByComparingTo("3");
            assertThat(quote.getCommission()).isEqualByComparingTo("300");
            assertThat(quote.getTotalPrice()).isEqualByComparingTo("10300");
            assertThat(quote.getRateSource()).isEqualTo(CommissionQuote.RateSource.REFERRAL_DISCOUNT);
        }

        @Test
        void expiredDiscountSilentlyFallsBackToTierRate() {
            UserAccount u = payer(MembershipTier.FREE);
            u.setHasReferralDiscount(true);
            u.setReferralDiscountExpiresAt(NOW.minusSeconds(1));

            CommissionQuote quote = calculator.calculate(u, TEN_THOUSAND, NOW);

            assertThat(quote.getRate()).isEqualByComparingTo("8");
            assertThat(quote.getCommission()).isEqualByComparingTo("800");
        }

        @Test
        void discountExpiringExactlyNowIsExpired() {
            UserAccount u = payer(MembershipTier.FREE);
            u.setHasReferralDiscount(true);
            u.setReferralDiscountExpiresAt(NOW);

            assertThat(calculator.calculate(u, TEN_THOUSAND, NOW).getRate()).isEqualByComparingTo("8");
        }

        @Test
        void discountNeverRaisesALowerTierRate() {
            UserAccount u = payer(MembershipTier.SUPER_PRO);
            u.setHasReferralDiscount(true);
            u.setReferralDiscountExpiresAt(NOW.plus(Duration.ofDays(1)));

            CommissionQuote quote = calculator.calculate(u, TEN_THOUSAND, NOW);

            assertThat(quote.getRate()).isEqualByComparingTo("2");
            assertThat(quote.getRateSource()).isEqualTo(CommissionQuote.RateSource.TIER_DEFAULT);
        }
    }

    @Test
    void roundsCommissionHalfUpToCents() {
        CommissionQuote quote = calculator.calculate(payer(MembershipTier.FREE), new BigDecimal("99.99"), NOW);

        // 99.99 * 8 / 100 = 7.9992
        assertThat(quote.getCommission()).isEqualByComparingTo("8.00");
        assertThat(quote.getCommission().scale()).isEqualTo(2);
        assertThat(quote.getTotalPrice()).isEqualByComparingTo("107.99");
    }

    @Test
    void sameInputsGiveSameQuote() {
        UserAccount u = payer(MembershipTier.PRO);
        BigDecimal base = new BigDecimal("1234.56");

        CommissionQuote first = calculator.calculate(u, base, NOW);
        CommissionQuote second = calculator.calculate(u, base, NOW);

        assertThat(second.getCommission()).isEqualByComparingTo(first.getCommission());
        assertThat(second.getTotalPrice()).isEqualByComparingTo(first.getTotalPrice());
        assertThat(first.getTotalPrice()).isEqualByComparingTo(base.add(first.getCommission()));
    }

    @Test
    void rejectsNonPositiveBase() {
        assertThatThrownBy(() -> calculator.calculate(payer(MembershipTier.FREE), BigDecimal.ZERO, NOW))
            .isInstanceOf(EscrowValidationException.class)
            .hasMessageContaining("greater than zero");
        assertThatThrownBy(() -> calculator.calculate(payer(MembershipTier.FREE), new BigDecimal("-5"), NOW))
            .isInstanceOf(EscrowValidationException.class);
    }
}
