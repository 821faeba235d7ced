package io.doers.escrow.commission;

import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.UserAccount;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Platform fee calculation. No I/O: the payer profile and the evaluation instant are
 * supplied by the caller, so the same inputs always produce the same quote.
 *
 * Rate selection, first match wins:
 * 1) family plan members pay the family rate
 * 2) an unexpired referral discount lowers the rate to the discount rate
 * 3) otherwise the membership tier default
 */
@Component
public class CommissionCalculator {

	private static final BigDecimal HUNDRED = new BigDecimal("100");

	private final EscrowProperties.Commission rates;

	public CommissionCalculator(EscrowProperties props) {
		this.rates = props.getCommission();
	}

	public CommissionQuote calculate(UserAccount payer, BigDecimal baseAmount, Instant asOf) {
		if (baseAmount == null || baseAmount.signum() <= 0) {
			throw new EscrowValidationException("baseAmount must be greater than zero", "baseAmount", baseAmount);
		}

		BigDecimal rate;
		CommissionQuote.RateSource source;
		if (payer.isFamilyPlan()) {
			rate = rates.getFamilyPlanRate();
			source = CommissionQuote.RateSource.FAMILY_PLAN;
		} else {
			BigDecimal tierRate = tierRate(payer.getMembershipTier());
			BigDecimal discountRate = rates.getReferralDiscountRate();
			// an expired discount just falls through to the tier rate
			if (payer.hasActiveReferralDiscount(asOf) && discountRate.compareTo(tierRate) < 0) {
				rate = discountRate;
				source = CommissionQuote.RateSource.REFERRAL_DISCOUNT;
			} else {
				rate = tierRate;
				source = CommissionQuote.RateSource.TIER_DEFAULT;
			}
		}

		BigDecimal commission = baseAmount.multiply(rate).divide(HUNDRED, 2, RoundingMode.HALF_UP);
		BigDecimal totalPrice = baseAmount.add(commission);
		return new CommissionQuote(rate, commission, totalPrice, source);
	}

	public BigDecimal tierRate(MembershipTier tier) {
		if (tier == null) {
			return rates.getFreeRate();
		}
		switch (tier) {
			case PRO:
				return rates.getProRate();
			case SUPER_PRO:
				return rates.getSuperProRate();
			case FREE:
			default:
				return rates.getFreeRate();
		}
	}
}
