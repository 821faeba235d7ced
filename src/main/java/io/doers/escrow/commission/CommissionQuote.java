package io.doers.escrow.commission;

import java.math.BigDecimal;

/**
 * Result of a commission calculation. Amounts are scaled to two decimals.
 */
public class CommissionQuote {

	public enum RateSource {
		TIER_DEFAULT,
		REFERRAL_DISCOUNT,
		FAMILY_PLAN
	}

	private final BigDecimal rate;
	private final BigDecimal commission;
	private final BigDecimal totalPrice;
	private final RateSource rateSource;

	public CommissionQuote(BigDecimal rate, BigDecimal commission, BigDecimal totalPrice, RateSource rateSource) {
		this.rate = rate;
		this.commission = commission;
		this.totalPrice = totalPrice;
		this.rateSource = rateSource;
	}

	public BigDecimal getRate() {
		return rate;
	}

	public BigDecimal getCommission() {
		return commission;
	}

	public BigDecimal getTotalPrice() {
		return totalPrice;
	}

	public RateSource getRateSource() {
		return rateSource;
	}

	@Override
	public String toString() {
		return String.format("CommissionQuote{rate=%s, commission=%s, totalPrice=%s, source=%s}",
				rate, commission, totalPrice, rateSource);
	}
}
