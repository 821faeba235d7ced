package io.doers.escrow.notification;

public enum NotificationTemplate {
	CONFIRMATION_REMINDER("confirmation_reminder"),
	CONTRACT_AWAITING_CONFIRMATION("contract_awaiting_confirmation"),
	CONTRACT_COMPLETED("contract_completed"),
	CONTRACT_AUTO_COMPLETED("contract_auto_completed"),
	CONTRACT_CANCELLED("contract_cancelled"),
	CONTRACT_DISPUTED("contract_disputed"),
	ESCROW_HELD("escrow_held"),
	ESCROW_RELEASED("escrow_released"),
	PAYMENT_FAILED("payment_failed"),
	PAYMENT_REFUNDED("payment_refunded"),
	PAYOUT_CONFIRMED("payout_confirmed"),
	REFERRAL_DISCOUNT_EXPIRED("referral_discount_expired");

	private final String code;

	NotificationTemplate(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}
}
