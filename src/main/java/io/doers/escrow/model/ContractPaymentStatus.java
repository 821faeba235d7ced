package io.doers.escrow.model;

/**
 * Payment progress as seen from the contract.
 */
public enum ContractPaymentStatus {
	PENDING("pending"),
	ESCROW("escrow"),
	PENDING_PAYOUT("pending_payout"),
	COMPLETED("completed"),
	REFUNDED("refunded"),
	PARTIAL_REFUND("partial_refund");

	private final String code;

	ContractPaymentStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static ContractPaymentStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (ContractPaymentStatus value : values()) {
			if (value.code.equalsIgnoreCase(code)) {
				return value;
			}
		}
		return null;
	}
}
