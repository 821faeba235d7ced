package io.doers.escrow.model;

/**
 * Kind of money movement a payment row represents.
 */
public enum PaymentType {
	CONTRACT_PAYMENT("contract_payment"),
	ESCROW_DEPOSIT("escrow_deposit"),
	ESCROW_RELEASE("escrow_release"),
	REFUND("refund");

	private final String code;

	PaymentType(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static PaymentType fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (PaymentType value : values()) {
			if (value.code.equalsIgnoreCase(code)) {
				return value;
			}
		}
		return null;
	}
}
