package io.doers.escrow.model;

/**
 * Two-phase status of a balance ledger row.
 */
public enum BalanceTransactionStatus {
	PENDING("pending"),
	COMPLETED("completed"),
	REVERSED("reversed");

	private final String code;

	BalanceTransactionStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static BalanceTransactionStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (BalanceTransactionStatus value : values()) {
			if (value.code.equalsIgnoreCase(code)) {
				return value;
			}
		}
		return null;
	}
}
