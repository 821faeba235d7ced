package io.doers.escrow.model;

/**
 * Ledger row kinds. Credits increase the balance on confirmation, debits decrease it.
 */
public enum BalanceTransactionType {
	PAYMENT("payment", true),
	REFUND("refund", true),
	BONUS("bonus", true),
	WITHDRAWAL("withdrawal", false),
	ADJUSTMENT_DEBIT("adjustment_debit", false);

	private final String code;
	private final boolean credit;

	BalanceTransactionType(String code, boolean credit) {
		this.code = code;
		this.credit = credit;
	}

	public String getCode() {
		return code;
	}

	public boolean isCredit() {
		return credit;
	}

	@Override
	public String toString() {
		return code;
	}

	public static BalanceTransactionType fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (BalanceTransactionType type : values()) {
			if (type.code.equalsIgnoreCase(code)) {
				return type;
			}
		}
		return null;
	}
}
