package io.doers.escrow.model;

/**
 * Escrow state mirrored on the contract row. Codes match the contracts.escrow_status column.
 */
public enum EscrowStatus {
	PENDING("pending"),
	HELD("held"),
	RELEASED("released"),
	REFUNDED("refunded"),
	DISPUTED("disputed");

	private final String code;

	EscrowStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static EscrowStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (EscrowStatus value : values()) {
			if (value.code.equalsIgnoreCase(code)) {
				return value;
			}
		}
		return null;
	}
}
