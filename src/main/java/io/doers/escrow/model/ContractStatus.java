package io.doers.escrow.model;

/**
 * Contract lifecycle states. Codes correspond to values stored in contracts.status.
 * COMPLETED and CANCELLED are terminal.
 */
public enum ContractStatus {
	PENDING("pending"),
	ACCEPTED("accepted"),
	IN_PROGRESS("in_progress"),
	AWAITING_CONFIRMATION("awaiting_confirmation"),
	COMPLETED("completed"),
	DISPUTED("disputed"),
	CANCELLED("cancelled");

	private final String code;

	ContractStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	public boolean isTerminal() {
		return this == COMPLETED || this == CANCELLED;
	}

	@Override
	public String toString() {
		return code;
	}

	/**
	 * Get ContractStatus from status code string.
	 * @param code Status code string
	 * @return ContractStatus enum value, or null if not found
	 */
	public static ContractStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (ContractStatus status : values()) {
			if (status.code.equalsIgnoreCase(code)) {
				return status;
			}
		}
		return null;
	}
}
