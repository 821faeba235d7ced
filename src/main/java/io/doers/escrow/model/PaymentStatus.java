package io.doers.escrow.model;

/**
 * Escrow ledger states for a single payment row.
 *
 * pending -> processing -> held_escrow -> completed
 * held_escrow -> refunded | partial_refund
 * partial_refund -> partial_refund | refunded | completed
 * pending | processing -> failed
 */
public enum PaymentStatus {
	PENDING("pending"),
	PROCESSING("processing"),
	HELD_ESCROW("held_escrow"),
	COMPLETED("completed"),
	REFUNDED("refunded"),
	PARTIAL_REFUND("partial_refund"),
	FAILED("failed");

	private final String code;

	PaymentStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	/**
	 * Statuses a refund may be issued from.
	 */
	public boolean isRefundable() {
		return this == HELD_ESCROW || this == PARTIAL_REFUND;
	}

	/**
	 * Statuses escrow may be released to the recipient from.
	 */
	public boolean isReleasable() {
		return this == HELD_ESCROW || this == PARTIAL_REFUND;
	}

	@Override
	public String toString() {
		return code;
	}

	public static PaymentStatus fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (PaymentStatus status : values()) {
			if (status.code.equalsIgnoreCase(code)) {
				return status;
			}
		}
		return null;
	}
}
