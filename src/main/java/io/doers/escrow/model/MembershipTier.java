package io.doers.escrow.model;

/**
 * Paid membership level of a user. Default commission rates per tier live in configuration.
 */
public enum MembershipTier {
	FREE("free"),
	PRO("pro"),
	SUPER_PRO("super_pro");

	private final String code;

	MembershipTier(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	/**
	 * Unknown or missing codes resolve to FREE.
	 */
	public static MembershipTier fromCode(String code) {
		if (code == null) {
			return FREE;
		}
		for (MembershipTier tier : values()) {
			if (tier.code.equalsIgnoreCase(code)) {
				return tier;
			}
		}
		return FREE;
	}
}
