package io.doers.escrow.model;

public enum CancelledByRole {
	CLIENT("client"),
	DOER("doer"),
	ADMIN("admin"),
	SYSTEM("system");

	private final String code;

	CancelledByRole(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static CancelledByRole fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (CancelledByRole value : values()) {
			if (value.code.equalsIgnoreCase(code)) {
				return value;
			}
		}
		return null;
	}
}
