package io.doers.escrow.model;

/**
 * Events accepted by the contract lifecycle. Codes are the values sent by API callers.
 */
public enum ContractEvent {
	CLIENT_ACCEPT_TERMS("client_accept_terms"),
	DOER_ACCEPT_TERMS("doer_accept_terms"),
	START("start"),
	CLIENT_CONFIRM("client_confirm"),
	DOER_CONFIRM("doer_confirm"),
	CANCEL("cancel"),
	DISPUTE("dispute");

	private final String code;

	ContractEvent(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}

	public static ContractEvent fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (ContractEvent event : values()) {
			if (event.code.equalsIgnoreCase(code)) {
				return event;
			}
		}
		return null;
	}
}
