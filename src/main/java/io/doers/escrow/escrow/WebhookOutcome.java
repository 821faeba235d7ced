package io.doers.escrow.escrow;

public enum WebhookOutcome {
	APPLIED,
	DUPLICATE,
	NO_CHANGE,
	IGNORED
}
