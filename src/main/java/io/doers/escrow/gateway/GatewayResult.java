package io.doers.escrow.gateway;

/**
 * Answer from one gateway call. {@code reference} is the order id, capture id or
 * refund id depending on the call.
 */
public class GatewayResult {
	private final boolean success;
	private final String reference;
	private final String status;
	private final String failureReason;

	public GatewayResult(boolean success, String reference, String status, String failureReason) {
		this.success = success;
		this.reference = reference;
		this.status = status;
		this.failureReason = failureReason;
	}

	public static GatewayResult ok(String reference, String status) {
		return new GatewayResult(true, reference, status, null);
	}

	public static GatewayResult fail(String reason) {
		return new GatewayResult(false, null, "FAILED", reason);
	}

	public boolean isSuccess() {
		return success;
	}

	public String getReference() {
		return reference;
	}

	public String getStatus() {
		return status;
	}

	public String getFailureReason() {
		return failureReason;
	}

	@Override
	public String toString() {
		return "GatewayResult{success=" + success + ", reference=" + reference + ", status=" + status
			+ ", failureReason=" + failureReason + "}";
	}
}
