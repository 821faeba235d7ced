package io.doers.escrow.contract;

import io.doers.escrow.model.ContractEvent;
import io.doers.escrow.model.ContractStatus;

import java.util.UUID;

/**
 * Outcome of one lifecycle event. A rejected event changed nothing; the reason says why.
 */
public class TransitionResult {

	private final UUID contractId;
	private final ContractEvent event;
	private final boolean accepted;
	private final ContractStatus status;
	private final String rejectionReason;

	private TransitionResult(UUID contractId, ContractEvent event, boolean accepted, ContractStatus status,
			String rejectionReason) {
		this.contractId = contractId;
		this.event = event;
		this.accepted = accepted;
		this.status = status;
		this.rejectionReason = rejectionReason;
	}

	public static TransitionResult ok(UUID contractId, ContractEvent event, ContractStatus status) {
		return new TransitionResult(contractId, event, true, status, null);
	}

	public static TransitionResult rejected(UUID contractId, ContractEvent event, ContractStatus status, String reason) {
		return new TransitionResult(contractId, event, false, status, reason);
	}

	public UUID getContractId() {
		return contractId;
	}

	public ContractEvent getEvent() {
		return event;
	}

	public boolean isAccepted() {
		return accepted;
	}

	public ContractStatus getStatus() {
		return status;
	}

	public String getRejectionReason() {
		return rejectionReason;
	}

	@Override
	public String toString() {
		return accepted
			? String.format("TransitionResult{contractId=%s, event=%s, status=%s}", contractId, event, status)
			: String.format("TransitionResult{contractId=%s, event=%s, rejected=%s}", contractId, event, rejectionReason);
	}
}
