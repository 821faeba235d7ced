package io.doers.escrow.contract;

import io.doers.escrow.model.CancelledByRole;
import io.doers.escrow.model.Contract;

import java.util.UUID;

/**
 * Decides what happens to a contract's escrowed funds once the contract is cancelled.
 * Called after the cancellation has committed; an implementation must not throw.
 */
public interface CancellationEscrowPolicy {

	void onCancelled(Contract contract, UUID cancelledById, CancelledByRole role, String reason);
}
