package io.doers.escrow.contract;

import io.doers.escrow.dlq.DeadLetterQueueService;
import io.doers.escrow.escrow.EscrowLedgerService;
import io.doers.escrow.model.CancelledByRole;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.Payment;
import io.doers.escrow.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Refunds whatever is still held in escrow for a cancelled contract. Orders that were never
 * captured are left alone. A failed refund goes to the DLQ for an operator; the
 * cancellation itself stays committed.
 */
@Component
public class RefundOnCancellationPolicy implements CancellationEscrowPolicy {

	private static final Logger log = LoggerFactory.getLogger(RefundOnCancellationPolicy.class);

	static final String OPERATION = "cancellation-refund";

	private final EscrowLedgerService escrowLedger;
	private final DeadLetterQueueService dlqService;

	public RefundOnCancellationPolicy(EscrowLedgerService escrowLedger, DeadLetterQueueService dlqService) {
		this.escrowLedger = escrowLedger;
		this.dlqService = dlqService;
	}

	@Override
	public void onCancelled(Contract contract, UUID cancelledById, CancelledByRole role, String reason) {
		Optional<Payment> escrow = escrowLedger.findEscrowPayment(contract.getContractId());
		if (escrow.isEmpty() || !escrow.get().getStatus().isRefundable()) {
			log.info("No held escrow to refund on cancellation: contractId={}", contract.getContractId());
			return;
		}
		Payment payment = escrow.get();
		String refundReason = "Contract cancelled by " + role.getCode() + (reason != null ? ": " + reason : "");
		try {
			escrowLedger.refund(payment.getPaymentId(), refundReason, cancelledById, null);
		} catch (Exception e) {
			LoggingUtils.logError(log, "Refund after cancellation failed", contract.getContractId(), OPERATION, e);
			Map<String, Object> payload = new HashMap<>();
			payload.put("paymentId", payment.getPaymentId());
			payload.put("cancelledBy", cancelledById);
			payload.put("role", role.getCode());
			payload.put("reason", refundReason);
			dlqService.addToDLQ(contract.getContractId(), OPERATION, payload, e, e.getClass().getSimpleName());
		}
	}
}
