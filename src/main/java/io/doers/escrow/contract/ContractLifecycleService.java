package io.doers.escrow.contract;

import io.doers.escrow.allocation.AllocationResult;
import io.doers.escrow.allocation.AllocationService;
import io.doers.escrow.audit.AuditService;
import io.doers.escrow.commission.CommissionQuote;
import io.doers.escrow.commission.CommissionService;
import io.doers.escrow.escrow.EscrowLedgerService;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.ledger.BalanceLedgerService;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.model.BalanceTransaction;
import io.doers.escrow.model.CancelledByRole;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.ContractEvent;
import io.doers.escrow.model.ContractPaymentStatus;
import io.doers.escrow.model.ContractStatus;
import io.doers.escrow.model.EscrowStatus;
import io.doers.escrow.model.Job;
import io.doers.escrow.model.Payment;
import io.doers.escrow.model.PaymentStatus;
import io.doers.escrow.model.WorkerAllocation;
import io.doers.escrow.notification.NotificationOutbox;
import io.doers.escrow.notification.NotificationTemplate;
import io.doers.escrow.repo.ContractRepository;
import io.doers.escrow.repo.JobRepository;
import io.doers.escrow.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract state machine.
 *
 * pending -> accepted -> in_progress -> awaiting_confirmation -> completed
 * cancelled from any non-terminal state, disputed from in_progress or awaiting_confirmation.
 *
 * Each event is one conditional UPDATE on the contract row; losing a race shows up as zero
 * affected rows and is reported as a rejection. Completion releases held escrow and records
 * the doer's pending payout in the same transaction. Notifications go to the outbox only
 * after that transaction has committed.
 */
@Service
public class ContractLifecycleService {

	private static final Logger log = LoggerFactory.getLogger(ContractLifecycleService.class);

	static final String TRIGGER_CONFIRMED = "confirmed";
	static final String TRIGGER_AUTO = "auto";

	private final ContractRepository contracts;
	private final JobRepository jobs;
	private final AllocationService allocationService;
	private final CommissionService commissionService;
	private final EscrowLedgerService escrowLedger;
	private final BalanceLedgerService balanceLedger;
	private final CancellationEscrowPolicy cancellationPolicy;
	private final TransactionOperations tx;
	private final AuditService auditService;
	private final EscrowMetrics metrics;
	private final NotificationOutbox outbox;
	private final Clock clock;

	public ContractLifecycleService(ContractRepository contracts, JobRepository jobs,
			AllocationService allocationService, CommissionService commissionService,
			EscrowLedgerService escrowLedger, BalanceLedgerService balanceLedger,
			CancellationEscrowPolicy cancellationPolicy, TransactionOperations tx, AuditService auditService,
			EscrowMetrics metrics, NotificationOutbox outbox, Clock clock) {
		this.contracts = contracts;
		this.jobs = jobs;
		this.allocationService = allocationService;
		this.commissionService = commissionService;
		this.escrowLedger = escrowLedger;
		this.balanceLedger = balanceLedger;
		this.cancellationPolicy = cancellationPolicy;
		this.tx = tx;
		this.auditService = auditService;
		this.metrics = metrics;
		this.outbox = outbox;
		this.clock = clock;
	}

	// ------------------------------------------------------------------
	// Creation
	// ------------------------------------------------------------------

	/**
	 * Freezes the job's worker split and creates one pending contract per worker. The
	 * commission is quoted for the client now and stored on the contract; later changes to
	 * the client's tier or referral discount do not affect it. A worker whose share rounds
	 * down to zero stays in the frozen allocation but gets no contract.
	 */
	public List<Contract> createContractsForJob(UUID jobId, List<UUID> workers, List<BigDecimal> explicitPercentages) {
		List<Contract> created = tx.execute(status -> {
			Job job = jobs.findById(jobId)
				.orElseThrow(() -> new EscrowValidationException("unknown job: " + jobId, "jobId", jobId));
			AllocationResult allocation = allocationService.finalizeAllocation(jobId, workers, explicitPercentages);

			Instant now = clock.instant();
			List<Contract> rows = new ArrayList<>();
			for (WorkerAllocation share : allocation.getAllocations()) {
				if (share.getAllocatedAmount().signum() <= 0) {
					log.info("No contract for zero share: jobId={} workerId={} percentage={}",
						jobId, share.getWorkerId(), share.getPercentage());
					continue;
				}
				CommissionQuote quote = commissionService.calculateCommission(job.getClientId(), share.getAllocatedAmount());

				Contract c = new Contract();
				c.setContractId(UUID.randomUUID());
				c.setJobId(jobId);
				c.setClientId(job.getClientId());
				c.setDoerId(share.getWorkerId());
				c.setPrice(share.getAllocatedAmount());
				c.setCommission(quote.getCommission());
				c.setCommissionRate(quote.getRate());
				c.setTotalPrice(quote.getTotalPrice());
				c.setStatus(ContractStatus.PENDING);
				c.setEscrowStatus(EscrowStatus.PENDING);
				c.setPaymentStatus(ContractPaymentStatus.PENDING);
				c.setAllocatedAmount(share.getAllocatedAmount());
				c.setPercentageOfBudget(share.getPercentage());
				c.setCreatedOn(now);
				c.setUpdatedOn(now);
				contracts.insert(c);
				rows.add(c);
			}
			if (rows.isEmpty()) {
				throw new EscrowValidationException("no worker received a non-zero share of the budget",
					"percentages", explicitPercentages);
			}
			return rows;
		});

		for (Contract c : created) {
			log.info("Contract created: contractId={} jobId={} doerId={} price={} commissionRate={} totalPrice={}",
				c.getContractId(), jobId, c.getDoerId(), c.getPrice(), c.getCommissionRate(), c.getTotalPrice());
			auditService.logContractTransition(c.getContractId(), null, ContractStatus.PENDING.getCode(),
				String.valueOf(c.getClientId()));
		}
		return created;
	}

	public Contract getContract(UUID contractId) {
		return contracts.findById(contractId)
			.orElseThrow(() -> new EscrowValidationException("unknown contract: " + contractId, "contractId", contractId));
	}

	public List<Contract> contractsForJob(UUID jobId) {
		return contracts.findByJobId(jobId);
	}

	// ------------------------------------------------------------------
	// Events
	// ------------------------------------------------------------------

	public TransitionResult advanceContract(UUID contractId, ContractEvent event, UUID actorId) {
		return advanceContract(contractId, event, actorId, null);
	}

	/**
	 * Applies one party event. The actor must be the client or the doer of the contract,
	 * and the side that matches the event. Admin cancellation goes through {@link #cancelByAdmin}.
	 */
	public TransitionResult advanceContract(UUID contractId, ContractEvent event, UUID actorId, String reason) {
		if (event == null) {
			throw new EscrowValidationException("event is required", "event", null);
		}
		LoggingUtils.setContractId(contractId);
		try {
			Contract contract = getContract(contractId);
			CancelledByRole party = partyOf(contract, actorId);
			if (party == null) {
				return TransitionResult.rejected(contractId, event, contract.getStatus(), "actor is not a party to this contract");
			}

			switch (event) {
				case CLIENT_ACCEPT_TERMS:
				case DOER_ACCEPT_TERMS:
					return acceptTerms(contract, event, party);
				case START:
					return start(contract, actorId);
				case CLIENT_CONFIRM:
				case DOER_CONFIRM:
					return confirm(contract, event, party, actorId);
				case CANCEL:
					return cancel(contract, actorId, party, reason);
				case DISPUTE:
					return dispute(contract, actorId);
				default:
					return TransitionResult.rejected(contractId, event, contract.getStatus(), "unsupported event " + event);
			}
		} finally {
			LoggingUtils.clearContractId();
		}
	}

	public TransitionResult cancelByAdmin(UUID contractId, UUID adminId, String reason) {
		if (reason == null || reason.isBlank()) {
			throw new EscrowValidationException("cancellation reason is required", "reason", reason);
		}
		return cancel(getContract(contractId), adminId, CancelledByRole.ADMIN, reason);
	}

	/**
	 * in_progress -> awaiting_confirmation once the job's end date has passed.
	 *
	 * @return false when the contract was not in progress
	 */
	public boolean markAwaitingConfirmation(UUID contractId) {
		Instant now = clock.instant();
		if (contracts.moveToAwaitingConfirmation(contractId, now) == 0) {
			return false;
		}
		Contract contract = getContract(contractId);
		log.info("Contract awaiting confirmation: contractId={} awaitingSince={}",
			contractId, contract.getAwaitingConfirmationAt());
		auditService.logContractTransition(contractId, ContractStatus.IN_PROGRESS.getCode(),
			ContractStatus.AWAITING_CONFIRMATION.getCode(), "system");
		Map<String, Object> data = Map.of("contractId", contractId.toString());
		outbox.enqueue(contract.getClientId(), NotificationTemplate.CONTRACT_AWAITING_CONFIRMATION, data);
		outbox.enqueue(contract.getDoerId(), NotificationTemplate.CONTRACT_AWAITING_CONFIRMATION, data);
		return true;
	}

	/**
	 * Forced completion for a contract whose grace window ran out. A contract completed,
	 * cancelled or disputed in the meantime is not touched.
	 *
	 * @param deadline contracts awaiting since this instant or earlier qualify
	 * @return false when the contract no longer qualified
	 */
	public boolean autoConfirm(UUID contractId, Instant deadline) {
		Instant now = clock.instant();
		Optional<Completion> completion = tx.execute(status -> {
			if (contracts.autoConfirm(contractId, deadline, now) == 0) {
				return Optional.<Completion>empty();
			}
			return Optional.of(completeInTransaction(getContract(contractId), now));
		});
		if (completion.isEmpty()) {
			return false;
		}
		Completion done = completion.get();
		log.info("Contract auto-confirmed: contractId={} payout={} escrowReleased={}",
			contractId, done.payoutAmount(), done.releasedPayment != null);
		auditService.logAutoConfirmed(contractId, done.payoutAmount());
		afterCompletion(done, TRIGGER_AUTO, NotificationTemplate.CONTRACT_AUTO_COMPLETED);
		return true;
	}

	// ------------------------------------------------------------------
	// Event handlers
	// ------------------------------------------------------------------

	private TransitionResult acceptTerms(Contract contract, ContractEvent event, CancelledByRole party) {
		boolean byClient = event == ContractEvent.CLIENT_ACCEPT_TERMS;
		if (byClient != (party == CancelledByRole.CLIENT)) {
			return TransitionResult.rejected(contract.getContractId(), event, contract.getStatus(),
				"event does not match the acting party");
		}
		UUID contractId = contract.getContractId();
		Instant now = clock.instant();
		Boolean accepted = tx.execute(status -> {
			if (contracts.acceptTerms(contractId, byClient, now) == 0) {
				return null;
			}
			return contracts.markAcceptedIfBothTermsAccepted(contractId, now) == 1;
		});
		if (accepted == null) {
			return rejectedWithCurrent(contractId, event, "terms already accepted or contract not pending");
		}
		if (accepted) {
			log.info("Contract accepted by both parties: contractId={}", contractId);
			auditService.logContractTransition(contractId, ContractStatus.PENDING.getCode(),
				ContractStatus.ACCEPTED.getCode(), party.getCode());
			return TransitionResult.ok(contractId, event, ContractStatus.ACCEPTED);
		}
		return TransitionResult.ok(contractId, event, ContractStatus.PENDING);
	}

	private TransitionResult start(Contract contract, UUID actorId) {
		UUID contractId = contract.getContractId();
		if (contracts.start(contractId, clock.instant()) == 0) {
			return rejectedWithCurrent(contractId, ContractEvent.START, "contract is not accepted");
		}
		log.info("Contract started: contractId={} actorId={}", contractId, actorId);
		auditService.logContractTransition(contractId, ContractStatus.ACCEPTED.getCode(),
			ContractStatus.IN_PROGRESS.getCode(), String.valueOf(actorId));
		return TransitionResult.ok(contractId, ContractEvent.START, ContractStatus.IN_PROGRESS);
	}

	private TransitionResult confirm(Contract contract, ContractEvent event, CancelledByRole party, UUID actorId) {
		boolean byClient = event == ContractEvent.CLIENT_CONFIRM;
		if (byClient != (party == CancelledByRole.CLIENT)) {
			return TransitionResult.rejected(contract.getContractId(), event, contract.getStatus(),
				"event does not match the acting party");
		}
		UUID contractId = contract.getContractId();
		Instant now = clock.instant();

		ConfirmOutcome outcome = tx.execute(status -> {
			if (contracts.recordConfirmation(contractId, byClient, now) == 0) {
				return null;
			}
			// the first confirmation opens the grace window
			boolean movedToAwaiting = contracts.moveToAwaitingConfirmation(contractId, now) == 1;
			if (contracts.completeConfirmed(contractId, now) == 0) {
				return new ConfirmOutcome(movedToAwaiting, null);
			}
			return new ConfirmOutcome(movedToAwaiting, completeInTransaction(getContract(contractId), now));
		});

		if (outcome == null) {
			return rejectedWithCurrent(contractId, event, "already confirmed or contract not confirmable");
		}
		log.info("Contract confirmed: contractId={} by={} actorId={}", contractId, party.getCode(), actorId);
		if (outcome.completion != null) {
			auditService.logContractTransition(contractId, ContractStatus.AWAITING_CONFIRMATION.getCode(),
				ContractStatus.COMPLETED.getCode(), String.valueOf(actorId));
			afterCompletion(outcome.completion, TRIGGER_CONFIRMED, NotificationTemplate.CONTRACT_COMPLETED);
			return TransitionResult.ok(contractId, event, ContractStatus.COMPLETED);
		}
		if (outcome.movedToAwaiting) {
			auditService.logContractTransition(contractId, ContractStatus.IN_PROGRESS.getCode(),
				ContractStatus.AWAITING_CONFIRMATION.getCode(), String.valueOf(actorId));
			UUID otherParty = byClient ? contract.getDoerId() : contract.getClientId();
			outbox.enqueue(otherParty, NotificationTemplate.CONTRACT_AWAITING_CONFIRMATION,
				Map.of("contractId", contractId.toString(), "confirmedBy", party.getCode()));
		}
		return TransitionResult.ok(contractId, event, ContractStatus.AWAITING_CONFIRMATION);
	}

	private TransitionResult cancel(Contract contract, UUID actorId, CancelledByRole role, String reason) {
		UUID contractId = contract.getContractId();
		if (contracts.cancel(contractId, actorId, role, reason, clock.instant()) == 0) {
			return rejectedWithCurrent(contractId, ContractEvent.CANCEL, "contract is already " + contract.getStatus());
		}
		log.info("Contract cancelled: contractId={} by={} actorId={} reason={}", contractId, role, actorId, reason);
		auditService.logContractTransition(contractId, contract.getStatus().getCode(),
			ContractStatus.CANCELLED.getCode(), String.valueOf(actorId));

		cancellationPolicy.onCancelled(contract, actorId, role, reason);

		Map<String, Object> data = Map.of(
			"contractId", contractId.toString(),
			"cancelledBy", role.getCode(),
			"reason", reason != null ? reason : "");
		if (role != CancelledByRole.CLIENT) {
			outbox.enqueue(contract.getClientId(), NotificationTemplate.CONTRACT_CANCELLED, data);
		}
		if (role != CancelledByRole.DOER) {
			outbox.enqueue(contract.getDoerId(), NotificationTemplate.CONTRACT_CANCELLED, data);
		}
		return TransitionResult.ok(contractId, ContractEvent.CANCEL, ContractStatus.CANCELLED);
	}

	private TransitionResult dispute(Contract contract, UUID actorId) {
		UUID contractId = contract.getContractId();
		if (contracts.dispute(contractId, actorId, clock.instant()) == 0) {
			return rejectedWithCurrent(contractId, ContractEvent.DISPUTE, "contract cannot be disputed");
		}
		log.warn("Contract disputed: contractId={} actorId={}", contractId, actorId);
		auditService.logContractTransition(contractId, contract.getStatus().getCode(),
			ContractStatus.DISPUTED.getCode(), String.valueOf(actorId));
		Map<String, Object> data = Map.of("contractId", contractId.toString(), "disputedBy", actorId.toString());
		outbox.enqueue(contract.getClientId(), NotificationTemplate.CONTRACT_DISPUTED, data);
		outbox.enqueue(contract.getDoerId(), NotificationTemplate.CONTRACT_DISPUTED, data);
		return TransitionResult.ok(contractId, ContractEvent.DISPUTE, ContractStatus.DISPUTED);
	}

	// ------------------------------------------------------------------
	// Completion
	// ------------------------------------------------------------------

	/**
	 * Runs inside the completing transaction: release the escrow, then record the doer's
	 * pending payout for the frozen allocation, reduced by whatever was refunded to the
	 * client. Without a captured escrow (never paid, or refunded in full) the contract
	 * completes but nothing is paid out.
	 */
	private Completion completeInTransaction(Contract contract, Instant now) {
		UUID contractId = contract.getContractId();
		Optional<Payment> released = escrowLedger.releaseForCompletedContract(contractId, now);
		if (released.isPresent()) {
			contracts.markEscrowReleased(contractId, now);
		}
		Optional<Payment> funding = released.isPresent()
			? released
			: escrowLedger.findEscrowPayment(contractId).filter(p -> p.getStatus() == PaymentStatus.COMPLETED);
		if (funding.isEmpty()) {
			log.warn("Contract completed without escrow funds, no payout recorded: contractId={} escrowStatus={}",
				contractId, contract.getEscrowStatus());
			return new Completion(contract, null, null);
		}
		BigDecimal payoutAmount = funding.get().retainedShareOf(contract.payoutAmount());
		if (payoutAmount.compareTo(contract.payoutAmount()) != 0) {
			log.info("Payout reduced by refunds: contractId={} allocated={} payout={} refunded={}",
				contractId, contract.payoutAmount(), payoutAmount, funding.get().getRefundedAmount());
		}
		BalanceTransaction payout = balanceLedger.recordPending(contract.getDoerId(), payoutAmount,
			contractId, "Payout for contract " + contractId);
		return new Completion(contract, released.orElse(null), payout);
	}

	private void afterCompletion(Completion done, String trigger, NotificationTemplate template) {
		Contract contract = done.contract;
		metrics.recordContractCompleted(trigger);
		if (done.releasedPayment != null) {
			escrowLedger.afterRelease(done.releasedPayment, "contract-" + trigger);
		}
		Map<String, Object> data = Map.of(
			"contractId", contract.getContractId().toString(),
			"payoutAmount", done.payoutAmount().toPlainString());
		outbox.enqueue(contract.getClientId(), template, data);
		outbox.enqueue(contract.getDoerId(), template, data);
	}

	private TransitionResult rejectedWithCurrent(UUID contractId, ContractEvent event, String reason) {
		ContractStatus current = contracts.findById(contractId).map(Contract::getStatus).orElse(null);
		log.info("Contract event rejected: contractId={} event={} status={} reason={}", contractId, event, current, reason);
		return TransitionResult.rejected(contractId, event, current, reason);
	}

	private static CancelledByRole partyOf(Contract contract, UUID actorId) {
		if (actorId == null) {
			return null;
		}
		if (actorId.equals(contract.getClientId())) {
			return CancelledByRole.CLIENT;
		}
		if (actorId.equals(contract.getDoerId())) {
			return CancelledByRole.DOER;
		}
		return null;
	}

	private static final class Completion {
		private final Contract contract;
		private final Payment releasedPayment;
		private final BalanceTransaction payout;

		private Completion(Contract contract, Payment releasedPayment, BalanceTransaction payout) {
			this.contract = contract;
			this.releasedPayment = releasedPayment;
			this.payout = payout;
		}

		private BigDecimal payoutAmount() {
			return payout != null ? payout.getAmount() : BigDecimal.ZERO;
		}
	}

	private static final class ConfirmOutcome {
		private final boolean movedToAwaiting;
		private final Completion completion;

		private ConfirmOutcome(boolean movedToAwaiting, Completion completion) {
			this.movedToAwaiting = movedToAwaiting;
			this.completion = completion;
		}
	}
}
