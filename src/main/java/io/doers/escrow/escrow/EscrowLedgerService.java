package io.doers.escrow.escrow;

import io.doers.escrow.audit.AuditService;
import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.exception.CaptureDeclinedException;
import io.doers.escrow.exception.EscrowPreconditionException;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.exception.PaymentGatewayException;
import io.doers.escrow.gateway.GatewayResult;
import io.doers.escrow.gateway.PaymentGatewayClient;
import io.doers.escrow.gateway.PaymentGatewayFactory;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.ContractPaymentStatus;
import io.doers.escrow.model.EscrowStatus;
import io.doers.escrow.model.Payment;
import io.doers.escrow.model.PaymentStatus;
import io.doers.escrow.model.PaymentType;
import io.doers.escrow.notification.NotificationOutbox;
import io.doers.escrow.notification.NotificationTemplate;
import io.doers.escrow.repo.ContractRepository;
import io.doers.escrow.repo.PaymentRepository;
import io.doers.escrow.repo.ProcessedGatewayEventRepository;
import io.doers.escrow.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * State machine of one escrow payment.
 *
 * Each command loads the row, checks its guard and performs one conditional write;
 * gateway calls complete before the local write commits. Release is at most once:
 * only the caller whose UPDATE ... WHERE status = 'held_escrow' hits a row wins.
 */
@Service
public class EscrowLedgerService {

	private static final Logger log = LoggerFactory.getLogger(EscrowLedgerService.class);

	private final PaymentRepository payments;
	private final ContractRepository contracts;
	private final ProcessedGatewayEventRepository processedEvents;
	private final PaymentGatewayFactory gatewayFactory;
	private final TransactionOperations tx;
	private final AuditService auditService;
	private final EscrowMetrics metrics;
	private final NotificationOutbox outbox;
	private final EscrowProperties props;
	private final Clock clock;

	public EscrowLedgerService(PaymentRepository payments, ContractRepository contracts,
			ProcessedGatewayEventRepository processedEvents, PaymentGatewayFactory gatewayFactory,
			TransactionOperations tx, AuditService auditService, EscrowMetrics metrics, NotificationOutbox outbox,
			EscrowProperties props, Clock clock) {
		this.payments = payments;
		this.contracts = contracts;
		this.processedEvents = processedEvents;
		this.gatewayFactory = gatewayFactory;
		this.tx = tx;
		this.auditService = auditService;
		this.metrics = metrics;
		this.outbox = outbox;
		this.props = props;
		this.clock = clock;
	}

	// ------------------------------------------------------------------
	// Order and capture
	// ------------------------------------------------------------------

	/**
	 * Opens a gateway order for the contract's total price and records a pending escrow
	 * payment. Returns the open payment instead if one already exists.
	 */
	public Payment createOrder(UUID contractId) {
		Contract contract = contracts.findById(contractId)
			.orElseThrow(() -> new EscrowValidationException("unknown contract: " + contractId, "contractId", contractId));
		if (contract.getStatus().isTerminal()) {
			throw new EscrowPreconditionException("contract is " + contract.getStatus(), contractId,
				contract.getStatus().getCode());
		}
		Optional<Payment> existing = payments.findEscrowByContractId(contractId);
		if (existing.isPresent()) {
			Payment p = existing.get();
			if (p.getStatus() == PaymentStatus.PENDING || p.getStatus() == PaymentStatus.PROCESSING) {
				log.info("Reusing open escrow order: contractId={} paymentId={}", contractId, p.getPaymentId());
				return p;
			}
			if (p.getStatus() != PaymentStatus.FAILED) {
				throw EscrowPreconditionException.alreadyProcessed(contractId, p.getStatus().getCode());
			}
		}

		PaymentGatewayClient gateway = gatewayFactory.get();
		GatewayResult order = gateway.createOrder(contract.getTotalPrice(), props.getCurrency(),
			"Contract " + contractId);
		if (!order.isSuccess()) {
			metrics.recordPaymentFailure("CREATE_ORDER");
			throw new PaymentGatewayException(order.getFailureReason(), null, "create-order");
		}

		Instant now = clock.instant();
		Payment payment = new Payment();
		payment.setPaymentId(UUID.randomUUID());
		payment.setContractId(contractId);
		payment.setPayerId(contract.getClientId());
		payment.setRecipientId(contract.getDoerId());
		payment.setAmount(contract.getTotalPrice());
		payment.setCurrency(props.getCurrency());
		payment.setStatus(PaymentStatus.PENDING);
		payment.setPaymentType(PaymentType.ESCROW_DEPOSIT);
		payment.setEscrow(true);
		payment.setPlatformFee(contract.getCommission());
		payment.setPlatformFeePercentage(contract.getCommissionRate());
		payment.setGatewayOrderId(order.getReference());
		payment.setRefundedAmount(BigDecimal.ZERO);
		payment.setMetadata("{\"gateway\":\"" + gateway.name() + "\",\"jobId\":\"" + contract.getJobId() + "\"}");
		payment.setCreatedOn(now);
		payment.setUpdatedOn(now);
		payments.insert(payment);

		log.info("Escrow order created: contractId={} paymentId={} orderId={} amount={}",
			contractId, payment.getPaymentId(), order.getReference(), payment.getAmount());
		return payment;
	}

	/**
	 * Captures the order and moves the payment into escrow.
	 * <ul>
	 *   <li>replayed event id or payment already held: returns the payment unchanged</li>
	 *   <li>gateway declines: payment becomes failed, {@link CaptureDeclinedException} is thrown</li>
	 *   <li>gateway unavailable: nothing changes, {@link PaymentGatewayException} is thrown</li>
	 * </ul>
	 */
	public Payment capture(UUID paymentId, String gatewayEventId) {
		LoggingUtils.setPaymentId(paymentId);
		if (gatewayEventId != null && processedEvents.exists(gatewayEventId)) {
			log.info("Capture event already processed: paymentId={} eventId={}", paymentId, gatewayEventId);
			return loadPayment(paymentId);
		}

		CaptureOutcome outcome = tx.execute(status -> {
			Payment payment = payments.lockById(paymentId)
				.orElseThrow(() -> new EscrowValidationException("unknown payment: " + paymentId, "paymentId", paymentId));
			if (payment.getStatus() != PaymentStatus.PENDING && payment.getStatus() != PaymentStatus.PROCESSING) {
				if (payment.getStatus() == PaymentStatus.FAILED) {
					throw new EscrowPreconditionException("payment already failed", paymentId, payment.getStatus().getCode());
				}
				return CaptureOutcome.unchanged(payment);
			}

			Instant now = clock.instant();
			GatewayResult capture;
			try {
				capture = gatewayFactory.get().captureOrder(payment.getGatewayOrderId());
			} catch (CaptureDeclinedException e) {
				payments.markFailed(paymentId, e.getDeclineCode(), now);
				recordEvent(gatewayEventId, paymentId, "capture-declined", now);
				payment.setStatus(PaymentStatus.FAILED);
				payment.setFailureReason(e.getDeclineCode());
				return CaptureOutcome.declined(payment, e);
			}

			if (payments.markHeld(paymentId, capture.getReference(), now) == 0) {
				throw new IllegalStateException("payment changed while locked: " + paymentId);
			}
			contracts.markEscrowHeld(payment.getContractId(), now);
			recordEvent(gatewayEventId != null ? gatewayEventId : "capture:" + capture.getReference(),
				paymentId, "capture", now);
			payment.setStatus(PaymentStatus.HELD_ESCROW);
			payment.setGatewayCaptureId(capture.getReference());
			return CaptureOutcome.captured(payment);
		});

		Payment payment = outcome.payment;
		if (outcome.declined != null) {
			log.warn("Capture declined: paymentId={} orderId={} code={}",
				paymentId, payment.getGatewayOrderId(), outcome.declined.getDeclineCode());
			metrics.recordPaymentFailure("CAPTURE_DECLINED");
			auditService.logPaymentFailed(paymentId, outcome.declined.getDeclineCode());
			outbox.enqueue(payment.getPayerId(), NotificationTemplate.PAYMENT_FAILED,
				Map.of("paymentId", paymentId.toString()));
			throw outcome.declined;
		}
		if (outcome.captured) {
			log.info("Payment captured into escrow: paymentId={} captureId={} amount={}",
				paymentId, payment.getGatewayCaptureId(), payment.getAmount());
			metrics.recordPaymentCaptured();
			auditService.logPaymentCaptured(paymentId, payment.getGatewayCaptureId(), payment.getAmount());
			notifyEscrowHeld(payment);
		} else {
			log.info("Capture skipped, payment already {}: paymentId={}", payment.getStatus(), paymentId);
		}
		return payment;
	}

	/**
	 * Applies a gateway webhook. Redelivered events (same event id) are dropped.
	 */
	public WebhookOutcome handleWebhook(GatewayWebhookEvent event) {
		if (event == null || event.getEventId() == null || event.getOrderId() == null) {
			throw new EscrowValidationException("webhook event requires eventId and orderId", "event", event);
		}
		Optional<Payment> found = payments.findByGatewayOrderId(event.getOrderId());
		if (found.isEmpty()) {
			log.warn("Webhook for unknown order ignored: eventId={} orderId={}", event.getEventId(), event.getOrderId());
			return WebhookOutcome.IGNORED;
		}
		Payment payment = found.get();
		LoggingUtils.setPaymentId(payment.getPaymentId());

		WebhookOutcome outcome = tx.execute(status -> {
			Instant now = clock.instant();
			if (!processedEvents.markProcessed(event.getEventId(), payment.getPaymentId(), event.getEventType(), now)) {
				return WebhookOutcome.DUPLICATE;
			}
			if (GatewayWebhookEvent.CAPTURE_COMPLETED.equals(event.getEventType())) {
				if (event.getCaptureId() == null) {
					throw new EscrowValidationException("capture webhook without captureId", "captureId", null);
				}
				if (payments.markHeld(payment.getPaymentId(), event.getCaptureId(), now) == 0) {
					return WebhookOutcome.NO_CHANGE;
				}
				contracts.markEscrowHeld(payment.getContractId(), now);
				return WebhookOutcome.APPLIED;
			}
			if (GatewayWebhookEvent.ORDER_APPROVED.equals(event.getEventType())) {
				// approved but not captured yet
				return payments.markProcessing(payment.getPaymentId(), now) == 1
					? WebhookOutcome.APPLIED : WebhookOutcome.NO_CHANGE;
			}
			if (GatewayWebhookEvent.CAPTURE_DENIED.equals(event.getEventType())) {
				String reason = event.getReason() != null ? event.getReason() : "CAPTURE_DENIED";
				return payments.markFailed(payment.getPaymentId(), reason, now) == 1
					? WebhookOutcome.APPLIED : WebhookOutcome.NO_CHANGE;
			}
			return WebhookOutcome.IGNORED;
		});

		log.info("Webhook processed: eventId={} type={} paymentId={} outcome={}",
			event.getEventId(), event.getEventType(), payment.getPaymentId(), outcome);
		if (outcome == WebhookOutcome.APPLIED) {
			if (GatewayWebhookEvent.CAPTURE_COMPLETED.equals(event.getEventType())) {
				payment.setGatewayCaptureId(event.getCaptureId());
				metrics.recordPaymentCaptured();
				auditService.logPaymentCaptured(payment.getPaymentId(), event.getCaptureId(), payment.getAmount());
				notifyEscrowHeld(payment);
			} else if (GatewayWebhookEvent.CAPTURE_DENIED.equals(event.getEventType())) {
				metrics.recordPaymentFailure("CAPTURE_DENIED");
				auditService.logPaymentFailed(payment.getPaymentId(), event.getReason());
			}
		}
		return outcome;
	}

	// ------------------------------------------------------------------
	// Release
	// ------------------------------------------------------------------

	/**
	 * Admin release. A payment that is not held is reported back to the admin:
	 * "already released" when it was released before.
	 */
	public Payment releaseEscrow(UUID paymentId, UUID actingAdminId) {
		LoggingUtils.setPaymentId(paymentId);
		Payment payment = loadPayment(paymentId);
		Instant now = clock.instant();

		boolean released = Boolean.TRUE.equals(tx.execute(status -> {
			if (payments.release(paymentId, actingAdminId, now) == 0) {
				return false;
			}
			contracts.markEscrowReleased(payment.getContractId(), now);
			return true;
		}));

		if (!released) {
			Payment current = loadPayment(paymentId);
			if (current.getStatus() == PaymentStatus.COMPLETED) {
				log.warn("Release rejected, already released: paymentId={} adminId={}", paymentId, actingAdminId);
				throw EscrowPreconditionException.alreadyReleased(paymentId, current.getStatus().getCode());
			}
			throw new EscrowPreconditionException("payment is not held in escrow", paymentId,
				current.getStatus().getCode());
		}

		log.info("Escrow released by admin: paymentId={} adminId={}", paymentId, actingAdminId);
		afterRelease(payment, String.valueOf(actingAdminId));
		return loadPayment(paymentId);
	}

	/**
	 * Release triggered by contract completion. Runs inside the caller's transaction and
	 * holds the payment row lock until it ends, so no refund can land between the snapshot
	 * and the release. A payment that is missing or no longer held is not an error here.
	 *
	 * @return the released payment, empty when nothing was released
	 */
	public Optional<Payment> releaseForCompletedContract(UUID contractId, Instant now) {
		Optional<Payment> escrow = payments.findEscrowByContractId(contractId)
			.flatMap(p -> payments.lockById(p.getPaymentId()));
		if (escrow.isEmpty() || !escrow.get().getStatus().isReleasable()) {
			log.debug("No held escrow to release: contractId={} status={}", contractId,
				escrow.map(p -> p.getStatus().getCode()).orElse("none"));
			return Optional.empty();
		}
		Payment payment = escrow.get();
		if (payments.release(payment.getPaymentId(), null, now) == 0) {
			log.info("Escrow already released by another actor: contractId={} paymentId={}",
				contractId, payment.getPaymentId());
			return Optional.empty();
		}
		payment.setStatus(PaymentStatus.COMPLETED);
		payment.setEscrowReleasedAt(now);
		return Optional.of(payment);
	}

	/**
	 * Post-commit bookkeeping for a release. Called by the contract lifecycle once its
	 * completion transaction has committed.
	 */
	public void afterRelease(Payment payment, String actor) {
		metrics.recordEscrowReleased();
		auditService.logEscrowReleased(payment.getPaymentId(), payment.getContractId(), actor);
		outbox.enqueue(payment.getRecipientId(), NotificationTemplate.ESCROW_RELEASED, Map.of(
			"paymentId", payment.getPaymentId().toString(),
			"contractId", payment.getContractId().toString()));
	}

	// ------------------------------------------------------------------
	// Refund
	// ------------------------------------------------------------------

	/**
	 * Refunds a held payment in full ({@code amount == null}) or in part. Partial refunds
	 * accumulate; once the refunded total reaches the amount the payment is refunded.
	 * The gateway refund must succeed before the local state changes.
	 */
	public Payment refund(UUID paymentId, String reason, UUID actorId, BigDecimal amount) {
		LoggingUtils.setPaymentId(paymentId);
		if (reason == null || reason.isBlank()) {
			throw new EscrowValidationException("refund reason is required", "reason", reason);
		}
		if (amount != null && amount.signum() <= 0) {
			throw new EscrowValidationException("refund amount must be greater than zero", "amount", amount);
		}

		Payment refunded = tx.execute(status -> {
			Payment payment = payments.lockById(paymentId)
				.orElseThrow(() -> new EscrowValidationException("unknown payment: " + paymentId, "paymentId", paymentId));
			if (!payment.getStatus().isRefundable()) {
				throw EscrowPreconditionException.alreadyProcessed(paymentId, payment.getStatus().getCode());
			}
			if (payment.getGatewayCaptureId() == null) {
				throw new EscrowValidationException("payment has no capture to refund", "paymentId", paymentId);
			}
			BigDecimal refundable = payment.refundableAmount();
			BigDecimal refundAmount = amount != null ? amount : refundable;
			if (refundAmount.compareTo(refundable) > 0) {
				throw new EscrowValidationException("refund exceeds refundable amount " + refundable, "amount", amount);
			}
			boolean full = refundAmount.compareTo(refundable) == 0;
			PaymentStatus newStatus = full ? PaymentStatus.REFUNDED : PaymentStatus.PARTIAL_REFUND;

			// 1) gateway first; a rejection leaves the row untouched
			GatewayResult result = gatewayFactory.get().refund(payment.getGatewayCaptureId(),
				full && payment.getRefundedAmount().signum() == 0 ? null : refundAmount);
			if (!result.isSuccess()) {
				metrics.recordPaymentFailure("REFUND_REJECTED");
				throw new PaymentGatewayException(result.getFailureReason(), paymentId, "refund");
			}

			// 2) local conditional write
			Instant now = clock.instant();
			if (payments.applyRefund(paymentId, payment.getRefundedAmount(), refundAmount, newStatus, reason,
					actorId, now) == 0) {
				throw new IllegalStateException("payment changed while locked: " + paymentId);
			}
			if (full) {
				contracts.updateEscrowState(payment.getContractId(), EscrowStatus.REFUNDED,
					ContractPaymentStatus.REFUNDED, now);
			} else {
				contracts.updateEscrowState(payment.getContractId(), EscrowStatus.HELD,
					ContractPaymentStatus.PARTIAL_REFUND, now);
			}
			payment.setStatus(newStatus);
			payment.setRefundedAmount(payment.getRefundedAmount().add(refundAmount));
			payment.setRefundReason(reason);
			payment.setRefundedAt(now);
			payment.setRefundedBy(actorId);
			return payment;
		});

		log.info("Payment refunded: paymentId={} status={} refundedTotal={} actorId={}",
			paymentId, refunded.getStatus(), refunded.getRefundedAmount(), actorId);
		metrics.recordRefund(refunded.getStatus().getCode());
		auditService.logRefund(paymentId, refunded.getRefundedAmount(), refunded.getStatus().getCode(), reason,
			String.valueOf(actorId));
		outbox.enqueue(refunded.getPayerId(), NotificationTemplate.PAYMENT_REFUNDED, Map.of(
			"paymentId", paymentId.toString(),
			"refundedAmount", refunded.getRefundedAmount().toPlainString(),
			"status", refunded.getStatus().getCode()));
		return refunded;
	}

	// ------------------------------------------------------------------
	// Queries
	// ------------------------------------------------------------------

	public Payment loadPayment(UUID paymentId) {
		return payments.findById(paymentId)
			.orElseThrow(() -> new EscrowValidationException("unknown payment: " + paymentId, "paymentId", paymentId));
	}

	public Optional<Payment> findEscrowPayment(UUID contractId) {
		return payments.findEscrowByContractId(contractId);
	}

	public List<Payment> paymentsForContract(UUID contractId) {
		return payments.findByContractId(contractId);
	}

	private void recordEvent(String eventId, UUID paymentId, String type, Instant now) {
		if (eventId != null) {
			processedEvents.markProcessed(eventId, paymentId, type, now);
		}
	}

	private void notifyEscrowHeld(Payment payment) {
		Map<String, Object> data = Map.of(
			"paymentId", payment.getPaymentId().toString(),
			"contractId", payment.getContractId().toString(),
			"amount", payment.getAmount().toPlainString());
		outbox.enqueue(payment.getPayerId(), NotificationTemplate.ESCROW_HELD, data);
		outbox.enqueue(payment.getRecipientId(), NotificationTemplate.ESCROW_HELD, data);
	}

	private static final class CaptureOutcome {
		private final Payment payment;
		private final boolean captured;
		private final CaptureDeclinedException declined;

		private CaptureOutcome(Payment payment, boolean captured, CaptureDeclinedException declined) {
			this.payment = payment;
			this.captured = captured;
			this.declined = declined;
		}

		static CaptureOutcome captured(Payment payment) {
			return new CaptureOutcome(payment, true, null);
		}

		static CaptureOutcome declined(Payment payment, CaptureDeclinedException e) {
			return new CaptureOutcome(payment, false, e);
		}

		static CaptureOutcome unchanged(Payment payment) {
			return new CaptureOutcome(payment, false, null);
		}
	}
}
