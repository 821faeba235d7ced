package io.doers.escrow.api;

import io.doers.escrow.escrow.EscrowLedgerService;
import io.doers.escrow.escrow.GatewayWebhookEvent;
import io.doers.escrow.escrow.WebhookOutcome;
import io.doers.escrow.model.Payment;
import io.doers.escrow.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Client-facing payment flow: open the gateway order, capture it into escrow, and the
 * gateway's own webhook.
 */
@RestController
@RequestMapping("/api/payments")
public class PaymentController {

	private static final Logger log = LoggerFactory.getLogger(PaymentController.class);

	private final EscrowLedgerService escrowLedger;

	public PaymentController(EscrowLedgerService escrowLedger) {
		this.escrowLedger = escrowLedger;
	}

	// POST /api/payments/orders  {"contractId": "..."}
	@PostMapping("/orders")
	public ResponseEntity<Map<String, Object>> createOrder(@RequestBody Map<String, String> request) {
		LoggingUtils.setCorrelationId(LoggingUtils.generateCorrelationId());
		try {
			UUID contractId = ApiResponses.parseUuid(request.get("contractId"), "contractId");
			Payment payment = escrowLedger.createOrder(contractId);
			return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
				"paymentId", payment.getPaymentId().toString(),
				"orderId", payment.getGatewayOrderId(),
				"amount", payment.getAmount(),
				"currency", payment.getCurrency(),
				"status", payment.getStatus().getCode()));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "create-order", e);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	// POST /api/payments/{paymentId}/capture  {"eventId": "..."} (eventId optional)
	@PostMapping("/{paymentId}/capture")
	public ResponseEntity<Map<String, Object>> capture(@PathVariable String paymentId,
			@RequestBody(required = false) Map<String, String> request) {
		LoggingUtils.setCorrelationId(LoggingUtils.generateCorrelationId());
		try {
			UUID id = ApiResponses.parseUuid(paymentId, "paymentId");
			String eventId = request != null ? request.get("eventId") : null;
			Payment payment = escrowLedger.capture(id, eventId);
			return ResponseEntity.ok(Map.of(
				"paymentId", paymentId,
				"status", payment.getStatus().getCode(),
				"captureId", String.valueOf(payment.getGatewayCaptureId())));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "capture", e);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	/**
	 * Gateway webhook. Always 200 for duplicates and unknown orders so the gateway stops
	 * redelivering them.
	 */
	@PostMapping("/webhook")
	public ResponseEntity<Map<String, Object>> webhook(@RequestBody GatewayWebhookEvent event) {
		LoggingUtils.setCorrelationId(LoggingUtils.generateCorrelationId());
		try {
			WebhookOutcome outcome = escrowLedger.handleWebhook(event);
			return ResponseEntity.ok(Map.of("eventId", event.getEventId(), "outcome", outcome.name()));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "webhook", e);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	@GetMapping("/{paymentId}")
	public ResponseEntity<Map<String, Object>> get(@PathVariable String paymentId) {
		try {
			return ResponseEntity.ok(Map.of("payment",
				escrowLedger.loadPayment(ApiResponses.parseUuid(paymentId, "paymentId"))));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "get-payment", e);
		}
	}

	@GetMapping("/contract/{contractId}")
	public ResponseEntity<Map<String, Object>> forContract(@PathVariable String contractId) {
		try {
			UUID id = ApiResponses.parseUuid(contractId, "contractId");
			return ResponseEntity.ok(Map.of("contractId", contractId, "payments", escrowLedger.paymentsForContract(id)));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "list-payments", e);
		}
	}
}
