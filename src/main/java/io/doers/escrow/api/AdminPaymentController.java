package io.doers.escrow.api;

import io.doers.escrow.contract.ContractLifecycleService;
import io.doers.escrow.contract.TransitionResult;
import io.doers.escrow.escrow.EscrowLedgerService;
import io.doers.escrow.ledger.BalanceLedgerService;
import io.doers.escrow.ledger.PendingPayoutFilter;
import io.doers.escrow.model.BalanceTransaction;
import io.doers.escrow.model.Payment;
import io.doers.escrow.ratelimit.EscrowRateLimiter;
import io.doers.escrow.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Back-office money operations. Every call here is a direct admin action, so a
 * precondition failure ("already released", "already processed") is reported as 409
 * instead of being treated as a no-op.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminPaymentController {

	private static final Logger log = LoggerFactory.getLogger(AdminPaymentController.class);

	private final EscrowLedgerService escrowLedger;
	private final BalanceLedgerService balanceLedger;
	private final ContractLifecycleService lifecycle;
	private final EscrowRateLimiter rateLimiter;

	public AdminPaymentController(EscrowLedgerService escrowLedger, BalanceLedgerService balanceLedger,
			ContractLifecycleService lifecycle, EscrowRateLimiter rateLimiter) {
		this.escrowLedger = escrowLedger;
		this.balanceLedger = balanceLedger;
		this.lifecycle = lifecycle;
		this.rateLimiter = rateLimiter;
	}

	// POST /api/admin/payments/{paymentId}/release-escrow
	@PostMapping("/payments/{paymentId}/release-escrow")
	public ResponseEntity<Map<String, Object>> releaseEscrow(@PathVariable String paymentId,
			@RequestHeader(name = ApiResponses.USER_HEADER, required = false) String userHeader) {
		if (!rateLimiter.tryConsumeAdminApi()) {
			return ApiResponses.rateLimited();
		}
		LoggingUtils.setCorrelationId(LoggingUtils.generateCorrelationId());
		try {
			UUID id = ApiResponses.parseUuid(paymentId, "paymentId");
			UUID adminId = ApiResponses.actor(userHeader);
			Payment payment = escrowLedger.releaseEscrow(id, adminId);
			return ResponseEntity.ok(Map.of(
				"paymentId", paymentId,
				"status", payment.getStatus().getCode(),
				"releasedAt", String.valueOf(payment.getEscrowReleasedAt())));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "release-escrow", e);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	// POST /api/admin/payments/{paymentId}/refund  {"reason": "...", "amount": "250.00"}  (amount optional)
	@PostMapping("/payments/{paymentId}/refund")
	public ResponseEntity<Map<String, Object>> refund(@PathVariable String paymentId,
			@RequestHeader(name = ApiResponses.USER_HEADER, required = false) String userHeader,
			@RequestBody Map<String, String> request) {
		if (!rateLimiter.tryConsumeAdminApi()) {
			return ApiResponses.rateLimited();
		}
		LoggingUtils.setCorrelationId(LoggingUtils.generateCorrelationId());
		try {
			UUID id = ApiResponses.parseUuid(paymentId, "paymentId");
			UUID adminId = ApiResponses.actor(userHeader);
			String rawAmount = request.get("amount");
			BigDecimal amount = rawAmount == null || rawAmount.isBlank() ? null : new BigDecimal(rawAmount.trim());

			Payment payment = escrowLedger.refund(id, request.get("reason"), adminId, amount);
			return ResponseEntity.ok(Map.of(
				"paymentId", paymentId,
				"status", payment.getStatus().getCode(),
				"refundedAmount", payment.getRefundedAmount()));
		} catch (NumberFormatException e) {
			return ApiResponses.badRequest("amount must be a decimal number");
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "refund", e);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	// POST /api/admin/contracts/{contractId}/cancel  {"reason": "..."}
	@PostMapping("/contracts/{contractId}/cancel")
	public ResponseEntity<Map<String, Object>> cancelContract(@PathVariable String contractId,
			@RequestHeader(name = ApiResponses.USER_HEADER, required = false) String userHeader,
			@RequestBody Map<String, String> request) {
		if (!rateLimiter.tryConsumeAdminApi()) {
			return ApiResponses.rateLimited();
		}
		try {
			UUID id = ApiResponses.parseUuid(contractId, "contractId");
			TransitionResult result = lifecycle.cancelByAdmin(id, ApiResponses.actor(userHeader), request.get("reason"));
			Map<String, Object> resp = new LinkedHashMap<>();
			resp.put("contractId", contractId);
			resp.put("accepted", result.isAccepted());
			resp.put("status", result.getStatus() != null ? result.getStatus().getCode() : null);
			if (!result.isAccepted()) {
				resp.put("error", result.getRejectionReason());
				return ResponseEntity.status(HttpStatus.CONFLICT).body(resp);
			}
			return ResponseEntity.ok(resp);
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "cancel-contract", e);
		}
	}

	// GET /api/admin/payouts?userId=...&from=2026-02-01T00:00:00Z&to=...&limit=100
	@GetMapping("/payouts")
	public ResponseEntity<Map<String, Object>> pendingPayouts(
			@RequestParam(required = false) String userId,
			@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
			@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
			@RequestParam(defaultValue = "100") int limit) {
		try {
			PendingPayoutFilter filter = PendingPayoutFilter.all()
				.setUserId(userId != null ? ApiResponses.parseUuid(userId, "userId") : null)
				.setCreatedFrom(from)
				.setCreatedTo(to)
				.setLimit(limit);
			List<BalanceTransaction> rows = balanceLedger.getPendingPayouts(filter);
			return ResponseEntity.ok(Map.of("count", rows.size(), "payouts", rows));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "pending-payouts", e);
		}
	}

	// POST /api/admin/balance-transactions/{transactionId}/confirm
	@PostMapping("/balance-transactions/{transactionId}/confirm")
	public ResponseEntity<Map<String, Object>> confirmPayout(@PathVariable String transactionId,
			@RequestHeader(name = ApiResponses.USER_HEADER, required = false) String userHeader) {
		if (!rateLimiter.tryConsumeAdminApi()) {
			return ApiResponses.rateLimited();
		}
		try {
			UUID id = ApiResponses.parseUuid(transactionId, "transactionId");
			BalanceTransaction row = balanceLedger.confirmAndCredit(id, ApiResponses.actor(userHeader));
			return ResponseEntity.ok(Map.of(
				"transactionId", transactionId,
				"status", row.getStatus().getCode(),
				"previousBalance", row.getPreviousBalance(),
				"newBalance", row.getNewBalance()));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "confirm-payout", e);
		}
	}

	// POST /api/admin/balance-transactions/{transactionId}/reverse  {"reason": "..."}
	@PostMapping("/balance-transactions/{transactionId}/reverse")
	public ResponseEntity<Map<String, Object>> reversePayout(@PathVariable String transactionId,
			@RequestHeader(name = ApiResponses.USER_HEADER, required = false) String userHeader,
			@RequestBody Map<String, String> request) {
		if (!rateLimiter.tryConsumeAdminApi()) {
			return ApiResponses.rateLimited();
		}
		try {
			UUID id = ApiResponses.parseUuid(transactionId, "transactionId");
			balanceLedger.reverse(id, ApiResponses.actor(userHeader), request.get("reason"));
			return ResponseEntity.ok(Map.of("transactionId", transactionId, "status", "reversed"));
		} catch (RuntimeException e) {
			return ApiResponses.error(log, "reverse-payout", e);
		}
	}
}
