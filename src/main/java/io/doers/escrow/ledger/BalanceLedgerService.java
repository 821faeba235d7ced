package io.doers.escrow.ledger;

import io.doers.escrow.audit.AuditService;
import io.doers.escrow.exception.EscrowPreconditionException;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.model.BalanceTransaction;
import io.doers.escrow.model.BalanceTransactionStatus;
import io.doers.escrow.model.BalanceTransactionType;
import io.doers.escrow.model.UserAccount;
import io.doers.escrow.notification.NotificationOutbox;
import io.doers.escrow.notification.NotificationTemplate;
import io.doers.escrow.repo.BalanceTransactionRepository;
import io.doers.escrow.repo.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Two-phase balance ledger. Payouts are first recorded as pending rows that leave the
 * visible balance untouched; an admin confirms them after checking the payment proof,
 * and only then is the user's balance written. This is the only writer of
 * user_accounts.balance.
 */
@Service
public class BalanceLedgerService {

	public static final String RELATED_CONTRACT = "Contract";

	private static final Logger log = LoggerFactory.getLogger(BalanceLedgerService.class);

	private final BalanceTransactionRepository transactions;
	private final UserAccountRepository users;
	private final TransactionOperations tx;
	private final AuditService auditService;
	private final EscrowMetrics metrics;
	private final NotificationOutbox outbox;
	private final Clock clock;

	public BalanceLedgerService(BalanceTransactionRepository transactions, UserAccountRepository users,
			TransactionOperations tx, AuditService auditService, EscrowMetrics metrics, NotificationOutbox outbox,
			Clock clock) {
		this.transactions = transactions;
		this.users = users;
		this.tx = tx;
		this.auditService = auditService;
		this.metrics = metrics;
		this.outbox = outbox;
		this.clock = clock;
	}

	/**
	 * Records a pending payout credit for a contract. Idempotent per (user, contract):
	 * a second call returns the row written by the first.
	 */
	public BalanceTransaction recordPending(UUID userId, BigDecimal amount, UUID relatedContractId, String description) {
		if (amount == null || amount.signum() <= 0) {
			throw new EscrowValidationException("payout amount must be greater than zero", "amount", amount);
		}
		UserAccount user = users.findById(userId)
			.orElseThrow(() -> new EscrowValidationException("unknown user: " + userId, "userId", userId));

		BalanceTransaction row = new BalanceTransaction();
		row.setTransactionId(UUID.randomUUID());
		row.setUserId(userId);
		row.setType(BalanceTransactionType.PAYMENT);
		row.setAmount(amount);
		row.setPreviousBalance(user.getBalance());
		row.setNewBalance(user.getBalance());
		row.setRelatedModel(RELATED_CONTRACT);
		row.setRelatedId(relatedContractId);
		row.setStatus(BalanceTransactionStatus.PENDING);
		row.setDescription(description);
		row.setCreatedOn(clock.instant());

		if (!transactions.insertIfAbsent(row)) {
			log.info("Pending payout already recorded: userId={} contractId={}", userId, relatedContractId);
			return transactions.findByRelated(userId, RELATED_CONTRACT, relatedContractId, BalanceTransactionType.PAYMENT)
				.orElseThrow(() -> new IllegalStateException("payout row vanished: contractId=" + relatedContractId));
		}
		log.info("Pending payout recorded: transactionId={} userId={} amount={} contractId={}",
			row.getTransactionId(), userId, amount, relatedContractId);
		return row;
	}

	/**
	 * pending -> completed and credit the balance. Confirming twice is rejected with
	 * "already processed"; it never credits twice.
	 */
	public BalanceTransaction confirmAndCredit(UUID transactionId, UUID adminId) {
		BalanceTransaction confirmed = tx.execute(status -> {
			BalanceTransaction row = transactions.findById(transactionId)
				.orElseThrow(() -> new EscrowValidationException("unknown balance transaction: " + transactionId,
					"transactionId", transactionId));
			if (row.getStatus() != BalanceTransactionStatus.PENDING) {
				throw EscrowPreconditionException.alreadyProcessed(transactionId, row.getStatus().getCode());
			}
			UserAccount user = users.findById(row.getUserId())
				.orElseThrow(() -> new EscrowValidationException("unknown user: " + row.getUserId(), "userId",
					row.getUserId()));

			BigDecimal previous = user.getBalance();
			BigDecimal next = previous.add(row.signedAmount());
			if (next.signum() < 0) {
				throw new EscrowValidationException("insufficient balance for debit", "amount", row.getAmount());
			}
			Instant now = clock.instant();

			// 1) claim the row
			if (transactions.complete(transactionId, previous, next, adminId, now) == 0) {
				throw EscrowPreconditionException.alreadyProcessed(transactionId, "completed");
			}
			// 2) apply to the balance read above; a concurrent credit forces a rollback
			if (users.updateBalance(row.getUserId(), previous, next, now) == 0) {
				throw new EscrowPreconditionException("balance changed concurrently, retry", row.getUserId(),
					previous.toPlainString());
			}
			row.setStatus(BalanceTransactionStatus.COMPLETED);
			row.setPreviousBalance(previous);
			row.setNewBalance(next);
			row.setProcessedBy(adminId);
			row.setProcessedAt(now);
			return row;
		});

		log.info("Balance credited: transactionId={} userId={} previousBalance={} newBalance={} adminId={}",
			transactionId, confirmed.getUserId(), confirmed.getPreviousBalance(), confirmed.getNewBalance(), adminId);
		auditService.logBalanceConfirmed(transactionId, confirmed.getUserId(), confirmed.getNewBalance(),
			String.valueOf(adminId));
		metrics.recordPayoutConfirmed();
		outbox.enqueue(confirmed.getUserId(), NotificationTemplate.PAYOUT_CONFIRMED, Map.of(
			"transactionId", transactionId.toString(),
			"amount", confirmed.getAmount().toPlainString(),
			"newBalance", confirmed.getNewBalance().toPlainString()));
		return confirmed;
	}

	/**
	 * pending -> reversed, for payouts an admin rejects. The balance is not touched.
	 */
	public void reverse(UUID transactionId, UUID adminId, String reason) {
		if (reason == null || reason.isBlank()) {
			throw new EscrowValidationException("reversal reason is required", "reason", reason);
		}
		BalanceTransaction row = transactions.findById(transactionId)
			.orElseThrow(() -> new EscrowValidationException("unknown balance transaction: " + transactionId,
				"transactionId", transactionId));
		if (transactions.reverse(transactionId, adminId, reason, clock.instant()) == 0) {
			throw EscrowPreconditionException.alreadyProcessed(transactionId, row.getStatus().getCode());
		}
		log.info("Balance transaction reversed: transactionId={} adminId={} reason={}", transactionId, adminId, reason);
		auditService.logBalanceReversed(transactionId, reason, String.valueOf(adminId));
	}

	public List<BalanceTransaction> getPendingPayouts(PendingPayoutFilter filter) {
		PendingPayoutFilter f = filter != null ? filter : PendingPayoutFilter.all();
		return transactions.findPending(f.getUserId(), f.getCreatedFrom(), f.getCreatedTo(), f.getLimit());
	}
}
