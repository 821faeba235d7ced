package io.doers.escrow.scheduler;

import io.doers.escrow.audit.AuditService;
import io.doers.escrow.contract.ContractLifecycleService;
import io.doers.escrow.dlq.DeadLetterQueueService;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.ContractStatus;
import io.doers.escrow.notification.NotificationOutbox;
import io.doers.escrow.notification.NotificationTemplate;
import io.doers.escrow.repo.ContractRepository;
import io.doers.escrow.util.LoggingUtils;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reminds parties to confirm once the job's end date has passed, at most once per contract.
 * In-progress contracts past the end date are moved to awaiting_confirmation, which starts
 * the auto-confirm grace window, even when their reminder went out before they started.
 */
@Component
public class ConfirmationReminderSweeper {

	private static final Logger log = LoggerFactory.getLogger(ConfirmationReminderSweeper.class);

	public static final String SWEEP_NAME = "confirmation-reminder";
	static final int BATCH_LIMIT = 200;

	private final ContractRepository contracts;
	private final ContractLifecycleService lifecycle;
	private final NotificationOutbox outbox;
	private final DeadLetterQueueService dlqService;
	private final AuditService auditService;
	private final EscrowMetrics metrics;
	private final Clock clock;
	private final AtomicBoolean running = new AtomicBoolean(false);

	public ConfirmationReminderSweeper(ContractRepository contracts, ContractLifecycleService lifecycle,
			NotificationOutbox outbox, DeadLetterQueueService dlqService, AuditService auditService,
			EscrowMetrics metrics, Clock clock) {
		this.contracts = contracts;
		this.lifecycle = lifecycle;
		this.outbox = outbox;
		this.dlqService = dlqService;
		this.auditService = auditService;
		this.metrics = metrics;
		this.clock = clock;
	}

	public SweepSummary runOnce() {
		if (!running.compareAndSet(false, true)) {
			log.warn("Reminder sweep still running, skipping tick");
			return SweepSummary.notRun(SWEEP_NAME);
		}
		LoggingUtils.setTickName(SWEEP_NAME);
		Timer.Sample sample = metrics.startTimer();
		SweepSummary summary = SweepSummary.started(SWEEP_NAME);
		try {
			Instant now = clock.instant();
			List<Contract> due = contracts.findDueForReminder(now, BATCH_LIMIT);

			for (Contract contract : due) {
				LoggingUtils.setContractId(contract.getContractId());
				try {
					if (remind(contract, now)) {
						summary.processed();
					} else {
						summary.skipped();
					}
				} catch (Exception e) {
					summary.failed();
					metrics.recordSweepFailure(SWEEP_NAME);
					LoggingUtils.logError(log, "Confirmation reminder failed", contract.getContractId(), SWEEP_NAME, e);
					dlqService.addToDLQ(contract.getContractId(), SWEEP_NAME,
						Map.of("contractId", contract.getContractId().toString()), e, e.getClass().getSimpleName());
				} finally {
					LoggingUtils.clearContractId();
				}
			}

			if (!due.isEmpty()) {
				log.info("Reminder sweep finished: {}", summary);
				auditService.logSweepCompleted(SWEEP_NAME, summary.getProcessed(), summary.getSkipped(),
					summary.getFailed());
			}
			return summary;
		} finally {
			metrics.recordSweepTime(sample);
			LoggingUtils.clearContext();
			running.set(false);
		}
	}

	private boolean remind(Contract contract, Instant now) {
		boolean moved = contract.getStatus() == ContractStatus.IN_PROGRESS
			&& lifecycle.markAwaitingConfirmation(contract.getContractId());
		// the flag write decides who sends; a concurrent tick that loses sends nothing.
		// A contract reminded while still accepted only needs the awaiting move once started.
		if (contracts.markReminderSent(contract.getContractId(), now) == 0) {
			return moved;
		}
		Map<String, Object> data = Map.of("contractId", contract.getContractId().toString());
		if (!contract.isClientConfirmed()) {
			outbox.enqueue(contract.getClientId(), NotificationTemplate.CONFIRMATION_REMINDER, data);
			metrics.recordReminderSent();
		}
		if (!contract.isDoerConfirmed()) {
			outbox.enqueue(contract.getDoerId(), NotificationTemplate.CONFIRMATION_REMINDER, data);
			metrics.recordReminderSent();
		}
		log.info("Confirmation reminder sent: contractId={} clientConfirmed={} doerConfirmed={}",
			contract.getContractId(), contract.isClientConfirmed(), contract.isDoerConfirmed());
		return true;
	}
}
