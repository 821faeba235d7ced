package io.doers.escrow.scheduler;

import io.doers.escrow.audit.AuditService;
import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.contract.ContractLifecycleService;
import io.doers.escrow.dlq.DeadLetterQueueService;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.model.Contract;
import io.doers.escrow.repo.ContractRepository;
import io.doers.escrow.util.LoggingUtils;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Completes contracts whose confirmation grace window has run out.
 *
 * Selection: status awaiting_confirmation, awaiting since at least the grace period,
 * at least one party unconfirmed. Every contract is handled on its own; a failure is
 * logged, sent to the DLQ and the tick carries on with the next one.
 */
@Component
public class AutoConfirmationSweeper {

	private static final Logger log = LoggerFactory.getLogger(AutoConfirmationSweeper.class);

	public static final String SWEEP_NAME = "auto-confirm";
	static final int BATCH_LIMIT = 200;

	private final ContractRepository contracts;
	private final ContractLifecycleService lifecycle;
	private final DeadLetterQueueService dlqService;
	private final AuditService auditService;
	private final EscrowMetrics metrics;
	private final EscrowProperties props;
	private final Clock clock;
	private final AtomicBoolean running = new AtomicBoolean(false);

	public AutoConfirmationSweeper(ContractRepository contracts, ContractLifecycleService lifecycle,
			DeadLetterQueueService dlqService, AuditService auditService, EscrowMetrics metrics,
			EscrowProperties props, Clock clock) {
		this.contracts = contracts;
		this.lifecycle = lifecycle;
		this.dlqService = dlqService;
		this.auditService = auditService;
		this.metrics = metrics;
		this.props = props;
		this.clock = clock;
	}

	public SweepSummary runOnce() {
		if (!running.compareAndSet(false, true)) {
			log.warn("Auto-confirm sweep still running, skipping tick");
			return SweepSummary.notRun(SWEEP_NAME);
		}
		LoggingUtils.setTickName(SWEEP_NAME);
		Timer.Sample sample = metrics.startTimer();
		SweepSummary summary = SweepSummary.started(SWEEP_NAME);
		try {
			Instant deadline = clock.instant().minus(props.getScheduling().getAutoConfirmGrace());
			List<Contract> due = contracts.findDueForAutoConfirm(deadline, BATCH_LIMIT);
			log.debug("Auto-confirm candidates: count={} deadline={}", due.size(), deadline);

			for (Contract contract : due) {
				LoggingUtils.setContractId(contract.getContractId());
				try {
					if (lifecycle.autoConfirm(contract.getContractId(), deadline)) {
						summary.processed();
					} else {
						// completed, cancelled or disputed since the query ran
						summary.skipped();
					}
				} catch (Exception e) {
					summary.failed();
					metrics.recordSweepFailure(SWEEP_NAME);
					LoggingUtils.logError(log, "Auto-confirm failed", contract.getContractId(), SWEEP_NAME, e);
					dlqService.addToDLQ(contract.getContractId(), SWEEP_NAME, payload(contract, deadline), e,
						e.getClass().getSimpleName());
				} finally {
					LoggingUtils.clearContractId();
				}
			}

			if (!due.isEmpty()) {
				log.info("Auto-confirm sweep finished: {}", summary);
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

	private static Map<String, Object> payload(Contract contract, Instant deadline) {
		Map<String, Object> payload = new HashMap<>();
		payload.put("contractId", contract.getContractId());
		payload.put("awaitingConfirmationAt", String.valueOf(contract.getAwaitingConfirmationAt()));
		payload.put("deadline", deadline.toString());
		return payload;
	}
}
