package io.doers.escrow.allocation;

import io.doers.escrow.exception.EscrowPreconditionException;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.model.Job;
import io.doers.escrow.repo.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Freezes a job's worker split exactly once. A second finalization is rejected rather
 * than re-splitting funds contracts were already created against.
 */
@Service
public class AllocationService {

	private static final Logger log = LoggerFactory.getLogger(AllocationService.class);

	private final JobRepository jobs;
	private final AllocationSplitter splitter;
	private final TransactionOperations tx;

	public AllocationService(JobRepository jobs, AllocationSplitter splitter, TransactionOperations tx) {
		this.jobs = jobs;
		this.splitter = splitter;
		this.tx = tx;
	}

	public AllocationResult finalizeAllocation(UUID jobId, List<UUID> workers, List<BigDecimal> explicitPercentages) {
		return tx.execute(status -> {
			Job job = jobs.findById(jobId)
				.orElseThrow(() -> new EscrowValidationException("unknown job: " + jobId, "jobId", jobId));
			if (job.isAllocationsFrozen()) {
				throw EscrowPreconditionException.alreadyProcessed(jobId, "allocations_frozen");
			}
			if (workers != null && workers.size() > Math.max(job.getMaxWorkers(), 1)) {
				throw new EscrowValidationException(
					"job accepts at most " + job.getMaxWorkers() + " workers", "workers", workers.size());
			}

			AllocationResult result = splitter.split(job.getPrice(), workers, explicitPercentages);

			if (jobs.freezeAllocations(jobId, result.getAllocatedTotal(), result.getRemainingBudget()) == 0) {
				throw EscrowPreconditionException.alreadyProcessed(jobId, "allocations_frozen");
			}
			jobs.insertAllocations(jobId, result.getAllocations());
			log.info("Allocation frozen: jobId={} workers={} allocatedTotal={} remainingBudget={}",
				jobId, workers.size(), result.getAllocatedTotal(), result.getRemainingBudget());
			return result;
		});
	}
}
