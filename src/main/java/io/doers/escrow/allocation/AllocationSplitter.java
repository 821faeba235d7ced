package io.doers.escrow.allocation;

import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.model.WorkerAllocation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

/**
 * Splits a job budget across its selected workers. Amounts are whole currency units.
 *
 * Even split: every worker gets floor(budget / n) and worker[0] also takes the
 * remainder, so the amounts add up to the budget exactly.
 * Explicit split: worker[i] gets floor(budget * pct[i] / 100); whatever is not
 * allocated is reported as remaining budget.
 */
@Component
public class AllocationSplitter {

	private static final BigDecimal HUNDRED = new BigDecimal("100");

	public AllocationResult split(BigDecimal jobBudget, List<UUID> workers, List<BigDecimal> explicitPercentages) {
		validate(jobBudget, workers);
		List<WorkerAllocation> allocations = explicitPercentages == null || explicitPercentages.isEmpty()
			? evenSplit(jobBudget, workers)
			: percentageSplit(jobBudget, workers, explicitPercentages);

		BigDecimal allocated = allocations.stream()
			.map(WorkerAllocation::getAllocatedAmount)
			.reduce(BigDecimal.ZERO, BigDecimal::add);
		BigDecimal remaining = jobBudget.subtract(allocated);
		if (remaining.signum() < 0) {
			// floor rounding cannot overshoot; reaching this means the inputs were inconsistent
			throw new IllegalStateException("allocation exceeds budget: allocated=" + allocated + " budget=" + jobBudget);
		}
		return new AllocationResult(allocations, remaining);
	}

	private List<WorkerAllocation> evenSplit(BigDecimal budget, List<UUID> workers) {
		BigDecimal count = BigDecimal.valueOf(workers.size());
		BigDecimal perWorker = budget.divide(count, 0, RoundingMode.FLOOR);
		BigDecimal remainder = budget.subtract(perWorker.multiply(count));

		List<WorkerAllocation> result = new ArrayList<>(workers.size());
		for (int i = 0; i < workers.size(); i++) {
			BigDecimal amount = i == 0 ? perWorker.add(remainder) : perWorker;
			result.add(new WorkerAllocation(workers.get(i), amount, percentageOf(amount, budget)));
		}
		return result;
	}

	private List<WorkerAllocation> percentageSplit(BigDecimal budget, List<UUID> workers, List<BigDecimal> percentages) {
		if (percentages.size() != workers.size()) {
			throw new EscrowValidationException(
				"expected " + workers.size() + " percentages, got " + percentages.size(), "percentages", percentages);
		}
		BigDecimal sum = BigDecimal.ZERO;
		for (BigDecimal pct : percentages) {
			if (pct == null || pct.signum() < 0) {
				throw new EscrowValidationException("percentages must not be negative", "percentages", percentages);
			}
			sum = sum.add(pct);
		}
		if (sum.compareTo(HUNDRED) > 0) {
			throw new EscrowValidationException("percentages add up to " + sum + ", more than 100", "percentages", percentages);
		}

		List<WorkerAllocation> result = new ArrayList<>(workers.size());
		for (int i = 0; i < workers.size(); i++) {
			BigDecimal pct = percentages.get(i);
			BigDecimal amount = budget.multiply(pct).divide(HUNDRED, 0, RoundingMode.FLOOR);
			result.add(new WorkerAllocation(workers.get(i), amount, pct));
		}
		return result;
	}

	private void validate(BigDecimal budget, List<UUID> workers) {
		if (budget == null || budget.signum() <= 0) {
			throw new EscrowValidationException("job budget must be greater than zero", "jobBudget", budget);
		}
		if (workers == null || workers.isEmpty()) {
			throw new EscrowValidationException("at least one worker is required", "workers", workers);
		}
		if (new HashSet<>(workers).size() != workers.size()) {
			throw new EscrowValidationException("workers must be distinct", "workers", workers);
		}
	}

	private static BigDecimal percentageOf(BigDecimal amount, BigDecimal budget) {
		return amount.multiply(HUNDRED).divide(budget, 4, RoundingMode.HALF_UP);
	}
}
