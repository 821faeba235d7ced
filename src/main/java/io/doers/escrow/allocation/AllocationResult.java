package io.doers.escrow.allocation;

import io.doers.escrow.model.WorkerAllocation;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

public class AllocationResult {

	private final List<WorkerAllocation> allocations;
	private final BigDecimal remainingBudget;

	public AllocationResult(List<WorkerAllocation> allocations, BigDecimal remainingBudget) {
		this.allocations = Collections.unmodifiableList(allocations);
		this.remainingBudget = remainingBudget;
	}

	public List<WorkerAllocation> getAllocations() {
		return allocations;
	}

	public BigDecimal getRemainingBudget() {
		return remainingBudget;
	}

	public BigDecimal getAllocatedTotal() {
		return allocations.stream()
			.map(WorkerAllocation::getAllocatedAmount)
			.reduce(BigDecimal.ZERO, BigDecimal::add);
	}
}
