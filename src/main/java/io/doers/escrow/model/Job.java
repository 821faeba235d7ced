package io.doers.escrow.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
public class Job {
  private UUID jobId;
  private UUID clientId;
  private String title;
  private BigDecimal price;            // total budget
  private int maxWorkers;
  private Instant startDate;
  private Instant endDate;
  private BigDecimal allocatedTotal;
  private BigDecimal remainingBudget;
  private boolean allocationsFrozen;
  private List<WorkerAllocation> workerAllocations = new ArrayList<>();
}
