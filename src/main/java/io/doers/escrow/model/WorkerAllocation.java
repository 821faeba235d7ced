package io.doers.escrow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkerAllocation {
  private UUID workerId;
  private BigDecimal allocatedAmount;
  private BigDecimal percentage;
}
