package io.doers.escrow.repo;

import io.doers.escrow.model.Job;
import io.doers.escrow.model.WorkerAllocation;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static io.doers.escrow.repo.SqlTimestamps.instant;
import static io.doers.escrow.repo.SqlTimestamps.ts;
import static io.doers.escrow.repo.SqlTimestamps.uuid;

@Repository
public class JobRepository {

  private final JdbcTemplate jdbc;

  public JobRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public void insert(Job job) {
    jdbc.update("""
        INSERT INTO jobs
        (job_id, client_id, title, price, max_workers, start_date, end_date,
         allocated_total, remaining_budget, allocations_frozen, created_on)
        VALUES (?, ?, ?, ?, ?, ?, ?, 0, ?, FALSE, CURRENT_TIMESTAMP)
        """,
        job.getJobId(), job.getClientId(), job.getTitle(), job.getPrice(), job.getMaxWorkers(),
        ts(job.getStartDate()), ts(job.getEndDate()), job.getPrice());
  }

  public Optional<Job> findById(UUID jobId) {
    List<Job> jobs = jdbc.query("""
        SELECT job_id, client_id, title, price, max_workers, start_date, end_date,
               allocated_total, remaining_budget, allocations_frozen
        FROM jobs WHERE job_id = ?
        """,
        (rs, i) -> {
          Job job = new Job();
          job.setJobId(uuid(rs, "job_id"));
          job.setClientId(uuid(rs, "client_id"));
          job.setTitle(rs.getString("title"));
          job.setPrice(rs.getBigDecimal("price"));
          job.setMaxWorkers(rs.getInt("max_workers"));
          job.setStartDate(instant(rs, "start_date"));
          job.setEndDate(instant(rs, "end_date"));
          job.setAllocatedTotal(rs.getBigDecimal("allocated_total"));
          job.setRemainingBudget(rs.getBigDecimal("remaining_budget"));
          job.setAllocationsFrozen(rs.getBoolean("allocations_frozen"));
          return job;
        },
        jobId);
    if (jobs.isEmpty()) {
      return Optional.empty();
    }
    Job job = jobs.get(0);
    job.setWorkerAllocations(findAllocations(jobId));
    return Optional.of(job);
  }

  public List<WorkerAllocation> findAllocations(UUID jobId) {
    return jdbc.query("""
        SELECT worker_id, allocated_amount, percentage
        FROM job_worker_allocations WHERE job_id = ?
        ORDER BY allocated_amount DESC, worker_id
        """,
        (rs, i) -> new WorkerAllocation(uuid(rs, "worker_id"), rs.getBigDecimal("allocated_amount"),
            rs.getBigDecimal("percentage")),
        jobId);
  }

  /**
   * Flips the frozen flag once. Zero rows means the job was already split.
   */
  public int freezeAllocations(UUID jobId, BigDecimal allocatedTotal, BigDecimal remainingBudget) {
    return jdbc.update("""
        UPDATE jobs SET allocations_frozen = TRUE, allocated_total = ?, remaining_budget = ?
        WHERE job_id = ? AND allocations_frozen = FALSE
        """,
        allocatedTotal, remainingBudget, jobId);
  }

  public void insertAllocations(UUID jobId, List<WorkerAllocation> allocations) {
    jdbc.batchUpdate(
        "INSERT INTO job_worker_allocations (job_id, worker_id, allocated_amount, percentage) VALUES (?, ?, ?, ?)",
        allocations,
        allocations.size(),
        (ps, a) -> {
          ps.setObject(1, jobId);
          ps.setObject(2, a.getWorkerId());
          ps.setBigDecimal(3, a.getAllocatedAmount());
          ps.setBigDecimal(4, a.getPercentage());
        });
  }
}
