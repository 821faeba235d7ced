package io.doers.escrow.allocation;

import io.doers.escrow.EscrowTestContext;
import io.doers.escrow.exception.EscrowPreconditionException;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.model.Job;
import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.WorkerAllocation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AllocationService")
class AllocationServiceTest {

    private EscrowTestContext ctx;
    private Job job;

    @BeforeEach
    void setUp() {
        ctx = new EscrowTestContext();
        UUID client = ctx.user(MembershipTier.FREE).getUserId();
        job = ctx.job(client, "10000", 3, ctx.clock.instant().plus(Duration.ofDays(1)));
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void freezesAllocationsOnce() {
        List<UUID> workers = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

        AllocationResult result = ctx.allocationService.finalizeAllocation(job.getJobId(), workers, null);

        assertThat(result.getAllocatedTotal()).isEqualByComparingTo("10000");
        Job stored = ctx.jobs.findById(job.getJobId()).orElseThrow();
        assertThat(stored.isAllocationsFrozen()).isTrue();
        assertThat(stored.getRemainingBudget()).isEqualByComparingTo("0");
        assertThat(ctx.jobs.findAllocations(job.getJobId()))
            .extracting(WorkerAllocation::getWorkerId)
            .containsExactlyInAnyOrderElementsOf(workers);
    }

    @Test
    void secondFinalizationIsRejected() {
        ctx.allocationService.finalizeAllocation(job.getJobId(), List.of(UUID.randomUUID()), null);

        assertThatThrownBy(() -> ctx.allocationService.finalizeAllocation(job.getJobId(),
                List.of(UUID.randomUUID(), UUID.randomUUID()), null))
            .isInstanceOf(EscrowPreconditionException.class)
            .hasMessage("already processed");
        assertThat(ctx.jobs.findAllocations(job.getJobId())).hasSize(1);
    }

    @Test
    void rejectsMoreWorkersThanTheJobAccepts() {
        List<UUID> workers = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

        assertThatThrownBy(() -> ctx.allocationService.finalizeAllocation(job.getJobId(), workers, null))
            .isInstanceOf(EscrowValidationException.class)
            .hasMessageContaining("at most 3");
        assertThat(ctx.jobs.findById(job.getJobId()).orElseThrow().isAllocationsFrozen()).isFalse();
    }

    @Test
    void rejectsUnknownJob() {
        assertThatThrownBy(() -> ctx.allocationService.finalizeAllocation(UUID.randomUUID(),
                List.of(UUID.randomUUID()), null))
            .isInstanceOf(EscrowValidationException.class);
    }
}
