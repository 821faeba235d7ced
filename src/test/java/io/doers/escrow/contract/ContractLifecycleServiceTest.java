package io.doers.escrow.contract;

import io.doers.escrow.EscrowTestContext;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.gateway.GatewayResult;
import io.doers.escrow.model.BalanceTransaction;
import io.doers.escrow.model.BalanceTransactionStatus;
import io.doers.escrow.model.CancelledByRole;
import io.doers.escrow.model.Contract;
import io.doers.escrow.model.ContractEvent;
import io.doers.escrow.model.ContractPaymentStatus;
import io.doers.escrow.model.ContractStatus;
import io.doers.escrow.model.EscrowStatus;
import io.doers.escrow.model.Job;
import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.Payment;
import io.doers.escrow.model.PaymentStatus;
import io.doers.escrow.model.UserAccount;
import io.doers.escrow.notification.NotificationTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.doReturn;

@DisplayName("ContractLifecycleService")
class ContractLifecycleServiceTest {

    private EscrowTestContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new EscrowTestContext();
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private String template(NotificationTemplate t) {
        return t.getCode();
    }

    @Nested
    @DisplayName("createContractsForJob")
    class Create {

        @Test
        void oneContractPerWorkerWithFrozenShareAndCommission() {
            UserAccount client = ctx.userWithReferralDiscount(ctx.clock.instant().plus(Duration.ofDays(30)));
            UUID w1 = ctx.user(MembershipTier.FREE).getUserId();
            UUID w2 = ctx.user(MembershipTier.PRO).getUserId();
            Job job = ctx.job(client.getUserId(), "9000", 2, ctx.clock.instant().plus(Duration.ofDays(3)));

            List<Contract> created = ctx.lifecycle.createContractsForJob(job.getJobId(), List.of(w1, w2), null);

            assertThat(created).hasSize(2);
            for (Contract c : created) {
                assertThat(c.getStatus()).isEqualTo(ContractStatus.PENDING);
                assertThat(c.getEscrowStatus()).isEqualTo(EscrowStatus.PENDING);
                assertThat(c.getAllocatedAmount()).isEqualByComparingTo("4500");
                assertThat(c.getCommissionRate()).isEqualByComparingTo("3");
                assertThat(c.getCommission()).isEqualByComparingTo("135");
                assertThat(c.getTotalPrice()).isEqualByComparingTo("4635");
            }
            assertThat(ctx.lifecycle.contractsForJob(job.getJobId()))
                .extracting(Contract::getDoerId)
                .containsExactlyInAnyOrder(w1, w2);
        }

        @Test
        @DisplayName("a worker with a zero share gets no contract")
        void zeroShareIsSkipped() {
            UserAccount client = ctx.user(MembershipTier.FREE);
            UUID w1 = ctx.user(MembershipTier.FREE).getUserId();
            UUID w2 = ctx.user(MembershipTier.FREE).getUserId();
            Job job = ctx.job(client.getUserId(), "9000", 2, ctx.clock.instant().plus(Duration.ofDays(3)));

            List<Contract> created = ctx.lifecycle.createContractsForJob(job.getJobId(), List.of(w1, w2),
                List.of(new BigDecimal("100"), BigDecimal.ZERO));

            assertThat(created).hasSize(1);
            assertThat(created.get(0).getDoerId()).isEqualTo(w1);
            assertThat(created.get(0).getPrice()).isEqualByComparingTo("9000");
            assertThat(ctx.jobs.findById(job.getJobId()).orElseThrow().isAllocationsFrozen()).isTrue();
        }

        @Test
        void allSharesRoundingToZeroAreRejectedWithoutFreezing() {
            UserAccount client = ctx.user(MembershipTier.FREE);
            UUID w1 = ctx.user(MembershipTier.FREE).getUserId();
            UUID w2 = ctx.user(MembershipTier.FREE).getUserId();
            Job job = ctx.job(client.getUserId(), "50", 2, ctx.clock.instant().plus(Duration.ofDays(3)));

            assertThatThrownBy(() -> ctx.lifecycle.createContractsForJob(job.getJobId(), List.of(w1, w2),
                List.of(BigDecimal.ONE, BigDecimal.ONE)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("non-zero share");

            assertThat(ctx.lifecycle.contractsForJob(job.getJobId())).isEmpty();
            assertThat(ctx.jobs.findById(job.getJobId()).orElseThrow().isAllocationsFrozen()).isFalse();
        }

        @Test
        void commissionIsNotRecomputedLater() {
            Contract c = ctx.pendingContract("10000");
            ctx.jdbc.update("UPDATE user_accounts SET membership_tier = 'super_pro' WHERE user_id = ?", c.getClientId());

            Contract reloaded = ctx.lifecycle.getContract(c.getContractId());

            assertThat(reloaded.getCommission()).isEqualByComparingTo("800");
            assertThat(reloaded.getTotalPrice()).isEqualByComparingTo("10800");
        }
    }

    @Nested
    @DisplayName("terms and start")
    class TermsAndStart {

        @Test
        void acceptedOnceBothPartiesAgree() {
            Contract c = ctx.pendingContract("10000");

            TransitionResult first = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.CLIENT_ACCEPT_TERMS, c.getClientId());
            assertThat(first.isAccepted()).isTrue();
            assertThat(first.getStatus()).isEqualTo(ContractStatus.PENDING);

            TransitionResult second = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.DOER_ACCEPT_TERMS, c.getDoerId());
            assertThat(second.isAccepted()).isTrue();
            assertThat(second.getStatus()).isEqualTo(ContractStatus.ACCEPTED);

            Contract reloaded = ctx.reload(c);
            assertThat(reloaded.isTermsAcceptedByClient()).isTrue();
            assertThat(reloaded.isTermsAcceptedByDoer()).isTrue();
        }

        @Test
        void rejectsEventFromTheWrongSide() {
            Contract c = ctx.pendingContract("10000");

            TransitionResult result = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.CLIENT_ACCEPT_TERMS, c.getDoerId());

            assertThat(result.isAccepted()).isFalse();
            assertThat(ctx.reload(c).isTermsAcceptedByClient()).isFalse();
        }

        @Test
        void rejectsActorOutsideTheContract() {
            Contract c = ctx.pendingContract("10000");

            TransitionResult result = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.CANCEL, UUID.randomUUID(), "not mine");

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.getRejectionReason()).contains("not a party");
            assertThat(ctx.reload(c).getStatus()).isEqualTo(ContractStatus.PENDING);
        }

        @Test
        void cannotStartBeforeTermsAreAccepted() {
            Contract c = ctx.pendingContract("10000");

            TransitionResult result = ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.START,
                c.getClientId());

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.getStatus()).isEqualTo(ContractStatus.PENDING);
        }

        @Test
        void repeatedAcceptanceIsRejected() {
            Contract c = ctx.pendingContract("10000");
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CLIENT_ACCEPT_TERMS, c.getClientId());

            TransitionResult again = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.CLIENT_ACCEPT_TERMS, c.getClientId());

            assertThat(again.isAccepted()).isFalse();
        }
    }

    @Nested
    @DisplayName("confirmation")
    class Confirmation {

        @Test
        void bothConfirmationsCompleteReleaseAndRecordPendingPayout() {
            Contract c = ctx.inProgressContractWithEscrow("10000");

            TransitionResult clientConfirm = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.CLIENT_CONFIRM, c.getClientId());
            assertThat(clientConfirm.getStatus()).isEqualTo(ContractStatus.AWAITING_CONFIRMATION);
            assertThat(ctx.reload(c).getAwaitingConfirmationAt()).isEqualTo(EscrowTestContext.T0);
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.CONTRACT_AWAITING_CONFIRMATION)))
                .isEqualTo(1);

            ctx.clock.advance(Duration.ofMinutes(30));
            TransitionResult doerConfirm = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.DOER_CONFIRM, c.getDoerId());
            assertThat(doerConfirm.getStatus()).isEqualTo(ContractStatus.COMPLETED);

            Contract done = ctx.reload(c);
            assertThat(done.getStatus()).isEqualTo(ContractStatus.COMPLETED);
            assertThat(done.getEscrowStatus()).isEqualTo(EscrowStatus.RELEASED);
            assertThat(done.getPaymentStatus()).isEqualTo(ContractPaymentStatus.PENDING_PAYOUT);
            assertThat(done.isAutoConfirmed()).isFalse();

            Payment payment = ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow();
            assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);

            List<BalanceTransaction> payouts = ctx.balanceTransactions.findByUser(c.getDoerId());
            assertThat(payouts).hasSize(1);
            assertThat(payouts.get(0).getStatus()).isEqualTo(BalanceTransactionStatus.PENDING);
            assertThat(payouts.get(0).getAmount()).isEqualByComparingTo("10000");
            assertThat(payouts.get(0).getRelatedId()).isEqualTo(c.getContractId());
            assertThat(ctx.users.findById(c.getDoerId()).orElseThrow().getBalance()).isEqualByComparingTo("0");

            assertThat(ctx.outboxCount(c.getClientId(), template(NotificationTemplate.CONTRACT_COMPLETED))).isEqualTo(1);
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.CONTRACT_COMPLETED))).isEqualTo(1);
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.ESCROW_RELEASED))).isEqualTo(1);
        }

        @Test
        void confirmingTwiceIsRejected() {
            Contract c = ctx.inProgressContractWithEscrow("10000");
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CLIENT_CONFIRM, c.getClientId());

            TransitionResult again = ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CLIENT_CONFIRM,
                c.getClientId());

            assertThat(again.isAccepted()).isFalse();
            assertThat(again.getStatus()).isEqualTo(ContractStatus.AWAITING_CONFIRMATION);
        }

        @Test
        @DisplayName("a partial refund reduces the payout to what is left in escrow")
        void completionAfterPartialRefundPaysOutTheRemainder() {
            Contract c = ctx.inProgressContractWithEscrow("10000");
            Payment held = ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow();
            ctx.escrowLedger.refund(held.getPaymentId(), "half the work dropped", UUID.randomUUID(),
                new BigDecimal("5400"));

            confirmBoth(c);

            Contract done = ctx.reload(c);
            assertThat(done.getStatus()).isEqualTo(ContractStatus.COMPLETED);
            assertThat(done.getEscrowStatus()).isEqualTo(EscrowStatus.RELEASED);
            assertThat(done.getPaymentStatus()).isEqualTo(ContractPaymentStatus.PENDING_PAYOUT);

            Payment payment = ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow();
            assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(payment.getRefundedAmount()).isEqualByComparingTo("5400");

            List<BalanceTransaction> payouts = ctx.balanceTransactions.findByUser(c.getDoerId());
            assertThat(payouts).hasSize(1);
            assertThat(payouts.get(0).getAmount()).isEqualByComparingTo("5000.00");
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.ESCROW_RELEASED))).isEqualTo(1);
        }

        @Test
        void completionAfterFullRefundRecordsNoPayout() {
            Contract c = ctx.inProgressContractWithEscrow("10000");
            Payment held = ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow();
            ctx.escrowLedger.refund(held.getPaymentId(), "client paid twice", UUID.randomUUID(), null);

            confirmBoth(c);

            Contract done = ctx.reload(c);
            assertThat(done.getStatus()).isEqualTo(ContractStatus.COMPLETED);
            assertThat(done.getEscrowStatus()).isEqualTo(EscrowStatus.REFUNDED);
            assertThat(done.getPaymentStatus()).isEqualTo(ContractPaymentStatus.REFUNDED);
            assertThat(ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow().getStatus())
                .isEqualTo(PaymentStatus.REFUNDED);
            assertThat(ctx.balanceTransactions.findByUser(c.getDoerId())).isEmpty();
        }

        @Test
        void completionWithoutCapturedEscrowRecordsNoPayout() {
            Contract c = ctx.pendingContract("5000");
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CLIENT_ACCEPT_TERMS, c.getClientId());
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.DOER_ACCEPT_TERMS, c.getDoerId());
            ctx.escrowLedger.createOrder(c.getContractId());
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.START, c.getDoerId());

            confirmBoth(c);

            Contract done = ctx.reload(c);
            assertThat(done.getStatus()).isEqualTo(ContractStatus.COMPLETED);
            assertThat(done.getEscrowStatus()).isEqualTo(EscrowStatus.PENDING);
            assertThat(done.getPaymentStatus()).isEqualTo(ContractPaymentStatus.PENDING);
            assertThat(ctx.balanceTransactions.findByUser(c.getDoerId())).isEmpty();
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.ESCROW_RELEASED))).isZero();
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.CONTRACT_COMPLETED))).isEqualTo(1);
        }

        @Test
        void escrowReleasedByAdminBeforeCompletionIsStillPaidOut() {
            Contract c = ctx.inProgressContractWithEscrow("10000");
            Payment held = ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow();
            ctx.escrowLedger.releaseEscrow(held.getPaymentId(), UUID.randomUUID());

            confirmBoth(c);

            Contract done = ctx.reload(c);
            assertThat(done.getEscrowStatus()).isEqualTo(EscrowStatus.RELEASED);
            assertThat(done.getPaymentStatus()).isEqualTo(ContractPaymentStatus.PENDING_PAYOUT);
            List<BalanceTransaction> payouts = ctx.balanceTransactions.findByUser(c.getDoerId());
            assertThat(payouts).hasSize(1);
            assertThat(payouts.get(0).getAmount()).isEqualByComparingTo("10000");
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.ESCROW_RELEASED))).isEqualTo(1);
        }

        private void confirmBoth(Contract c) {
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.DOER_CONFIRM, c.getDoerId());
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CLIENT_CONFIRM, c.getClientId());
        }
    }

    @Nested
    @DisplayName("cancel and dispute")
    class CancelAndDispute {

        @Test
        void cancellationRefundsHeldEscrow() {
            Contract c = ctx.inProgressContractWithEscrow("10000");

            TransitionResult result = ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CANCEL,
                c.getClientId(), "plans changed");

            assertThat(result.getStatus()).isEqualTo(ContractStatus.CANCELLED);
            Contract cancelled = ctx.reload(c);
            assertThat(cancelled.getCancelledByRole()).isEqualTo(CancelledByRole.CLIENT);
            assertThat(cancelled.getCancellationReason()).isEqualTo("plans changed");
            assertThat(cancelled.getEscrowStatus()).isEqualTo(EscrowStatus.REFUNDED);

            Payment payment = ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow();
            assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(payment.getRefundReason()).startsWith("Contract cancelled by client");

            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.CONTRACT_CANCELLED))).isEqualTo(1);
            assertThat(ctx.outboxCount(c.getClientId(), template(NotificationTemplate.CONTRACT_CANCELLED))).isZero();
        }

        @Test
        void failedRefundKeepsCancellationAndGoesToDeadLetterQueue() {
            Contract c = ctx.inProgressContractWithEscrow("10000");
            doReturn(GatewayResult.fail("gateway down")).when(ctx.gateway).refund(anyString(), nullable(BigDecimal.class));

            TransitionResult result = ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CANCEL,
                c.getDoerId(), "sick");

            assertThat(result.isAccepted()).isTrue();
            assertThat(ctx.reload(c).getStatus()).isEqualTo(ContractStatus.CANCELLED);
            assertThat(ctx.escrowLedger.findEscrowPayment(c.getContractId()).orElseThrow().getStatus())
                .isEqualTo(PaymentStatus.HELD_ESCROW);
            assertThat(ctx.dlq.getUnresolvedEntries(RefundOnCancellationPolicy.OPERATION)).hasSize(1);
        }

        @Test
        void adminCancellationRequiresReason() {
            Contract c = ctx.pendingContract("10000");

            assertThatThrownBy(() -> ctx.lifecycle.cancelByAdmin(c.getContractId(), UUID.randomUUID(), " "))
                .isInstanceOf(EscrowValidationException.class);

            TransitionResult result = ctx.lifecycle.cancelByAdmin(c.getContractId(), UUID.randomUUID(), "fraud");
            assertThat(result.getStatus()).isEqualTo(ContractStatus.CANCELLED);
            assertThat(ctx.outboxCount(c.getClientId(), template(NotificationTemplate.CONTRACT_CANCELLED))).isEqualTo(1);
            assertThat(ctx.outboxCount(c.getDoerId(), template(NotificationTemplate.CONTRACT_CANCELLED))).isEqualTo(1);
        }

        @Test
        void disputeFreezesEscrowAndBlocksConfirmation() {
            Contract c = ctx.inProgressContractWithEscrow("10000");

            TransitionResult result = ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.DISPUTE,
                c.getDoerId());

            assertThat(result.getStatus()).isEqualTo(ContractStatus.DISPUTED);
            Contract disputed = ctx.reload(c);
            assertThat(disputed.getEscrowStatus()).isEqualTo(EscrowStatus.DISPUTED);
            assertThat(disputed.getDisputedById()).isEqualTo(c.getDoerId());
            assertThat(ctx.outboxCount(c.getClientId(), template(NotificationTemplate.CONTRACT_DISPUTED))).isEqualTo(1);

            TransitionResult confirm = ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CLIENT_CONFIRM,
                c.getClientId());
            assertThat(confirm.isAccepted()).isFalse();
        }

        @Test
        void pendingContractCannotBeDisputed() {
            Contract c = ctx.pendingContract("10000");

            assertThat(ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.DISPUTE, c.getClientId())
                .isAccepted()).isFalse();
        }

        @Test
        void terminalContractStaysTerminal() {
            Contract c = ctx.pendingContract("10000");
            ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CANCEL, c.getClientId(), "no longer needed");

            TransitionResult again = ctx.lifecycle.advanceContract(c.getContractId(), ContractEvent.CANCEL,
                c.getDoerId(), "me too");
            TransitionResult accept = ctx.lifecycle.advanceContract(c.getContractId(),
                ContractEvent.CLIENT_ACCEPT_TERMS, c.getClientId());

            assertThat(again.isAccepted()).isFalse();
            assertThat(accept.isAccepted()).isFalse();
            Contract reloaded = ctx.reload(c);
            assertThat(reloaded.getStatus()).isEqualTo(ContractStatus.CANCELLED);
            assertThat(reloaded.getCancelledByRole()).isEqualTo(CancelledByRole.CLIENT);
        }
    }
}
