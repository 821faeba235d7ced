package io.doers.escrow.ledger;

import io.doers.escrow.EscrowTestContext;
import io.doers.escrow.exception.EscrowPreconditionException;
import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.model.BalanceTransaction;
import io.doers.escrow.model.BalanceTransactionStatus;
import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.UserAccount;
import io.doers.escrow.notification.NotificationTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BalanceLedgerService")
class BalanceLedgerServiceTest {

    private EscrowTestContext ctx;
    private UserAccount doer;
    private final UUID admin = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ctx = new EscrowTestContext();
        doer = ctx.user(MembershipTier.FREE);
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private BigDecimal balanceOf(UUID userId) {
        return ctx.users.findById(userId).orElseThrow().getBalance();
    }

    @Nested
    @DisplayName("recordPending")
    class RecordPending {

        @Test
        void leavesBalanceUntouched() {
            BalanceTransaction row = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("4500"),
                UUID.randomUUID(), "payout");

            assertThat(row.getStatus()).isEqualTo(BalanceTransactionStatus.PENDING);
            assertThat(row.getPreviousBalance()).isEqualByComparingTo(row.getNewBalance());
            assertThat(balanceOf(doer.getUserId())).isEqualByComparingTo("0");
        }

        @Test
        void isIdempotentPerContract() {
            UUID contractId = UUID.randomUUID();

            BalanceTransaction first = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("4500"),
                contractId, "payout");
            BalanceTransaction second = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("4500"),
                contractId, "payout");

            assertThat(second.getTransactionId()).isEqualTo(first.getTransactionId());
            assertThat(ctx.balanceTransactions.findByUser(doer.getUserId())).hasSize(1);
        }

        @Test
        void rejectsNonPositiveAmountAndUnknownUser() {
            assertThatThrownBy(() -> ctx.balanceLedger.recordPending(doer.getUserId(), BigDecimal.ZERO,
                    UUID.randomUUID(), "payout"))
                .isInstanceOf(EscrowValidationException.class);
            assertThatThrownBy(() -> ctx.balanceLedger.recordPending(UUID.randomUUID(), BigDecimal.TEN,
                    UUID.randomUUID(), "payout"))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("unknown user");
        }
    }

    @Nested
    @DisplayName("confirmAndCredit")
    class ConfirmAndCredit {

        @Test
        void creditsBalanceOnce() {
            BalanceTransaction pending = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("4500"),
                UUID.randomUUID(), "payout");

            BalanceTransaction confirmed = ctx.balanceLedger.confirmAndCredit(pending.getTransactionId(), admin);

            assertThat(confirmed.getStatus()).isEqualTo(BalanceTransactionStatus.COMPLETED);
            assertThat(confirmed.getPreviousBalance()).isEqualByComparingTo("0");
            assertThat(confirmed.getNewBalance()).isEqualByComparingTo("4500");
            assertThat(balanceOf(doer.getUserId())).isEqualByComparingTo("4500");
            assertThat(ctx.outboxCount(doer.getUserId(), NotificationTemplate.PAYOUT_CONFIRMED.getCode())).isEqualTo(1);

            assertThatThrownBy(() -> ctx.balanceLedger.confirmAndCredit(pending.getTransactionId(), admin))
                .isInstanceOf(EscrowPreconditionException.class)
                .hasMessage("already processed");
            assertThat(balanceOf(doer.getUserId())).isEqualByComparingTo("4500");
        }

        @Test
        void accumulatesAcrossPayouts() {
            BalanceTransaction a = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("100"),
                UUID.randomUUID(), "a");
            BalanceTransaction b = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("250.50"),
                UUID.randomUUID(), "b");

            ctx.balanceLedger.confirmAndCredit(a.getTransactionId(), admin);
            BalanceTransaction second = ctx.balanceLedger.confirmAndCredit(b.getTransactionId(), admin);

            assertThat(second.getPreviousBalance()).isEqualByComparingTo("100");
            assertThat(second.getNewBalance()).isEqualByComparingTo("350.50");
        }
    }

    @Nested
    @DisplayName("reverse")
    class Reverse {

        @Test
        void reversedPayoutCanNoLongerBeConfirmed() {
            BalanceTransaction pending = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("4500"),
                UUID.randomUUID(), "payout");

            ctx.balanceLedger.reverse(pending.getTransactionId(), admin, "proof rejected");

            assertThat(ctx.balanceTransactions.findById(pending.getTransactionId()).orElseThrow().getStatus())
                .isEqualTo(BalanceTransactionStatus.REVERSED);
            assertThatThrownBy(() -> ctx.balanceLedger.confirmAndCredit(pending.getTransactionId(), admin))
                .isInstanceOf(EscrowPreconditionException.class);
            assertThat(balanceOf(doer.getUserId())).isEqualByComparingTo("0");
        }

        @Test
        void requiresReasonAndPendingRow() {
            BalanceTransaction pending = ctx.balanceLedger.recordPending(doer.getUserId(), new BigDecimal("10"),
                UUID.randomUUID(), "payout");

            assertThatThrownBy(() -> ctx.balanceLedger.reverse(pending.getTransactionId(), admin, " "))
                .isInstanceOf(EscrowValidationException.class);

            ctx.balanceLedger.confirmAndCredit(pending.getTransactionId(), admin);
            assertThatThrownBy(() -> ctx.balanceLedger.reverse(pending.getTransactionId(), admin, "late"))
                .isInstanceOf(EscrowPreconditionException.class);
        }
    }

    @Test
    void pendingPayoutsFilterByUser() {
        UserAccount other = ctx.user(MembershipTier.PRO);
        ctx.balanceLedger.recordPending(doer.getUserId(), BigDecimal.TEN, UUID.randomUUID(), "a");
        ctx.balanceLedger.recordPending(other.getUserId(), BigDecimal.ONE, UUID.randomUUID(), "b");

        assertThat(ctx.balanceLedger.getPendingPayouts(PendingPayoutFilter.all())).hasSize(2);
        assertThat(ctx.balanceLedger.getPendingPayouts(PendingPayoutFilter.all().setUserId(doer.getUserId())))
            .extracting(BalanceTransaction::getUserId)
            .containsExactly(doer.getUserId());
    }
}
