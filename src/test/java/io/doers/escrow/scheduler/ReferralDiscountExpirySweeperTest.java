package io.doers.escrow.scheduler;

import io.doers.escrow.EscrowTestContext;
import io.doers.escrow.model.UserAccount;
import io.doers.escrow.notification.NotificationTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReferralDiscountExpirySweeperTest {

    private EscrowTestContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new EscrowTestContext();
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void clearsOnlyExpiredDiscounts() {
        UserAccount expired = ctx.userWithReferralDiscount(ctx.clock.instant().minus(Duration.ofHours(1)));
        UserAccount active = ctx.userWithReferralDiscount(ctx.clock.instant().plus(Duration.ofDays(5)));

        SweepSummary summary = ctx.referralExpirySweeper.runOnce();

        assertThat(summary.getProcessed()).isEqualTo(1);
        UserAccount cleared = ctx.users.findById(expired.getUserId()).orElseThrow();
        assertThat(cleared.isHasReferralDiscount()).isFalse();
        assertThat(cleared.getCurrentCommissionRate()).isEqualByComparingTo("8");
        assertThat(ctx.users.findById(active.getUserId()).orElseThrow().isHasReferralDiscount()).isTrue();
        assertThat(ctx.outboxCount(expired.getUserId(),
            NotificationTemplate.REFERRAL_DISCOUNT_EXPIRED.getCode())).isEqualTo(1);

        assertThat(ctx.referralExpirySweeper.runOnce().getProcessed()).isZero();
    }
}
