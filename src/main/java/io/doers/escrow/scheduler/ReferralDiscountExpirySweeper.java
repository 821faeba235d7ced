package io.doers.escrow.scheduler;

import io.doers.escrow.commission.CommissionCalculator;
import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.model.MembershipTier;
import io.doers.escrow.model.UserAccount;
import io.doers.escrow.notification.NotificationOutbox;
import io.doers.escrow.notification.NotificationTemplate;
import io.doers.escrow.repo.UserAccountRepository;
import io.doers.escrow.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daily cleanup of referral discounts past their expiry. Commission quotes already ignore
 * an expired discount; this only resets the stored flag and rate for display.
 */
@Component
public class ReferralDiscountExpirySweeper {

	private static final Logger log = LoggerFactory.getLogger(ReferralDiscountExpirySweeper.class);

	public static final String SWEEP_NAME = "referral-expiry";

	private final UserAccountRepository users;
	private final CommissionCalculator calculator;
	private final NotificationOutbox outbox;
	private final EscrowProperties props;
	private final Clock clock;
	private final AtomicBoolean running = new AtomicBoolean(false);

	public ReferralDiscountExpirySweeper(UserAccountRepository users, CommissionCalculator calculator,
			NotificationOutbox outbox, EscrowProperties props, Clock clock) {
		this.users = users;
		this.calculator = calculator;
		this.outbox = outbox;
		this.props = props;
		this.clock = clock;
	}

	public SweepSummary runOnce() {
		if (!running.compareAndSet(false, true)) {
			return SweepSummary.notRun(SWEEP_NAME);
		}
		LoggingUtils.setTickName(SWEEP_NAME);
		SweepSummary summary = SweepSummary.started(SWEEP_NAME);
		try {
			Instant now = clock.instant();
			for (MembershipTier tier : MembershipTier.values()) {
				for (UserAccount user : users.findExpiredReferralDiscounts(now, tier)) {
					BigDecimal rate = user.isFamilyPlan()
						? props.getCommission().getFamilyPlanRate()
						: calculator.tierRate(tier);
					if (users.clearReferralDiscount(user.getUserId(), rate, now) == 0) {
						summary.skipped();
						continue;
					}
					summary.processed();
					outbox.enqueue(user.getUserId(), NotificationTemplate.REFERRAL_DISCOUNT_EXPIRED,
						Map.of("commissionRate", rate.toPlainString()));
				}
			}
			if (summary.getProcessed() > 0) {
				log.info("Referral discounts expired: {}", summary);
			}
			return summary;
		} finally {
			LoggingUtils.clearContext();
			running.set(false);
		}
	}
}
