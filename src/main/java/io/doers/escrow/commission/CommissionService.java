package io.doers.escrow.commission;

import io.doers.escrow.exception.EscrowValidationException;
import io.doers.escrow.model.UserAccount;
import io.doers.escrow.repo.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Loads the payer profile and quotes the commission as of now.
 * The quote is meant to be snapshotted onto the contract; nothing here re-reads it later.
 */
@Service
public class CommissionService {

	private static final Logger log = LoggerFactory.getLogger(CommissionService.class);

	private final UserAccountRepository users;
	private final CommissionCalculator calculator;
	private final Clock clock;

	public CommissionService(UserAccountRepository users, CommissionCalculator calculator, Clock clock) {
		this.users = users;
		this.calculator = calculator;
		this.clock = clock;
	}

	public CommissionQuote calculateCommission(UUID payerId, BigDecimal baseAmount) {
		UserAccount payer = users.findById(payerId)
			.orElseThrow(() -> new EscrowValidationException("unknown payer: " + payerId, "payerId", payerId));
		CommissionQuote quote = calculator.calculate(payer, baseAmount, clock.instant());
		log.debug("Commission quoted: payerId={} baseAmount={} {}", payerId, baseAmount, quote);
		return quote;
	}
}
