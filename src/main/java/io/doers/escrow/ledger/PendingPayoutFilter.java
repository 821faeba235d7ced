package io.doers.escrow.ledger;

import java.time.Instant;
import java.util.UUID;

/**
 * Query parameters for the admin pending-payouts view. All fields optional.
 */
public class PendingPayoutFilter {

	public static final int DEFAULT_LIMIT = 100;
	public static final int MAX_LIMIT = 500;

	private UUID userId;
	private Instant createdFrom;
	private Instant createdTo;
	private int limit = DEFAULT_LIMIT;

	public static PendingPayoutFilter all() {
		return new PendingPayoutFilter();
	}

	public UUID getUserId() {
		return userId;
	}

	public PendingPayoutFilter setUserId(UUID userId) {
		this.userId = userId;
		return this;
	}

	public Instant getCreatedFrom() {
		return createdFrom;
	}

	public PendingPayoutFilter setCreatedFrom(Instant createdFrom) {
		this.createdFrom = createdFrom;
		return this;
	}

	public Instant getCreatedTo() {
		return createdTo;
	}

	public PendingPayoutFilter setCreatedTo(Instant createdTo) {
		this.createdTo = createdTo;
		return this;
	}

	public int getLimit() {
		return limit;
	}

	public PendingPayoutFilter setLimit(int limit) {
		this.limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
		return this;
	}
}
