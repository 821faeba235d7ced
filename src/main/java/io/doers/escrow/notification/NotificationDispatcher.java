package io.doers.escrow.notification;

import java.util.Map;
import java.util.UUID;

/**
 * Delivery channel for user notifications (push, email). Implementations may throw;
 * the outbox dispatcher handles retries.
 */
public interface NotificationDispatcher {

	void notify(UUID userId, String template, Map<String, Object> data);
}
