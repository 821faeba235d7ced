package io.doers.escrow.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Writes notifications to the log. Replace with a @Primary dispatcher to deliver push or email.
 */
@Component
public class LoggingNotificationDispatcher implements NotificationDispatcher {

	private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

	@Override
	public void notify(UUID userId, String template, Map<String, Object> data) {
		log.info("Notification: userId={} template={} data={}", userId, template, data);
	}
}
