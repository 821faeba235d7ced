package io.doers.escrow.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.doers.escrow.model.NotificationOutboxEntry;
import io.doers.escrow.repo.NotificationOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Queues notifications for later delivery. Callers enqueue after their state change
 * has committed; enqueue failures are logged and swallowed so they can never undo
 * or block a financial transition.
 */
@Service
public class NotificationOutbox {

	private static final Logger log = LoggerFactory.getLogger(NotificationOutbox.class);

	private final NotificationOutboxRepository repo;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public NotificationOutbox(NotificationOutboxRepository repo, ObjectMapper objectMapper, Clock clock) {
		this.repo = repo;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public void enqueue(UUID userId, NotificationTemplate template, Map<String, Object> data) {
		if (userId == null) {
			return;
		}
		try {
			NotificationOutboxEntry entry = new NotificationOutboxEntry();
			entry.setOutboxId(UUID.randomUUID());
			entry.setUserId(userId);
			entry.setTemplate(template.getCode());
			entry.setPayload(data != null ? objectMapper.writeValueAsString(data) : null);
			entry.setCreatedOn(clock.instant());
			repo.insert(entry);
		} catch (Exception e) {
			log.warn("Failed to enqueue notification (non-blocking): userId={} template={} error={}",
				userId, template, e.getMessage());
			log.debug("Notification enqueue failure details", e);
		}
	}
}
