package io.doers.escrow.notification;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.metrics.EscrowMetrics;
import io.doers.escrow.model.NotificationOutboxEntry;
import io.doers.escrow.repo.NotificationOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the notification outbox. Each entry gets a short in-process retry; entries that
 * still fail stay pending for the next tick until they run out of attempts.
 */
@Service
public class OutboxDispatcher {

	private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

	private final NotificationOutboxRepository repo;
	private final NotificationDispatcher dispatcher;
	private final RetryTemplate retryTemplate;
	private final ObjectMapper objectMapper;
	private final EscrowProperties props;
	private final EscrowMetrics metrics;
	private final Clock clock;
	private final AtomicBoolean running = new AtomicBoolean(false);

	public OutboxDispatcher(NotificationOutboxRepository repo, NotificationDispatcher dispatcher,
			@Qualifier("notificationRetryTemplate") RetryTemplate retryTemplate, ObjectMapper objectMapper,
			EscrowProperties props, EscrowMetrics metrics, Clock clock) {
		this.repo = repo;
		this.dispatcher = dispatcher;
		this.retryTemplate = retryTemplate;
		this.objectMapper = objectMapper;
		this.props = props;
		this.metrics = metrics;
		this.clock = clock;
	}

	/**
	 * @return number of notifications delivered in this pass
	 */
	public int dispatchPending() {
		if (!running.compareAndSet(false, true)) {
			log.info("Outbox dispatch still running, skipping tick");
			return 0;
		}
		try {
			int delivered = 0;
			List<NotificationOutboxEntry> batch = repo.findPending(props.getOutbox().getBatchSize());
			for (NotificationOutboxEntry entry : batch) {
				if (deliver(entry)) {
					delivered++;
				}
			}
			if (!batch.isEmpty()) {
				log.info("Outbox dispatch finished: batch={} delivered={}", batch.size(), delivered);
			}
			return delivered;
		} finally {
			running.set(false);
		}
	}

	private boolean deliver(NotificationOutboxEntry entry) {
		try {
			Map<String, Object> data = parse(entry.getPayload());
			retryTemplate.execute(ctx -> {
				dispatcher.notify(entry.getUserId(), entry.getTemplate(), data);
				return null;
			});
			repo.markSent(entry.getOutboxId(), clock.instant());
			metrics.recordNotification("sent");
			return true;
		} catch (Exception e) {
			boolean abandon = entry.getAttempts() + 1 >= props.getOutbox().getMaxAttempts();
			repo.markAttemptFailed(entry.getOutboxId(), truncate(e.getMessage()), abandon);
			metrics.recordNotification(abandon ? "abandoned" : "failed");
			if (abandon) {
				log.error("Notification abandoned after {} attempts: outboxId={} userId={} template={}",
					entry.getAttempts() + 1, entry.getOutboxId(), entry.getUserId(), entry.getTemplate(), e);
			} else {
				log.warn("Notification delivery failed, will retry next tick: outboxId={} error={}",
					entry.getOutboxId(), e.getMessage());
			}
			return false;
		}
	}

	private Map<String, Object> parse(String payload) throws Exception {
		if (payload == null) {
			return Collections.emptyMap();
		}
		return objectMapper.readValue(payload, new TypeReference<Map<String, Object>>() {});
	}

	private static String truncate(String message) {
		if (message == null) {
			return null;
		}
		return message.length() > 1000 ? message.substring(0, 1000) : message;
	}
}
