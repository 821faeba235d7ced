package io.doers.escrow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry template for notification delivery from the outbox.
 * Short backoff only: anything still failing stays in the outbox for the next tick.
 */
@Configuration
public class RetryConfig {

	private static final Logger log = LoggerFactory.getLogger(RetryConfig.class);

	@Bean
	public RetryTemplate notificationRetryTemplate() {
		RetryTemplate retryTemplate = new RetryTemplate();

		SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy();
		retryPolicy.setMaxAttempts(3);
		retryTemplate.setRetryPolicy(retryPolicy);

		// 200ms, 400ms, capped at 2s
		ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
		backOffPolicy.setInitialInterval(200);
		backOffPolicy.setMultiplier(2.0);
		backOffPolicy.setMaxInterval(2000);
		retryTemplate.setBackOffPolicy(backOffPolicy);

		retryTemplate.registerListener(new RetryListener() {
			@Override
			public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
					Throwable throwable) {
				int attempt = context.getRetryCount();
				log.warn("Notification delivery failed (attempt {} of {}): {}",
					attempt, retryPolicy.getMaxAttempts(), throwable.getMessage());
			}

			@Override
			public <T, E extends Throwable> void onSuccess(RetryContext context, RetryCallback<T, E> callback,
					T result) {
				if (context.getRetryCount() > 0) {
					log.info("Notification delivered after {} retries", context.getRetryCount());
				}
			}
		});

		return retryTemplate;
	}
}
