package io.doers.escrow.health;

import io.doers.escrow.config.EscrowProperties;
import io.doers.escrow.dlq.DeadLetterQueueService;
import io.doers.escrow.ratelimit.EscrowRateLimiter;
import io.doers.escrow.repo.NotificationOutboxRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Checks database connectivity, payment gateway availability, DLQ size and outbox backlog.
 */
@Component
public class EscrowHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbc;
    private final RestTemplate restTemplate;
    private final EscrowProperties props;
    private final DeadLetterQueueService dlqService;
    private final NotificationOutboxRepository outboxRepository;
    private final EscrowRateLimiter rateLimiter;

    public EscrowHealthIndicator(JdbcTemplate jdbc, RestTemplate restTemplate, EscrowProperties props,
                                 DeadLetterQueueService dlqService, NotificationOutboxRepository outboxRepository,
                                 EscrowRateLimiter rateLimiter) {
        this.jdbc = jdbc;
        this.restTemplate = restTemplate;
        this.props = props;
        this.dlqService = dlqService;
        this.outboxRepository = outboxRepository;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        Map<String, Object> details = new HashMap<>();

        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
            details.put("database", Map.of("status", "UP", "message", "Connected"));
        } catch (Exception e) {
            details.put("database", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
            return builder.down().withDetails(details).build();
        }

        // gateway down means degraded, not down
        String strategy = props.getGateway().getStrategy();
        if ("HTTP".equalsIgnoreCase(strategy)) {
            EscrowProperties.Gateway.Http http = props.getGateway().getHttp();
            String healthUrl = http.getBaseUrl() + http.getHealthPath();
            try {
                var response = restTemplate.getForEntity(healthUrl, Map.class);
                if (response.getStatusCode().is2xxSuccessful()) {
                    details.put("paymentGateway", Map.of("status", "UP", "url", healthUrl));
                } else {
                    details.put("paymentGateway", Map.of("status", "WARNING", "statusCode", response.getStatusCode().value()));
                }
            } catch (Exception e) {
                details.put("paymentGateway", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
            }
        } else {
            details.put("paymentGateway", Map.of("status", "N/A", "strategy", strategy));
        }
        details.put("gatewayTokensAvailable", rateLimiter.getRemainingGatewayTokens());

        boolean healthy = true;
        int threshold = props.getDlqWarningThreshold();
        int dlqSize = dlqService.getUnresolvedCount();
        details.put("deadLetterQueue", Map.of("size", dlqSize, "status", dlqSize > threshold ? "WARNING" : "OK"));
        if (dlqSize > threshold) {
            builder.withDetail("dlqWarning", "DLQ size exceeds threshold: " + dlqSize);
            healthy = false;
        }

        try {
            details.put("outboxPending", outboxRepository.countPending());
        } catch (Exception e) {
            details.put("outboxPending", "CHECK_FAILED");
        }

        builder.withDetails(details);
        return healthy ? builder.up().build() : builder.status(Status.DOWN).build();
    }
}
