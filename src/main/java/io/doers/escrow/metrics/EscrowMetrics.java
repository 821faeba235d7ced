package io.doers.escrow.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Prometheus-compatible metrics for escrow, ledger and scheduler activity.
 */
@Component
public class EscrowMetrics {

    private static final Logger log = LoggerFactory.getLogger(EscrowMetrics.class);

    private final Counter paymentsCaptured;
    private final Counter escrowReleased;
    private final Counter payoutsConfirmed;
    private final Counter remindersSent;
    private final Timer gatewayCallTime;
    private final Timer sweepTime;
    private final MeterRegistry registry;

    public EscrowMetrics(MeterRegistry registry, JdbcTemplate jdbc) {
        this.registry = registry;

        this.paymentsCaptured = Counter.builder("escrow.payments.captured")
            .description("Payments captured into escrow")
            .register(registry);

        this.escrowReleased = Counter.builder("escrow.payments.released")
            .description("Escrow holds released to the recipient")
            .register(registry);

        this.payoutsConfirmed = Counter.builder("escrow.payouts.confirmed")
            .description("Pending balance credits confirmed by an admin")
            .register(registry);

        this.remindersSent = Counter.builder("escrow.contracts.reminders")
            .description("Confirmation reminders queued")
            .register(registry);

        this.gatewayCallTime = Timer.builder("escrow.gateway.call.time")
            .description("Time for payment gateway calls")
            .register(registry);

        this.sweepTime = Timer.builder("escrow.sweep.time")
            .description("Time for one scheduled sweep")
            .register(registry);

        Gauge.builder("escrow.dlq.size", () -> count(jdbc,
                "SELECT COUNT(1) FROM escrow_dead_letter_queue WHERE resolved = FALSE"))
            .description("Unresolved dead letter queue entries")
            .register(registry);

        Gauge.builder("escrow.outbox.pending", () -> count(jdbc,
                "SELECT COUNT(1) FROM notification_outbox WHERE status = 'PENDING'"))
            .description("Notifications waiting for delivery")
            .register(registry);
    }

    public void recordContractCompleted(String trigger) {
        Counter.builder("escrow.contracts.completed")
            .tag("trigger", trigger != null ? trigger : "unknown")
            .register(registry)
            .increment();
    }

    public void recordPaymentCaptured() {
        paymentsCaptured.increment();
    }

    public void recordPaymentFailure(String reason) {
        Counter.builder("escrow.payments.failed")
            .tag("reason", reason != null ? reason : "unknown")
            .register(registry)
            .increment();
    }

    public void recordEscrowReleased() {
        escrowReleased.increment();
    }

    public void recordRefund(String status) {
        Counter.builder("escrow.payments.refunded")
            .tag("status", status != null ? status : "unknown")
            .register(registry)
            .increment();
    }

    public void recordPayoutConfirmed() {
        payoutsConfirmed.increment();
    }

    public void recordReminderSent() {
        remindersSent.increment();
    }

    public void recordSweepFailure(String sweep) {
        Counter.builder("escrow.sweep.failures")
            .tag("sweep", sweep)
            .register(registry)
            .increment();
    }

    public void recordNotification(String outcome) {
        Counter.builder("escrow.notifications")
            .tag("outcome", outcome)
            .register(registry)
            .increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordGatewayCallTime(Timer.Sample sample) {
        sample.stop(gatewayCallTime);
    }

    public void recordSweepTime(Timer.Sample sample) {
        sample.stop(sweepTime);
    }

    private int count(JdbcTemplate jdbc, String sql) {
        try {
            Integer count = jdbc.queryForObject(sql, Integer.class);
            return count != null ? count : 0;
        } catch (Exception e) {
            log.debug("Failed to evaluate gauge query: {}", sql, e);
            return 0;
        }
    }
}
