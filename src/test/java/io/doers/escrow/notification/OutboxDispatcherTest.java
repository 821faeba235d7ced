package io.doers.escrow.notification;

import io.doers.escrow.EscrowTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("OutboxDispatcher")
class OutboxDispatcherTest {

    private EscrowTestContext ctx;
    private NotificationDispatcher channel;
    private OutboxDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        ctx = new EscrowTestContext();
        ctx.props.getOutbox().setMaxAttempts(2);
        channel = mock(NotificationDispatcher.class);
        RetryTemplate retry = new RetryTemplate();
        retry.setRetryPolicy(new SimpleRetryPolicy(2));
        dispatcher = new OutboxDispatcher(ctx.outboxRepository, channel, retry, ctx.objectMapper, ctx.props,
            ctx.metrics, ctx.clock);
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private String statusOf(UUID userId) {
        return ctx.jdbc.queryForObject("SELECT status FROM notification_outbox WHERE user_id = ?", String.class, userId);
    }

    @Test
    void deliversPendingEntriesWithTheirPayload() {
        UUID user = UUID.randomUUID();
        ctx.outbox.enqueue(user, NotificationTemplate.ESCROW_HELD, Map.of("paymentId", "p-1"));

        int delivered = dispatcher.dispatchPending();

        assertThat(delivered).isEqualTo(1);
        verify(channel).notify(eq(user), eq("escrow_held"), eq(Map.of("paymentId", "p-1")));
        assertThat(statusOf(user)).isEqualTo("SENT");
        assertThat(dispatcher.dispatchPending()).isZero();
    }

    @Test
    void failingEntryStaysPendingThenIsAbandoned() {
        UUID user = UUID.randomUUID();
        ctx.outbox.enqueue(user, NotificationTemplate.PAYMENT_FAILED, Map.of());
        doThrow(new IllegalStateException("push provider down")).when(channel).notify(any(), anyString(), anyMap());

        assertThat(dispatcher.dispatchPending()).isZero();
        assertThat(statusOf(user)).isEqualTo("PENDING");

        assertThat(dispatcher.dispatchPending()).isZero();
        assertThat(statusOf(user)).isEqualTo("ABANDONED");

        // two ticks, two in-process attempts each
        verify(channel, times(4)).notify(any(), anyString(), anyMap());
        assertThat(ctx.meterRegistry.counter("escrow.notifications", "outcome", "abandoned").count()).isEqualTo(1.0);
    }

    @Test
    void oneFailureDoesNotBlockOtherEntries() {
        UUID broken = UUID.randomUUID();
        UUID fine = UUID.randomUUID();
        ctx.outbox.enqueue(broken, NotificationTemplate.PAYMENT_FAILED, Map.of());
        ctx.outbox.enqueue(fine, NotificationTemplate.ESCROW_RELEASED, Map.of());
        doThrow(new IllegalStateException("bad device token")).when(channel).notify(eq(broken), anyString(), anyMap());

        assertThat(dispatcher.dispatchPending()).isEqualTo(1);
        assertThat(statusOf(fine)).isEqualTo("SENT");
        assertThat(statusOf(broken)).isEqualTo("PENDING");
    }

    @Test
    void enqueueWithoutUserIsDropped() {
        ctx.outbox.enqueue(null, NotificationTemplate.ESCROW_HELD, Map.of());

        assertThat(ctx.outboxRepository.countPending()).isZero();
    }
}
