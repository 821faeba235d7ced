package io.doers.escrow.repo;

import io.doers.escrow.model.NotificationOutboxEntry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static io.doers.escrow.repo.SqlTimestamps.instant;
import static io.doers.escrow.repo.SqlTimestamps.ts;
import static io.doers.escrow.repo.SqlTimestamps.uuid;

@Repository
public class NotificationOutboxRepository {

  private final JdbcTemplate jdbc;

  public NotificationOutboxRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public void insert(NotificationOutboxEntry e) {
    jdbc.update("""
        INSERT INTO notification_outbox (outbox_id, user_id, template, payload, status, attempts, created_on)
        VALUES (?, ?, ?, ?, 'PENDING', 0, ?)
        """,
        e.getOutboxId(), e.getUserId(), e.getTemplate(), e.getPayload(), ts(e.getCreatedOn()));
  }

  public List<NotificationOutboxEntry> findPending(int limit) {
    return jdbc.query("""
        SELECT outbox_id, user_id, template, payload, status, attempts, last_error, created_on, sent_on
        FROM notification_outbox
        WHERE status = 'PENDING'
        ORDER BY created_on
        LIMIT ?
        """,
        (rs, i) -> {
          NotificationOutboxEntry e = new NotificationOutboxEntry();
          e.setOutboxId(uuid(rs, "outbox_id"));
          e.setUserId(uuid(rs, "user_id"));
          e.setTemplate(rs.getString("template"));
          e.setPayload(rs.getString("payload"));
          e.setStatus(rs.getString("status"));
          e.setAttempts(rs.getInt("attempts"));
          e.setLastError(rs.getString("last_error"));
          e.setCreatedOn(instant(rs, "created_on"));
          e.setSentOn(instant(rs, "sent_on"));
          return e;
        },
        limit);
  }

  public int markSent(UUID outboxId, Instant now) {
    return jdbc.update(
        "UPDATE notification_outbox SET status = 'SENT', sent_on = ? WHERE outbox_id = ? AND status = 'PENDING'",
        ts(now), outboxId);
  }

  public int markAttemptFailed(UUID outboxId, String error, boolean abandon) {
    return jdbc.update("""
        UPDATE notification_outbox
        SET attempts = attempts + 1, last_error = ?, status = ?
        WHERE outbox_id = ? AND status = 'PENDING'
        """,
        error, abandon ? "ABANDONED" : "PENDING", outboxId);
  }

  public int countPending() {
    Integer count = jdbc.queryForObject(
        "SELECT COUNT(1) FROM notification_outbox WHERE status = 'PENDING'", Integer.class);
    return count != null ? count : 0;
  }
}
