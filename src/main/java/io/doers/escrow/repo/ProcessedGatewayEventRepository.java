package io.doers.escrow.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

import static io.doers.escrow.repo.SqlTimestamps.ts;

/**
 * Gateway event ids already applied. Used to drop redelivered webhooks and repeated captures.
 */
@Repository
public class ProcessedGatewayEventRepository {

  private final JdbcTemplate jdbc;

  public ProcessedGatewayEventRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  public boolean exists(String eventId) {
    Integer count = jdbc.queryForObject(
        "SELECT COUNT(1) FROM processed_gateway_events WHERE event_id = ?", Integer.class, eventId);
    return count != null && count > 0;
  }

  /**
   * @return false when the event id was already recorded
   */
  public boolean markProcessed(String eventId, UUID paymentId, String eventType, Instant now) {
    int rows = jdbc.update("""
        INSERT INTO processed_gateway_events (event_id, payment_id, event_type, processed_on)
        VALUES (?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """,
        eventId, paymentId, eventType, ts(now));
    return rows == 1;
  }
}
