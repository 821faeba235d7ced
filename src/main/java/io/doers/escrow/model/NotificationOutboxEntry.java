package io.doers.escrow.model;

import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
public class NotificationOutboxEntry {
  private UUID outboxId;
  private UUID userId;
  private String template;
  private String payload;             // JSON text
  private String status;              // PENDING | SENT | ABANDONED
  private int attempts;
  private String lastError;
  private Instant createdOn;
  private Instant sentOn;
}
