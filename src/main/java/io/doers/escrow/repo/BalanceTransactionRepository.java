package io.doers.escrow.repo;

import io.doers.escrow.model.BalanceTransaction;
import io.doers.escrow.model.BalanceTransactionStatus;
import io.doers.escrow.model.BalanceTransactionType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static io.doers.escrow.repo.SqlTimestamps.instant;
import static io.doers.escrow.repo.SqlTimestamps.ts;
import static io.doers.escrow.repo.SqlTimestamps.uuid;

/**
 * Append-only balance ledger. Rows are never deleted; only the status moves forward.
 */
@Repository
public class BalanceTransactionRepository {

  private static final String COLUMNS = """
      transaction_id, user_id, transaction_type, amount, previous_balance, new_balance,
      related_model, related_id, status, description, processed_by, processed_at, created_on
      """;

  private static final RowMapper<BalanceTransaction> MAPPER = (rs, i) -> {
    BalanceTransaction tx = new BalanceTransaction();
    tx.setTransactionId(uuid(rs, "transaction_id"));
    tx.setUserId(uuid(rs, "user_id"));
    tx.setType(BalanceTransactionType.fromCode(rs.getString("transaction_type")));
    tx.setAmount(rs.getBigDecimal("amount"));
    tx.setPreviousBalance(rs.getBigDecimal("previous_balance"));
    tx.setNewBalance(rs.getBigDecimal("new_balance"));
    tx.setRelatedModel(rs.getString("related_model"));
    tx.setRelatedId(uuid(rs, "related_id"));
    tx.setStatus(BalanceTransactionStatus.fromCode(rs.getString("status")));
    tx.setDescription(rs.getString("description"));
    tx.setProcessedBy(uuid(rs, "processed_by"));
    tx.setProcessedAt(instant(rs, "processed_at"));
    tx.setCreatedOn(instant(rs, "created_on"));
    return tx;
  };

  private final JdbcTemplate jdbc;

  public BalanceTransactionRepository(JdbcTemplate jdbcTemplate) {
    this.jdbc = jdbcTemplate;
  }

  /**
   * Inserts unless a row for the same (user, related row, type) already exists.
   * @return true if the row was written
   */
  public boolean insertIfAbsent(BalanceTransaction tx) {
    int rows = jdbc.update("""
        INSERT INTO balance_transactions
        (transaction_id, user_id, transaction_type, amount, previous_balance, new_balance,
         related_model, related_id, status, description, created_on)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """,
        tx.getTransactionId(), tx.getUserId(), tx.getType().getCode(), tx.getAmount(),
        tx.getPreviousBalance(), tx.getNewBalance(), tx.getRelatedModel(), tx.getRelatedId(),
        tx.getStatus().getCode(), tx.getDescription(), ts(tx.getCreatedOn()));
    return rows == 1;
  }

  public Optional<BalanceTransaction> findById(UUID transactionId) {
    return jdbc.query("SELECT " + COLUMNS + " FROM balance_transactions WHERE transaction_id = ?",
        MAPPER, transactionId).stream().findFirst();
  }

  public Optional<BalanceTransaction> findByRelated(UUID userId, String relatedModel, UUID relatedId,
                                                    BalanceTransactionType type) {
    return jdbc.query("SELECT " + COLUMNS + """
        FROM balance_transactions
        WHERE user_id = ? AND related_model = ? AND related_id = ? AND transaction_type = ?
        """, MAPPER, userId, relatedModel, relatedId, type.getCode()).stream().findFirst();
  }

  public List<BalanceTransaction> findByUser(UUID userId) {
    return jdbc.query("SELECT " + COLUMNS + " FROM balance_transactions WHERE user_id = ? ORDER BY created_on",
        MAPPER, userId);
  }

  /**
   * pending -> completed, recording the balance the credit produced.
   */
  public int complete(UUID transactionId, BigDecimal previousBalance, BigDecimal newBalance, UUID processedBy,
                      Instant now) {
    return jdbc.update("""
        UPDATE balance_transactions
        SET status = 'completed', previous_balance = ?, new_balance = ?, processed_by = ?, processed_at = ?
        WHERE transaction_id = ? AND status = 'pending'
        """,
        previousBalance, newBalance, processedBy, ts(now), transactionId);
  }

  public int reverse(UUID transactionId, UUID processedBy, String reason, Instant now) {
    return jdbc.update("""
        UPDATE balance_transactions
        SET status = 'reversed', processed_by = ?, processed_at = ?,
            description = COALESCE(description, '') || ' [reversed: ' || ? || ']'
        WHERE transaction_id = ? AND status = 'pending'
        """,
        processedBy, ts(now), reason, transactionId);
  }

  /**
   * Pending rows for the admin payouts view, newest first.
   */
  public List<BalanceTransaction> findPending(UUID userId, Instant createdFrom, Instant createdTo, int limit) {
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
        .append(" FROM balance_transactions WHERE status = 'pending'");
    List<Object> args = new ArrayList<>();
    if (userId != null) {
      sql.append(" AND user_id = ?");
      args.add(userId);
    }
    if (createdFrom != null) {
      sql.append(" AND created_on >= ?");
      args.add(ts(createdFrom));
    }
    if (createdTo != null) {
      sql.append(" AND created_on < ?");
      args.add(ts(createdTo));
    }
    sql.append(" ORDER BY created_on DESC LIMIT ?");
    args.add(limit);
    return jdbc.query(sql.toString(), MAPPER, args.toArray());
  }
}
