package com.portfoliosync.worker.dispatch;

import com.portfoliosync.worker.config.DispatchProperties;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcTaskDispatchRepository implements TaskDispatchRepository {
  private final JdbcTemplate jdbcTemplate;
  private final int maxAttempts;

  public JdbcTaskDispatchRepository(JdbcTemplate jdbcTemplate, DispatchProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.maxAttempts = Math.max(1, properties.getMaxAttempts());
  }

  @Override
  public UUID enqueue(
      String taskType, String topic, String messageKey, String payloadJson, Instant availableAt) {
    UUID id = UUID.randomUUID();
    String sql =
        """
            INSERT INTO task_dispatch_queue (
                id,
                task_type,
                topic,
                message_key,
                payload,
                status,
                attempt_count,
                available_at,
                created_at
            ) VALUES (?, ?, ?, ?, CAST(? AS JSONB), 'NEW', 0, ?, NOW())
            """;
    jdbcTemplate.update(
        sql, id, taskType, topic, messageKey, payloadJson, Timestamp.from(availableAt));
    return id;
  }

  /** Claims due rows for this instance; rows stuck in PROCESSING for two minutes are released first. */
  @Override
  @Transactional
  public List<TaskDispatchRecord> claimDueBatch(int limit) {
    int safeLimit = Math.max(1, limit);
    String reclaimStaleSql =
        """
            UPDATE task_dispatch_queue
            SET status = 'FAILED',
                available_at = NOW(),
                processing_started_at = NULL,
                last_error = COALESCE(last_error, 'Reclaimed stale dispatch lease')
            WHERE status = 'PROCESSING'
              AND processing_started_at < NOW() - INTERVAL '2 minutes'
            """;
    jdbcTemplate.update(reclaimStaleSql);

    String sql =
        """
            WITH claimable AS (
                SELECT id
                FROM task_dispatch_queue
                WHERE status IN ('NEW', 'FAILED')
                  AND available_at <= NOW()
                ORDER BY available_at ASC, created_at ASC
                FOR UPDATE SKIP LOCKED
                LIMIT ?
            )
            UPDATE task_dispatch_queue queue
            SET status = 'PROCESSING',
                processing_started_at = NOW()
            FROM claimable
            WHERE queue.id = claimable.id
            RETURNING queue.id,
                      queue.task_type,
                      queue.topic,
                      queue.message_key,
                      queue.payload,
                      queue.status,
                      queue.attempt_count,
                      queue.available_at,
                      queue.created_at
            """;
    return jdbcTemplate.query(sql, this::mapRecord, safeLimit);
  }

  @Override
  public void markPublished(UUID id, Instant publishedAt) {
    String sql =
        """
            UPDATE task_dispatch_queue
            SET status = 'PUBLISHED',
                published_at = ?,
                last_error = NULL,
                processing_started_at = NULL
            WHERE id = ?
            """;
    jdbcTemplate.update(sql, Timestamp.from(publishedAt), id);
  }

  @Override
  public boolean markFailed(UUID id, String errorMessage) {
    String sql =
        """
            UPDATE task_dispatch_queue
            SET status = CASE
                            WHEN attempt_count + 1 >= ? THEN 'DEAD'
                            ELSE 'FAILED'
                         END,
                attempt_count = attempt_count + 1,
                last_error = ?,
                processing_started_at = NULL,
                available_at = CASE
                                 WHEN attempt_count + 1 >= ? THEN available_at
                                 ELSE NOW() + (INTERVAL '5 seconds' * POWER(2, LEAST(attempt_count + 1, 6)))
                               END
            WHERE id = ?
            RETURNING status
            """;
    List<String> status = jdbcTemplate.queryForList(sql, String.class, maxAttempts, errorMessage, maxAttempts, id);
    return status.size() == 1 && "DEAD".equals(status.get(0));
  }

  private TaskDispatchRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
    return new TaskDispatchRecord(
        rs.getObject("id", UUID.class),
        rs.getString("task_type"),
        rs.getString("topic"),
        rs.getString("message_key"),
        rs.getString("payload"),
        rs.getString("status"),
        rs.getInt("attempt_count"),
        rs.getTimestamp("available_at").toInstant(),
        rs.getTimestamp("created_at").toInstant());
  }
}
