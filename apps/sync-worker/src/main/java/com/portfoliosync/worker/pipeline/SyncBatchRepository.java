package com.portfoliosync.worker.pipeline;

import com.portfoliosync.infra.kafka.contract.payload.SyncConnectorTaskV1;
import com.portfoliosync.worker.connection.ConnectionSpec;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Per-user barrier rows and the per-connection run rows below them. Callers own the transaction;
 * the run lookups take row locks.
 */
@Repository
public class SyncBatchRepository {
  private final JdbcTemplate jdbcTemplate;

  public SyncBatchRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public long createBatch(long userId, LocalDate snapshotDate, int totalTasks) {
    String sql =
        """
            INSERT INTO sync_batches (
                user_id, snapshot_date, total_tasks, pending_tasks, status, created_at)
            VALUES (?, ?, ?, ?, 'RUNNING', NOW())
            RETURNING id
            """;
    Long id =
        jdbcTemplate.queryForObject(
            sql, Long.class, userId, Date.valueOf(snapshotDate), totalTasks, totalTasks);
    return id;
  }

  public long createTaskRun(long batchId, ConnectionSpec connection) {
    String sql =
        """
            INSERT INTO sync_task_runs (
                batch_id, user_id, connection_id, connection_kind, source_type, status, attempt)
            VALUES (?, ?, ?, ?, ?, 'PENDING', 0)
            RETURNING id
            """;
    Long id =
        jdbcTemplate.queryForObject(
            sql,
            Long.class,
            batchId,
            connection.userId(),
            connection.connectionId(),
            connection.connectionKind().name(),
            connection.sourceType().queueName());
    return id;
  }

  public Optional<TaskRunState> findRunForUpdate(long batchId, String connectionKind, long connectionId) {
    String sql =
        """
            SELECT id, batch_id, status, attempt
            FROM sync_task_runs
            WHERE batch_id = ?
              AND connection_kind = ?
              AND connection_id = ?
            FOR UPDATE
            """;
    List<TaskRunState> rows =
        jdbcTemplate.query(
            sql,
            (rs, rowNum) ->
                new TaskRunState(
                    rs.getLong("id"),
                    rs.getLong("batch_id"),
                    TaskRunStatus.valueOf(rs.getString("status")),
                    rs.getInt("attempt")),
            batchId,
            connectionKind,
            connectionId);
    return rows.stream().findFirst();
  }

  /**
   * Runs still open in batches created before {@code createdBefore}, as the task that would have
   * closed them. Oldest first.
   */
  public List<SyncConnectorTaskV1> findStaleRuns(Instant createdBefore, int limit) {
    String sql =
        """
            SELECT r.batch_id, r.user_id, r.connection_id, r.connection_kind, r.source_type, r.attempt,
                   b.snapshot_date
            FROM sync_task_runs r
            JOIN sync_batches b ON b.id = r.batch_id
            WHERE r.status IN ('PENDING', 'RUNNING', 'RETRYING')
              AND b.created_at < ?
            ORDER BY b.created_at, r.id
            LIMIT ?
            """;
    return jdbcTemplate.query(
        sql,
        (rs, rowNum) ->
            new SyncConnectorTaskV1(
                rs.getLong("batch_id"),
                rs.getLong("user_id"),
                rs.getLong("connection_id"),
                rs.getString("connection_kind"),
                rs.getString("source_type"),
                rs.getDate("snapshot_date").toLocalDate(),
                Math.max(1, rs.getInt("attempt"))),
        Timestamp.from(createdBefore),
        Math.max(1, limit));
  }

  public void markRunning(long runId, int attempt) {
    jdbcTemplate.update(
        """
            UPDATE sync_task_runs
            SET status = 'RUNNING',
                attempt = ?,
                started_at = COALESCE(started_at, NOW())
            WHERE id = ?
            """,
        attempt,
        runId);
  }

  public void markRetrying(long runId, int attempt, String error) {
    jdbcTemplate.update(
        """
            UPDATE sync_task_runs
            SET status = 'RETRYING',
                attempt = ?,
                last_error = ?
            WHERE id = ?
            """,
        attempt,
        error,
        runId);
  }

  /** Moves a run to a terminal state once; returns false when it already was terminal. */
  public boolean markTerminal(long runId, TaskRunStatus status, String error, String resultJson) {
    if (!status.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal status: " + status);
    }
    int updated =
        jdbcTemplate.update(
            """
                UPDATE sync_task_runs
                SET status = ?,
                    last_error = ?,
                    result = CAST(? AS JSONB),
                    finished_at = NOW()
                WHERE id = ?
                  AND status NOT IN ('SUCCEEDED', 'FAILED')
                """,
            status.name(),
            error,
            resultJson,
            runId);
    return updated == 1;
  }

  /** Counts one finished task against the barrier and returns the tasks still pending. */
  public OptionalInt decrementPending(long batchId) {
    String sql =
        """
            UPDATE sync_batches
            SET pending_tasks = pending_tasks - 1,
                status = CASE WHEN pending_tasks - 1 = 0 THEN 'ANALYZING' ELSE status END
            WHERE id = ?
              AND pending_tasks > 0
            RETURNING pending_tasks
            """;
    List<Integer> remaining = jdbcTemplate.queryForList(sql, Integer.class, batchId);
    return remaining.isEmpty() ? OptionalInt.empty() : OptionalInt.of(remaining.get(0));
  }

  public void markCompleted(long batchId) {
    jdbcTemplate.update(
        """
            UPDATE sync_batches
            SET status = 'COMPLETED',
                completed_at = COALESCE(completed_at, NOW())
            WHERE id = ?
            """,
        batchId);
  }
}
