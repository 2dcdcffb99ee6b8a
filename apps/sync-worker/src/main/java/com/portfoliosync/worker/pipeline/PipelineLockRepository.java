package com.portfoliosync.worker.pipeline;

import java.time.Duration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Named locks with a TTL. An expired lock can be taken over by the next caller. */
@Repository
public class PipelineLockRepository {
  private final JdbcTemplate jdbcTemplate;

  public PipelineLockRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public boolean tryAcquire(String lockKey, Duration ttl) {
    String sql =
        """
            INSERT INTO pipeline_locks (lock_key, acquired_at, expires_at)
            VALUES (?, NOW(), NOW() + (? * INTERVAL '1 second'))
            ON CONFLICT (lock_key) DO UPDATE
            SET acquired_at = EXCLUDED.acquired_at,
                expires_at = EXCLUDED.expires_at
            WHERE pipeline_locks.expires_at < NOW()
            """;
    return jdbcTemplate.update(sql, lockKey, Math.max(1L, ttl.toSeconds())) == 1;
  }
}
