package com.portfoliosync.testsupport.containers;

import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL for JDBC tests. The container is wired to {@code spring.datasource.*}, so
 * Flyway migrates it on context start. Tests are skipped when no Docker daemon is reachable.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresContainerSupport {
  @Container @ServiceConnection
  protected static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("portfolio")
          .withUsername("portfolio")
          .withPassword("portfolio_pass");
}
