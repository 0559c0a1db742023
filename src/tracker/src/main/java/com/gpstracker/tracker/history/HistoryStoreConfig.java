package com.gpstracker.tracker.history;

import com.gpstracker.tracker.config.TrackerProperties;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the durable history store.
 *
 * <p>The repository bean is only created when persistence is enabled; without it the tracker
 * runs purely in memory and history reads come back empty.
 */
@Configuration
public class HistoryStoreConfig {
  private static final Logger log = LoggerFactory.getLogger(HistoryStoreConfig.class);

  /**
   * Opens the SQLite history database.
   *
   * @param properties typed tracker properties
   * @return history repository instance
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(
      prefix = "tracker.persistence",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public PositionHistoryRepository positionHistoryRepository(TrackerProperties properties) {
    String file = properties.getPersistence().getSqliteFile();
    if (file == null || file.isBlank()) {
      throw new IllegalStateException("tracker.persistence.enabled=true but sqlite-file is empty");
    }
    log.info("Connected to SQLite history database: {}", file);
    return new SqlitePositionHistoryRepository(
        Path.of(file), properties.getPersistence().getOperationTimeoutSeconds());
  }
}
