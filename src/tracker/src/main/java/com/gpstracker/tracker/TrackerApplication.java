package com.gpstracker.tracker;

import com.gpstracker.tracker.config.TrackerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot entrypoint for the GPS tracker service.
 *
 * <p>The service accepts device positions over HTTP (and optionally MQTT), keeps the latest
 * position and a bounded trail per device in memory, mirrors history into SQLite and pushes
 * every accepted position to connected WebSocket viewers.
 */
@SpringBootApplication
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerApplication {
  /**
   * Starts the tracker application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(TrackerApplication.class, args);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "tracker.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
