package com.gpstracker.tracker.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Browser access to the tracker REST API.
 *
 * <p>Origins come from {@code tracker.api.cors.allowed-origins} ({@code PUBLIC_ORIGIN}). With an
 * empty list no CORS mapping is registered and only same-origin pages can call the API.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final TrackerProperties properties;

  public WebConfig(TrackerProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> origins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (origins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/api/**")
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .allowedOrigins(origins.toArray(String[]::new))
        .allowCredentials(true)
        .maxAge(600);
  }
}
