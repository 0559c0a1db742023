package com.gpstracker.tracker.api;

import com.gpstracker.tracker.config.TrackerProperties;
import com.gpstracker.tracker.ingest.DeviceTokenVerifier;
import com.gpstracker.tracker.model.HealthResponse;
import com.gpstracker.tracker.model.HistoryResponse;
import com.gpstracker.tracker.model.PositionRecord;
import com.gpstracker.tracker.model.PositionsResponse;
import com.gpstracker.tracker.model.StatsResponse;
import com.gpstracker.tracker.model.TrackResponse;
import com.gpstracker.tracker.service.TrackingService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for device submissions and dashboard reads.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code POST /api/track}: device position submission, shared-token protected</li>
 *   <li>{@code GET /api/positions}: latest position per device</li>
 *   <li>{@code GET /api/stats}: aggregate counters</li>
 *   <li>{@code GET /api/history/{deviceId}}: persisted history, most recent first</li>
 *   <li>{@code GET /api/health}: liveness payload</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class TrackingController {
  static final String VERSION = "1.0.0";

  private final TrackingService trackingService;
  private final DeviceTokenVerifier tokenVerifier;
  private final TrackerProperties properties;

  public TrackingController(
      TrackingService trackingService,
      DeviceTokenVerifier tokenVerifier,
      TrackerProperties properties) {
    this.trackingService = trackingService;
    this.tokenVerifier = tokenVerifier;
    this.properties = properties;
  }

  /**
   * Accepts one position report from a device.
   *
   * <p>The payload is validated before the token, so a malformed report gets 400 even without
   * credentials.
   *
   * @param headerToken token from {@code X-Device-Token}
   * @param queryToken token from the {@code token} query parameter
   * @param body JSON object with {@code device_id, lat, lng} and optional
   *     {@code speed, heading, sats, ts}
   * @return confirmation payload
   */
  @PostMapping("/track")
  public TrackResponse track(
      @RequestHeader(value = "X-Device-Token", required = false) String headerToken,
      @RequestParam(value = "token", required = false) String queryToken,
      @RequestBody Map<String, Object> body) {
    PositionRecord record = trackingService.validate(body, "http");
    tokenVerifier.verify(headerToken, queryToken);
    trackingService.accept(record, "http");
    return new TrackResponse(true, "Position updated successfully");
  }

  @GetMapping("/positions")
  public PositionsResponse positions() {
    List<PositionRecord> devices = trackingService.positions();
    return new PositionsResponse(true, devices.size(), devices);
  }

  @GetMapping("/stats")
  public StatsResponse stats() {
    return new StatsResponse(true, trackingService.stats());
  }

  /**
   * Returns persisted history for one device.
   *
   * @param deviceId device identifier
   * @param limit optional maximum number of rows; non-numeric or non-positive values fall back
   *     to the configured default
   * @return history payload, empty for unknown devices
   */
  @GetMapping("/history/{deviceId}")
  public HistoryResponse history(
      @PathVariable("deviceId") String deviceId,
      @RequestParam(value = "limit", required = false) String limit) {
    List<PositionRecord> positions = trackingService.history(deviceId, resolveLimit(limit));
    return new HistoryResponse(true, deviceId, positions.size(), positions);
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse(
        "healthy", trackingService.nowMillis(), trackingService.uptimeMillis(), VERSION);
  }

  private int resolveLimit(String raw) {
    TrackerProperties.Api api = properties.getApi();
    int parsed;
    try {
      parsed = raw == null ? 0 : Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      parsed = 0;
    }
    if (parsed <= 0) {
      parsed = api.getHistoryDefaultLimit();
    }
    return Math.min(parsed, api.getHistoryMaxLimit());
  }
}
