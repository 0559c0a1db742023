package com.gpstracker.tracker.service;

import com.gpstracker.tracker.config.TrackerProperties;
import com.gpstracker.tracker.history.PositionHistoryRepository;
import com.gpstracker.tracker.history.PositionHistoryWriter;
import com.gpstracker.tracker.ingest.PositionNormalizer;
import com.gpstracker.tracker.ingest.ValidationException;
import com.gpstracker.tracker.model.PositionRecord;
import com.gpstracker.tracker.model.StatsResponse;
import com.gpstracker.tracker.state.DeviceStateStore;
import com.gpstracker.tracker.stream.PositionBroadcaster;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingestion pipeline shared by the HTTP and MQTT adapters.
 *
 * <p>An inbound payload is normalized, applied to the device state store and fanned out to
 * live viewers in one step, then handed to the history writer. Once normalization passes the
 * record is accepted unconditionally; persistence and delivery problems never reach the caller.
 */
@Service
public class TrackingService {
  private static final Logger log = LoggerFactory.getLogger(TrackingService.class);

  private final PositionNormalizer normalizer;
  private final DeviceStateStore stateStore;
  private final PositionBroadcaster broadcaster;
  private final PositionHistoryWriter historyWriter;
  private final Optional<PositionHistoryRepository> historyRepository;
  private final TrackerProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Counter acceptedCounter;
  private final ConcurrentHashMap<String, Counter> rejectedCounters = new ConcurrentHashMap<>();
  private final long startedAtMs;

  public TrackingService(
      PositionNormalizer normalizer,
      DeviceStateStore stateStore,
      PositionBroadcaster broadcaster,
      PositionHistoryWriter historyWriter,
      Optional<PositionHistoryRepository> historyRepository,
      TrackerProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.normalizer = normalizer;
    this.stateStore = stateStore;
    this.broadcaster = broadcaster;
    this.historyWriter = historyWriter;
    this.historyRepository = historyRepository;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.acceptedCounter = meterRegistry.counter("tracker.positions.accepted");
    this.startedAtMs = clock.millis();
    log.info(
        "Tracker started: historyPoints={}, onlineWindowS={}, persistence={}",
        properties.getHistoryPoints(),
        properties.getOnlineWindowSeconds(),
        historyRepository.isPresent() ? properties.getPersistence().getSqliteFile() : "disabled");
  }

  /**
   * Validates and accepts one inbound position.
   *
   * @param raw decoded payload
   * @param source adapter name used for metrics and logs ({@code http}, {@code mqtt})
   * @return accepted record
   * @throws ValidationException when the payload is malformed
   */
  public PositionRecord ingest(Map<String, ?> raw, String source) {
    return accept(validate(raw, source), source);
  }

  /**
   * Normalizes a payload without accepting it.
   *
   * @param raw decoded payload
   * @param source adapter name used for metrics and logs
   * @return canonical record
   * @throws ValidationException when the payload is malformed
   */
  public PositionRecord validate(Map<String, ?> raw, String source) {
    try {
      return normalizer.normalize(raw);
    } catch (ValidationException ex) {
      rejected(source).increment();
      log.debug("Rejected {} payload: {}", source, ex.getMessage());
      throw ex;
    }
  }

  /**
   * Applies a validated record to the state store, fans it out and queues it for history.
   *
   * <p>The history hand-off runs under the device lock so durable writes of one device follow
   * acceptance order.
   *
   * @param record record returned by {@link #validate}
   * @param source adapter name used for metrics and logs
   * @return the accepted record
   */
  public PositionRecord accept(PositionRecord record, String source) {
    broadcaster.publishAccepted(() -> stateStore.apply(record, historyWriter::submit));
    acceptedCounter.increment();
    log.debug(
        "Position updated for {} via {}: {}, {}", record.deviceId(), source, record.lat(), record.lng());
    return record;
  }

  /** Latest position of every known device. */
  public List<PositionRecord> positions() {
    return stateStore.snapshot();
  }

  /**
   * Builds the aggregate counters served by {@code /api/stats}.
   *
   * @return current statistics
   */
  public StatsResponse.Stats stats() {
    long now = clock.millis();
    long onlineThreshold = now - properties.getOnlineWindowSeconds() * 1000L;
    return new StatsResponse.Stats(
        stateStore.totalDevices(),
        stateStore.totalPositions(),
        stateStore.countUpdatedAfter(onlineThreshold),
        broadcaster.subscriberCount(),
        now - startedAtMs,
        properties.getHistoryPoints(),
        properties.getOnlineWindowSeconds());
  }

  /**
   * Reads persisted history of a device, most recent first.
   *
   * @param deviceId device identifier
   * @param limit maximum number of positions
   * @return persisted positions, empty for unknown devices or when persistence is disabled
   */
  public List<PositionRecord> history(String deviceId, int limit) {
    return historyRepository.map(repo -> repo.findRecent(deviceId, limit)).orElse(List.of());
  }

  public long uptimeMillis() {
    return clock.millis() - startedAtMs;
  }

  public long nowMillis() {
    return clock.millis();
  }

  private Counter rejected(String source) {
    return rejectedCounters.computeIfAbsent(
        source,
        s -> meterRegistry.counter("tracker.positions.rejected", "source", s, "reason", "validation"));
  }
}
