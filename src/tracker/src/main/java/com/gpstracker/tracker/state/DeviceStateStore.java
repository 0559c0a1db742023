package com.gpstracker.tracker.state;

import com.gpstracker.tracker.config.TrackerProperties;
import com.gpstracker.tracker.model.PositionRecord;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;

/**
 * In-memory source of truth for the current world state.
 *
 * <p>Holds, per device, the most recently accepted position and a FIFO trail bounded to
 * {@code tracker.history-points}. Updates for different devices run in parallel; updates for
 * the same device are serialized on its {@link DeviceState}. Devices are never evicted.
 */
@Component
public class DeviceStateStore {
  private final int historyPoints;
  private final Map<String, DeviceState> devices = new ConcurrentHashMap<>();
  private final AtomicLong totalDevices = new AtomicLong();
  private final AtomicLong totalPositions = new AtomicLong();

  public DeviceStateStore(TrackerProperties properties, MeterRegistry meterRegistry) {
    if (properties.getHistoryPoints() < 1) {
      throw new IllegalStateException("tracker.history-points must be at least 1");
    }
    this.historyPoints = properties.getHistoryPoints();
    meterRegistry.gaugeMapSize("tracker.devices.known", Tags.empty(), devices);
  }

  /**
   * Records an accepted position.
   *
   * <p>Creates the device on first sight, overwrites its latest position (last write wins, no
   * timestamp ordering) and appends to its trail, evicting the oldest entries beyond the bound.
   *
   * @param record accepted record
   * @return the same record, for downstream consumers
   */
  public PositionRecord apply(PositionRecord record) {
    return apply(record, applied -> {});
  }

  /**
   * Records an accepted position and runs {@code onApplied} before any later record of the same
   * device can be applied.
   *
   * <p>Callbacks of one device therefore run in acceptance order. They hold the device lock and
   * must not block.
   *
   * @param record accepted record
   * @param onApplied hand-off to per-device ordered consumers such as the history writer
   * @return the same record
   */
  public PositionRecord apply(PositionRecord record, Consumer<PositionRecord> onApplied) {
    DeviceState state = devices.computeIfAbsent(record.deviceId(), this::newDevice);
    state.apply(record, onApplied);
    totalPositions.incrementAndGet();
    return record;
  }

  /**
   * Returns the latest position of every known device, in no particular order.
   *
   * @return snapshot list, empty when no device has reported yet
   */
  public List<PositionRecord> snapshot() {
    List<PositionRecord> snapshot = new ArrayList<>(devices.size());
    for (DeviceState state : devices.values()) {
      PositionRecord latest = state.latest();
      if (latest != null) {
        snapshot.add(latest);
      }
    }
    return snapshot;
  }

  public Optional<PositionRecord> latest(String deviceId) {
    DeviceState state = devices.get(deviceId);
    return state == null ? Optional.empty() : Optional.ofNullable(state.latest());
  }

  /**
   * Returns the in-memory trail of a device, oldest first.
   *
   * @param deviceId device identifier
   * @return copy of the trail, empty for unknown devices
   */
  public List<PositionRecord> trail(String deviceId) {
    DeviceState state = devices.get(deviceId);
    return state == null ? List.of() : state.history();
  }

  /**
   * Counts devices whose latest position is newer than {@code thresholdMillis}.
   *
   * @param thresholdMillis exclusive lower bound in epoch milliseconds
   * @return number of online devices
   */
  public long countUpdatedAfter(long thresholdMillis) {
    return snapshot().stream().filter(position -> position.timestamp() > thresholdMillis).count();
  }

  public long totalDevices() {
    return totalDevices.get();
  }

  public long totalPositions() {
    return totalPositions.get();
  }

  private DeviceState newDevice(String deviceId) {
    totalDevices.incrementAndGet();
    return new DeviceState(historyPoints);
  }
}
