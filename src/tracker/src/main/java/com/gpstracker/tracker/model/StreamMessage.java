package com.gpstracker.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Message pushed to live viewers over the WebSocket channel.
 *
 * <p>Either a {@code snapshot} carrying every known device, or an {@code update} carrying the
 * one record that was just accepted.
 *
 * @param type {@code snapshot} or {@code update}
 * @param devices latest position per device, only set on snapshots
 * @param device accepted record, only set on updates
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamMessage(String type, List<PositionRecord> devices, PositionRecord device) {
  public static final String SNAPSHOT = "snapshot";
  public static final String UPDATE = "update";

  public static StreamMessage snapshot(List<PositionRecord> devices) {
    return new StreamMessage(SNAPSHOT, List.copyOf(devices), null);
  }

  public static StreamMessage update(PositionRecord device) {
    return new StreamMessage(UPDATE, null, device);
  }
}
