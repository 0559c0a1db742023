package com.gpstracker.tracker.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Response contract for {@code GET /api/history/{deviceId}}.
 *
 * @param success always {@code true}
 * @param deviceId requested device
 * @param count number of returned positions
 * @param positions persisted positions, most recent first
 */
public record HistoryResponse(
    boolean success,
    @JsonProperty("device_id") String deviceId,
    int count,
    List<PositionRecord> positions) {}
