package com.gpstracker.tracker.model;

import java.util.List;

/**
 * Response contract for {@code GET /api/positions}.
 *
 * @param success always {@code true}
 * @param count number of devices returned
 * @param devices latest position of every known device
 */
public record PositionsResponse(boolean success, int count, List<PositionRecord> devices) {}
