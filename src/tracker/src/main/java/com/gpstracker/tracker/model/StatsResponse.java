package com.gpstracker.tracker.model;

/**
 * Response contract for {@code GET /api/stats}.
 *
 * @param success always {@code true}
 * @param stats aggregate counters
 */
public record StatsResponse(boolean success, Stats stats) {

  /**
   * Aggregate server counters.
   *
   * @param totalDevices distinct devices seen since startup
   * @param totalPositions accepted positions since startup
   * @param onlineDevices devices whose latest position falls inside the online window
   * @param wsClients live push subscribers
   * @param uptime process uptime in milliseconds
   * @param historyPoints configured history bound per device
   * @param onlineWindowS configured online window in seconds
   */
  public record Stats(
      long totalDevices,
      long totalPositions,
      long onlineDevices,
      int wsClients,
      long uptime,
      int historyPoints,
      int onlineWindowS) {}
}
