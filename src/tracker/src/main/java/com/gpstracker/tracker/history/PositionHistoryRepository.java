package com.gpstracker.tracker.history;

import com.gpstracker.tracker.model.PositionRecord;
import java.util.List;

/**
 * Durable store for device summaries and position history.
 *
 * <p>Every method throws {@link PersistenceException} when the store fails.
 */
public interface PositionHistoryRepository {
  /**
   * Inserts or refreshes the summary row of the record's device.
   *
   * @param record latest accepted record
   */
  void upsertDevice(PositionRecord record);

  /**
   * Appends one history row.
   *
   * @param record accepted record
   */
  void appendPosition(PositionRecord record);

  /**
   * Deletes history rows of a device beyond the {@code keep} most recent ones.
   *
   * <p>Rows are ranked by timestamp, newest first; rows sharing a timestamp are ranked by
   * insertion order so the oldest insert goes first.
   *
   * @param deviceId device identifier
   * @param keep number of rows to retain
   * @return number of deleted rows
   */
  int prune(String deviceId, int keep);

  /**
   * Returns up to {@code limit} most recent rows of a device, most recent first.
   *
   * @param deviceId device identifier
   * @param limit maximum number of rows
   * @return rows, empty for unknown devices
   */
  List<PositionRecord> findRecent(String deviceId, int limit);
}
