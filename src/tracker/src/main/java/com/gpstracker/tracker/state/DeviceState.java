package com.gpstracker.tracker.state;

import com.gpstracker.tracker.model.PositionRecord;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Latest position and bounded trail of one device.
 *
 * <p>Owned by {@link DeviceStateStore}; every method synchronizes on the instance so
 * {@code latest} and {@code history} always move together.
 */
final class DeviceState {
  private final int historyPoints;
  private final Deque<PositionRecord> history;
  private PositionRecord latest;

  DeviceState(int historyPoints) {
    this.historyPoints = historyPoints;
    this.history = new ArrayDeque<>(Math.min(historyPoints, 64));
  }

  synchronized void apply(PositionRecord record, Consumer<PositionRecord> onApplied) {
    latest = record;
    history.addLast(record);
    while (history.size() > historyPoints) {
      history.removeFirst();
    }
    onApplied.accept(record);
  }

  synchronized PositionRecord latest() {
    return latest;
  }

  synchronized List<PositionRecord> history() {
    return new ArrayList<>(history);
  }
}
