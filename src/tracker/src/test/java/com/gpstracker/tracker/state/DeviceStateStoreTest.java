package com.gpstracker.tracker.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gpstracker.tracker.config.TrackerProperties;
import com.gpstracker.tracker.model.PositionRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DeviceStateStoreTest {

  private static DeviceStateStore store(int historyPoints) {
    TrackerProperties properties = new TrackerProperties();
    properties.setHistoryPoints(historyPoints);
    return new DeviceStateStore(properties, new SimpleMeterRegistry());
  }

  private static PositionRecord point(String deviceId, int seq) {
    return new PositionRecord(deviceId, 40.0 + seq * 0.001, -74.0, seq, seq % 360, 8, 1_700_000_000_000L + seq);
  }

  @Test
  void historyIsBoundedAndKeepsMostRecentInArrivalOrder() {
    DeviceStateStore store = store(3);
    List<PositionRecord> sent = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      PositionRecord record = point("D1", i);
      sent.add(record);
      store.apply(record);
      assertThat(store.trail("D1")).hasSize(Math.min(i + 1, 3));
    }

    assertThat(store.trail("D1")).containsExactlyElementsOf(sent.subList(4, 7));
  }

  @Test
  void shortHistoryIsKeptWhole() {
    DeviceStateStore store = store(500);
    store.apply(point("D1", 1));
    store.apply(point("D1", 2));

    assertThat(store.trail("D1")).containsExactly(point("D1", 1), point("D1", 2));
  }

  @Test
  void latestIsLastAcceptedRecordRegardlessOfTimestampOrder() {
    DeviceStateStore store = store(10);
    PositionRecord newer = new PositionRecord("D1", 1.0, 1.0, 0, 0, 0, 2_000L);
    PositionRecord older = new PositionRecord("D1", 2.0, 2.0, 0, 0, 0, 1_000L);

    store.apply(newer);
    store.apply(point("D2", 1));
    store.apply(older);

    assertThat(store.latest("D1")).contains(older);
  }

  @Test
  void snapshotHoldsOneLatestEntryPerDevice() {
    DeviceStateStore store = store(10);
    store.apply(point("A", 1));
    store.apply(point("B", 1));
    store.apply(point("A", 2));
    store.apply(point("C", 1));

    assertThat(store.snapshot())
        .containsExactlyInAnyOrder(point("A", 2), point("B", 1), point("C", 1));
    assertThat(store.totalDevices()).isEqualTo(3);
    assertThat(store.totalPositions()).isEqualTo(4);
  }

  @Test
  void unknownDeviceHasEmptyTrailAndNoLatest() {
    DeviceStateStore store = store(10);

    assertThat(store.trail("nope")).isEmpty();
    assertThat(store.latest("nope")).isEmpty();
    assertThat(store.snapshot()).isEmpty();
  }

  @Test
  void countsDevicesUpdatedAfterThreshold() {
    DeviceStateStore store = store(10);
    store.apply(new PositionRecord("old", 1, 1, 0, 0, 0, 1_000L));
    store.apply(new PositionRecord("edge", 1, 1, 0, 0, 0, 5_000L));
    store.apply(new PositionRecord("fresh", 1, 1, 0, 0, 0, 9_000L));

    assertThat(store.countUpdatedAfter(5_000L)).isEqualTo(1);
  }

  @Test
  void concurrentUpdatesKeepLatestAndHistoryConsistent() throws Exception {
    DeviceStateStore store = store(50);
    int writers = 8;
    int perWriter = 500;
    ExecutorService pool = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int w = 0; w < writers; w++) {
        String deviceId = w % 2 == 0 ? "shared" : "own-" + w;
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < perWriter; i++) {
            store.apply(point(deviceId, i));
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(store.totalPositions()).isEqualTo((long) writers * perWriter);
    assertThat(store.totalDevices()).isEqualTo(5);
    for (PositionRecord latest : store.snapshot()) {
      List<PositionRecord> trail = store.trail(latest.deviceId());
      assertThat(trail).hasSize(50);
      assertThat(trail.get(trail.size() - 1)).isEqualTo(latest);
    }
  }

  @Test
  void applyCallbackBlocksLaterRecordsOfSameDeviceOnly() throws Exception {
    DeviceStateStore store = store(10);
    CountDownLatch inCallback = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    List<Integer> order = new CopyOnWriteArrayList<>();

    Thread first = new Thread(() -> store.apply(point("D1", 1), applied -> {
      order.add(1);
      inCallback.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }));
    first.start();
    assertThat(inCallback.await(5, TimeUnit.SECONDS)).isTrue();

    Thread second = new Thread(() -> store.apply(point("D1", 2), applied -> order.add(2)));
    second.start();
    store.apply(point("D2", 1), applied -> order.add(99));
    second.join(200);

    assertThat(second.isAlive()).isTrue();
    assertThat(order).containsExactly(1, 99);

    release.countDown();
    first.join(5_000);
    second.join(5_000);
    assertThat(order).containsExactly(1, 99, 2);
    assertThat(store.latest("D1")).contains(point("D1", 2));
  }

  @Test
  void rejectsNonPositiveHistoryBound() {
    assertThatThrownBy(() -> store(0)).isInstanceOf(IllegalStateException.class);
  }
}
