package com.gpstracker.tracker.history;

import com.gpstracker.tracker.config.TrackerProperties;
import com.gpstracker.tracker.model.PositionRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Best-effort mirror of accepted positions into the history store.
 *
 * <p>Records are queued on a bounded queue drained by one writer thread, which keeps writes for
 * a device in acceptance order. For each record the device summary is refreshed, a history row is
 * appended and the device history is pruned to {@code tracker.history-points}. Every failure is
 * logged and counted, never retried, and never reported back to the ingestion path. When the
 * queue is full the record is dropped from the durable store only.
 */
@Component
public class PositionHistoryWriter {
  private static final Logger log = LoggerFactory.getLogger(PositionHistoryWriter.class);

  private final Optional<PositionHistoryRepository> repository;
  private final int historyPoints;
  private final int shutdownTimeoutSeconds;
  private final Executor executor;
  private final Counter writeCounter;
  private final Counter errorCounter;
  private final Counter droppedCounter;

  @Autowired
  public PositionHistoryWriter(
      Optional<PositionHistoryRepository> repository,
      TrackerProperties properties,
      MeterRegistry meterRegistry) {
    this(repository, properties, meterRegistry, newWriterExecutor(properties));
  }

  PositionHistoryWriter(
      Optional<PositionHistoryRepository> repository,
      TrackerProperties properties,
      MeterRegistry meterRegistry,
      Executor executor) {
    this.repository = repository;
    this.historyPoints = properties.getHistoryPoints();
    this.shutdownTimeoutSeconds = Math.max(1, properties.getPersistence().getOperationTimeoutSeconds());
    this.executor = executor;
    this.writeCounter = meterRegistry.counter("tracker.persistence.writes");
    this.errorCounter = meterRegistry.counter("tracker.persistence.errors");
    this.droppedCounter = meterRegistry.counter("tracker.persistence.dropped");
    if (executor instanceof ThreadPoolExecutor pool) {
      meterRegistry.gauge("tracker.persistence.queue.depth", pool, p -> p.getQueue().size());
    }
  }

  private static ThreadPoolExecutor newWriterExecutor(TrackerProperties properties) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(Math.max(1, properties.getPersistence().getQueueCapacity())),
        runnable -> {
          Thread thread = new Thread(runnable, "tracker-history-writer");
          thread.setDaemon(true);
          return thread;
        });
  }

  /**
   * Queues an accepted record for persistence without waiting for it.
   *
   * @param record accepted record
   */
  public void submit(PositionRecord record) {
    if (repository.isEmpty()) {
      return;
    }
    try {
      executor.execute(() -> write(repository.get(), record));
    } catch (RejectedExecutionException ex) {
      droppedCounter.increment();
      log.warn("History queue full, position for {} not persisted", record.deviceId());
    }
  }

  private void write(PositionHistoryRepository store, PositionRecord record) {
    boolean ok = step("update device", record, () -> store.upsertDevice(record));
    ok &= step("insert position", record, () -> store.appendPosition(record));
    ok &= step("prune positions", record, () -> store.prune(record.deviceId(), historyPoints));
    if (ok) {
      writeCounter.increment();
    }
  }

  private boolean step(String operation, PositionRecord record, Runnable action) {
    try {
      action.run();
      return true;
    } catch (Exception ex) {
      errorCounter.increment();
      log.warn("History store failed to {} for {}", operation, record.deviceId(), ex);
      return false;
    }
  }

  /** Lets queued writes finish for up to the operation timeout, then abandons the rest. */
  @PreDestroy
  public void shutdown() {
    if (!(executor instanceof ExecutorService service)) {
      return;
    }
    service.shutdown();
    try {
      if (!service.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
        int abandoned = service.shutdownNow().size();
        log.warn("History writer stopped with {} queued positions not persisted", abandoned);
      }
    } catch (InterruptedException ignored) {
      service.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
