package com.gpstracker.tracker.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpstracker.tracker.config.TrackerProperties;
import com.gpstracker.tracker.model.PositionRecord;
import com.gpstracker.tracker.model.StreamMessage;
import com.gpstracker.tracker.state.DeviceStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Real-time fan-out of accepted positions to live viewers.
 *
 * <p>A new subscriber first receives a {@code snapshot} of every known device (skipped while no
 * device has reported), then one {@code update} per accepted record. Each subscriber has its own
 * bounded outbound queue drained on a shared executor, so a slow or broken viewer never delays
 * the others. A subscriber whose queue overflows or whose send fails is dropped; its transport
 * is closed on the delivery executor, never on the ingesting thread.
 *
 * <p>Registration and acceptance are ordered by {@code registryLock}: acceptances hold the read
 * side (they run in parallel with each other), registration holds the write side while it takes
 * the snapshot. A record accepted concurrently with a subscription therefore reaches that
 * subscriber exactly once, either inside the snapshot or as an update queued after it.
 *
 * <p>Liveness is checked every {@code tracker.stream.heartbeat-interval-ms}: subscribers that did
 * not answer the previous ping are terminated, the others are pinged again.
 */
@Service
public class PositionBroadcaster {
  private static final Logger log = LoggerFactory.getLogger(PositionBroadcaster.class);

  private final DeviceStateStore stateStore;
  private final ObjectMapper objectMapper;
  private final Executor deliveryExecutor;
  private final ExecutorService ownedExecutor;
  private final int sendQueueCapacity;
  private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();
  private final ReadWriteLock registryLock = new ReentrantReadWriteLock();
  private final Counter failedDeliveries;

  @Autowired
  public PositionBroadcaster(
      DeviceStateStore stateStore,
      ObjectMapper objectMapper,
      TrackerProperties properties,
      MeterRegistry meterRegistry) {
    this(stateStore, objectMapper, properties, meterRegistry, newDeliveryExecutor());
  }

  PositionBroadcaster(
      DeviceStateStore stateStore,
      ObjectMapper objectMapper,
      TrackerProperties properties,
      MeterRegistry meterRegistry,
      Executor deliveryExecutor) {
    this.stateStore = stateStore;
    this.objectMapper = objectMapper;
    this.deliveryExecutor = deliveryExecutor;
    this.ownedExecutor = deliveryExecutor instanceof ExecutorService service ? service : null;
    this.sendQueueCapacity = properties.getStream().getSendQueueCapacity();
    this.failedDeliveries = meterRegistry.counter("tracker.stream.deliveries.failed");
    meterRegistry.gauge("tracker.stream.subscribers", subscriptions, Set::size);
  }

  private static ExecutorService newDeliveryExecutor() {
    AtomicInteger sequence = new AtomicInteger();
    return Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "tracker-stream-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Registers a sink and queues the current snapshot for it.
   *
   * @param sink transport endpoint of the new viewer
   * @return handle used to unsubscribe and report liveness
   */
  public Subscription subscribe(SubscriberSink sink) {
    Subscription subscription = new Subscription(sink, sendQueueCapacity);
    registryLock.writeLock().lock();
    try {
      List<PositionRecord> devices = stateStore.snapshot();
      if (!devices.isEmpty()) {
        String payload = serialize(StreamMessage.snapshot(devices));
        if (payload != null) {
          subscription.offer(payload);
        }
      }
      subscription.open();
      subscriptions.add(subscription);
    } finally {
      registryLock.writeLock().unlock();
    }
    scheduleDrain(subscription);
    log.debug("Stream subscriber {} registered ({} active)", sink.id(), subscriptions.size());
    return subscription;
  }

  /**
   * Sends one {@code update} for {@code record} to every open subscriber.
   *
   * @param record accepted record
   */
  public void publish(PositionRecord record) {
    publishAccepted(() -> record);
  }

  /**
   * Runs an acceptance step and fans its result out, atomically with respect to new
   * subscriptions.
   *
   * @param acceptance state mutation producing the accepted record
   * @return the accepted record
   */
  public PositionRecord publishAccepted(Supplier<PositionRecord> acceptance) {
    registryLock.readLock().lock();
    try {
      PositionRecord record = acceptance.get();
      String payload = serialize(StreamMessage.update(record));
      if (payload == null) {
        return record;
      }
      for (Subscription subscription : subscriptions) {
        if (subscription.isOpen()) {
          enqueue(subscription, payload);
        }
      }
      return record;
    } finally {
      registryLock.readLock().unlock();
    }
  }

  /**
   * Removes a subscription. Safe to call repeatedly.
   *
   * @param subscription handle returned by {@link #subscribe}
   */
  public void unsubscribe(Subscription subscription) {
    if (subscription == null || !subscription.markClosed()) {
      return;
    }
    subscriptions.remove(subscription);
    log.debug(
        "Stream subscriber {} removed ({} active)", subscription.sink().id(), subscriptions.size());
  }

  /**
   * Records a pong from the subscriber.
   *
   * @param subscription handle of the answering subscriber
   */
  public void markAlive(Subscription subscription) {
    if (subscription != null) {
      subscription.markAlive();
    }
  }

  /** Terminates subscribers that missed the previous ping and pings the rest. */
  @Scheduled(
      fixedDelayString = "${tracker.stream.heartbeat-interval-ms:30000}",
      initialDelayString = "${tracker.stream.heartbeat-interval-ms:30000}")
  public void checkLiveness() {
    for (Subscription subscription : subscriptions) {
      SubscriberSink sink = subscription.sink();
      if (!sink.isOpen()) {
        unsubscribe(subscription);
        continue;
      }
      if (!subscription.resetAlive()) {
        log.debug("Terminating unresponsive stream subscriber {}", sink.id());
        terminate(subscription);
        continue;
      }
      try {
        sink.ping();
      } catch (Exception ex) {
        handleSendFailure(subscription, "ping", ex);
      }
    }
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  /** Closes every subscriber and stops delivery threads. */
  @PreDestroy
  public void shutdown() {
    for (Subscription subscription : subscriptions) {
      unsubscribe(subscription);
      closeSink(subscription);
    }
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
      try {
        ownedExecutor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException ignored) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void enqueue(Subscription subscription, String payload) {
    if (!subscription.offer(payload)) {
      failedDeliveries.increment();
      log.warn("Stream subscriber {} is too slow, dropping it", subscription.sink().id());
      terminate(subscription);
      return;
    }
    scheduleDrain(subscription);
  }

  private void scheduleDrain(Subscription subscription) {
    if (!subscription.hasPending() || !subscription.startDraining()) {
      return;
    }
    try {
      deliveryExecutor.execute(() -> drain(subscription));
    } catch (RejectedExecutionException ex) {
      subscription.stopDraining();
      log.debug("Delivery executor rejected work for {}", subscription.sink().id());
      terminate(subscription);
    }
  }

  private void drain(Subscription subscription) {
    try {
      String payload;
      while (!subscription.isClosed() && (payload = subscription.poll()) != null) {
        if (!deliver(subscription, payload)) {
          return;
        }
      }
    } finally {
      subscription.stopDraining();
    }
    if (!subscription.isClosed()) {
      // A message may have been queued between the last poll and the flag reset.
      scheduleDrain(subscription);
    }
  }

  private boolean deliver(Subscription subscription, String payload) {
    try {
      subscription.sink().send(payload);
      return true;
    } catch (Exception ex) {
      handleSendFailure(subscription, "update", ex);
      return false;
    }
  }

  private void handleSendFailure(Subscription subscription, String what, Exception ex) {
    failedDeliveries.increment();
    if (isExpectedClientDisconnect(ex)) {
      log.debug(
          "Stream subscriber {} disconnected during {} delivery: {}",
          subscription.sink().id(),
          what,
          rootCauseSummary(ex));
    } else {
      log.warn("Stream {} delivery failed for subscriber {}", what, subscription.sink().id(), ex);
    }
    terminate(subscription);
  }

  /**
   * Deregisters a subscriber and closes its sink on the delivery executor.
   *
   * <p>Closing a stalled transport can block, and this runs on ingest threads holding
   * {@code registryLock}, so only the bookkeeping happens inline.
   */
  private void terminate(Subscription subscription) {
    unsubscribe(subscription);
    try {
      deliveryExecutor.execute(() -> closeSink(subscription));
    } catch (RejectedExecutionException ex) {
      closeSink(subscription);
    }
  }

  private void closeSink(Subscription subscription) {
    try {
      subscription.sink().close();
    } catch (Exception ex) {
      log.debug("Closing stream subscriber {} failed: {}", subscription.sink().id(), rootCauseSummary(ex));
    }
  }

  private String serialize(StreamMessage message) {
    try {
      return objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize {} message", message.type(), ex);
      return null;
    }
  }

  static boolean isExpectedClientDisconnect(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String className = current.getClass().getName();
      if (className.endsWith("ClientAbortException")
          || className.endsWith("EofException")
          || className.endsWith("SessionLimitExceededException")) {
        return true;
      }
      if (hasDisconnectMessage(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static boolean hasDisconnectMessage(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    return normalized.contains("broken pipe")
        || normalized.contains("connection reset")
        || normalized.contains("socket closed")
        || normalized.contains("session closed")
        || normalized.contains("connection abort")
        || normalized.contains("forcibly closed by the remote host");
  }

  private static String rootCauseSummary(Throwable error) {
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return current.getClass().getSimpleName();
    }
    return current.getClass().getSimpleName() + ": " + message;
  }
}
