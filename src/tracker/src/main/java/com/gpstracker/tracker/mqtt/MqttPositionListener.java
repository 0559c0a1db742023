package com.gpstracker.tracker.mqtt;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpstracker.tracker.config.TrackerProperties;
import com.gpstracker.tracker.ingest.ValidationException;
import com.gpstracker.tracker.service.TrackingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * MQTT bridge for devices publishing on {@code track/#}.
 *
 * <p>Payloads use the same JSON shape as {@code POST /api/track} without a token; access is
 * controlled by the broker. Messages are copied off the Paho callback thread onto a bounded
 * single-worker queue that feeds {@link TrackingService#ingest}. Invalid JSON and rejected
 * records are logged and dropped. The client reconnects on its own after a lost connection and
 * re-subscribes on every successful connect; a failed first connect is retried every
 * {@code tracker.mqtt.reconnect-delay-ms}.
 */
@Component
@ConditionalOnProperty(prefix = "tracker.mqtt", name = "enabled", havingValue = "true")
public class MqttPositionListener implements MqttCallbackExtended {
  private static final Logger log = LoggerFactory.getLogger(MqttPositionListener.class);
  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final TrackingService trackingService;
  private final ObjectMapper objectMapper;
  private final TrackerProperties.Mqtt settings;
  private final Counter messageCounter;
  private final Counter errorCounter;
  private final ThreadPoolExecutor worker;
  private final ScheduledExecutorService connector;
  private volatile MqttClient client;

  public MqttPositionListener(
      TrackingService trackingService,
      ObjectMapper objectMapper,
      TrackerProperties properties,
      MeterRegistry meterRegistry) {
    this.trackingService = trackingService;
    this.objectMapper = objectMapper;
    this.settings = properties.getMqtt();
    this.messageCounter = meterRegistry.counter("tracker.mqtt.messages");
    this.errorCounter = meterRegistry.counter("tracker.mqtt.errors");
    this.worker = new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(Math.max(1, settings.getQueueCapacity())),
        runnable -> daemon(runnable, "tracker-mqtt-worker"));
    this.connector = Executors.newSingleThreadScheduledExecutor(
        runnable -> daemon(runnable, "tracker-mqtt-connect"));
  }

  private static Thread daemon(Runnable runnable, String name) {
    Thread thread = new Thread(runnable, name);
    thread.setDaemon(true);
    return thread;
  }

  /** Creates the client and starts connecting in the background. */
  @PostConstruct
  public void start() throws MqttException {
    String clientId = settings.getClientId() == null || settings.getClientId().isBlank()
        ? "gps-tracker-" + MqttClient.generateClientId()
        : settings.getClientId();
    client = new MqttClient(settings.serverUri(), clientId, new MemoryPersistence());
    client.setCallback(this);
    log.info("Connecting to MQTT broker: {}", settings.serverUri());
    connector.execute(this::connect);
  }

  /** Disconnects from the broker and stops the worker. */
  @PreDestroy
  public void stop() {
    connector.shutdownNow();
    worker.shutdown();
    MqttClient current = client;
    if (current == null) {
      return;
    }
    try {
      if (current.isConnected()) {
        current.disconnect();
      }
      current.close();
    } catch (MqttException ex) {
      log.debug("MQTT client shutdown failed: {}", ex.getMessage());
    }
  }

  MqttConnectOptions connectOptions() {
    MqttConnectOptions options = new MqttConnectOptions();
    options.setKeepAliveInterval(settings.getKeepAliveSeconds());
    options.setConnectionTimeout(settings.getConnectTimeoutSeconds());
    options.setAutomaticReconnect(true);
    options.setCleanSession(true);
    if (settings.getUsername() != null && !settings.getUsername().isBlank()) {
      options.setUserName(settings.getUsername());
      String password = settings.getPassword() == null ? "" : settings.getPassword();
      options.setPassword(password.toCharArray());
    }
    return options;
  }

  private void connect() {
    try {
      client.connect(connectOptions());
    } catch (MqttException ex) {
      errorCounter.increment();
      log.warn(
          "MQTT connect to {} failed ({}), retrying in {} ms",
          settings.serverUri(),
          ex.getMessage(),
          settings.getReconnectDelayMs());
      try {
        connector.schedule(this::connect, settings.getReconnectDelayMs(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException ignored) {
        log.debug("MQTT listener stopped, not retrying connect");
      }
    }
  }

  private void subscribe() {
    try {
      client.subscribe(settings.getTopic(), 0);
      log.info("Subscribed to {} topic", settings.getTopic());
    } catch (MqttException ex) {
      errorCounter.increment();
      log.error("Error subscribing to {}", settings.getTopic(), ex);
    }
  }

  @Override
  public void connectComplete(boolean reconnect, String serverUri) {
    log.info("{} MQTT broker {}", reconnect ? "Reconnected to" : "Connected to", serverUri);
    // Paho forbids blocking client calls on its callback thread.
    try {
      connector.execute(this::subscribe);
    } catch (RejectedExecutionException ignored) {
      log.debug("MQTT listener stopped, skipping subscribe");
    }
  }

  @Override
  public void connectionLost(Throwable cause) {
    log.warn("MQTT connection lost ({}), reconnecting...", cause == null ? "unknown" : cause.getMessage());
  }

  @Override
  public void messageArrived(String topic, MqttMessage message) {
    messageCounter.increment();
    byte[] payload = message.getPayload();
    try {
      worker.execute(() -> handlePayload(topic, payload));
    } catch (RejectedExecutionException ex) {
      errorCounter.increment();
      log.warn("MQTT work queue full, dropping message on {}", topic);
    }
  }

  @Override
  public void deliveryComplete(IMqttDeliveryToken token) {
    // subscribe-only client
  }

  void handlePayload(String topic, byte[] payload) {
    Map<String, Object> data;
    try {
      data = objectMapper.readValue(payload, PAYLOAD_TYPE);
    } catch (IOException ex) {
      errorCounter.increment();
      log.warn("Error parsing MQTT message on {}: {}", topic, ex.getMessage());
      return;
    }
    try {
      trackingService.ingest(data, "mqtt");
    } catch (ValidationException ex) {
      errorCounter.increment();
      log.warn("Invalid location data on {}: {}", topic, ex.getMessage());
    }
  }
}
