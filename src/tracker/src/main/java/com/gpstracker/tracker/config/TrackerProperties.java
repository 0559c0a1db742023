package com.gpstracker.tracker.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the tracker service.
 *
 * <p>Values are bound from {@code tracker.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
  private String deviceToken = "default_token";
  private int historyPoints = 500;
  private int onlineWindowSeconds = 60;
  private final Api api = new Api();
  private final Stream stream = new Stream();
  private final Persistence persistence = new Persistence();
  private final Mqtt mqtt = new Mqtt();

  public String getDeviceToken() {
    return deviceToken;
  }

  public void setDeviceToken(String deviceToken) {
    this.deviceToken = deviceToken;
  }

  public int getHistoryPoints() {
    return historyPoints;
  }

  public void setHistoryPoints(int historyPoints) {
    this.historyPoints = historyPoints;
  }

  public int getOnlineWindowSeconds() {
    return onlineWindowSeconds;
  }

  public void setOnlineWindowSeconds(int onlineWindowSeconds) {
    this.onlineWindowSeconds = onlineWindowSeconds;
  }

  public Api getApi() {
    return api;
  }

  public Stream getStream() {
    return stream;
  }

  public Persistence getPersistence() {
    return persistence;
  }

  public Mqtt getMqtt() {
    return mqtt;
  }

  /** HTTP API behavior (history limits, CORS). */
  public static class Api {
    private int historyDefaultLimit = 100;
    private int historyMaxLimit = 1000;
    private final Cors cors = new Cors();

    public int getHistoryDefaultLimit() {
      return historyDefaultLimit;
    }

    public void setHistoryDefaultLimit(int historyDefaultLimit) {
      this.historyDefaultLimit = historyDefaultLimit;
    }

    public int getHistoryMaxLimit() {
      return historyMaxLimit;
    }

    public void setHistoryMaxLimit(int historyMaxLimit) {
      this.historyMaxLimit = historyMaxLimit;
    }

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for browser consumers. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** WebSocket push channel settings. */
  public static class Stream {
    private String path = "/ws";
    private long heartbeatIntervalMs = 30_000L;
    private int sendQueueCapacity = 1024;
    private int sendTimeLimitMs = 5_000;
    private int sendBufferSizeLimit = 512 * 1024;

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public long getHeartbeatIntervalMs() {
      return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
      this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public int getSendQueueCapacity() {
      return sendQueueCapacity;
    }

    public void setSendQueueCapacity(int sendQueueCapacity) {
      this.sendQueueCapacity = sendQueueCapacity;
    }

    public int getSendTimeLimitMs() {
      return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
      this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
      return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
      this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
  }

  /** SQLite history store configuration. */
  public static class Persistence {
    private boolean enabled = true;
    private String sqliteFile = "./data/tracker.sqlite";
    private int queueCapacity = 10_000;
    private int operationTimeoutSeconds = 5;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getSqliteFile() {
      return sqliteFile;
    }

    public void setSqliteFile(String sqliteFile) {
      this.sqliteFile = sqliteFile;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public int getOperationTimeoutSeconds() {
      return operationTimeoutSeconds;
    }

    public void setOperationTimeoutSeconds(int operationTimeoutSeconds) {
      this.operationTimeoutSeconds = operationTimeoutSeconds;
    }
  }

  /** Optional MQTT bridge for devices publishing on {@code track/#}. */
  public static class Mqtt {
    private boolean enabled = false;
    private String brokerHost = "localhost";
    private int port = 1883;
    private String username = "";
    private String password = "";
    private String clientId = "";
    private String topic = "track/#";
    private int keepAliveSeconds = 60;
    private int connectTimeoutSeconds = 30;
    private long reconnectDelayMs = 5_000L;
    private int queueCapacity = 1_000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBrokerHost() {
      return brokerHost;
    }

    public void setBrokerHost(String brokerHost) {
      this.brokerHost = brokerHost;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(String topic) {
      this.topic = topic;
    }

    public int getKeepAliveSeconds() {
      return keepAliveSeconds;
    }

    public void setKeepAliveSeconds(int keepAliveSeconds) {
      this.keepAliveSeconds = keepAliveSeconds;
    }

    public int getConnectTimeoutSeconds() {
      return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
      this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public long getReconnectDelayMs() {
      return reconnectDelayMs;
    }

    public void setReconnectDelayMs(long reconnectDelayMs) {
      this.reconnectDelayMs = reconnectDelayMs;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    /**
     * Builds the Paho server URI from host and port.
     *
     * @return broker URI such as {@code tcp://localhost:1883}
     */
    public String serverUri() {
      return "tcp://" + brokerHost + ":" + port;
    }
  }
}
