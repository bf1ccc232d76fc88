package com.altivion.api.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the ingest API service.
 *
 * <p>Values are bound from {@code altivion.*} in {@code application.yml}, which defaults them
 * from environment variables ({@code API_KEY}, {@code NODES_TOTAL}, {@code ENABLE_LISTEN}, ...).
 */
@ConfigurationProperties(prefix = "altivion")
public class AltivionProperties {
  private String apiKey = "";
  private final Api api = new Api();
  private final Nodes nodes = new Nodes();
  private final Listener listener = new Listener();
  private final WebSocket webSocket = new WebSocket();
  private final Ingest ingest = new Ingest();

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public Api getApi() {
    return api;
  }

  public Nodes getNodes() {
    return nodes;
  }

  public Listener getListener() {
    return listener;
  }

  public WebSocket getWebSocket() {
    return webSocket;
  }

  public Ingest getIngest() {
    return ingest;
  }

  /** Read endpoint limits and CORS allowlist. */
  public static class Api {
    private int maxPointsCap = 50_000;
    private int maxWindowMinutes = 10_080;
    private final Cors cors = new Cors();

    public int getMaxPointsCap() {
      return maxPointsCap;
    }

    public void setMaxPointsCap(int maxPointsCap) {
      this.maxPointsCap = maxPointsCap;
    }

    public int getMaxWindowMinutes() {
      return maxWindowMinutes;
    }

    public void setMaxWindowMinutes(int maxWindowMinutes) {
      this.maxWindowMinutes = maxWindowMinutes;
    }

    public Cors getCors() {
      return cors;
    }
  }

  /** CORS allowlist configuration for the map frontend. */
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();

    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }

  /** Sensor node liveness settings used by the dashboard card. */
  public static class Nodes {
    private long onlineWindowSeconds = 60;
    private int total = 3;

    public long getOnlineWindowSeconds() {
      return onlineWindowSeconds;
    }

    public void setOnlineWindowSeconds(long onlineWindowSeconds) {
      this.onlineWindowSeconds = onlineWindowSeconds;
    }

    public int getTotal() {
      return total;
    }

    public void setTotal(int total) {
      this.total = total;
    }
  }

  /** PostgreSQL LISTEN/NOTIFY relay settings. */
  public static class Listener {
    private boolean enabled = true;
    private String channel = "signals";
    private Duration retryDelay = Duration.ofSeconds(2);
    private Duration pollTimeout = Duration.ofSeconds(1);
    private Duration validationInterval = Duration.ofSeconds(30);
    private Duration validationTimeout = Duration.ofSeconds(5);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getChannel() {
      return channel;
    }

    public void setChannel(String channel) {
      this.channel = channel;
    }

    public Duration getRetryDelay() {
      return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
    }

    public Duration getPollTimeout() {
      return pollTimeout;
    }

    public void setPollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
    }

    public Duration getValidationInterval() {
      return validationInterval;
    }

    public void setValidationInterval(Duration validationInterval) {
      this.validationInterval = validationInterval;
    }

    public Duration getValidationTimeout() {
      return validationTimeout;
    }

    public void setValidationTimeout(Duration validationTimeout) {
      this.validationTimeout = validationTimeout;
    }
  }

  /** Real-time channel settings. */
  public static class WebSocket {
    private String path = "/ws";
    private int sendTimeLimitMs = 5_000;
    private int bufferSizeLimitBytes = 512 * 1024;

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public int getSendTimeLimitMs() {
      return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
      this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getBufferSizeLimitBytes() {
      return bufferSizeLimitBytes;
    }

    public void setBufferSizeLimitBytes(int bufferSizeLimitBytes) {
      this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }
  }

  /** Thread pool running store writes off the request threads. */
  public static class Ingest {
    private int corePoolSize = 4;
    private int maxPoolSize = 16;
    private int queueCapacity = 1_000;

    public int getCorePoolSize() {
      return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
      this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }
  }
}
