package ai.landlord.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for running tables.
 *
 * Usage:
 * {@code -Dtable.turn-timeout-seconds=15 -Dtable.seed=42}
 */
@Component
@ConfigurationProperties(prefix = "table")
public class TableProperties {
  private int turnTimeoutSeconds = 30;
  private long aiDelayMillis = 800;
  private long aiDelayJitterMillis = 700;
  private int cleanupDelaySeconds = 10;
  private Long seed;

  /**
   * Seconds a remote seat has to act before an automatic action is taken for it.
   */
  public int getTurnTimeoutSeconds() {
    return turnTimeoutSeconds;
  }

  public void setTurnTimeoutSeconds(int turnTimeoutSeconds) {
    this.turnTimeoutSeconds = turnTimeoutSeconds;
  }

  /**
   * Minimum "thinking" delay before an AI seat acts.
   */
  public long getAiDelayMillis() {
    return aiDelayMillis;
  }

  public void setAiDelayMillis(long aiDelayMillis) {
    this.aiDelayMillis = aiDelayMillis;
  }

  /**
   * Random extra delay, up to this many milliseconds, added to {@link #getAiDelayMillis()}.
   */
  public long getAiDelayJitterMillis() {
    return aiDelayJitterMillis;
  }

  public void setAiDelayJitterMillis(long aiDelayJitterMillis) {
    this.aiDelayJitterMillis = aiDelayJitterMillis;
  }

  /**
   * Seconds a finished table stays registered before it is removed.
   */
  public int getCleanupDelaySeconds() {
    return cleanupDelaySeconds;
  }

  public void setCleanupDelaySeconds(int cleanupDelaySeconds) {
    this.cleanupDelaySeconds = cleanupDelaySeconds;
  }

  /**
   * Optional fixed seed for shuffling and AI decisions; unset means non-deterministic.
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
