package ai.landlord.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the heuristic AI.
 *
 * These are tuning knobs, not rules: changing them alters how adventurous the computer
 * opponents are without affecting which plays are legal.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments=--ai.open-bid-probability=0.8}
 */
@Component
@ConfigurationProperties(prefix = "ai")
public class AiProperties {
  private double openBidProbability = 0.6;
  private double raiseBidProbability = 0.3;
  private int emptyHandThreshold = 4;
  private int freeBombThreshold = 6;
  private double bombHoldProbability = 0.5;

  /**
   * Chance of bidding when nobody has bid yet.
   */
  public double getOpenBidProbability() {
    return openBidProbability;
  }

  public void setOpenBidProbability(double openBidProbability) {
    this.openBidProbability = openBidProbability;
  }

  /**
   * Chance of bidding over an existing bid.
   */
  public double getRaiseBidProbability() {
    return raiseBidProbability;
  }

  public void setRaiseBidProbability(double raiseBidProbability) {
    this.raiseBidProbability = raiseBidProbability;
  }

  /**
   * When leading with at most this many cards, try to play the whole hand at once.
   */
  public int getEmptyHandThreshold() {
    return emptyHandThreshold;
  }

  public void setEmptyHandThreshold(int emptyHandThreshold) {
    this.emptyHandThreshold = emptyHandThreshold;
  }

  /**
   * With at most this many cards, a bomb is played without hesitation when nothing else beats.
   */
  public int getFreeBombThreshold() {
    return freeBombThreshold;
  }

  public void setFreeBombThreshold(int freeBombThreshold) {
    this.freeBombThreshold = freeBombThreshold;
  }

  /**
   * Chance of holding a bomb back (passing) with a larger hand.
   */
  public double getBombHoldProbability() {
    return bombHoldProbability;
  }

  public void setBombHoldProbability(double bombHoldProbability) {
    this.bombHoldProbability = bombHoldProbability;
  }
}
