package ai.holdem.config;

import ai.holdem.table.TableRules;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the table.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments="--table.players=4 --table.max-hands=10"}
 */
@Component
@ConfigurationProperties(prefix = "table")
public class TableProperties {
  /** Seats at the table, including the human seat (2..9). */
  private int players = 6;
  private int smallBlind = 1;
  private int bigBlind = 2;
  private int buyIn = 200;
  /** Hands to play before the session ends; 0 means until the player quits. */
  private int maxHands = 0;

  public int getPlayers() {
    return players;
  }

  public void setPlayers(int players) {
    this.players = players;
  }

  public int getSmallBlind() {
    return smallBlind;
  }

  public void setSmallBlind(int smallBlind) {
    this.smallBlind = smallBlind;
  }

  public int getBigBlind() {
    return bigBlind;
  }

  public void setBigBlind(int bigBlind) {
    this.bigBlind = bigBlind;
  }

  public int getBuyIn() {
    return buyIn;
  }

  public void setBuyIn(int buyIn) {
    this.buyIn = buyIn;
  }

  public int getMaxHands() {
    return maxHands;
  }

  public void setMaxHands(int maxHands) {
    this.maxHands = maxHands;
  }

  /**
   * Validated blinds and buy-in.
   *
   * @throws IllegalArgumentException if the configured values are inconsistent
   */
  public TableRules toRules() {
    return new TableRules(smallBlind, bigBlind, buyIn);
  }
}
