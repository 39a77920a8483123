package ai.holdem.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for how fast automated seats act and how fast the
 * board is dealt out once nobody can bet any more.
 */
@Component
@ConfigurationProperties(prefix = "pacing")
public class PacingProperties {

  public enum Speed {
    INSTANT(50),
    NORMAL(600),
    SLOW(1200);

    private final long delayMillis;

    Speed(long delayMillis) {
      this.delayMillis = delayMillis;
    }

    public long getDelayMillis() {
      return delayMillis;
    }
  }

  private Speed speed = Speed.NORMAL;
  /** When false, delays are kept on the virtual clock only and never slept. */
  private boolean realTime = true;

  public Speed getSpeed() {
    return speed;
  }

  public void setSpeed(Speed speed) {
    this.speed = speed;
  }

  public boolean isRealTime() {
    return realTime;
  }

  public void setRealTime(boolean realTime) {
    this.realTime = realTime;
  }

  public long getDelayMillis() {
    return speed.getDelayMillis();
  }
}
