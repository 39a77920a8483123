package ai.holdem.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for where player stats and the leaderboard live.
 * When disabled, they are kept in memory for the session only.
 */
@Component
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
  private boolean enabled = true;
  private String directory = System.getProperty("user.home") + "/.holdem";

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getDirectory() {
    return directory;
  }

  public void setDirectory(String directory) {
    this.directory = directory;
  }
}
