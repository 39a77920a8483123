package ai.holdem.player;

import ai.holdem.player.ai.HeuristicPlayer;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Plays the human seat with the same heuristics as the automated opponents, for unattended
 * sessions.
 */
@Component
@Profile("autoplay")
public class AutoPilotPlayer extends HeuristicPlayer {
}
