package ai.holdem;

import static org.junit.jupiter.api.Assertions.*;

import ai.holdem.player.AutoPilotPlayer;
import ai.holdem.player.Player;
import ai.holdem.table.Table;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Boots the application with the autoplay profile. The command-line runner plays one
 * session while the context starts; the test then plays another through the same beans.
 */
@SpringBootTest(properties = {"table.players=4", "table.max-hands=3", "storage.enabled=false"})
@ActiveProfiles("autoplay")
class AutoplaySessionTest {

    @Autowired
    Game game;

    @Autowired
    Player player;

    @Autowired
    Table table;

    @Test
    void playsTheConfiguredNumberOfHands() {
        assertInstanceOf(AutoPilotPlayer.class, player);
        assertEquals(3, table.getStats().handsPlayed());

        Game.SessionResult result = game.play();

        assertEquals(3, result.handsPlayed());
        assertEquals(6, result.stats().handsPlayed());
        assertEquals(4, table.getSeatCount());
        assertFalse(table.isHandInProgress());
    }
}
