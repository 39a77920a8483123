package ai.holdem;

import static org.junit.jupiter.api.Assertions.*;

import ai.holdem.config.TableProperties;
import ai.holdem.player.Player;
import ai.holdem.player.TurnDriver;
import ai.holdem.stats.InMemoryStatsStore;
import ai.holdem.table.CooperativeScheduler;
import ai.holdem.table.Decision;
import ai.holdem.table.Table;
import ai.holdem.table.TableRules;
import ai.holdem.view.TableFormatter;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * Session loop with a scripted seat-0 player and three seats.
 */
class GameTest {

    private static Game game(Player player, int seats, int maxHands) {
        CooperativeScheduler scheduler = new CooperativeScheduler();
        Table table = new Table(TableRules.DEFAULT, new InMemoryStatsStore(), scheduler, 0);
        TableProperties properties = new TableProperties();
        properties.setPlayers(seats);
        properties.setMaxHands(maxHands);
        return new Game(player, table, new TurnDriver(table, scheduler, 0), scheduler, properties,
                new TableFormatter());
    }

    @Test
    void leavingFoldsAndEndsTheSessionAfterTheCurrentHand() {
        AtomicInteger asked = new AtomicInteger();
        Game game = game((seat, snapshot) -> {
            asked.incrementAndGet();
            return null;
        }, 3, 0);

        Game.SessionResult result = game.play();

        assertEquals(1, result.handsPlayed());
        // Seat 0 is first to act preflop at a three-handed table and is never asked again.
        assertEquals(1, asked.get());
        assertEquals(0, result.stats().handsWon());
    }

    @Test
    void checkOrCallPlayerReachesTheHandLimit() {
        Player calling = (seat, snapshot) -> snapshot.canCheck() ? Decision.check() : Decision.call();
        Game.SessionResult result = game(calling, 3, 5).play();
        assertEquals(5, result.handsPlayed());
        assertEquals(5, result.stats().handsPlayed());
    }

    @Test
    void invalidSeatCountFailsFast() {
        Game game = game((seat, snapshot) -> Decision.fold(), 12, 1);
        assertThrows(IllegalArgumentException.class, game::play);
    }
}
