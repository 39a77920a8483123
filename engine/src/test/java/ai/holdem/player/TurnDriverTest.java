package ai.holdem.player;

import static org.junit.jupiter.api.Assertions.*;

import ai.holdem.game.Deck;
import ai.holdem.player.ai.HeuristicPlayer;
import ai.holdem.stats.InMemoryStatsStore;
import ai.holdem.table.ActionType;
import ai.holdem.table.CooperativeScheduler;
import ai.holdem.table.Decision;
import ai.holdem.table.SeatView;
import ai.holdem.table.Table;
import ai.holdem.table.TableRules;
import ai.holdem.table.TableSnapshot;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TurnDriverTest {

    private final CooperativeScheduler scheduler = new CooperativeScheduler();

    private Table table(int seats, long seed) {
        Table table = new Table(TableRules.DEFAULT, new Deck(new Random(seed)), new InMemoryStatsStore(),
                scheduler, 600, Clock.systemUTC());
        table.initPlayers(seats);
        return table;
    }

    @Test
    void automatedSeatsPlayWholeHands() {
        Table table = table(6, 17);
        TurnDriver driver = new TurnDriver(table, scheduler, 600);
        for (int i = 0; i < 6; i++) {
            driver.bind(i, new HeuristicPlayer(new Random(100 + i)));
        }
        for (int hand = 1; hand <= 25; hand++) {
            table.startHand();
            driver.continuePlay();
            scheduler.runAll();
            assertFalse(table.isHandInProgress(), "hand " + hand + " did not finish");
            int total = 0;
            for (SeatView seat : table.getState().seats()) {
                total += seat.chips();
            }
            assertEquals(1200, total);
        }
        assertEquals(25, table.getStats().handsPlayed());
    }

    @Test
    void stopsAtASeatWithoutAPlayer() {
        Table table = table(3, 1);
        TurnDriver driver = new TurnDriver(table, scheduler, 600);
        driver.bind(1, (seat, snapshot) -> Decision.fold());
        driver.bind(2, (seat, snapshot) -> Decision.fold());
        table.startHand();
        // Seat 0 is first to act and is not bound.
        assertFalse(driver.continuePlay());
        assertEquals(0, scheduler.pending());
        table.performAction(0, ActionType.CALL, 0);

        assertTrue(driver.continuePlay());
        scheduler.runAll();
        assertFalse(table.isHandInProgress());
        assertEquals("You", table.getLastHandResult().winners().get(0).name());
    }

    @Test
    void queuedTurnIsDroppedWhenTheSeatNoLongerActs() {
        Table table = table(3, 2);
        AtomicInteger asked = new AtomicInteger();
        TurnDriver driver = new TurnDriver(table, scheduler, 600);
        driver.bind(0, (seat, snapshot) -> {
            asked.incrementAndGet();
            return Decision.call();
        });
        table.startHand();
        assertTrue(driver.continuePlay());
        // A second request while the turn is queued does not queue it twice.
        assertTrue(driver.continuePlay());
        assertEquals(1, scheduler.pending());

        table.performAction(0, ActionType.FOLD, 0);
        scheduler.runAll();

        assertEquals(0, asked.get());
        assertEquals(1, table.getCurrentPlayerIndex());
        assertFalse(driver.continuePlay());
    }

    @Test
    void illegalAutomatedDecisionFallsBackToFold() {
        Table table = table(2, 3);
        TurnDriver driver = new TurnDriver(table, scheduler, 0);
        driver.bind(0, (seat, snapshot) -> Decision.check());
        driver.bind(1, (seat, snapshot) -> null);
        table.startHand();
        // Seat 0 faces the big blind, so checking is illegal.
        driver.continuePlay();
        scheduler.runAll();
        assertFalse(table.isHandInProgress());
        TableSnapshot state = table.getState();
        assertTrue(state.seats().get(0).folded());
        assertEquals("Alice", state.lastHandResult().winners().get(0).name());
    }
}
