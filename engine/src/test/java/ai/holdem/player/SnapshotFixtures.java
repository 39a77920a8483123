package ai.holdem.player;

import ai.holdem.game.Card;
import ai.holdem.game.Cards;
import ai.holdem.stats.PlayerStats;
import ai.holdem.table.ActionType;
import ai.holdem.table.Phase;
import ai.holdem.table.SeatView;
import ai.holdem.table.TableSnapshot;
import java.util.ArrayList;
import java.util.List;

/**
 * Test helper: hand-built snapshots for exercising players without a live table.
 *
 * <p>Builds a table of {@code seats} seats with the acting seat at index 0 holding
 * {@code hole}; the other seats hold nothing and have matched the current bet.
 */
public final class SnapshotFixtures {

    private Phase phase = Phase.PREFLOP;
    private String hole = "2c 7d";
    private String board = "";
    private int seats = 3;
    private int dealer = 0;
    private int pot = 3;
    private int chips = 198;
    private int bet = 0;
    private int maxBet = 2;
    private int minRaise = 2;
    private int bigBlind = 2;

    private SnapshotFixtures() {
    }

    public static SnapshotFixtures snapshot() {
        return new SnapshotFixtures();
    }

    public SnapshotFixtures phase(Phase phase) {
        this.phase = phase;
        return this;
    }

    public SnapshotFixtures hole(String hole) {
        this.hole = hole;
        return this;
    }

    public SnapshotFixtures board(String board) {
        this.board = board;
        return this;
    }

    public SnapshotFixtures seats(int seats) {
        this.seats = seats;
        return this;
    }

    public SnapshotFixtures dealer(int dealer) {
        this.dealer = dealer;
        return this;
    }

    public SnapshotFixtures pot(int pot) {
        this.pot = pot;
        return this;
    }

    public SnapshotFixtures chips(int chips) {
        this.chips = chips;
        return this;
    }

    /**
     * The acting seat's bet and the highest bet on the table this round.
     */
    public SnapshotFixtures bets(int bet, int maxBet) {
        this.bet = bet;
        this.maxBet = maxBet;
        return this;
    }

    public SnapshotFixtures minRaise(int minRaise) {
        this.minRaise = minRaise;
        return this;
    }

    public SeatView seat() {
        return new SeatView(0, "You", true, chips, Cards.of(hole), bet, false, false, false, null);
    }

    public TableSnapshot build() {
        List<SeatView> views = new ArrayList<>();
        views.add(seat());
        for (int i = 1; i < seats; i++) {
            views.add(new SeatView(i, "Bot" + i, false, 200 - maxBet, List.of(), maxBet, false, false, false, null));
        }
        int toCall = maxBet - bet;
        List<ActionType> actions = new ArrayList<>();
        actions.add(ActionType.FOLD);
        actions.add(toCall <= 0 ? ActionType.CHECK : ActionType.CALL);
        if (chips > toCall) {
            actions.add(ActionType.RAISE);
        }
        int maxRaiseTotal = bet + chips;
        List<Card> community = board.isBlank() ? List.of() : Cards.of(board);
        return new TableSnapshot(
                views,
                community,
                pot,
                phase,
                dealer,
                0,
                1,
                actions,
                Math.min(toCall, chips),
                Math.min(maxBet + Math.max(minRaise, bigBlind), maxRaiseTotal),
                maxRaiseTotal,
                toCall <= 0,
                maxBet,
                minRaise,
                bigBlind,
                null,
                PlayerStats.empty(),
                List.of());
    }
}
