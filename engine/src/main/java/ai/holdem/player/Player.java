package ai.holdem.player;

import ai.holdem.table.Decision;
import ai.holdem.table.SeatView;
import ai.holdem.table.TableSnapshot;

/**
 * Represents a participant capable of choosing the next action for its seat.
 */
public interface Player {

    /**
     * Choose an action for the seat that is to act.
     *
     * @param seat     the acting seat, including its hole cards
     * @param snapshot current table state; legal actions and raise bounds describe {@code seat}
     * @return the decision, or {@code null} when the player has no decision (leaves the table)
     */
    Decision decide(SeatView seat, TableSnapshot snapshot);
}
