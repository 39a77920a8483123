package ai.holdem.table;

import java.util.List;

/**
 * Outcome of a finished hand as reported to {@link TableListener#onHandComplete(HandResult)}.
 *
 * @param handNumber the hand's number
 * @param winners    seats that shared the pot, first winner first
 * @param ranked     all contenders, strongest first (only the winner when everyone else folded)
 * @param pot        chips distributed to the winners
 * @param profit     the human seat's ending stack minus the buy-in
 * @param humanWon   whether the human seat is among the winners
 */
public record HandResult(
        int handNumber,
        List<SeatView> winners,
        List<SeatView> ranked,
        int pot,
        int profit,
        boolean humanWon) {

    public HandResult {
        winners = List.copyOf(winners);
        ranked = List.copyOf(ranked);
    }

    /**
     * True when the hand ended because everyone else folded, with no cards shown.
     */
    public boolean uncontested() {
        return ranked.size() == 1;
    }
}
