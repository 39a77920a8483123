package ai.holdem.table;

import ai.holdem.game.Card;
import ai.holdem.game.HandEvaluation;
import java.util.List;

/**
 * Immutable copy of a {@link Seat} handed to players and viewers.
 *
 * @param handResult best hand at showdown, {@code null} before showdown or when folded
 */
public record SeatView(
        int index,
        String name,
        boolean human,
        int chips,
        List<Card> hand,
        int bet,
        boolean folded,
        boolean allIn,
        boolean sittingOut,
        HandEvaluation handResult) {

    public SeatView {
        hand = List.copyOf(hand);
    }
}
