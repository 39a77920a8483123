package ai.holdem.table;

import ai.holdem.game.Card;
import ai.holdem.stats.LeaderboardEntry;
import ai.holdem.stats.PlayerStats;
import java.util.List;

/**
 * Read-only picture of the table handed to players and viewers.
 * <p>
 * Betting fields ({@code validActions}, {@code callAmount}, raise bounds, {@code canCheck})
 * describe the seat at {@code currentPlayerIndex}; they are empty/zero outside a betting
 * round.
 *
 * @param pot                total chips in the pot, including this round's bets
 * @param minRaiseTotal      smallest legal raise total for the acting seat (capped at all-in)
 * @param maxRaiseTotal      largest legal raise total for the acting seat (all-in)
 * @param minRaise           current minimum raise increment
 * @param lastHandResult     the most recent finished hand, or {@code null}
 */
public record TableSnapshot(
        List<SeatView> seats,
        List<Card> communityCards,
        int pot,
        Phase phase,
        int dealerIndex,
        int currentPlayerIndex,
        int handNumber,
        List<ActionType> validActions,
        int callAmount,
        int minRaiseTotal,
        int maxRaiseTotal,
        boolean canCheck,
        int currentMaxBet,
        int minRaise,
        int bigBlind,
        HandResult lastHandResult,
        PlayerStats stats,
        List<LeaderboardEntry> leaderboard) {

    public TableSnapshot {
        seats = List.copyOf(seats);
        communityCards = List.copyOf(communityCards);
        validActions = List.copyOf(validActions);
        leaderboard = List.copyOf(leaderboard);
    }

    /**
     * The acting seat, or {@code null} outside a betting round.
     */
    public SeatView currentSeat() {
        if (!phase.isBettingRound() || currentPlayerIndex < 0 || currentPlayerIndex >= seats.size()) {
            return null;
        }
        return seats.get(currentPlayerIndex);
    }

    public boolean isLegal(ActionType action) {
        return validActions.contains(action);
    }
}
