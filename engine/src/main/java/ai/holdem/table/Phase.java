package ai.holdem.table;

/**
 * Betting stages of a hand. {@link #WAITING} precedes the first hand; a finished hand
 * rests in {@link #SHOWDOWN} until the next {@code startHand()}.
 */
public enum Phase {
    WAITING,
    PREFLOP,
    FLOP,
    TURN,
    RIVER,
    SHOWDOWN;

    /**
     * True for the four streets on which seats act.
     */
    public boolean isBettingRound() {
        return this != WAITING && this != SHOWDOWN;
    }
}
