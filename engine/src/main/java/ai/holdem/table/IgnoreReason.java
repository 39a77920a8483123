package ai.holdem.table;

/**
 * Why a call into the table was ignored without changing any state.
 */
public enum IgnoreReason {
    /** No betting round is running (before the first hand or after showdown). */
    NO_HAND_IN_PROGRESS,
    /** {@code startHand()} or {@code initPlayers()} while a hand is running. */
    HAND_IN_PROGRESS,
    /** The named seat is not the one to act; late or duplicate input. */
    NOT_YOUR_TURN,
    /** The acting seat has folded or is all-in. */
    SEAT_CANNOT_ACT,
    /** The action is not in the acting seat's legal set, e.g. check while facing a bet. */
    ILLEGAL_ACTION,
    /** Seat count outside 2..9. */
    INVALID_SEAT_COUNT
}
