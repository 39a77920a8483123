package ai.holdem.table;

/**
 * Actions a seat can take on its turn.
 */
public enum ActionType {
    FOLD,
    CHECK,
    CALL,
    /** Raise to a total bet for the round; the amount is clamped into the legal range. */
    RAISE
}
