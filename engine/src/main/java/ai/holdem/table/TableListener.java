package ai.holdem.table;

/**
 * Notifications from the {@link Table} to its viewers. Listeners read state through
 * {@link Table#getState()} and must not call back into the table from these methods.
 */
public interface TableListener {

    /**
     * Fired after every state change a viewer should reflect.
     */
    default void onStateChange() {
    }

    /**
     * Fired once per finished hand, after the final {@link #onStateChange()}.
     */
    default void onHandComplete(HandResult result) {
    }
}
