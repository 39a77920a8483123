package ai.holdem.table;

/**
 * Waits out the cosmetic delay before a scheduled continuation runs.
 */
@FunctionalInterface
public interface Pacer {

    /** Runs continuations back to back; used by tests and unattended sessions. */
    Pacer NONE = millis -> {
    };

    /** Sleeps on the calling thread; an interrupt cuts the pause short and is preserved. */
    Pacer SLEEP = millis -> {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    };

    void pause(long millis);
}
