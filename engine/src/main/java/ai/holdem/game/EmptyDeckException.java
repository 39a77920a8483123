package ai.holdem.game;

/**
 * Thrown when a card is drawn from an exhausted {@link Deck}.
 * <p>
 * A full table draws at most 23 cards per hand, so hitting this indicates a dealing bug
 * rather than a recoverable condition.
 */
public class EmptyDeckException extends IllegalStateException {

    public EmptyDeckException() {
        super("Deck is empty; no cards left to draw");
    }
}
