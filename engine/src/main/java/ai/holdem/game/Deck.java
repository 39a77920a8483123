package ai.holdem.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Represents a standard 52-card deck dealt from during a single hand of Hold'em.
 * <p>
 * A {@code Deck} manages a collection of {@link Card} objects, supporting shuffling,
 * drawing and querying the deck state. The deck is initialised with all 52 cards
 * (13 ranks × 4 suits) and is shuffled upon construction and on every {@link #reset()}.
 * Shuffling uses {@link Collections#shuffle(List, Random)}, a Fisher–Yates permutation in
 * which every ordering is equally likely.
 */
public class Deck {
    /** The list of cards currently in the deck; the last element is the top card. */
    private final List<Card> cards = new ArrayList<>();
    private final Random random;

    /**
     * Constructs a new Deck with all 52 cards and shuffles it.
     */
    public Deck() {
        this(new Random());
    }

    /**
     * Constructs a new Deck that shuffles with the given source of randomness.
     *
     * @param random the random source (a seeded instance makes dealing reproducible)
     */
    public Deck(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        reset();
    }

    /**
     * Shuffles the remaining cards in the deck.
     * <p>
     * Called automatically during {@link #reset()}.
     */
    protected void shuffle() {
        Collections.shuffle(cards, random);
    }

    /**
     * Draws and removes the top card from the deck.
     *
     * @return the top card of the deck
     * @throws EmptyDeckException if the deck is empty
     */
    public Card draw() {
        if (cards.isEmpty()) {
            throw new EmptyDeckException();
        }
        return cards.remove(cards.size() - 1);
    }

    /**
     * Returns the number of cards remaining in the deck.
     *
     * @return the number of cards in the deck
     */
    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the cards in the deck, bottom first.
     *
     * @return an unmodifiable list of the deck's cards
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Mutable access for subclasses that arrange the deck in a fixed order.
     */
    protected List<Card> cards() {
        return cards;
    }

    /**
     * Resets the deck to its initial state with all 52 cards and shuffles it.
     */
    public final void reset() {
        cards.clear();
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(rank, suit));
            }
        }
        shuffle();
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
