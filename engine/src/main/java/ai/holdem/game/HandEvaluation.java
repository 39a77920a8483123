package ai.holdem.game;

import java.util.List;
import java.util.Objects;

/**
 * Result of evaluating a poker hand: its category, the tie-break rank values (most
 * significant first) and the five cards that make the hand.
 * <p>
 * Natural ordering follows {@link HandEvaluator#compare(HandEvaluation, HandEvaluation)},
 * so a larger evaluation is a stronger hand and two evaluations compare equal only on an
 * exact tie. Equality ignores the actual cards, matching that ordering.
 *
 * @param category  the hand category
 * @param tieBreaks rank values (2–14) compared lexicographically within a category
 * @param cards     the best five-card subset
 */
public record HandEvaluation(HandCategory category, List<Integer> tieBreaks, List<Card> cards)
        implements Comparable<HandEvaluation> {

    public HandEvaluation {
        Objects.requireNonNull(category, "category");
        tieBreaks = List.copyOf(tieBreaks);
        cards = List.copyOf(cards);
    }

    /**
     * Returns the human-readable hand name, e.g. "Full House".
     */
    public String name() {
        return category.getDisplayName();
    }

    @Override
    public int compareTo(HandEvaluation other) {
        return HandEvaluator.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandEvaluation other)) {
            return false;
        }
        return category == other.category && tieBreaks.equals(other.tieBreaks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, tieBreaks);
    }

    @Override
    public String toString() {
        return category.getDisplayName() + " " + tieBreaks;
    }
}
