package ai.holdem.game;

import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Each card is immutable and uniquely identified by its rank and suit combination.
 * Cards provide methods for string representation (including optional colour formatting
 * for display in terminals), parsing of short notation, and equality comparison.
 */
public class Card {
    /** The rank (Two through Ace) of this card. */
    private final Rank rank;
    /** The suit of this card. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /**
     * Parses short card notation such as "As", "Td", "10h" or "Q♠".
     * <p>
     * The last character is the suit (letter code or Unicode symbol); everything before it
     * is the rank label.
     *
     * @param token the card token
     * @return the parsed card
     * @throws IllegalArgumentException if the token is not a valid card
     */
    public static Card parse(String token) {
        if (token == null || token.trim().length() < 2) {
            throw new IllegalArgumentException("Invalid card token: " + token);
        }
        String t = token.trim();
        Suit suit = Suit.fromChar(t.charAt(t.length() - 1));
        Rank rank = Rank.fromLabel(t.substring(0, t.length() - 1));
        if (suit == null || rank == null) {
            throw new IllegalArgumentException("Invalid card token: " + token);
        }
        return new Card(rank, suit);
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns a short, non-coloured string representation of this card.
     * <p>
     * The format is the rank label followed by the suit symbol (e.g., "Q♠", "T♦", "A♣").
     *
     * @return the short name of the card
     */
    public String shortName() {
        return rank.getLabel() + suit.getSymbol();
    }

    /**
     * Returns a string representation of this card with ANSI colour for red suits.
     *
     * @return the card string (e.g., "Q♠" or coloured "T♦")
     */
    @Override
    public String toString() {
        return Suit.colouriseIfRed(suit, shortName());
    }

    /**
     * Two cards are equal if and only if they have the same rank and suit.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
