package ai.holdem.game;

/**
 * Enumeration representing the 13 ranks of a standard playing card deck in poker order.
 * <p>
 * Each rank carries a numeric value (2–14) used for ordering and tie-breaking, and a
 * single-character label for display (e.g., "T", "Q", "A"). Two is the lowest rank and
 * Ace the highest; the only place an Ace plays low is the five-high straight, which the
 * {@link HandEvaluator} handles explicitly.
 */
public enum Rank {
    /** Two – the lowest rank (value 2). */
    TWO(2, "2"),
    /** Three – rank value 3. */
    THREE(3, "3"),
    /** Four – rank value 4. */
    FOUR(4, "4"),
    /** Five – rank value 5. */
    FIVE(5, "5"),
    /** Six – rank value 6. */
    SIX(6, "6"),
    /** Seven – rank value 7. */
    SEVEN(7, "7"),
    /** Eight – rank value 8. */
    EIGHT(8, "8"),
    /** Nine – rank value 9. */
    NINE(9, "9"),
    /** Ten – rank value 10. */
    TEN(10, "T"),
    /** Jack – rank value 11. */
    JACK(11, "J"),
    /** Queen – rank value 12. */
    QUEEN(12, "Q"),
    /** King – rank value 13. */
    KING(13, "K"),
    /** Ace – the highest rank (value 14). */
    ACE(14, "A");

    /** Numeric value of the rank, used for ordering and tie-break sequences (2–14). */
    private final int value;
    /** Short string label for display (e.g., "A", "K", "T"). */
    private final String label;

    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return the numeric rank value (2 for Two, 14 for Ace)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the zero-based position of this rank (0 for Two, 12 for Ace).
     * <p>
     * Used by strength heuristics that scale linearly across the rank range.
     *
     * @return the rank index
     */
    public int index() {
        return ordinal();
    }

    /**
     * Returns the short string label of this rank.
     *
     * @return the label (e.g., "A", "K", "T")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Looks up a rank by its label or numeric value ("T" and "10" both resolve to Ten).
     *
     * @param token the label, case-insensitive
     * @return the matching rank, or {@code null} if none matches
     */
    public static Rank fromLabel(String token) {
        if (token == null) {
            return null;
        }
        String t = token.trim().toUpperCase();
        if ("10".equals(t)) {
            return TEN;
        }
        for (Rank rank : values()) {
            if (rank.label.equals(t)) {
                return rank;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
