package ai.holdem.game;

/**
 * Enumeration representing the four suits of a standard playing card deck.
 * <p>
 * Each suit has a Unicode symbol and a single-letter code ("h", "d", "c", "s") and is
 * classified as red (Hearts, Diamonds) or black (Clubs, Spades). Suits carry no ranking
 * in Hold'em; they only matter for flushes.
 * <p>
 * This enum also provides ANSI colour formatting utilities for terminal display,
 * allowing red suits to be rendered in red text and black suits in default text.
 */
public enum Suit {
    /** Hearts – a red suit represented by the ♥ symbol. */
    HEARTS("♥", 'h', true),
    /** Diamonds – a red suit represented by the ♦ symbol. */
    DIAMONDS("♦", 'd', true),
    /** Clubs – a black suit represented by the ♣ symbol. */
    CLUBS("♣", 'c', false),
    /** Spades – a black suit represented by the ♠ symbol. */
    SPADES("♠", 's', false);

    /** ANSI escape code for red text output in terminals. */
    private static final String ANSI_RED = "\u001B[31m";
    /** ANSI escape code to reset text formatting in terminals. */
    private static final String ANSI_RESET = "\u001B[0m";

    private final String symbol;
    private final char letter;
    private final boolean red;

    Suit(String symbol, char letter, boolean red) {
        this.symbol = symbol;
        this.letter = letter;
        this.red = red;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♥", "♠")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the single-letter code of this suit, as used in card notation like "As".
     *
     * @return one of 'h', 'd', 'c', 's'
     */
    public char getLetter() {
        return letter;
    }

    /**
     * Checks whether this suit is red.
     *
     * @return {@code true} for Hearts and Diamonds
     */
    public boolean isRed() {
        return red;
    }

    /**
     * Resolves a suit from either its letter code or its Unicode symbol.
     *
     * @param c the character to resolve, case-insensitive for letters
     * @return the suit, or {@code null} if the character is not a suit
     */
    public static Suit fromChar(char c) {
        char lower = Character.toLowerCase(c);
        for (Suit suit : values()) {
            if (suit.letter == lower || suit.symbol.charAt(0) == c) {
                return suit;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * Colourises the given value string using ANSI red codes if the suit is red.
     *
     * @param suit the suit to check for colour (may be null)
     * @param value the string value to colourise
     * @return the value wrapped in ANSI red codes if suit is red; otherwise the value unchanged
     */
    public static String colouriseIfRed(Suit suit, String value) {
        if (suit != null && suit.isRed()) {
            return ANSI_RED + value + ANSI_RESET;
        }
        return value;
    }
}
