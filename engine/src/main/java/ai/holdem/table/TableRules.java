package ai.holdem.table;

/**
 * Fixed stakes for a table.
 *
 * @param smallBlind forced bet of the seat after the dealer
 * @param bigBlind   forced bet of the next seat; also the minimum raise increment
 * @param buyIn      stack every seat starts each hand with
 */
public record TableRules(int smallBlind, int bigBlind, int buyIn) {

    public static final TableRules DEFAULT = new TableRules(1, 2, 200);

    public TableRules {
        if (smallBlind <= 0 || bigBlind < smallBlind) {
            throw new IllegalArgumentException(
                    "Blinds must satisfy 0 < smallBlind <= bigBlind, got " + smallBlind + "/" + bigBlind);
        }
        if (buyIn < bigBlind) {
            throw new IllegalArgumentException("Buy-in " + buyIn + " is below the big blind " + bigBlind);
        }
    }
}
