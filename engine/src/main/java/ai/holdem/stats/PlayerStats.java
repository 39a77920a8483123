package ai.holdem.stats;

/**
 * Cumulative results of the human seat across sessions.
 *
 * @param handsPlayed number of completed hands
 * @param handsWon    hands in which the human seat was among the winners
 * @param totalProfit sum over hands of (ending stack − buy-in)
 */
public record PlayerStats(int handsPlayed, int handsWon, long totalProfit) {

    public static PlayerStats empty() {
        return new PlayerStats(0, 0, 0L);
    }

    /**
     * Returns a copy with one more completed hand folded in.
     */
    public PlayerStats recordHand(boolean won, int profit) {
        return new PlayerStats(handsPlayed + 1, won ? handsWon + 1 : handsWon, totalProfit + profit);
    }

    /**
     * Win rate as a percentage in [0, 100]; zero before any hand is played.
     */
    public double winRatePercent() {
        return handsPlayed == 0 ? 0.0 : (handsWon * 100.0) / handsPlayed;
    }
}
