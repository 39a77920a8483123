package ai.holdem.view;

import ai.holdem.game.Card;
import ai.holdem.stats.LeaderboardEntry;
import ai.holdem.stats.PlayerStats;
import ai.holdem.table.HandResult;
import ai.holdem.table.Phase;
import ai.holdem.table.SeatView;
import ai.holdem.table.TableSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Handles formatting of a {@link TableSnapshot} for console display.
 * <p>
 * Renders a header line (hand, phase, pot, board) followed by one bordered row per seat
 * with dealer and acting markers, stack, current bet and status badges. Automated seats'
 * hole cards stay hidden until the showdown. All widths account for ANSI colour escape
 * sequences, so red suits do not break alignment.
 */
public class TableFormatter {
    /** Minimum cell width (in characters). */
    private static final int CELL_WIDTH = 8;
    private static final String HIDDEN_CARD = "##";

    /**
     * Renders the whole table.
     */
    public String format(TableSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append("Hand #").append(snapshot.handNumber())
                .append("  ").append(snapshot.phase())
                .append("  Pot: ").append(snapshot.pot())
                .append('\n');
        sb.append("Board: ").append(cards(snapshot.communityCards())).append('\n');

        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("", "Seat", "Chips", "Bet", "Cards", "Status"));
        for (SeatView seat : snapshot.seats()) {
            rows.add(List.of(
                    marker(seat, snapshot),
                    seat.name(),
                    Integer.toString(seat.chips()),
                    seat.bet() > 0 ? Integer.toString(seat.bet()) : "",
                    holeCards(seat, snapshot.phase()),
                    status(seat)));
        }
        int[] widths = columnWidths(rows);
        String border = buildBorder(widths);
        sb.append(border).append('\n');
        for (List<String> row : rows) {
            sb.append(buildRow(row, widths)).append('\n');
        }
        sb.append(border).append('\n');
        return sb.toString();
    }

    /**
     * Renders the end-of-hand summary: winners, winning hand, profit and running stats.
     */
    public String formatSummary(HandResult result, PlayerStats stats, List<LeaderboardEntry> leaderboard, int top) {
        StringBuilder sb = new StringBuilder();
        List<String> names = new ArrayList<>();
        for (SeatView winner : result.winners()) {
            names.add(winner.name());
        }
        sb.append(String.join(" & ", names))
                .append(names.size() > 1 ? " split " : " won ")
                .append(result.pot());
        if (!result.uncontested() && result.winners().get(0).handResult() != null) {
            sb.append(" with ").append(result.winners().get(0).handResult().name());
        }
        sb.append('\n');
        sb.append("Your profit this hand: ").append(signed(result.profit())).append('\n');
        sb.append(String.format(Locale.ROOT, "Hands: %d  Won: %d  Win rate: %.1f%%  Total: %s%n",
                stats.handsPlayed(), stats.handsWon(), stats.winRatePercent(), signed(stats.totalProfit())));
        if (!leaderboard.isEmpty() && top > 0) {
            sb.append("Best hands:\n");
            for (int i = 0; i < Math.min(top, leaderboard.size()); i++) {
                LeaderboardEntry entry = leaderboard.get(i);
                sb.append(String.format(Locale.ROOT, "  %2d. %s  %s%n", i + 1, entry.date(), signed(entry.profit())));
            }
        }
        return sb.toString();
    }

    private static String marker(SeatView seat, TableSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        if (seat.index() == snapshot.dealerIndex()) {
            sb.append("D");
        }
        if (seat.index() == snapshot.currentPlayerIndex() && snapshot.phase().isBettingRound()) {
            sb.append(">");
        }
        return sb.toString();
    }

    String holeCards(SeatView seat, Phase phase) {
        if (seat.hand().isEmpty()) {
            return "";
        }
        boolean revealed = seat.human() || (phase == Phase.SHOWDOWN && !seat.folded());
        if (!revealed) {
            return HIDDEN_CARD + " " + HIDDEN_CARD;
        }
        return cards(seat.hand());
    }

    private static String status(SeatView seat) {
        if (seat.sittingOut()) {
            return "OUT";
        }
        if (seat.folded()) {
            return "FOLD";
        }
        if (seat.allIn()) {
            return "ALL-IN";
        }
        if (seat.handResult() != null) {
            return seat.handResult().name();
        }
        return "";
    }

    private static String cards(List<Card> cards) {
        if (cards.isEmpty()) {
            return "--";
        }
        List<String> parts = new ArrayList<>();
        for (Card card : cards) {
            parts.add(card.toString());
        }
        return String.join(" ", parts);
    }

    private static String signed(long value) {
        return value > 0 ? "+" + value : Long.toString(value);
    }

    private int[] columnWidths(List<List<String>> rows) {
        int[] widths = new int[rows.get(0).size()];
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], visibleLength(row.get(i)));
            }
        }
        for (int i = 1; i < widths.length; i++) {
            widths[i] = Math.max(widths[i], CELL_WIDTH);
        }
        return widths;
    }

    private String buildBorder(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.toString();
    }

    private String buildRow(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(' ').append(padCell(cells.get(i), widths[i])).append(" |");
        }
        return sb.toString();
    }

    private String padCell(String value, int width) {
        int padding = width - visibleLength(value);
        return padding > 0 ? value + " ".repeat(padding) : value;
    }

    /**
     * Length of a string as shown on screen, excluding ANSI colour escape sequences.
     */
    private int visibleLength(String value) {
        String stripped = value.replaceAll("\\u001B\\[[;\\d]*m", "");
        return stripped.length();
    }
}
