package ai.holdem.view;

import ai.holdem.table.HandResult;
import ai.holdem.table.Table;
import ai.holdem.table.TableListener;
import ai.holdem.table.TableSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the table after every state change and a summary after every hand.
 * <p>
 * With a human at the table the board goes out at info level; unattended sessions only
 * log it at debug level, without colour codes, and keep the per-hand summary at info.
 */
public class ConsoleTableView implements TableListener {
    private static final Logger log = LoggerFactory.getLogger(ConsoleTableView.class);
    private static final String SEPARATOR =
            "\n--------------------------------------------------------------------------------\n";
    static final int LEADERBOARD_LINES = 5;

    private final Table table;
    private final TableFormatter formatter;
    private final boolean interactive;

    public ConsoleTableView(Table table, TableFormatter formatter, boolean interactive) {
        this.table = table;
        this.formatter = formatter;
        this.interactive = interactive;
    }

    @Override
    public void onStateChange() {
        if (!interactive && !log.isDebugEnabled()) {
            return;
        }
        TableSnapshot snapshot = table.getState();
        String board = SEPARATOR + formatter.format(snapshot);
        if (interactive) {
            log.info("{}", board);
        } else {
            log.debug("{}", stripAnsi(board));
        }
    }

    @Override
    public void onHandComplete(HandResult result) {
        TableSnapshot snapshot = table.getState();
        String summary = formatter.formatSummary(result, snapshot.stats(), snapshot.leaderboard(), LEADERBOARD_LINES);
        log.info("{}", interactive ? summary : stripAnsi(summary));
    }

    static String stripAnsi(String value) {
        return value.replaceAll("\\u001B\\[[;\\d]*m", "");
    }
}
