package ai.holdem;

import ai.holdem.config.TableProperties;
import ai.holdem.player.HumanPlayer;
import ai.holdem.player.Player;
import ai.holdem.player.TurnDriver;
import ai.holdem.player.ai.HeuristicPlayer;
import ai.holdem.stats.PlayerStats;
import ai.holdem.table.ActionOutcome;
import ai.holdem.table.CooperativeScheduler;
import ai.holdem.table.Decision;
import ai.holdem.table.SeatView;
import ai.holdem.table.Table;
import ai.holdem.table.TableSnapshot;
import ai.holdem.view.ConsoleTableView;
import ai.holdem.view.TableFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);
    /** Upper bound on decisions asked of seat 0 in one hand; only a broken table gets near it. */
    private static final int MAX_TURNS_PER_HAND = 1_000;

    private final Player player;
    private final Table table;
    private final TurnDriver turnDriver;
    private final CooperativeScheduler scheduler;
    private final TableProperties tableProperties;
    private final ConsoleTableView view;

    public Game(Player player,
                Table table,
                TurnDriver turnDriver,
                CooperativeScheduler scheduler,
                TableProperties tableProperties,
                TableFormatter formatter) {
        this.player = player;
        this.table = table;
        this.turnDriver = turnDriver;
        this.scheduler = scheduler;
        this.tableProperties = tableProperties;
        this.view = new ConsoleTableView(table, formatter, player instanceof HumanPlayer);
        table.addListener(view);
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests can call play() directly.
        SessionResult result = play();
        log.info("Session over after {} hands. Win rate {}%, total profit {}",
                result.handsPlayed(),
                String.format("%.1f", result.stats().winRatePercent()),
                result.stats().totalProfit());
    }

    /**
     * Session loop used by both the CLI runner and tests.
     * <p>
     * Seats the configured number of players, then plays hands until the seat-0 player
     * leaves or {@code table.max-hands} is reached. Each hand alternates between draining the
     * scheduler (automated seats, board run-outs) and asking the seat-0 player for a decision.
     *
     * @return hands played this session and the cumulative stats after the last one
     * @throws IllegalArgumentException if the configured seat count is outside 2..9
     */
    public SessionResult play() {
        int seats = tableProperties.getPlayers();
        ActionOutcome seated = table.initPlayers(seats);
        if (!seated.isApplied()) {
            throw new IllegalArgumentException("Cannot seat " + seats + " players: " + seated.reason());
        }
        turnDriver.unbindAll();
        for (int i = 1; i < seats; i++) {
            turnDriver.bind(i, new HeuristicPlayer());
        }

        int maxHands = tableProperties.getMaxHands();
        int handsPlayed = 0;
        boolean quit = false;
        while (!quit && (maxHands <= 0 || handsPlayed < maxHands)) {
            table.startHand();
            quit = playHand();
            handsPlayed++;
        }
        scheduler.clear();
        return new SessionResult(handsPlayed, table.getStats());
    }

    /**
     * Plays the current hand to completion.
     *
     * @return {@code true} if the seat-0 player asked to leave
     */
    private boolean playHand() {
        boolean quit = false;
        int turns = 0;
        while (true) {
            turnDriver.continuePlay();
            scheduler.runAll();
            if (!table.isHandInProgress()) {
                return quit;
            }
            TableSnapshot snapshot = table.getState();
            SeatView seat = snapshot.currentSeat();
            if (seat == null || turnDriver.isAutomated(seat.index())) {
                throw new IllegalStateException("Hand #" + snapshot.handNumber() + " stalled in " + snapshot.phase());
            }
            if (++turns > MAX_TURNS_PER_HAND) {
                throw new IllegalStateException("Hand #" + snapshot.handNumber() + " exceeded " + MAX_TURNS_PER_HAND + " turns");
            }

            Decision decision = quit ? null : player.decide(seat, snapshot);
            if (decision == null) {
                // Leaving the table forfeits the current hand.
                if (!quit && log.isDebugEnabled()) {
                    log.debug("Input closed. Leaving the table for player {}", player.getClass().getSimpleName());
                }
                quit = true;
                decision = Decision.fold();
            }
            ActionOutcome outcome = table.performAction(seat.index(), decision);
            if (!outcome.isApplied()) {
                log.info("Action {} not applied: {}", decision, outcome.reason());
            }
        }
    }

    /**
     * Summary of a session.
     *
     * @param handsPlayed hands completed in this session
     * @param stats       cumulative stats, including earlier sessions when storage is enabled
     */
    public record SessionResult(int handsPlayed, PlayerStats stats) {
    }
}
