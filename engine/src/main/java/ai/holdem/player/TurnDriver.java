package ai.holdem.player;

import ai.holdem.table.ActionType;
import ai.holdem.table.CooperativeScheduler;
import ai.holdem.table.Decision;
import ai.holdem.table.Phase;
import ai.holdem.table.SeatView;
import ai.holdem.table.Table;
import ai.holdem.table.TableSnapshot;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the automated seats of a {@link Table}.
 * <p>
 * Each automated turn is queued on the {@link CooperativeScheduler} after a thinking delay.
 * When it comes due it only runs if the same hand is still being played and the same seat
 * is still to act; otherwise it is dropped. After an automated action is applied the driver
 * queues the next automated turn, so draining the scheduler plays the hand forward until a
 * seat without a bound player is to act or the hand ends.
 */
public class TurnDriver {
    private static final Logger log = LoggerFactory.getLogger(TurnDriver.class);

    private final Table table;
    private final CooperativeScheduler scheduler;
    private final long thinkDelayMillis;
    private final Map<Integer, Player> players = new HashMap<>();
    private boolean turnPending;

    public TurnDriver(Table table, CooperativeScheduler scheduler, long thinkDelayMillis) {
        this.table = Objects.requireNonNull(table, "table");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.thinkDelayMillis = thinkDelayMillis;
    }

    public void bind(int seatIndex, Player player) {
        players.put(seatIndex, Objects.requireNonNull(player, "player"));
    }

    public void unbindAll() {
        players.clear();
    }

    public boolean isAutomated(int seatIndex) {
        return players.containsKey(seatIndex);
    }

    /**
     * Queues the acting seat's decision if that seat is automated.
     *
     * @return {@code true} if an automated turn is queued
     */
    public boolean continuePlay() {
        if (turnPending) {
            return true;
        }
        if (!table.isHandInProgress() || !table.getPhase().isBettingRound()) {
            return false;
        }
        int seat = table.getCurrentPlayerIndex();
        Player player = players.get(seat);
        if (player == null) {
            return false;
        }
        int hand = table.getHandNumber();
        turnPending = true;
        scheduler.schedule(thinkDelayMillis, () -> stillToAct(hand, seat), () -> act(seat, player));
        return true;
    }

    private boolean stillToAct(int hand, int seat) {
        boolean valid = table.isHandInProgress()
                && table.getHandNumber() == hand
                && table.getPhase() != Phase.SHOWDOWN
                && table.getCurrentPlayerIndex() == seat;
        if (!valid) {
            turnPending = false;
        }
        return valid;
    }

    private void act(int seat, Player player) {
        turnPending = false;
        TableSnapshot snapshot = table.getState();
        SeatView view = snapshot.currentSeat();
        if (view == null) {
            return;
        }
        Decision decision = player.decide(view, snapshot);
        boolean applied = decision != null && table.performAction(seat, decision).isApplied();
        if (!applied) {
            // An automated seat must not stall the hand.
            log.warn("Seat {} decision {} was not applied; folding", view.name(), decision);
            table.performAction(seat, ActionType.FOLD, 0);
        }
        continuePlay();
    }
}
