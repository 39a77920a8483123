package ai.holdem.player.ai;

import ai.holdem.player.AIPlayer;
import ai.holdem.table.ActionType;
import ai.holdem.table.Decision;
import ai.holdem.table.Phase;
import ai.holdem.table.SeatView;
import ai.holdem.table.TableSnapshot;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based opponent: estimates hand strength, perturbs it a little, and bets, calls or
 * folds against fixed thresholds with occasional bluffs.
 * <p>
 * Decisions depend only on the snapshot and the injected {@link Random}, so a seeded
 * random source makes the player fully reproducible.
 */
public class HeuristicPlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(HeuristicPlayer.class);

    static final double RAISE_UNOPENED = 0.65;
    static final double BLUFF_UNOPENED = 0.12;
    static final double RAISE_FACING_BET = 0.8;
    static final double CALL_FLOOR = 0.45;
    static final double RERAISE_STRENGTH = 0.7;
    static final double RERAISE_CHANCE = 0.3;
    static final double BLUFF_FACING_BET = 0.08;
    static final double MARGINAL_CALL = 0.3;
    static final double ALL_IN_CHANCE = 0.08;

    private final Random random;

    public HeuristicPlayer() {
        this(new Random());
    }

    public HeuristicPlayer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Decision decide(SeatView seat, TableSnapshot snapshot) {
        if (snapshot.validActions().isEmpty()) {
            return null;
        }
        double strength = snapshot.phase() == Phase.PREFLOP
                ? HandStrength.preflop(seat.hand())
                : HandStrength.postflop(seat.hand(), snapshot.communityCards());
        strength = clamp(strength + (random.nextDouble() - 0.5) * 0.15);
        int seats = snapshot.seats().size();
        strength = clamp(strength + (double) positionFromDealer(seat.index(), snapshot) / seats * 0.05);

        Decision decision = choose(seat, snapshot, strength);
        if (log.isDebugEnabled()) {
            log.debug("{} strength={} -> {}", seat.name(), String.format("%.2f", strength), decision);
        }
        return decision;
    }

    private Decision choose(SeatView seat, TableSnapshot snapshot, double strength) {
        boolean canRaise = snapshot.isLegal(ActionType.RAISE);
        int toCall = toCall(snapshot);
        int pot = snapshot.pot();

        if (toCall == 0 && snapshot.isLegal(ActionType.CHECK)) {
            if (strength > RAISE_UNOPENED && canRaise) {
                return makeRaise(strength, seat, snapshot);
            }
            if (random.nextDouble() < BLUFF_UNOPENED && canRaise) {
                return makeRaise(0.4, seat, snapshot);
            }
            return Decision.check();
        }

        double potOdds = (double) toCall / (pot + toCall);
        if (strength > RAISE_FACING_BET && canRaise && seat.chips() > toCall) {
            return makeRaise(strength, seat, snapshot);
        }
        if ((strength > potOdds + 0.05 || strength > CALL_FLOOR) && snapshot.isLegal(ActionType.CALL)) {
            if (strength > RERAISE_STRENGTH && random.nextDouble() < RERAISE_CHANCE && canRaise) {
                return makeRaise(strength, seat, snapshot);
            }
            return Decision.call();
        }
        if (random.nextDouble() < BLUFF_FACING_BET && canRaise && toCall < pot * 0.3) {
            return makeRaise(0.5, seat, snapshot);
        }
        if (strength > MARGINAL_CALL && toCall <= snapshot.bigBlind() * 3 && snapshot.isLegal(ActionType.CALL)) {
            return Decision.call();
        }
        return Decision.fold();
    }

    /**
     * Sizes a raise from strength: all-in, pot, half pot or minimum, clamped to the range
     * between a minimum raise and all-in.
     */
    Decision makeRaise(double strength, SeatView seat, TableSnapshot snapshot) {
        int pot = snapshot.pot();
        int maxBet = snapshot.currentMaxBet();
        int allIn = seat.bet() + seat.chips();

        int total;
        if (strength > 0.9 || random.nextDouble() < ALL_IN_CHANCE) {
            total = allIn;
        } else if (strength > 0.75) {
            total = maxBet + pot;
        } else if (strength > 0.6) {
            total = maxBet + pot / 2;
        } else {
            total = maxBet + snapshot.minRaise();
        }
        total = Math.max(total, maxBet + snapshot.minRaise());
        total = Math.min(total, allIn);
        return Decision.raiseTo(total);
    }
}
