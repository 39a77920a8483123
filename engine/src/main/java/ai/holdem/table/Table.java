package ai.holdem.table;

import ai.holdem.game.Card;
import ai.holdem.game.Deck;
import ai.holdem.game.HandEvaluator;
import ai.holdem.stats.LeaderboardEntry;
import ai.holdem.stats.PlayerStats;
import ai.holdem.stats.StatsStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single No-Limit Hold'em table: seats, deck, pot and the betting-round state machine.
 * <p>
 * <strong>Phases:</strong> {@code WAITING → PREFLOP → FLOP → TURN → RIVER → SHOWDOWN}. Only
 * {@link #startHand()}, {@link #performAction(ActionType, int)} and the table's own
 * scheduled run-out continuations move the phase.
 * <p>
 * <strong>Chips:</strong> committed chips go straight into the pot; a seat's {@code bet} is
 * its share of the pot for the current round. {@code pot + Σ chips} is therefore constant
 * during a hand, and settlement empties the pot into the winners' stacks. All chips are
 * pooled into a single pot even when seats are all-in for different amounts, and the pot
 * is split only among the best hands at showdown; side pots are not built.
 * <p>
 * <strong>Bad input:</strong> mutators never throw for out-of-turn, illegal or malformed
 * calls. They return an {@link ActionOutcome} saying whether the call was applied, and raise
 * amounts outside the legal range are clamped into it.
 * <p>
 * The table is single-threaded: all methods must be called from the thread that drives
 * its {@link CooperativeScheduler}.
 */
public class Table {
    private static final Logger log = LoggerFactory.getLogger(Table.class);

    public static final int MIN_SEATS = 2;
    public static final int MAX_SEATS = 9;
    /** Number of leaderboard entries kept. */
    public static final int LEADERBOARD_SIZE = 20;
    static final String HUMAN_NAME = "You";
    static final List<String> BOT_NAMES = List.of(
            "Alice", "Bob", "Charlie", "Diana", "Eve", "Frank", "Grace", "Hank", "Ivy");

    private final TableRules rules;
    private final Deck deck;
    private final StatsStore statsStore;
    private final CooperativeScheduler scheduler;
    private final long runOutDelayMillis;
    private final Clock clock;
    private final List<TableListener> listeners = new ArrayList<>();

    private final List<Seat> seats = new ArrayList<>();
    private final List<Card> communityCards = new ArrayList<>();
    private int pot;
    private Phase phase = Phase.WAITING;
    private int dealerIndex;
    private int currentPlayerIndex = -1;
    private int minRaise;
    private int lastRaise;
    private int handNumber;
    private boolean handInProgress;
    private PlayerStats stats;
    private final List<LeaderboardEntry> leaderboard;
    private HandResult lastHandResult;

    public Table(TableRules rules, StatsStore statsStore, CooperativeScheduler scheduler, long runOutDelayMillis) {
        this(rules, new Deck(), statsStore, scheduler, runOutDelayMillis, Clock.systemDefaultZone());
    }

    public Table(TableRules rules,
                 Deck deck,
                 StatsStore statsStore,
                 CooperativeScheduler scheduler,
                 long runOutDelayMillis,
                 Clock clock) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.deck = Objects.requireNonNull(deck, "deck");
        this.statsStore = Objects.requireNonNull(statsStore, "statsStore");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.runOutDelayMillis = runOutDelayMillis;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.minRaise = rules.bigBlind();
        this.stats = loadStats();
        this.leaderboard = loadLeaderboard();
    }

    public void addListener(TableListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Rebuilds the seat list: seat 0 is the human, the rest are automated seats named from a
     * fixed roster.
     *
     * @param count number of seats, 2..9
     */
    public ActionOutcome initPlayers(int count) {
        if (handInProgress) {
            return ignore(IgnoreReason.HAND_IN_PROGRESS, "initPlayers");
        }
        if (count < MIN_SEATS || count > MAX_SEATS) {
            return ignore(IgnoreReason.INVALID_SEAT_COUNT, "initPlayers(" + count + ")");
        }
        seats.clear();
        seats.add(new Seat(0, HUMAN_NAME, true));
        for (int i = 1; i < count; i++) {
            seats.add(new Seat(i, BOT_NAMES.get(i - 1), false));
        }
        for (Seat seat : seats) {
            seat.resetForHand(rules.buyIn());
        }
        communityCards.clear();
        pot = 0;
        phase = Phase.WAITING;
        dealerIndex = 0;
        currentPlayerIndex = -1;
        emitState();
        return ActionOutcome.applied();
    }

    /**
     * Marks a seat as sitting out (or back in) from the next hand on. A table always keeps
     * at least two seats in play.
     */
    public ActionOutcome setSittingOut(int seatIndex, boolean sittingOut) {
        if (handInProgress) {
            return ignore(IgnoreReason.HAND_IN_PROGRESS, "setSittingOut");
        }
        if (seatIndex < 0 || seatIndex >= seats.size()) {
            return ignore(IgnoreReason.ILLEGAL_ACTION, "setSittingOut(" + seatIndex + ")");
        }
        Seat seat = seats.get(seatIndex);
        if (sittingOut && !seat.isSittingOut() && seatedCount() <= MIN_SEATS) {
            return ignore(IgnoreReason.ILLEGAL_ACTION, "setSittingOut(" + seatIndex + ")");
        }
        seat.setSittingOut(sittingOut);
        emitState();
        return ActionOutcome.applied();
    }

    /**
     * Starts the next hand: restores stacks, posts blinds, deals hole cards and opens the
     * preflop betting round. Ignored while a hand is running.
     */
    public ActionOutcome startHand() {
        if (handInProgress) {
            return ignore(IgnoreReason.HAND_IN_PROGRESS, "startHand");
        }
        if (seatedCount() < MIN_SEATS) {
            return ignore(IgnoreReason.INVALID_SEAT_COUNT, "startHand");
        }
        handInProgress = true;
        handNumber++;
        deck.reset();
        communityCards.clear();
        pot = 0;
        minRaise = rules.bigBlind();
        lastRaise = 0;
        for (Seat seat : seats) {
            seat.resetForHand(rules.buyIn());
        }

        dealerIndex = dealerIndex % seats.size();
        // Heads-up the dealer posts the small blind and acts first preflop.
        int smallBlindIndex = seatedCount() == 2 && seats.get(dealerIndex).canAct()
                ? dealerIndex
                : nextActiveIndex(dealerIndex);
        int bigBlindIndex = nextActiveIndex(smallBlindIndex);
        postBlind(smallBlindIndex, rules.smallBlind());
        postBlind(bigBlindIndex, rules.bigBlind());

        for (Seat seat : seats) {
            if (!seat.isSittingOut()) {
                seat.receive(deck.draw());
                seat.receive(deck.draw());
            }
        }

        phase = Phase.PREFLOP;
        resetActed();
        // The big blind has put chips in but keeps the option to raise.
        seats.get(bigBlindIndex).setActed(false);
        currentPlayerIndex = nextActiveIndex(bigBlindIndex);

        if (log.isDebugEnabled()) {
            log.debug("Hand #{} started: dealer={}, SB={} ({}), BB={} ({})",
                    handNumber,
                    seats.get(dealerIndex).getName(),
                    seats.get(smallBlindIndex).getName(), rules.smallBlind(),
                    seats.get(bigBlindIndex).getName(), rules.bigBlind());
        }

        if (isBettingRoundComplete()) {
            // Blinds put everyone all-in; nothing to bet on.
            advancePhase();
        } else {
            emitState();
        }
        return ActionOutcome.applied();
    }

    /**
     * Applies an action for whichever seat is to act.
     *
     * @param action the action
     * @param amount raise total for {@link ActionType#RAISE}; ignored otherwise
     */
    public ActionOutcome performAction(ActionType action, int amount) {
        Objects.requireNonNull(action, "action");
        if (!handInProgress || !phase.isBettingRound()) {
            return ignore(IgnoreReason.NO_HAND_IN_PROGRESS, action.name());
        }
        Seat seat = actingSeat();
        if (seat == null || !seat.canAct()) {
            return ignore(IgnoreReason.SEAT_CANNOT_ACT, action.name());
        }
        if (!validActions(seat).contains(action)) {
            return ignore(IgnoreReason.ILLEGAL_ACTION, seat.getName() + " " + action.name());
        }

        switch (action) {
            case FOLD -> seat.fold();
            case CHECK -> {
                // nothing moves
            }
            case CALL -> pot += seat.commit(currentMaxBet() - seat.getBet());
            case RAISE -> raise(seat, amount);
        }
        seat.setActed(true);

        if (log.isDebugEnabled()) {
            log.debug("{} {}{} -> bet={}, chips={}, pot={}",
                    seat.getName(),
                    action.name().toLowerCase(),
                    action == ActionType.RAISE ? " to " + seat.getBet() : "",
                    seat.getBet(), seat.getChips(), pot);
        }

        List<Seat> contenders = contenders();
        if (contenders.size() == 1) {
            awardPotTo(contenders.get(0));
            return ActionOutcome.applied();
        }

        if (isBettingRoundComplete()) {
            advancePhase();
        } else {
            currentPlayerIndex = nextActiveIndex(currentPlayerIndex);
            emitState();
        }
        return ActionOutcome.applied();
    }

    /**
     * Applies an action on behalf of a specific seat, ignoring it when that seat is not the
     * one to act (late or duplicate input).
     */
    public ActionOutcome performAction(int seatIndex, ActionType action, int amount) {
        if (!handInProgress || !phase.isBettingRound()) {
            return ignore(IgnoreReason.NO_HAND_IN_PROGRESS, action == null ? "null" : action.name());
        }
        if (seatIndex != currentPlayerIndex) {
            return ignore(IgnoreReason.NOT_YOUR_TURN, "seat " + seatIndex);
        }
        return performAction(action, amount);
    }

    public ActionOutcome performAction(int seatIndex, Decision decision) {
        return performAction(seatIndex, decision.action(), decision.amount());
    }

    /**
     * Read-only snapshot of the table for players and viewers.
     */
    public TableSnapshot getState() {
        Seat current = actingSeat();
        List<ActionType> actions = current == null ? List.of() : validActions(current);
        int maxBet = currentMaxBet();
        int callAmount = 0;
        int minRaiseTotal = 0;
        int maxRaiseTotal = 0;
        boolean canCheck = false;
        if (current != null) {
            callAmount = Math.min(maxBet - current.getBet(), current.getChips());
            maxRaiseTotal = current.getBet() + current.getChips();
            minRaiseTotal = Math.min(maxBet + Math.max(minRaise, rules.bigBlind()), maxRaiseTotal);
            canCheck = current.getBet() >= maxBet;
        }
        return new TableSnapshot(
                views(seats),
                communityCards,
                pot,
                phase,
                dealerIndex,
                currentPlayerIndex,
                handNumber,
                actions,
                callAmount,
                minRaiseTotal,
                maxRaiseTotal,
                canCheck,
                maxBet,
                minRaise,
                rules.bigBlind(),
                lastHandResult,
                stats,
                leaderboard);
    }

    private void raise(Seat seat, int amount) {
        int maxBet = currentMaxBet();
        int allIn = seat.getChips() + seat.getBet();
        int total = Math.max(maxBet, Math.min(amount, allIn));
        int raiseBy = total - maxBet;
        pot += seat.commit(total - seat.getBet());
        if (raiseBy > 0) {
            minRaise = raiseBy;
            lastRaise = total;
            // A raise reopens the action for everyone who can still act.
            for (Seat other : seats) {
                if (other != seat && other.canAct()) {
                    other.setActed(false);
                }
            }
        }
    }

    /**
     * Closes the current betting round and deals the next street, or resolves the showdown
     * after the river.
     */
    private void advancePhase() {
        for (Seat seat : seats) {
            seat.clearBet();
        }
        minRaise = rules.bigBlind();
        lastRaise = 0;

        switch (phase) {
            case PREFLOP -> {
                phase = Phase.FLOP;
                dealCommunity(3);
            }
            case FLOP -> {
                phase = Phase.TURN;
                dealCommunity(1);
            }
            case TURN -> {
                phase = Phase.RIVER;
                dealCommunity(1);
            }
            case RIVER -> {
                resolveShowdown();
                return;
            }
            default -> {
                return;
            }
        }

        if (stillActingCount() <= 1) {
            // Nobody left to bet against: deal the remaining streets out on a delay.
            currentPlayerIndex = -1;
            emitState();
            int hand = handNumber;
            scheduler.schedule(runOutDelayMillis,
                    () -> handInProgress && handNumber == hand && phase != Phase.SHOWDOWN,
                    this::advancePhase);
            return;
        }

        resetActed();
        currentPlayerIndex = nextActiveIndex(dealerIndex);
        emitState();
    }

    private void resolveShowdown() {
        phase = Phase.SHOWDOWN;
        currentPlayerIndex = -1;
        List<Seat> contenders = contenders();
        for (Seat seat : contenders) {
            List<Card> cards = new ArrayList<>(seat.getHand());
            cards.addAll(communityCards);
            seat.setHandResult(HandEvaluator.evaluate(cards));
        }

        List<Seat> ranked = new ArrayList<>(contenders);
        // List.sort is stable: equal hands keep seat order.
        ranked.sort((a, b) -> HandEvaluator.compare(b.getHandResult(), a.getHandResult()));

        List<Seat> winners = new ArrayList<>();
        winners.add(ranked.get(0));
        for (int i = 1; i < ranked.size(); i++) {
            if (HandEvaluator.compare(ranked.get(i).getHandResult(), ranked.get(0).getHandResult()) != 0) {
                break;
            }
            winners.add(ranked.get(i));
        }

        int awarded = pot;
        int share = awarded / winners.size();
        int remainder = awarded - share * winners.size();
        for (int i = 0; i < winners.size(); i++) {
            winners.get(i).award(share + (i == 0 ? remainder : 0));
        }
        finishHand(winners, ranked, awarded);
    }

    private void awardPotTo(Seat winner) {
        int awarded = pot;
        winner.award(awarded);
        phase = Phase.SHOWDOWN;
        currentPlayerIndex = -1;
        finishHand(List.of(winner), List.of(winner), awarded);
    }

    private void finishHand(List<Seat> winners, List<Seat> ranked, int awarded) {
        pot = 0;
        for (Seat seat : seats) {
            seat.clearBet();
        }
        Seat human = humanSeat();
        boolean humanWon = winners.stream().anyMatch(Seat::isHuman);
        int profit = human == null ? 0 : human.getChips() - rules.buyIn();

        stats = stats.recordHand(humanWon, profit);
        addToLeaderboard(new LeaderboardEntry(LocalDate.now(clock).toString(), profit));
        persist();

        handInProgress = false;
        lastHandResult = new HandResult(handNumber, views(winners), views(ranked), awarded, profit, humanWon);
        dealerIndex = (dealerIndex + 1) % seats.size();

        if (log.isDebugEnabled()) {
            log.debug("Hand #{} won by {} ({} chips), human profit {}",
                    handNumber,
                    winners.stream().map(Seat::getName).toList(),
                    awarded,
                    profit);
        }

        emitState();
        for (TableListener listener : List.copyOf(listeners)) {
            listener.onHandComplete(lastHandResult);
        }
    }

    private void addToLeaderboard(LeaderboardEntry entry) {
        leaderboard.add(entry);
        leaderboard.sort(Comparator.comparingInt(LeaderboardEntry::profit).reversed());
        while (leaderboard.size() > LEADERBOARD_SIZE) {
            leaderboard.remove(leaderboard.size() - 1);
        }
    }

    private void persist() {
        try {
            statsStore.saveStats(stats);
            statsStore.saveLeaderboard(List.copyOf(leaderboard));
        } catch (RuntimeException e) {
            // Persistence must never interfere with play.
            log.warn("Failed to save stats after hand #{}", handNumber, e);
        }
    }

    private PlayerStats loadStats() {
        try {
            PlayerStats loaded = statsStore.loadStats();
            return loaded == null ? PlayerStats.empty() : loaded;
        } catch (RuntimeException e) {
            log.warn("Failed to load stats; starting from zero", e);
            return PlayerStats.empty();
        }
    }

    private List<LeaderboardEntry> loadLeaderboard() {
        List<LeaderboardEntry> loaded;
        try {
            loaded = statsStore.loadLeaderboard();
        } catch (RuntimeException e) {
            log.warn("Failed to load leaderboard; starting empty", e);
            loaded = null;
        }
        List<LeaderboardEntry> entries = new ArrayList<>();
        if (loaded != null) {
            for (LeaderboardEntry entry : loaded) {
                if (entry != null) {
                    entries.add(entry);
                }
            }
        }
        entries.sort(Comparator.comparingInt(LeaderboardEntry::profit).reversed());
        return entries;
    }

    private void postBlind(int seatIndex, int amount) {
        pot += seats.get(seatIndex).commit(amount);
    }

    private void dealCommunity(int count) {
        for (int i = 0; i < count; i++) {
            communityCards.add(deck.draw());
        }
    }

    private List<ActionType> validActions(Seat seat) {
        if (!seat.canAct()) {
            return List.of();
        }
        List<ActionType> actions = new ArrayList<>(3);
        actions.add(ActionType.FOLD);
        int toCall = currentMaxBet() - seat.getBet();
        actions.add(toCall <= 0 ? ActionType.CHECK : ActionType.CALL);
        if (seat.getChips() > toCall) {
            actions.add(ActionType.RAISE);
        }
        return actions;
    }

    /**
     * The round is over once every seat that can still act has acted and matched the
     * highest bet.
     */
    private boolean isBettingRoundComplete() {
        int maxBet = currentMaxBet();
        for (Seat seat : seats) {
            if (!seat.canAct()) {
                continue;
            }
            if (!seat.hasActed() || seat.getBet() < maxBet) {
                return false;
            }
        }
        return true;
    }

    private void resetActed() {
        for (Seat seat : seats) {
            seat.setActed(!seat.canAct());
        }
    }

    private int nextActiveIndex(int from) {
        int idx = (from + 1) % seats.size();
        int safety = 0;
        while (!seats.get(idx).canAct() && safety < seats.size()) {
            idx = (idx + 1) % seats.size();
            safety++;
        }
        return idx;
    }

    private Seat actingSeat() {
        if (!handInProgress || !phase.isBettingRound()
                || currentPlayerIndex < 0 || currentPlayerIndex >= seats.size()) {
            return null;
        }
        return seats.get(currentPlayerIndex);
    }

    private List<Seat> contenders() {
        List<Seat> result = new ArrayList<>();
        for (Seat seat : seats) {
            if (seat.isContending()) {
                result.add(seat);
            }
        }
        return result;
    }

    private int stillActingCount() {
        int count = 0;
        for (Seat seat : seats) {
            if (seat.canAct()) {
                count++;
            }
        }
        return count;
    }

    private int seatedCount() {
        int count = 0;
        for (Seat seat : seats) {
            if (!seat.isSittingOut()) {
                count++;
            }
        }
        return count;
    }

    private Seat humanSeat() {
        for (Seat seat : seats) {
            if (seat.isHuman()) {
                return seat;
            }
        }
        return null;
    }

    public int currentMaxBet() {
        int max = 0;
        for (Seat seat : seats) {
            max = Math.max(max, seat.getBet());
        }
        return max;
    }

    private void emitState() {
        for (TableListener listener : List.copyOf(listeners)) {
            listener.onStateChange();
        }
    }

    private ActionOutcome ignore(IgnoreReason reason, String what) {
        if (log.isDebugEnabled()) {
            log.debug("Ignored {}: {}", what, reason);
        }
        return ActionOutcome.ignored(reason);
    }

    private static List<SeatView> views(List<Seat> seats) {
        List<SeatView> result = new ArrayList<>(seats.size());
        for (Seat seat : seats) {
            result.add(seat.view());
        }
        return result;
    }

    /**
     * Direct access for tests in this package that need to inspect per-round flags.
     */
    Seat seat(int index) {
        return seats.get(index);
    }

    public Phase getPhase() {
        return phase;
    }

    public int getPot() {
        return pot;
    }

    public int getHandNumber() {
        return handNumber;
    }

    public boolean isHandInProgress() {
        return handInProgress;
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    public int getDealerIndex() {
        return dealerIndex;
    }

    public int getMinRaise() {
        return minRaise;
    }

    public int getLastRaise() {
        return lastRaise;
    }

    public int getSeatCount() {
        return seats.size();
    }

    public List<Card> getCommunityCards() {
        return Collections.unmodifiableList(communityCards);
    }

    public PlayerStats getStats() {
        return stats;
    }

    public List<LeaderboardEntry> getLeaderboard() {
        return List.copyOf(leaderboard);
    }

    public HandResult getLastHandResult() {
        return lastHandResult;
    }
}
