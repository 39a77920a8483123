package ai.holdem.table;

import ai.holdem.game.Card;
import ai.holdem.game.HandEvaluation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable per-seat state owned by the {@link Table}.
 * <p>
 * Identity (index, name, human flag) is fixed for the session. Chips carry between hands
 * but are restored to the buy-in when each hand starts. Everything else is per hand or,
 * for {@code bet} and {@code acted}, per betting round. Collaborators only ever see
 * {@link SeatView} copies.
 */
public class Seat {
    private final int index;
    private final String name;
    private final boolean human;

    private int chips;
    private final List<Card> hand = new ArrayList<>(2);
    /** Chips committed in the current betting round; already counted in the pot. */
    private int bet;
    private boolean folded;
    private boolean allIn;
    private boolean sittingOut;
    /** Whether the seat has acted since the betting round opened or was last reopened. */
    private boolean acted;
    private HandEvaluation handResult;

    Seat(int index, String name, boolean human) {
        this.index = index;
        this.name = name;
        this.human = human;
    }

    void resetForHand(int buyIn) {
        hand.clear();
        chips = buyIn;
        bet = 0;
        folded = false;
        allIn = false;
        acted = false;
        handResult = null;
    }

    /**
     * Moves up to {@code amount} chips from the stack into this round's bet, marking the
     * seat all-in when the stack runs out.
     *
     * @return the number of chips actually committed
     */
    int commit(int amount) {
        int actual = Math.max(0, Math.min(amount, chips));
        chips -= actual;
        bet += actual;
        if (chips == 0) {
            allIn = true;
        }
        return actual;
    }

    void award(int amount) {
        chips += amount;
    }

    void receive(Card card) {
        hand.add(card);
    }

    /**
     * True when the seat still contests the pot.
     */
    boolean isContending() {
        return !folded && !sittingOut;
    }

    /**
     * True when the seat can still be asked to act this hand.
     */
    boolean canAct() {
        return !folded && !sittingOut && !allIn;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public boolean isHuman() {
        return human;
    }

    public int getChips() {
        return chips;
    }

    public List<Card> getHand() {
        return Collections.unmodifiableList(hand);
    }

    public int getBet() {
        return bet;
    }

    void clearBet() {
        bet = 0;
    }

    public boolean isFolded() {
        return folded;
    }

    void fold() {
        folded = true;
    }

    public boolean isAllIn() {
        return allIn;
    }

    public boolean isSittingOut() {
        return sittingOut;
    }

    void setSittingOut(boolean sittingOut) {
        this.sittingOut = sittingOut;
    }

    boolean hasActed() {
        return acted;
    }

    void setActed(boolean acted) {
        this.acted = acted;
    }

    public HandEvaluation getHandResult() {
        return handResult;
    }

    void setHandResult(HandEvaluation handResult) {
        this.handResult = handResult;
    }

    SeatView view() {
        return new SeatView(index, name, human, chips, List.copyOf(hand), bet, folded, allIn, sittingOut, handResult);
    }

    @Override
    public String toString() {
        return "Seat(" + index + ", " + name + ", chips=" + chips + ", bet=" + bet + ")";
    }
}
