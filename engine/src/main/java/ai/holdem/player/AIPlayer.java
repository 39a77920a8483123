package ai.holdem.player;

import ai.holdem.table.TableSnapshot;

/**
 * Base class for automated players with helpers for reading the betting state.
 */
public abstract class AIPlayer implements Player {

    protected int toCall(TableSnapshot snapshot) {
        return snapshot.callAmount();
    }

    /**
     * Seats after the dealer, counted clockwise; the dealer is 0.
     */
    protected int positionFromDealer(int seatIndex, TableSnapshot snapshot) {
        int seats = snapshot.seats().size();
        return (seatIndex - snapshot.dealerIndex() + seats) % seats;
    }

    protected static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
