package ai.holdem.table;

import java.util.Objects;

/**
 * An action chosen by a player, with the raise total for {@link ActionType#RAISE}.
 *
 * @param action the action
 * @param amount total bet for the round when raising; ignored otherwise
 */
public record Decision(ActionType action, int amount) {

    public Decision {
        Objects.requireNonNull(action, "action");
    }

    public static Decision fold() {
        return new Decision(ActionType.FOLD, 0);
    }

    public static Decision check() {
        return new Decision(ActionType.CHECK, 0);
    }

    public static Decision call() {
        return new Decision(ActionType.CALL, 0);
    }

    public static Decision raiseTo(int total) {
        return new Decision(ActionType.RAISE, total);
    }

    @Override
    public String toString() {
        return action == ActionType.RAISE ? "raise to " + amount : action.name().toLowerCase();
    }
}
