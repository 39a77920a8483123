package ai.holdem.player;

import ai.holdem.table.ActionType;
import ai.holdem.table.Decision;
import ai.holdem.table.SeatView;
import ai.holdem.table.TableSnapshot;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Scanner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Human player that reads commands from stdin (CLI).
 * <p>
 * Commands: {@code f} fold, {@code c} check or call, {@code k} check, {@code r <total>}
 * raise to a total, {@code r half|pot|2x|allin} preset raise, {@code q} quit. Unknown or
 * currently illegal input re-prompts; end of input quits.
 */
@Component
@Profile("!autoplay")
public class HumanPlayer implements Player {
    private final Scanner scanner;
    private final PrintStream out;

    public HumanPlayer() {
        this(new Scanner(System.in), System.out);
    }

    HumanPlayer(Scanner scanner, PrintStream out) {
        this.scanner = scanner;
        this.out = out;
    }

    @Override
    public Decision decide(SeatView seat, TableSnapshot snapshot) {
        while (true) {
            out.print(buildPrompt(snapshot));
            if (!scanner.hasNextLine()) {
                return null;
            }
            String input = scanner.nextLine().trim();
            if (input.equalsIgnoreCase("q") || input.equalsIgnoreCase("quit")) {
                return null;
            }
            Optional<Decision> decision = parse(input, snapshot);
            if (decision.isPresent()) {
                return decision.get();
            }
            out.println("Not available: '" + input + "'");
        }
    }

    /**
     * Parses one command line against the current legal actions.
     *
     * @return the decision, or empty when the input is unknown or not legal right now
     */
    static Optional<Decision> parse(String input, TableSnapshot snapshot) {
        String[] parts = input.trim().toLowerCase(Locale.ROOT).split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            return Optional.empty();
        }
        switch (parts[0]) {
            case "f", "fold" -> {
                return legal(snapshot, ActionType.FOLD, Decision.fold());
            }
            case "k", "check" -> {
                return legal(snapshot, ActionType.CHECK, Decision.check());
            }
            case "c", "call" -> {
                if (snapshot.isLegal(ActionType.CHECK)) {
                    return Optional.of(Decision.check());
                }
                return legal(snapshot, ActionType.CALL, Decision.call());
            }
            case "r", "raise" -> {
                if (parts.length < 2 || !snapshot.isLegal(ActionType.RAISE)) {
                    return Optional.empty();
                }
                Optional<RaisePreset> preset = RaisePreset.fromKeyword(parts[1]);
                if (preset.isPresent()) {
                    return Optional.of(Decision.raiseTo(preset.get().total(snapshot)));
                }
                try {
                    return Optional.of(Decision.raiseTo(Integer.parseInt(parts[1])));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private static Optional<Decision> legal(TableSnapshot snapshot, ActionType action, Decision decision) {
        return snapshot.isLegal(action) ? Optional.of(decision) : Optional.empty();
    }

    private static String buildPrompt(TableSnapshot snapshot) {
        StringBuilder sb = new StringBuilder("Enter command (f");
        if (snapshot.isLegal(ActionType.CHECK)) {
            sb.append(" | c/k check");
        } else if (snapshot.isLegal(ActionType.CALL)) {
            sb.append(" | c call ").append(snapshot.callAmount());
        }
        if (snapshot.isLegal(ActionType.RAISE)) {
            sb.append(" | r ").append(snapshot.minRaiseTotal()).append("-").append(snapshot.maxRaiseTotal())
                    .append(" | r half|pot|2x|allin");
        }
        sb.append(" | q): ");
        return sb.toString();
    }
}
