package ai.holdem.player;

import ai.holdem.table.TableSnapshot;
import java.util.Locale;
import java.util.Optional;

/**
 * Shortcut raise sizes offered to the human seat.
 */
public enum RaisePreset {
    HALF("half"),
    POT("pot"),
    DOUBLE_POT("2x"),
    ALL_IN("allin");

    private final String keyword;

    RaisePreset(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Raise total for this preset, clamped into the snapshot's legal raise range.
     */
    public int total(TableSnapshot snapshot) {
        int maxBet = snapshot.currentMaxBet();
        int pot = snapshot.pot();
        int total = switch (this) {
            case HALF -> maxBet + pot / 2;
            case POT -> maxBet + pot;
            case DOUBLE_POT -> maxBet + pot * 2;
            case ALL_IN -> snapshot.maxRaiseTotal();
        };
        return Math.max(snapshot.minRaiseTotal(), Math.min(total, snapshot.maxRaiseTotal()));
    }

    public static Optional<RaisePreset> fromKeyword(String keyword) {
        String normalised = keyword.trim().toLowerCase(Locale.ROOT);
        for (RaisePreset preset : values()) {
            if (preset.keyword.equals(normalised)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
