package ai.holdem.table;

/**
 * Result of a mutating call on the {@link Table}: either applied, or ignored with a reason.
 * <p>
 * The table never throws for bad input from its collaborators; callers that care can
 * tell a legitimate no-op from a bug by inspecting the reason.
 */
public final class ActionOutcome {
    private static final ActionOutcome APPLIED = new ActionOutcome(null);

    private final IgnoreReason reason;

    private ActionOutcome(IgnoreReason reason) {
        this.reason = reason;
    }

    public static ActionOutcome applied() {
        return APPLIED;
    }

    public static ActionOutcome ignored(IgnoreReason reason) {
        return new ActionOutcome(reason);
    }

    public boolean isApplied() {
        return reason == null;
    }

    /**
     * @return the reason the call was ignored, or {@code null} when it was applied
     */
    public IgnoreReason reason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActionOutcome other)) {
            return false;
        }
        return reason == other.reason;
    }

    @Override
    public int hashCode() {
        return reason == null ? 0 : reason.hashCode();
    }

    @Override
    public String toString() {
        return isApplied() ? "applied" : "ignored:" + reason;
    }
}
