package ai.holdem.stats;

import java.util.List;

/**
 * Storage port for cumulative statistics and the leaderboard.
 * <p>
 * The table reads both once at construction and writes them back at the end of every
 * hand. Implementations must not throw on read: missing or unreadable data comes back as
 * {@link PlayerStats#empty()} or an empty list.
 */
public interface StatsStore {

    PlayerStats loadStats();

    void saveStats(PlayerStats stats);

    /**
     * @return leaderboard entries, best profit first
     */
    List<LeaderboardEntry> loadLeaderboard();

    /**
     * @param entries entries already sorted by profit descending and truncated
     */
    void saveLeaderboard(List<LeaderboardEntry> entries);
}
