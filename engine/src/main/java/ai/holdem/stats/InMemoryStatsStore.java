package ai.holdem.stats;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link StatsStore} that keeps everything in memory for the lifetime of the process.
 * Used when persistence is disabled and in tests.
 */
public class InMemoryStatsStore implements StatsStore {
    private PlayerStats stats = PlayerStats.empty();
    private List<LeaderboardEntry> leaderboard = new ArrayList<>();

    @Override
    public PlayerStats loadStats() {
        return stats;
    }

    @Override
    public void saveStats(PlayerStats stats) {
        this.stats = stats;
    }

    @Override
    public List<LeaderboardEntry> loadLeaderboard() {
        return new ArrayList<>(leaderboard);
    }

    @Override
    public void saveLeaderboard(List<LeaderboardEntry> entries) {
        this.leaderboard = new ArrayList<>(entries);
    }
}
