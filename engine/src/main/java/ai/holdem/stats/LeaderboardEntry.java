package ai.holdem.stats;

/**
 * One leaderboard row: the day a hand was played and the human seat's profit on it.
 *
 * @param date   ISO-8601 local date, e.g. "2024-03-01"
 * @param profit ending stack minus buy-in
 */
public record LeaderboardEntry(String date, int profit) {
}
