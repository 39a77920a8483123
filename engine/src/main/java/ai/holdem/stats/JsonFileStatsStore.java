package ai.holdem.stats;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StatsStore} backed by two JSON files in a directory: {@code stats.json} and
 * {@code leaderboard.json}.
 * <p>
 * Reads never fail: a missing file yields a fresh record, and an unreadable or corrupt one
 * is logged and replaced by a fresh record. Write failures are logged and swallowed so a
 * full disk never breaks a hand in progress.
 */
public class JsonFileStatsStore implements StatsStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStatsStore.class);
    private static final TypeReference<List<LeaderboardEntry>> LEADERBOARD_TYPE = new TypeReference<>() {
    };

    static final String STATS_FILE = "stats.json";
    static final String LEADERBOARD_FILE = "leaderboard.json";

    private final Path statsFile;
    private final Path leaderboardFile;
    private final ObjectMapper objectMapper;

    public JsonFileStatsStore(Path directory, ObjectMapper objectMapper) {
        Objects.requireNonNull(directory, "directory");
        this.statsFile = directory.resolve(STATS_FILE);
        this.leaderboardFile = directory.resolve(LEADERBOARD_FILE);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public PlayerStats loadStats() {
        if (!Files.isRegularFile(statsFile)) {
            return PlayerStats.empty();
        }
        try {
            PlayerStats stats = objectMapper.readValue(statsFile.toFile(), PlayerStats.class);
            return stats == null ? PlayerStats.empty() : stats;
        } catch (IOException e) {
            log.warn("Could not read stats from {}; starting from zero", statsFile, e);
            return PlayerStats.empty();
        }
    }

    @Override
    public void saveStats(PlayerStats stats) {
        write(statsFile, stats);
    }

    @Override
    public List<LeaderboardEntry> loadLeaderboard() {
        if (!Files.isRegularFile(leaderboardFile)) {
            return new ArrayList<>();
        }
        try {
            List<LeaderboardEntry> entries = objectMapper.readValue(leaderboardFile.toFile(), LEADERBOARD_TYPE);
            return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
        } catch (IOException e) {
            log.warn("Could not read leaderboard from {}; starting empty", leaderboardFile, e);
            return new ArrayList<>();
        }
    }

    @Override
    public void saveLeaderboard(List<LeaderboardEntry> entries) {
        write(leaderboardFile, entries);
    }

    private void write(Path file, Object value) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        } catch (IOException e) {
            log.warn("Could not write {}", file, e);
        }
    }
}
