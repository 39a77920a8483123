package ai.holdem.config;

import ai.holdem.player.TurnDriver;
import ai.holdem.stats.InMemoryStatsStore;
import ai.holdem.stats.JsonFileStatsStore;
import ai.holdem.stats.StatsStore;
import ai.holdem.table.CooperativeScheduler;
import ai.holdem.table.Pacer;
import ai.holdem.table.Table;
import ai.holdem.view.TableFormatter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the table, its scheduler and storage from the configuration properties.
 */
@Configuration
public class EngineConfiguration {
    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public StatsStore statsStore(StorageProperties storage) {
        if (!storage.isEnabled()) {
            log.debug("Stats storage disabled; keeping stats in memory");
            return new InMemoryStatsStore();
        }
        return new JsonFileStatsStore(Paths.get(storage.getDirectory()), new ObjectMapper());
    }

    @Bean
    public CooperativeScheduler cooperativeScheduler(PacingProperties pacing) {
        return new CooperativeScheduler(pacing.isRealTime() ? Pacer.SLEEP : Pacer.NONE);
    }

    @Bean
    public Table table(TableProperties tableProperties,
                       StatsStore statsStore,
                       CooperativeScheduler scheduler,
                       PacingProperties pacing) {
        return new Table(tableProperties.toRules(), statsStore, scheduler, pacing.getDelayMillis());
    }

    @Bean
    public TurnDriver turnDriver(Table table, CooperativeScheduler scheduler, PacingProperties pacing) {
        return new TurnDriver(table, scheduler, pacing.getDelayMillis());
    }

    @Bean
    public TableFormatter tableFormatter() {
        return new TableFormatter();
    }
}
