package net.spotter.integration.spring.sched;

import net.spotter.adapter.jdbc.repo.JdbcSpawnStore;
import net.spotter.core.maintenance.FleetMaintenance;
import net.spotter.core.service.Orchestrator;
import net.spotter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class SpotterSchedulers {
    private static final Logger log = LoggerFactory.getLogger(SpotterSchedulers.class);

    private final Orchestrator orchestrator;
    private final FleetMaintenance maintenance;
    private final JdbcSpawnStore spawnStore;
    private final Clock clock;

    private Duration sightingRetention;   // null = 보관 무제한

    public SpotterSchedulers(Orchestrator orchestrator, FleetMaintenance maintenance,
                             JdbcSpawnStore spawnStore, Clock clock) {
        this.orchestrator = orchestrator;
        this.maintenance = maintenance;
        this.spawnStore = spawnStore;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${spotter.scheduler.tick-delay-ms:3000}")
    public void tick() {
        orchestrator.tick();
    }

    @Scheduled(fixedDelayString = "${spotter.scheduler.maintenance-delay-ms:10000}")
    public void maintenance() throws Exception {
        if (!orchestrator.isStarted()) return;
        maintenance.runOnce();
        if (sightingRetention != null) {
            int pruned = spawnStore.pruneSightings(clock.now().minus(sightingRetention));
            if (pruned > 0) log.info("Pruned {} sightings older than {}", pruned, sightingRetention);
        }
    }

    public void setSightingRetention(Duration sightingRetention) {
        this.sightingRetention = sightingRetention;
    }
}
