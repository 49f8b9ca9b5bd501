package net.spotter.bootstrap.catalog;

import net.spotter.bootstrap.props.SpotterProperties;
import net.spotter.core.model.Account;
import net.spotter.core.model.Confidence;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Region;
import net.spotter.core.model.SpawnPoint;
import net.spotter.core.service.AccountManager;
import net.spotter.core.service.EngineSettings;
import net.spotter.core.service.SpawnCatalog;
import net.spotter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 설정에 적힌 계정과 스폰 지점을 엔진에 등록한다.
 * 설정 오류는 IllegalArgumentException 으로 기동을 막는다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final AccountManager accounts;
    private final SpawnCatalog catalog;
    private final EngineSettings settings;
    private final Clock clock;

    public CatalogRegistrar(AccountManager accounts, SpawnCatalog catalog, EngineSettings settings, Clock clock) {
        this.accounts = accounts;
        this.catalog = catalog;
        this.settings = settings;
        this.clock = clock;
    }

    public void register(SpotterProperties props) {
        registerAccounts(props.getAccounts());
        if (props.getCatalog().isEnabled()) {
            seedSpawnPoints(props.getCatalog().getSpawnPoints());
        }
    }

    private void registerAccounts(List<SpotterProperties.AccountDef> defs) {
        if (defs == null || defs.isEmpty()) {
            throw new IllegalArgumentException("spotter.accounts is empty; at least one account is required");
        }
        Set<String> seen = new HashSet<>();
        for (var d : defs) {
            if (d.getUsername() == null || d.getUsername().isBlank()) {
                throw new IllegalArgumentException("account.username is required: " + d);
            }
            if (!seen.add(d.getUsername())) {
                throw new IllegalArgumentException("duplicate account: " + d.getUsername());
            }
            accounts.register(Account.ofNew(d.getUsername(), d.getPassword(), d.getProvider()));
        }
        if (defs.size() < settings.fleetSize()) {
            log.warn("{} accounts for {} workers; {} workers will stay retired until accounts free up",
                    defs.size(), settings.fleetSize(), settings.fleetSize() - defs.size());
        }
        log.info("Accounts registered: {}", defs.size());
    }

    private void seedSpawnPoints(List<SpotterProperties.SpawnDef> defs) {
        Region region = settings.getRegion();
        Instant now = clock.now();
        int seeded = 0;
        for (var d : defs) {
            if (d.getLat() == null || d.getLon() == null) {
                throw new IllegalArgumentException("spawn point lat/lon are required: " + d);
            }
            GeoPoint p = new GeoPoint(d.getLat(), d.getLon());
            if (!region.contains(p)) {
                log.warn("Spawn point {} lies outside the scan region; seeding anyway", p);
            }
            if (catalog.seed(toSpawnPoint(p, d, now))) seeded++;
        }
        log.info("Spawn catalog seeded: {} new of {} configured", seeded, defs.size());
    }

    private SpawnPoint toSpawnPoint(GeoPoint p, SpotterProperties.SpawnDef d, Instant now) {
        if (d.getDespawnSecond() == null) {
            return SpawnPoint.discovered(p, now);
        }
        long periodSec = settings.getSpawnPeriod().toSeconds();
        int second = d.getDespawnSecond();
        if (second < 0 || second >= periodSec) {
            throw new IllegalArgumentException("despawnSecond must be in [0," + periodSec + "): " + d);
        }
        // 현재 주기 시작 + second. 이후 주기 반복은 SpawnPoint 가 계산한다
        long periodStart = Math.floorDiv(now.getEpochSecond(), periodSec) * periodSec;
        Instant expiration = Instant.ofEpochSecond(periodStart + second);
        Duration duration = d.getDuration() != null ? d.getDuration() : settings.getDefaultDuration();
        return SpawnPoint.discovered(p, now)
                .withTiming(expiration, duration, Confidence.CONFIRMED, 2, now);
    }
}
