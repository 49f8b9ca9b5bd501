package net.spotter.app.sim;

import net.spotter.core.model.Account;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Region;
import net.spotter.core.spi.Clock;
import net.spotter.core.spi.ScanClient;
import net.spotter.core.spi.ScanException;
import net.spotter.core.spi.ScanResult;
import net.spotter.core.spi.ScanSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 영역 안에 고정 시드로 스폰 지점을 흩어 놓은 모의 서버.
 * 각 지점은 매 주기 despawnSecond 에 사라지고 그 전 spawnDuration 동안 보인다.
 */
public class SimulatedScanClient implements ScanClient {
    private static final Logger log = LoggerFactory.getLogger(SimulatedScanClient.class);

    record SimSpawn(GeoPoint position, int despawnSecond) {}

    private final List<SimSpawn> spawns;
    private final Set<String> banned = ConcurrentHashMap.newKeySet();
    private final Clock clock;
    private final Duration period;
    private final SimulationProperties props;

    public SimulatedScanClient(Region region, Duration period, Clock clock, SimulationProperties props) {
        this.clock = clock;
        this.period = period;
        this.props = props;
        Random r = new Random(props.getSeed());
        List<SimSpawn> out = new ArrayList<>();
        for (int i = 0; i < props.getSpawnCount(); i++) {
            double lat = region.south() + r.nextDouble() * (region.north() - region.south());
            double lon = region.west() + r.nextDouble() * (region.east() - region.west());
            out.add(new SimSpawn(new GeoPoint(lat, lon), r.nextInt((int) period.toSeconds())));
        }
        this.spawns = List.copyOf(out);
        log.info("Simulated world: {} spawn points in {}", spawns.size(), region);
    }

    /** 이후 이 계정의 호출은 BANNED */
    public void ban(String username) {
        banned.add(username);
    }

    @Override
    public ScanSession login(Account account) throws ScanException {
        if (banned.contains(account.username())) {
            throw new ScanException(ScanException.Failure.BANNED, "account " + account.username() + " is banned");
        }
        String username = account.username();
        return () -> username;
    }

    @Override
    public ScanResult scan(ScanSession session, GeoPoint position) throws ScanException {
        if (banned.contains(session.username())) {
            throw new ScanException(ScanException.Failure.BANNED, "account " + session.username() + " is banned");
        }
        pause();
        Instant now = clock.now();
        List<ScanResult.Encounter> seen = new ArrayList<>();
        for (SimSpawn s : spawns) {
            if (s.position().distanceTo(position) > props.getScanRadiusMeters()) continue;
            Instant exp = nextDespawn(s, now);
            if (now.isBefore(exp.minus(props.getSpawnDuration()))) continue;
            seen.add(new ScanResult.Encounter(s.position(), exp, Map.of("source", "sim")));
        }
        return new ScanResult(now, seen);
    }

    private Instant nextDespawn(SimSpawn s, Instant now) {
        long periodSec = period.toSeconds();
        long start = Math.floorDiv(now.getEpochSecond(), periodSec) * periodSec;
        Instant exp = Instant.ofEpochSecond(start + s.despawnSecond());
        return exp.isBefore(now) ? exp.plus(period) : exp;
    }

    private void pause() throws ScanException {
        long ms = props.getLatency() == null ? 0 : props.getLatency().toMillis();
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException(ScanException.Failure.TRANSIENT, "interrupted", e);
        }
    }

    List<SimSpawn> spawns() {
        return spawns;
    }
}
