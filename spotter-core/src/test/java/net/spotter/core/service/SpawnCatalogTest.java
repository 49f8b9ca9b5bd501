package net.spotter.core.service;

import net.spotter.core.model.Confidence;
import net.spotter.core.model.DueTarget;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Observation;
import net.spotter.core.model.Sighting;
import net.spotter.core.model.SpawnPoint;
import net.spotter.core.spi.SpawnStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static net.spotter.core.service.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class SpawnCatalogTest {

    MutableClock clock;
    SpawnCatalog catalog;

    final GeoPoint a = new GeoPoint(0.001, 0.001);
    final GeoPoint b = new GeoPoint(0.002, 0.002);
    final GeoPoint c = new GeoPoint(0.003, 0.003);
    final GeoPoint d = new GeoPoint(0.004, 0.004);
    final GeoPoint e = new GeoPoint(0.005, 0.005);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        catalog = new SpawnCatalog(SpawnStore.none(), clock, Fixtures.settings(1, 1));
    }

    @Test
    void firstTimedSighting_isEstimated_withRemainingTimeAsDuration() {
        SpawnPoint p = catalog.upsert(Observation.sighting(a, T0, T0.plus(Duration.ofMinutes(10)), Map.of()))
                .orElseThrow();

        assertEquals(Confidence.ESTIMATED, p.confidence());
        assertEquals(1, p.consistentObservations());
        assertEquals(T0.plus(Duration.ofMinutes(10)), p.knownExpiration());
        assertEquals(Duration.ofMinutes(10), p.durationEstimate());
        assertEquals(T0, p.lastSeen());
    }

    @Test
    void consistentTimerInNextPeriod_confirms() {
        catalog.upsert(Observation.sighting(a, T0, T0.plus(Duration.ofMinutes(10)), Map.of()));

        Instant nextHour = T0.plus(Duration.ofHours(1));
        clock.set(nextHour);
        // 2초 오차는 허용 범위 안
        SpawnPoint p = catalog.upsert(Observation.sighting(a, nextHour,
                nextHour.plus(Duration.ofMinutes(10)).plusSeconds(2), Map.of())).orElseThrow();

        assertEquals(Confidence.CONFIRMED, p.confidence());
        assertEquals(2, p.consistentObservations());
    }

    @Test
    void identicalObservationTwice_isIdempotent() {
        Observation o = Observation.sighting(a, T0, T0.plus(Duration.ofMinutes(10)), Map.of("kind", "x"));
        SpawnPoint first = catalog.upsert(o).orElseThrow();
        SpawnPoint second = catalog.upsert(o).orElseThrow();

        assertEquals(first, second);
        assertEquals(1, second.consistentObservations());
        assertEquals(1, catalog.size());
    }

    @Test
    void missOnUnknownPoint_isDropped() {
        assertTrue(catalog.upsert(Observation.miss(a, T0)).isEmpty());
        assertEquals(0, catalog.size());
    }

    @Test
    void sightingWithoutTimer_staysMystery() {
        SpawnPoint p = catalog.upsert(Observation.sighting(a, T0, null, Map.of())).orElseThrow();
        assertEquals(Confidence.NONE, p.confidence());
        assertFalse(p.timed());
        assertEquals(T0, p.lastSeen());
    }

    @Test
    void conflictingTimer_onConfirmedPoint_keepsTiming() {
        catalog.seed(Fixtures.confirmed(a, T0.plus(Duration.ofMinutes(20)), Duration.ofMinutes(15)));

        SpawnPoint p = catalog.upsert(Observation.sighting(a, T0, T0.plus(Duration.ofMinutes(3)), Map.of()))
                .orElseThrow();

        assertEquals(Confidence.CONFIRMED, p.confidence());
        assertEquals(T0.plus(Duration.ofMinutes(20)), p.knownExpiration());
        assertEquals(T0, p.lastSeen(), "sighting itself is still recorded");
    }

    @Test
    void conflictingTimer_onEstimatedPoint_retimes() {
        catalog.upsert(Observation.sighting(a, T0, T0.plus(Duration.ofMinutes(10)), Map.of()));

        Instant later = T0.plus(Duration.ofMinutes(30));
        SpawnPoint p = catalog.upsert(Observation.sighting(a, later, later.plus(Duration.ofMinutes(5)), Map.of()))
                .orElseThrow();

        assertEquals(Confidence.ESTIMATED, p.confidence());
        assertEquals(1, p.consistentObservations());
        assertEquals(later.plus(Duration.ofMinutes(5)), p.knownExpiration());
    }

    @Test
    void missInsideWindow_shrinksDurationBySmoothing() {
        catalog.seed(Fixtures.confirmed(a, T0.plus(Duration.ofMinutes(20)), Duration.ofMinutes(15)));

        // 창 [T0+5m, T0+20m] 안에서 T0+10m 에 못 봄 → 상한 10분, 15 + 0.3*(10-15) = 13.5분
        SpawnPoint p = catalog.upsert(Observation.miss(a, T0.plus(Duration.ofMinutes(10)))).orElseThrow();

        assertEquals(Duration.ofSeconds(810), p.durationEstimate());
        assertEquals(Confidence.CONFIRMED, p.confidence());
        assertNull(p.lastSeen());
    }

    @Test
    void sightingRemainingTime_raisesDuration() {
        catalog.seed(Fixtures.confirmed(a, T0.plus(Duration.ofMinutes(20)), Duration.ofMinutes(10)));

        SpawnPoint p = catalog.upsert(Observation.sighting(a, T0.plus(Duration.ofMinutes(5)),
                T0.plus(Duration.ofMinutes(20)), Map.of())).orElseThrow();

        assertEquals(Duration.ofMinutes(15), p.durationEstimate());
        assertEquals(3, p.consistentObservations());
    }

    @Test
    void dueTargets_areEarliestDeadlineFirst_andSkipSeenStaleAndFarWindows() {
        Duration dur = Duration.ofMinutes(15);
        catalog.seed(Fixtures.confirmed(a, T0.plus(Duration.ofMinutes(10)), dur));     // 창 진행 중
        catalog.seed(Fixtures.confirmed(b, T0.plus(Duration.ofMinutes(5)), dur));      // 더 이른 마감
        catalog.seed(Fixtures.confirmed(c, T0.plus(Duration.ofMinutes(40)), dur));     // 창이 호라이즌 밖
        catalog.seed(Fixtures.confirmed(d, T0.plus(Duration.ofMinutes(8)), dur)
                .withObservation(T0.minusSeconds(60), T0.minusSeconds(60), false, T0));   // 이번 창에서 이미 봄
        catalog.seed(Fixtures.confirmed(e, T0.plus(Duration.ofMinutes(7)), dur).markedStale(T0));

        List<String> ids = new ArrayList<>();
        for (DueTarget t : catalog.dueTargets(Duration.ofSeconds(60))) ids.add(t.spawnId());

        assertEquals(List.of(b.key(), a.key()), ids);
    }

    @Test
    void dueTargets_rollPastExpirationIntoCurrentPeriod() {
        // 50분 전에 만료됐던 지점 → 다음 만료는 T0+10m
        catalog.seed(Fixtures.confirmed(a, T0.minus(Duration.ofMinutes(50)), Duration.ofMinutes(15)));

        Iterator<DueTarget> it = catalog.dueTargets(Duration.ofSeconds(60)).iterator();
        assertTrue(it.hasNext());
        DueTarget t = it.next();
        assertEquals(T0.plus(Duration.ofMinutes(10)), t.deadline());
        assertEquals(T0.minus(Duration.ofMinutes(5)), t.windowStart());
    }

    @Test
    void dueTargets_iterationTakesFreshSnapshot() {
        Iterable<DueTarget> due = catalog.dueTargets(Duration.ofSeconds(60));
        assertFalse(due.iterator().hasNext());

        catalog.seed(Fixtures.confirmed(a, T0.plus(Duration.ofMinutes(10)), Duration.ofMinutes(15)));
        assertTrue(due.iterator().hasNext());
    }

    @Test
    void markStale_flagsLongUnseenPoints_andClearsOnSighting() {
        catalog.seed(Fixtures.confirmed(a, T0.plus(Duration.ofMinutes(10)), Duration.ofMinutes(15)));

        assertEquals(1, catalog.markStale(T0.minus(Duration.ofHours(1))));
        assertTrue(catalog.get(a.key()).orElseThrow().stale());
        assertEquals(0, catalog.markStale(T0.minus(Duration.ofHours(1))), "already stale");
        assertFalse(catalog.dueTargets(Duration.ofSeconds(60)).iterator().hasNext());

        SpawnPoint seen = catalog.upsert(Observation.sighting(a, T0, T0.plus(Duration.ofMinutes(10)), Map.of()))
                .orElseThrow();
        assertFalse(seen.stale());
        assertEquals(Confidence.CONFIRMED, seen.confidence(), "stale points keep their confidence");
    }

    @Test
    void explorationTargets_putMysteriesFirst_thenLeastRecentlyScannedCells() {
        catalog.upsert(Observation.sighting(a, T0, null, Map.of()));

        Iterator<GeoPoint> it = catalog.explorationTargets(Fixtures.REGION).iterator();
        assertEquals(a, it.next());
        GeoPoint firstCell = it.next();

        catalog.recordScan(firstCell, T0);
        Iterator<GeoPoint> again = catalog.explorationTargets(Fixtures.REGION).iterator();
        assertEquals(a, again.next());
        assertNotEquals(firstCell, again.next(), "scanned cell moves behind never-scanned ones");
        assertEquals(T0, catalog.lastScan(firstCell).orElseThrow());
    }

    @Test
    void persistenceFailure_doesNotBreakUpsert() {
        SpawnStore failing = new SpawnStore() {
            @Override public List<SpawnPoint> loadSpawnPoints() { return List.of(); }
            @Override public void saveSighting(Sighting sighting) throws Exception { throw new Exception("down"); }
            @Override public void saveSpawnPoint(SpawnPoint point) throws Exception { throw new Exception("down"); }
        };
        SpawnCatalog c = new SpawnCatalog(failing, clock, Fixtures.settings(1, 1));

        assertTrue(c.upsert(Observation.sighting(a, T0, T0.plusSeconds(600), Map.of())).isPresent());
    }
}
