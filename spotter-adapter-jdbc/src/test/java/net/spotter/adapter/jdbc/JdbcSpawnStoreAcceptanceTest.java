package net.spotter.adapter.jdbc;

import net.spotter.adapter.jdbc.repo.JdbcSpawnStore;
import net.spotter.core.model.Confidence;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Observation;
import net.spotter.core.model.Region;
import net.spotter.core.model.Sighting;
import net.spotter.core.model.SpawnPoint;
import net.spotter.core.service.EngineSettings;
import net.spotter.core.service.SpawnCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSpawnStoreAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    final GeoPoint p = new GeoPoint(0.004, 0.008);

    JdbcSpawnStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcSpawnStore(tx);
    }

    private EngineSettings settings() {
        EngineSettings s = new EngineSettings();
        s.setRegion(new Region(0, 0, 0.01, 0.02));
        return s.validate();
    }

    @Test
    @DisplayName("모르는 값(null)을 포함한 스폰 지점 저장/적재")
    void saveAndLoad_discoveredPoint() throws Exception {
        store.saveSpawnPoint(SpawnPoint.discovered(p, T0));

        List<SpawnPoint> loaded = store.loadSpawnPoints();
        assertEquals(1, loaded.size());
        SpawnPoint sp = loaded.get(0);
        assertEquals(p.key(), sp.spawnId());
        assertEquals(p, sp.position());
        assertNull(sp.knownExpiration());
        assertNull(sp.durationEstimate());
        assertEquals(Confidence.NONE, sp.confidence());
        assertFalse(sp.stale());
        assertEquals(T0, sp.updatedAt());
    }

    @Test
    @DisplayName("같은 SPAWN_ID 저장은 갱신(upsert)")
    void save_isUpsertBySpawnId() throws Exception {
        store.saveSpawnPoint(SpawnPoint.discovered(p, T0));
        SpawnPoint timed = SpawnPoint.discovered(p, T0)
                .withTiming(T0.plusSeconds(600), Duration.ofMinutes(15), Confidence.CONFIRMED, 3, T0.plusSeconds(1))
                .withObservation(T0, T0, false, T0.plusSeconds(1))
                .markedStale(T0.plusSeconds(2));
        store.saveSpawnPoint(timed);

        assertEquals(1, count("TB_SPAWN_POINT"));
        assertEquals(timed, store.loadSpawnPoints().get(0));
    }

    @Test
    @DisplayName("목격 이력은 (지점, 관측 시각) 당 한 건, 속성 보존")
    void sightings_areDeduplicated() throws Exception {
        Sighting s = new Sighting(p.key(), p, T0, T0.plusSeconds(300), Map.of("kind", "a b", "x", "1=2&3"));
        store.saveSighting(s);
        store.saveSighting(s);
        store.saveSighting(new Sighting(p.key(), p, T0.plusSeconds(60), null, null));

        List<Sighting> history = store.sightingsOf(p.key());
        assertEquals(2, history.size());
        assertEquals(s, history.get(0));
        assertNull(history.get(1).expiresAt());
        assertTrue(history.get(1).attributes().isEmpty());

        assertEquals(1, store.pruneSightings(T0.plusSeconds(30)));
        assertEquals(1, count("TB_SIGHTING"));
    }

    @Test
    @DisplayName("속성은 키 정렬된 JSON 으로 저장된다")
    void sightingAttributes_areStoredAsJson() throws Exception {
        store.saveSighting(new Sighting(p.key(), p, T0, null, Map.of("x", "1=2&3", "kind", "a \"b\"")));

        assertEquals("{\"kind\":\"a \\\"b\\\"\",\"x\":\"1=2&3\"}",
                queryString("SELECT ATTRIBUTES FROM TB_SIGHTING"));
        assertEquals(Map.of("x", "1=2&3", "kind", "a \"b\""), store.sightingsOf(p.key()).get(0).attributes());
    }

    @Test
    @DisplayName("읽을 수 없는 신뢰도 코드는 NONE 으로 적재")
    void unreadableConfidence_loadsAsNone() throws Exception {
        store.saveSpawnPoint(SpawnPoint.discovered(p, T0)
                .withTiming(T0.plusSeconds(600), Duration.ofMinutes(15), Confidence.CONFIRMED, 3, T0));
        exec("UPDATE TB_SPAWN_POINT SET CONFIDENCE = 'LEGACY'");

        assertEquals(Confidence.NONE, store.loadSpawnPoints().get(0).confidence());
    }

    @Test
    @DisplayName("카탈로그가 학습한 타이머가 재기동 후에도 남는다")
    void catalogStateSurvivesRestart() throws Exception {
        SpawnCatalog first = new SpawnCatalog(store, () -> T0, settings());
        first.upsert(Observation.sighting(p, T0, T0.plusSeconds(600), Map.of()));
        first.upsert(Observation.sighting(p, T0.plusSeconds(3600), T0.plusSeconds(4200), Map.of()));
        SpawnPoint learned = first.get(p.key()).orElseThrow();
        assertEquals(Confidence.CONFIRMED, learned.confidence());
        assertEquals(2, learned.consistentObservations());

        SpawnCatalog restarted = new SpawnCatalog(store, () -> T0.plusSeconds(7200), settings());
        assertEquals(1, restarted.load());
        assertEquals(learned, restarted.get(p.key()).orElseThrow());
    }
}
