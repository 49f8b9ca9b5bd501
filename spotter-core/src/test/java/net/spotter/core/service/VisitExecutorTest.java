package net.spotter.core.service;

import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Sighting;
import net.spotter.core.model.SpawnPoint;
import net.spotter.core.model.VisitOutcome;
import net.spotter.core.model.VisitTask;
import net.spotter.core.model.Worker;
import net.spotter.core.spi.AccountStore;
import net.spotter.core.spi.ChallengeSink;
import net.spotter.core.spi.ProtocolViolationException;
import net.spotter.core.spi.ScanException;
import net.spotter.core.spi.ScanResult;
import net.spotter.core.spi.SpawnStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static net.spotter.core.service.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class VisitExecutorTest {

    final GeoPoint target = new GeoPoint(0.004, 0.008);

    MutableClock clock;
    FakeScanClient client;
    SpawnCatalog catalog;
    AccountManager accounts;
    Throttle throttle;
    List<Sighting> savedSightings;
    VisitExecutor executor;
    Worker worker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        client = new FakeScanClient(clock::now);
        EngineSettings settings = Fixtures.settings(1, 1);
        settings.setVisitTimeout(Duration.ofMillis(200));
        savedSightings = new CopyOnWriteArrayList<>();
        SpawnStore store = new SpawnStore() {
            @Override public List<SpawnPoint> loadSpawnPoints() { return List.of(); }
            @Override public void saveSighting(Sighting sighting) { savedSightings.add(sighting); }
            @Override public void saveSpawnPoint(SpawnPoint point) {}
        };
        catalog = new SpawnCatalog(store, clock, settings);
        accounts = new AccountManager(AccountStore.none(), ChallengeSink.none(), clock);
        accounts.register(Fixtures.account("a"));
        throttle = new Throttle(clock);
        executor = new VisitExecutor(client, catalog, store, accounts, throttle, clock, settings);
        worker = Worker.ofNew(0, new GeoPoint(0.005, 0.01), 5.0, T0).withAccount("a", Worker.Status.VISITING, T0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private VisitTask spawnTask(Instant deadline) {
        return VisitTask.create(VisitTask.Kind.SPAWN, target.key(), target, 0, T0, deadline, T0);
    }

    @Test
    void sighting_updatesCatalog_andPersistsSighting() {
        catalog.seed(Fixtures.confirmed(target, T0.plusSeconds(300), Duration.ofMinutes(15)));
        GeoPoint neighbour = target.offset(0.0002, 0);
        client.then(p -> new ScanResult(T0, List.of(
                new ScanResult.Encounter(target, T0.plusSeconds(300), null),
                new ScanResult.Encounter(neighbour, null, null))));

        VisitOutcome outcome = executor.visit(worker, spawnTask(T0.plusSeconds(300)));

        assertEquals(VisitOutcome.Kind.VISITED, outcome.kind());
        assertEquals(2, outcome.seen());
        assertEquals(T0, catalog.get(target.key()).orElseThrow().lastSeen());
        assertTrue(catalog.get(neighbour.key()).isPresent(), "new spawn point discovered");
        assertEquals(2, savedSightings.size());
        assertEquals(List.of(target), client.scannedAt);
        assertEquals(T0, catalog.lastScan(target).orElseThrow());
    }

    @Test
    void emptyVisitToSpawnTarget_recordsMiss() {
        catalog.seed(Fixtures.confirmed(target, T0.plusSeconds(300), Duration.ofMinutes(15)));
        client.thenEmpty();

        VisitOutcome outcome = executor.visit(worker, spawnTask(T0.plusSeconds(300)));

        assertEquals(VisitOutcome.visited(0), outcome);
        SpawnPoint p = catalog.get(target.key()).orElseThrow();
        assertNull(p.lastSeen());
        assertEquals(T0, p.lastObservedAt());
    }

    @Test
    void scanFailures_areClassifiedByKind() {
        VisitTask task = spawnTask(T0.plusSeconds(300));
        for (ScanException.Failure f : ScanException.Failure.values()) {
            client.thenFail(f);
            VisitOutcome outcome = executor.visit(worker, task);
            assertEquals(VisitOutcome.Kind.valueOf(f.name()), outcome.kind(), "classification of " + f);
        }
    }

    @Test
    void unexpectedResponseShape_isProtocolError() {
        client.then(p -> { throw new ProtocolViolationException("missing cells"); });

        VisitOutcome outcome = executor.visit(worker, spawnTask(T0.plusSeconds(300)));

        assertEquals(VisitOutcome.Kind.PROTOCOL_ERROR, outcome.kind());
    }

    @Test
    void challenge_dropsCachedSession() {
        VisitTask task = spawnTask(T0.plusSeconds(300));
        client.thenEmpty().thenEmpty();
        executor.visit(worker, task);
        executor.visit(worker, task);
        assertEquals(1, client.logins.get(), "session is reused");

        client.thenFail(ScanException.Failure.CHALLENGED).thenEmpty();
        executor.visit(worker, task);
        executor.visit(worker, task);
        assertEquals(2, client.logins.get(), "challenge forces a fresh login");

        // 일시 장애는 세션을 유지한다
        client.thenFail(ScanException.Failure.TRANSIENT).thenEmpty();
        executor.visit(worker, task);
        executor.visit(worker, task);
        assertEquals(2, client.logins.get());
    }

    @Test
    void slowClient_isTransientTimeout() {
        client.then(p -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ScanResult(T0, List.of());
        });

        long started = System.nanoTime();
        VisitOutcome outcome = executor.visit(worker, spawnTask(T0.plusSeconds(300)));

        assertEquals(VisitOutcome.Kind.TRANSIENT, outcome.kind());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(1)) < 0);
    }

    @Test
    void resultArrivingAfterDeadline_isDiscarded() {
        catalog.seed(Fixtures.confirmed(target, T0.plusSeconds(5), Duration.ofMinutes(15)));
        client.then(p -> {
            clock.advance(Duration.ofSeconds(10));
            return new ScanResult(clock.now(), List.of(new ScanResult.Encounter(target, T0.plusSeconds(5), null)));
        });

        VisitOutcome outcome = executor.visit(worker, spawnTask(T0.plusSeconds(5)));

        assertEquals(VisitOutcome.Kind.CANCELLED, outcome.kind());
        assertNull(catalog.get(target.key()).orElseThrow().lastSeen());
        assertTrue(savedSightings.isEmpty());
    }

    @Test
    void expiredTask_andThrottle_shortCircuitBeforeCallingClient() {
        VisitTask task = spawnTask(T0.plusSeconds(5));

        throttle.engage(T0.plusSeconds(60));
        assertEquals(VisitOutcome.Kind.THROTTLED, executor.visit(worker, task).kind());

        clock.advance(Duration.ofSeconds(10));
        assertEquals(VisitOutcome.Kind.CANCELLED, executor.visit(worker, task).kind());

        Worker noAccount = Worker.ofNew(1, target, 5.0, T0);
        assertEquals(VisitOutcome.Kind.TRANSIENT, executor.visit(noAccount, task).kind());

        assertTrue(client.scannedBy.isEmpty());
    }
}
