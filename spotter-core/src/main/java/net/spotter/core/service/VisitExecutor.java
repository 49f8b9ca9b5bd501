package net.spotter.core.service;

import net.spotter.core.model.Account;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Observation;
import net.spotter.core.model.Sighting;
import net.spotter.core.model.VisitOutcome;
import net.spotter.core.model.VisitTask;
import net.spotter.core.model.Worker;
import net.spotter.core.spi.Clock;
import net.spotter.core.spi.ScanClient;
import net.spotter.core.spi.ScanException;
import net.spotter.core.spi.ScanResult;
import net.spotter.core.spi.ScanSession;
import net.spotter.core.spi.SpawnStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 워커 한 명의 방문 1회를 수행하고 결과를 분류한다.
 * 재시도하지 않는다. 재시도/계정 처리는 FailureRecoveryController 의 몫.
 */
public final class VisitExecutor {
    private static final Logger log = LoggerFactory.getLogger(VisitExecutor.class);

    private final ConcurrentHashMap<String, ScanSession> sessions = new ConcurrentHashMap<>();

    private final ScanClient client;
    private final SpawnCatalog catalog;
    private final SpawnStore store;
    private final AccountManager accounts;
    private final Throttle throttle;
    private final Clock clock;
    private final Duration timeout;
    private final double jitterDegrees;
    private final ExecutorService calls;

    public VisitExecutor(ScanClient client, SpawnCatalog catalog, SpawnStore store, AccountManager accounts, Throttle throttle,
                         Clock clock, EngineSettings settings) {
        this(client, catalog, store, accounts, throttle, clock, settings,
                Executors.newFixedThreadPool(settings.fleetSize(), WorkerPool.threads("spotter-client-")));
    }

    public VisitExecutor(ScanClient client, SpawnCatalog catalog, SpawnStore store, AccountManager accounts, Throttle throttle,
                         Clock clock, EngineSettings settings, ExecutorService calls) {
        this.client = client;
        this.catalog = catalog;
        this.store = store;
        this.accounts = accounts;
        this.throttle = throttle;
        this.clock = clock;
        this.timeout = settings.getVisitTimeout();
        this.jitterDegrees = settings.getPointJitterDegrees();
        this.calls = calls;
    }

    public VisitOutcome visit(Worker worker, VisitTask task) {
        String username = worker.account();
        if (username == null) {
            return VisitOutcome.failure(VisitOutcome.Kind.TRANSIENT, "worker " + worker.workerId() + " has no account");
        }
        if (task.expired(clock.now())) {
            return VisitOutcome.cancelled("deadline passed before visit");
        }
        if (throttle.isEngaged()) {
            return VisitOutcome.failure(VisitOutcome.Kind.THROTTLED, "throttled for " + throttle.remaining());
        }

        GeoPoint target = jitter(task.position());
        ScanResult result;
        Future<ScanResult> call = calls.submit(() -> client.scan(session(worker), target));
        try {
            result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.debug("Visit timed out: worker={} task={} after {}", worker.workerId(), task.taskId(), timeout);
            return VisitOutcome.failure(VisitOutcome.Kind.TRANSIENT, "timeout after " + timeout);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return VisitOutcome.cancelled("interrupted");
        } catch (ExecutionException e) {
            return classify(username, e.getCause());
        }

        if (task.expired(clock.now())) {
            log.debug("Discarding late result: worker={} task={} deadline={}", worker.workerId(), task.taskId(), task.deadline());
            return VisitOutcome.cancelled("deadline passed during visit");
        }
        return record(task, target, result);
    }

    private ScanSession session(Worker worker) throws ScanException {
        ScanSession s = sessions.get(worker.account());
        if (s != null && s.valid()) return s;
        ScanSession fresh = client.login(accountOf(worker));
        sessions.put(worker.account(), fresh);
        log.debug("Logged in {} for worker {}", worker.account(), worker.workerId());
        return fresh;
    }

    private Account accountOf(Worker worker) throws ScanException {
        return accounts.get(worker.account())
                .orElseThrow(() -> new ScanException(ScanException.Failure.TRANSIENT, "unknown account " + worker.account()));
    }

    private VisitOutcome classify(String username, Throwable cause) {
        if (cause instanceof ScanException se) {
            VisitOutcome.Kind kind = switch (se.failure()) {
                case TRANSIENT -> VisitOutcome.Kind.TRANSIENT;
                case CHALLENGED -> VisitOutcome.Kind.CHALLENGED;
                case BANNED -> VisitOutcome.Kind.BANNED;
                case RATE_LIMITED -> VisitOutcome.Kind.RATE_LIMITED;
                case PROTOCOL_ERROR -> VisitOutcome.Kind.PROTOCOL_ERROR;
            };
            if (kind == VisitOutcome.Kind.CHALLENGED || kind == VisitOutcome.Kind.BANNED
                    || kind == VisitOutcome.Kind.PROTOCOL_ERROR) {
                forget(username);
            }
            return VisitOutcome.failure(kind, se.getMessage());
        }
        if (cause instanceof RuntimeException) {
            forget(username);
            log.warn("Unexpected client failure for {}: {}", username, cause.toString());
            return VisitOutcome.failure(VisitOutcome.Kind.PROTOCOL_ERROR, cause.toString());
        }
        return VisitOutcome.failure(VisitOutcome.Kind.TRANSIENT, String.valueOf(cause));
    }

    private VisitOutcome record(VisitTask task, GeoPoint scanned, ScanResult result) {
        Instant at = result.scannedAt() != null ? result.scannedAt() : clock.now();
        boolean targetSeen = false;
        int seen = 0;
        for (ScanResult.Encounter e : result.encounters()) {
            Observation o = Observation.sighting(e.spawnPosition(), at, e.expiresAt(), e.attributes());
            catalog.upsert(o);
            seen++;
            if (o.spawnId().equals(task.spawnId())) targetSeen = true;
            try {
                store.saveSighting(Sighting.of(o));
            } catch (Exception ex) {
                log.warn("Failed to persist sighting at {}: {}", o.spawnId(), ex.toString());
            }
        }
        if (task.kind() == VisitTask.Kind.SPAWN && !targetSeen) {
            catalog.upsert(Observation.miss(task.position(), at));
        }
        catalog.recordScan(scanned, at);
        return VisitOutcome.visited(seen);
    }

    /** 같은 좌표를 반복 요청하지 않도록 살짝 흔든다 */
    private GeoPoint jitter(GeoPoint p) {
        if (jitterDegrees <= 0) return p;
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double lat = clamp(p.lat() + r.nextDouble(-jitterDegrees, jitterDegrees), -90, 90);
        double lon = clamp(p.lon() + r.nextDouble(-jitterDegrees, jitterDegrees), -180, 180);
        return new GeoPoint(lat, lon);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    /** 캐시된 세션 폐기 (계정 교체/밴/챌린지) */
    public void forget(String username) {
        if (username != null && sessions.remove(username) != null) {
            log.debug("Session dropped for {}", username);
        }
    }

    public void shutdown() {
        calls.shutdownNow();
    }
}
