package net.spotter.core.service;

import net.spotter.core.model.DueTarget;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.VisitOutcome;
import net.spotter.core.model.VisitTask;
import net.spotter.core.model.Worker;
import net.spotter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 마감 우선(EDF) 그리디 배정.
 * - 대상마다 required_speed = 거리 / max(eps, deadline - now)
 * - 속도 한도 이하인 유휴 워커 중 최소 required_speed (동률이면 작은 id)
 * - 적격 워커가 없으면 다음 틱으로 미룸 (패널티 없음)
 * - 방문 시작 = max(창 시작, now + 거리 / 속도 한도)
 * 틱은 락으로 직렬화된다.
 */
public final class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicBoolean tickRequested = new AtomicBoolean(false);
    private final ExecutorService trigger = Executors.newSingleThreadExecutor(WorkerPool.threads("spotter-trigger-"));

    // 배정되었으나 아직 결과가 나오지 않은 태스크 (억제 판정용)
    private final Map<Long, VisitTask> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong paused = new AtomicLong();
    private final AtomicLong assigned = new AtomicLong();
    private final AtomicLong visits = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong redundant = new AtomicLong();
    private final AtomicLong deferred = new AtomicLong();
    private final AtomicLong explorations = new AtomicLong();
    private final AtomicLong spawnVisitDelayMs = new AtomicLong();
    private final AtomicLong spawnVisitsTimed = new AtomicLong();

    private final SpawnCatalog catalog;
    private final WorkerPool pool;
    private final VisitExecutor executor;
    private final FailureRecoveryController recovery;
    private final AccountManager accounts;
    private final Throttle throttle;
    private final Clock clock;
    private final EngineSettings settings;

    public Scheduler(SpawnCatalog catalog, WorkerPool pool, VisitExecutor executor, FailureRecoveryController recovery,
                     AccountManager accounts, Throttle throttle, Clock clock, EngineSettings settings) {
        this.catalog = catalog;
        this.pool = pool;
        this.executor = executor;
        this.recovery = recovery;
        this.accounts = accounts;
        this.throttle = throttle;
        this.clock = clock;
        this.settings = settings;
    }

    /** 한 번의 스케줄 사이클. 배정한 태스크 수를 돌려준다 */
    public int tick() {
        tickLock.lock();
        try {
            cycles.incrementAndGet();
            if (throttle.isEngaged()) {
                paused.incrementAndGet();
                log.debug("Dispatch paused by throttle for {}", throttle.remaining());
                return 0;
            }
            int pending = accounts.pendingChallenges();
            if (pending > settings.getMaxPendingChallenges()) {
                paused.incrementAndGet();
                log.warn("Dispatch paused: {} challenges pending (max {})", pending, settings.getMaxPendingChallenges());
                return 0;
            }
            Instant now = clock.now();
            List<VisitTask> planned = plan(now);
            int dispatched = 0;
            for (VisitTask t : planned) {
                if (dispatch(t, now)) dispatched++;
            }
            if (dispatched > 0) log.debug("Tick dispatched {} tasks", dispatched);
            return dispatched;
        } finally {
            tickLock.unlock();
        }
    }

    /** 워커가 유휴가 되면 즉시 한 번 더 돌린다. 여러 요청은 하나로 합친다 */
    public void requestTick() {
        if (!tickRequested.compareAndSet(false, true)) return;
        try {
            trigger.execute(() -> {
                tickRequested.set(false);
                try {
                    tick();
                } catch (RuntimeException e) {
                    log.error("Opportunistic tick failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            tickRequested.set(false);
            log.debug("Tick request ignored: trigger stopped");
        }
    }

    /**
     * 이번 사이클의 배정안. 워커와 카탈로그는 건드리지 않는다 (통계만 센다).
     * 반환되는 태스크는 모두 deadline ≥ now 이고 워커 속도 한도를 넘지 않는다.
     */
    public List<VisitTask> plan(Instant now) {
        List<Worker> idle = new ArrayList<>(pool.idleWorkers());
        List<VisitTask> out = new ArrayList<>();
        if (idle.isEmpty()) return out;

        List<VisitTask> claimed = new ArrayList<>(inFlight.values());
        Set<String> claimedIds = new HashSet<>();
        for (VisitTask t : claimed) {
            if (t.spawnId() != null) claimedIds.add(t.spawnId());
        }
        double eps = settings.getMinDeadlineSlack().toMillis() / 1000.0;

        for (DueTarget d : catalog.dueTargets(settings.getScanHorizon())) {
            if (idle.isEmpty()) break;
            if (d.deadline().isBefore(now)) {
                skipped.incrementAndGet();
                continue;
            }
            if (claimedIds.contains(d.spawnId()) || suppressed(d.position(), d.deadline(), claimed)) {
                redundant.incrementAndGet();
                continue;
            }
            Worker best = null;
            double bestSpeed = Double.MAX_VALUE;
            for (Worker w : idle) {
                double speed = requiredSpeed(w.position(), d.position(), d.deadline(), now, eps);
                if (speed <= w.speedLimit() && speed < bestSpeed) {
                    best = w;
                    bestSpeed = speed;
                }
            }
            if (best == null) {
                deferred.incrementAndGet();
                continue;
            }
            Instant start = later(d.windowStart(), arrival(best, d.position(), now));
            VisitTask t = VisitTask.create(VisitTask.Kind.SPAWN, d.spawnId(), d.position(), best.workerId(),
                    start, d.deadline(), now);
            out.add(t);
            claimed.add(t);
            claimedIds.add(d.spawnId());
            idle.remove(best);
        }

        if (!idle.isEmpty()) planExploration(now, idle, out, eps);
        return out;
    }

    /** 우선순위 순서(미스터리 → 오래 안 훑은 셀)에서 도달 가능한 앞쪽 후보들 중 가장 가까운 곳 */
    private void planExploration(Instant now, List<Worker> idle, List<VisitTask> out, double eps) {
        List<GeoPoint> candidates = new ArrayList<>();
        for (GeoPoint c : catalog.explorationTargets(settings.getRegion())) candidates.add(c);
        Instant deadline = now.plus(settings.getExplorationDeadline());
        int window = settings.getExplorationCandidates();
        for (Worker w : idle) {
            GeoPoint best = null;
            double bestSpeed = Double.MAX_VALUE;
            int considered = 0;
            for (GeoPoint c : candidates) {
                double speed = requiredSpeed(w.position(), c, deadline, now, eps);
                if (speed > w.speedLimit()) continue;
                if (speed < bestSpeed) {
                    best = c;
                    bestSpeed = speed;
                }
                if (++considered >= window) break;
            }
            if (best == null) continue;
            candidates.remove(best);
            out.add(VisitTask.create(VisitTask.Kind.EXPLORATION, null, best, w.workerId(),
                    arrival(w, best, now), deadline, now));
        }
    }

    static double requiredSpeed(GeoPoint from, GeoPoint to, Instant deadline, Instant now, double epsSeconds) {
        double seconds = Duration.between(now, deadline).toMillis() / 1000.0;
        return from.distanceTo(to) / Math.max(epsSeconds, seconds);
    }

    /** 속도 한도로 이동했을 때 도착 시각. 방문은 이보다 앞설 수 없다 */
    static Instant arrival(Worker w, GeoPoint target, Instant now) {
        double seconds = w.position().distanceTo(target) / w.speedLimit();
        return now.plusMillis((long) Math.ceil(seconds * 1000));
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    /** 이미 잡힌 스폰 태스크 근처(반경)이고 마감도 비슷하면 한 번의 방문으로 충분하다 */
    private boolean suppressed(GeoPoint p, Instant deadline, List<VisitTask> claimed) {
        double radius = settings.getSuppressionRadiusMeters();
        if (radius <= 0) return false;
        long windowMs = settings.getSuppressionWindow().toMillis();
        for (VisitTask t : claimed) {
            if (t.kind() != VisitTask.Kind.SPAWN) continue;
            if (Math.abs(Duration.between(t.deadline(), deadline).toMillis()) > windowMs) continue;
            if (t.position().distanceTo(p) <= radius) return true;
        }
        return false;
    }

    private boolean dispatch(VisitTask task, Instant now) {
        Worker w = pool.get(task.workerId()).orElse(null);
        if (w == null) return false;
        try {
            pool.assign(w, task);
        } catch (IllegalStateException e) {
            log.debug("Skipping stale assignment: {}", e.getMessage());
            return false;
        }
        inFlight.put(task.taskId(), task);
        assigned.incrementAndGet();
        if (task.kind() == VisitTask.Kind.EXPLORATION) explorations.incrementAndGet();
        log.debug("Assigned {} task {} -> worker {} (start {}, deadline {})",
                task.kind(), task.spawnId() != null ? task.spawnId() : task.position(), w.workerId(),
                task.scheduledAt(), task.deadline());
        pool.submit(() -> runTask(task), Duration.between(now, task.scheduledAt()));
        return true;
    }

    /** 워커 실행기 스레드에서 돈다. 재시도도 같은 경로를 탄다 */
    public void runTask(VisitTask task) {
        int workerId = task.workerId();
        inFlight.put(task.taskId(), task);
        VisitOutcome outcome;
        try {
            Instant now = clock.now();
            if (task.expired(now)) {
                outcome = VisitOutcome.cancelled("deadline passed before start");
            } else {
                Worker w = pool.beginVisit(workerId, task);
                outcome = executor.visit(w, task);
            }
        } catch (RuntimeException e) {
            log.warn("Visit of task {} on worker {} failed unexpectedly: {}", task.taskId(), workerId, e.toString());
            outcome = VisitOutcome.failure(VisitOutcome.Kind.TRANSIENT, e.toString());
        } finally {
            inFlight.remove(task.taskId());
        }
        if (outcome.success()) {
            visits.incrementAndGet();
            if (task.kind() == VisitTask.Kind.SPAWN) {
                spawnVisitsTimed.incrementAndGet();
                long delay = Duration.between(task.scheduledAt(), clock.now()).toMillis();
                spawnVisitDelayMs.addAndGet(Math.max(0, delay));
            }
        } else if (outcome.kind() == VisitOutcome.Kind.CANCELLED) {
            skipped.incrementAndGet();
        }
        recovery.onOutcome(workerId, task, outcome);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public Map<String, Long> stats() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("cycles", cycles.get());
        m.put("paused", paused.get());
        m.put("assigned", assigned.get());
        m.put("visits", visits.get());
        m.put("explorations", explorations.get());
        m.put("skipped", skipped.get());
        m.put("redundant", redundant.get());
        m.put("deferred", deferred.get());
        long timed = spawnVisitsTimed.get();
        m.put("avgSpawnDelayMs", timed == 0 ? 0 : spawnVisitDelayMs.get() / timed);
        return m;
    }

    public void shutdown() {
        trigger.shutdownNow();
        try {
            if (!trigger.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Tick trigger did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
