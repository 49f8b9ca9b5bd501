package net.spotter.core.service;

import net.spotter.core.model.Account;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Region;
import net.spotter.core.model.VisitTask;
import net.spotter.core.model.Worker;
import net.spotter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * 고정 크기 워커 함대. 워커 상태 전이는 워커별 compute 로 직렬화.
 * 워커 태스크와 백오프 타이머는 함대 크기의 스케줄 풀 하나에서 돈다.
 */
public final class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ConcurrentHashMap<Integer, Worker> workers = new ConcurrentHashMap<>();
    private final List<Consumer<Worker>> idleListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> detachListeners = new CopyOnWriteArrayList<>();

    private final AccountManager accounts;
    private final EngineSettings settings;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    public WorkerPool(AccountManager accounts, EngineSettings settings, Clock clock) {
        this(accounts, settings, clock, Executors.newScheduledThreadPool(settings.fleetSize(), threads("spotter-worker-")));
    }

    public WorkerPool(AccountManager accounts, EngineSettings settings, Clock clock, ScheduledExecutorService executor) {
        this.accounts = accounts;
        this.settings = settings;
        this.clock = clock;
        this.executor = executor;
    }

    static ThreadFactory threads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** 격자 시작 위치에 워커를 만들고 계정을 바인딩한다 */
    public void start() {
        Region region = settings.getRegion();
        Instant now = clock.now();
        for (int i = 0; i < settings.fleetSize(); i++) {
            GeoPoint start = region.startPosition(i, settings.getGridRows(), settings.getGridCols());
            Worker w = Worker.ofNew(i, start, settings.getSpeedLimit(), now);
            workers.put(i, bind(w, now, true));
        }
        log.info("Worker pool started: {} workers ({})", workers.size(), stats());
    }

    private Worker bind(Worker w, Instant now, boolean resumeAtAccountPosition) {
        try {
            Account a = accounts.acquire(w.workerId());
            Worker bound = w.withAccount(a.username(), Worker.Status.IDLE, now);
            // 계정이 마지막으로 있던 곳에서 이어 간다
            return resumeAtAccountPosition && a.lastPosition() != null ? bound.movedTo(a.lastPosition()) : bound;
        } catch (NoAccountAvailableException e) {
            log.warn("Worker {} retired: {}", w.workerId(), e.getMessage());
            return w.withAccount(null, Worker.Status.RETIRED, now);
        }
    }

    /** 할당 가능한 워커. HEALTHY 계정을 쥔 IDLE 워커, id 순 */
    public List<Worker> idleWorkers() {
        List<Worker> out = new ArrayList<>();
        for (Worker w : workers.values()) {
            if (w.status() != Worker.Status.IDLE || w.busy() || w.account() == null) continue;
            boolean healthy = accounts.get(w.account())
                    .map(a -> a.state() == Account.State.HEALTHY)
                    .orElse(false);
            if (healthy) out.add(w);
        }
        out.sort(Comparator.comparingInt(Worker::workerId));
        return out;
    }

    /** IDLE → TRAVELING. 이미 태스크를 가진 워커면 IllegalStateException */
    public Worker assign(Worker worker, VisitTask task) {
        return update(worker.workerId(), w -> {
            if (w.status() != Worker.Status.IDLE || w.busy()) {
                throw new IllegalStateException("worker " + w.workerId() + " is not idle: " + w.status() + " task=" + w.taskId());
            }
            return w.withStatus(Worker.Status.TRAVELING, task.deadline(), task.taskId());
        });
    }

    public Worker beginVisit(int workerId, VisitTask task) {
        return update(workerId, w -> {
            if (w.taskId() == null || w.taskId() != task.taskId()) {
                throw new IllegalStateException("worker " + workerId + " does not hold task " + task.taskId());
            }
            return w.withStatus(Worker.Status.VISITING, task.deadline(), task.taskId()).movedTo(task.position());
        });
    }

    /** 태스크 종료 → IDLE (계정이 없으면 RETIRED). 카운터 갱신을 같은 전이에서 적용 */
    public Worker complete(int workerId, UnaryOperator<Worker> counters) {
        Worker done = update(workerId, w -> {
            Worker c = counters == null ? w : counters.apply(w);
            Worker.Status next = c.account() == null ? Worker.Status.RETIRED : Worker.Status.IDLE;
            return c.withStatus(next, null, null);
        });
        if (done.status() == Worker.Status.IDLE) fireIdle(done);
        return done;
    }

    /** retained 가 null 이 아니면 재시도 대기 중인 태스크를 계속 쥐고 있는다 */
    public Worker markRecovering(int workerId, VisitTask retained) {
        return update(workerId, w -> retained == null
                ? w.withStatus(Worker.Status.RECOVERING, null, null)
                : w.withStatus(Worker.Status.RECOVERING, retained.deadline(), retained.taskId()));
    }

    /** 재시도: RECOVERING → TRAVELING */
    public Worker resume(int workerId, VisitTask task) {
        return update(workerId, w -> {
            if (w.status() != Worker.Status.RECOVERING) {
                throw new IllegalStateException("worker " + workerId + " is not recovering: " + w.status());
            }
            return w.withStatus(Worker.Status.TRAVELING, task.deadline(), task.taskId());
        });
    }

    public Worker updateCounters(int workerId, UnaryOperator<Worker> counters) {
        return update(workerId, counters);
    }

    /**
     * 계정 교체. 현재 계정을 반납하고(밴/캡차 계정은 그 상태 그대로 풀에 남는다)
     * 새 계정을 받는다. 위치는 유지. 새 계정이 없으면 RETIRED.
     * @param cooldownUntil null 이 아니면 반납 전에 HEALTHY 계정을 쿨다운에 넣는다
     */
    public Worker restart(int workerId, Instant cooldownUntil) {
        Worker w = require(workerId);
        String old = w.account();
        if (old != null) {
            for (Consumer<String> l : detachListeners) {
                try {
                    l.accept(old);
                } catch (RuntimeException e) {
                    log.warn("Detach listener failed for {}: {}", old, e.toString());
                }
            }
            if (cooldownUntil != null && coolable(old)) accounts.markCooldown(old, cooldownUntil);
            accounts.release(old, w.position());
        }
        Instant now = clock.now();
        Worker restarted = update(workerId, cur -> bind(cur, now, false));
        log.info("Worker {} restarted: {} -> {} ({})", workerId, old, restarted.account(), restarted.status());
        if (restarted.status() == Worker.Status.IDLE) fireIdle(restarted);
        return restarted;
    }

    private boolean coolable(String username) {
        return accounts.get(username)
                .map(a -> a.state() == Account.State.HEALTHY || a.state() == Account.State.COOLDOWN)
                .orElse(false);
    }

    /**
     * 태스크 없는 IDLE 워커만 교체한다. 판정과 선점이 같은 전이 안에서 일어나므로
     * 그 사이 배정된 워커는 건드리지 않는다.
     */
    public Optional<Worker> restartIfIdle(int workerId, Instant cooldownUntil) {
        boolean[] claimed = {false};
        update(workerId, w -> {
            if (w.status() != Worker.Status.IDLE || w.busy()) return w;
            claimed[0] = true;
            return w.withStatus(Worker.Status.RECOVERING, null, null);
        });
        if (!claimed[0]) return Optional.empty();
        return Optional.of(restart(workerId, cooldownUntil));
    }

    /** RETIRED 워커에 계정 재발급 시도. 되살아난 수를 돌려준다 */
    public int reviveRetired() {
        int revived = 0;
        for (Worker w : snapshot()) {
            if (w.status() != Worker.Status.RETIRED) continue;
            if (accounts.spareCount() == 0) break;
            Instant now = clock.now();
            Worker r = update(w.workerId(), cur -> cur.status() == Worker.Status.RETIRED ? bind(cur, now, false) : cur);
            if (r.status() == Worker.Status.IDLE) {
                revived++;
                fireIdle(r);
            }
        }
        if (revived > 0) log.info("Revived {} retired workers", revived);
        return revived;
    }

    /** 워커 실행기에 태스크 제출. 예외는 로그만 남기고 풀을 죽이지 않는다 */
    public ScheduledFuture<?> submit(Runnable body, Duration delay) {
        long ms = delay == null || delay.isNegative() ? 0 : delay.toMillis();
        return executor.schedule(() -> {
            try {
                body.run();
            } catch (Throwable t) {
                log.error("Worker task failed", t);
            }
        }, ms, TimeUnit.MILLISECONDS);
    }

    private Worker update(int workerId, UnaryOperator<Worker> fn) {
        Worker updated = workers.computeIfPresent(workerId, (id, w) -> fn.apply(w));
        if (updated == null) throw new IllegalArgumentException("unknown worker: " + workerId);
        return updated;
    }

    private Worker require(int workerId) {
        Worker w = workers.get(workerId);
        if (w == null) throw new IllegalArgumentException("unknown worker: " + workerId);
        return w;
    }

    private void fireIdle(Worker w) {
        for (Consumer<Worker> l : idleListeners) {
            try {
                l.accept(w);
            } catch (RuntimeException e) {
                log.warn("Idle listener failed for worker {}: {}", w.workerId(), e.toString());
            }
        }
    }

    public void onIdle(Consumer<Worker> listener) {
        idleListeners.add(listener);
    }

    /** 워커에서 계정이 떨어질 때 (세션 정리용) */
    public void onAccountDetached(Consumer<String> listener) {
        detachListeners.add(listener);
    }

    public Optional<Worker> get(int workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    public List<Worker> snapshot() {
        List<Worker> out = new ArrayList<>(workers.values());
        out.sort(Comparator.comparingInt(Worker::workerId));
        return out;
    }

    public Map<Worker.Status, Long> stats() {
        Map<Worker.Status, Long> m = new EnumMap<>(Worker.Status.class);
        for (Worker w : workers.values()) m.merge(w.status(), 1L, Long::sum);
        return m;
    }

    /** 실행기 정지 후 계정 반납 */
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker executor did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (Worker w : snapshot()) {
            if (w.account() == null) continue;
            try {
                accounts.release(w.account(), w.position());
            } catch (RuntimeException e) {
                log.warn("Failed to release account {} on shutdown: {}", w.account(), e.toString());
            }
        }
        log.info("Worker pool stopped");
    }
}
