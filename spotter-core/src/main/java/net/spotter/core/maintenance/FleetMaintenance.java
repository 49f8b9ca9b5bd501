package net.spotter.core.maintenance;

import net.spotter.core.model.Confidence;
import net.spotter.core.model.Worker;
import net.spotter.core.service.AccountManager;
import net.spotter.core.service.EngineSettings;
import net.spotter.core.service.Scheduler;
import net.spotter.core.service.SpawnCatalog;
import net.spotter.core.service.Throttle;
import net.spotter.core.service.WorkerPool;
import net.spotter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

public final class FleetMaintenance {
    private static final Logger log = LoggerFactory.getLogger(FleetMaintenance.class);

    private final SpawnCatalog catalog;
    private final AccountManager accounts;
    private final WorkerPool pool;
    private final Scheduler scheduler;
    private final Throttle throttle;
    private final Clock clock;
    private final EngineSettings settings;

    private volatile Instant lastSwap;

    public FleetMaintenance(SpawnCatalog catalog,
                            AccountManager accounts,
                            WorkerPool pool,
                            Scheduler scheduler,
                            Throttle throttle,
                            Clock clock,
                            EngineSettings settings) {
        this.catalog = catalog;
        this.accounts = accounts;
        this.pool = pool;
        this.scheduler = scheduler;
        this.throttle = throttle;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 만료된 쿨다운 해제
     * - RETIRED 워커 되살리기
     * - 가장 덜 생산적인 워커 계정 교체 (여분 계정이 있을 때, swapInterval 마다)
     * - 오래 안 보인 스폰 지점 stale 표시
     * - 함대 상태 로그
     */
    public MaintenanceReport runOnce() {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        // 1) 쿨다운 해제
        r.cooldownsExpired = accounts.expireCooldowns();

        // 2) 계정 없는 워커 재가동
        r.workersRevived = pool.reviveRetired();

        // 3) least productive 교체
        r.swappedWorker = swapLeastProductive(now);

        // 4) stale 표시
        r.markedStale = catalog.markStale(now.minus(settings.getStaleAfter()));

        r.timestamp = now;
        logStatus(r);
        return r;
    }

    private Integer swapLeastProductive(Instant now) {
        Duration interval = settings.getSwapInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) return null;
        if (lastSwap == null) {
            lastSwap = now;
            return null;
        }
        if (now.isBefore(lastSwap.plus(interval))) return null;
        if (accounts.spareCount() == 0) return null;

        Optional<Worker> worst = pool.snapshot().stream()
                .filter(w -> w.status() == Worker.Status.IDLE && !w.busy() && w.account() != null)
                .filter(w -> w.startedAt() != null && !w.startedAt().plus(interval).isAfter(now))
                .min(Comparator.comparingDouble((Worker w) -> w.seenPerMinute(now)).thenComparingInt(Worker::workerId));
        if (worst.isEmpty()) return null;

        Worker w = worst.get();
        if (pool.restartIfIdle(w.workerId(), null).isEmpty()) {
            log.debug("Worker {} picked up a task before the swap; retrying next run", w.workerId());
            return null;
        }
        log.info("Swapped least productive worker {} ({} seen/min on {})",
                w.workerId(), String.format("%.2f", w.seenPerMinute(now)), w.account());
        lastSwap = now;
        return w.workerId();
    }

    private void logStatus(MaintenanceReport r) {
        Map<String, Long> s = scheduler.stats();
        Map<Confidence, Long> c = catalog.counts();
        long known = c.getOrDefault(Confidence.CONFIRMED, 0L) + c.getOrDefault(Confidence.ESTIMATED, 0L);
        long mystery = c.getOrDefault(Confidence.NONE, 0L);
        log.info("Fleet: workers={} visits={} skipped={} redundant={} deferred={} | spawns known={} mystery={} stale={}"
                        + " | spare accounts={} challenges pending={} | throttled={} | {}",
                pool.stats(), s.get("visits"), s.get("skipped"), s.get("redundant"), s.get("deferred"),
                known, mystery, catalog.staleCount(),
                accounts.spareCount(), accounts.pendingChallenges(),
                throttle.isEngaged() ? throttle.remaining() : "no", r);
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int cooldownsExpired;
        public int workersRevived;
        public Integer swappedWorker;
        public int markedStale;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", cooldownsExpired=" + cooldownsExpired +
                    ", workersRevived=" + workersRevived +
                    ", swappedWorker=" + swappedWorker +
                    ", markedStale=" + markedStale +
                    '}';
        }
    }
}
