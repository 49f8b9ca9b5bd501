package net.spotter.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

public final class Orchestrator {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final SpawnCatalog catalog;
    private final AccountManager accounts;
    private final WorkerPool pool;
    private final VisitExecutor executor;
    private final FailureRecoveryController recovery;
    private final Scheduler scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public Orchestrator(SpawnCatalog catalog, AccountManager accounts, WorkerPool pool, VisitExecutor executor,
                        FailureRecoveryController recovery, Scheduler scheduler) {
        this.catalog = catalog;
        this.accounts = accounts;
        this.pool = pool;
        this.executor = executor;
        this.recovery = recovery;
        this.scheduler = scheduler;
    }

    /** 기동: (1) 카탈로그/계정 적재 (2) 리스너 연결 (3) 워커 함대 시작 */
    public void start() throws Exception {
        if (!started.compareAndSet(false, true)) return;
        catalog.load();
        accounts.load();
        if (accounts.size() == 0) {
            throw new IllegalStateException("no accounts registered; refusing to start the worker pool");
        }
        recovery.setRetryRunner(scheduler::runTask);
        pool.onIdle(w -> scheduler.requestTick());
        pool.onAccountDetached(executor::forget);
        pool.start();
        log.info("Spotter engine started: {} spawn points, {} accounts, {} workers",
                catalog.size(), accounts.size(), pool.snapshot().size());
    }

    /** 한 번의 틱: 유휴 워커에 방문 배정 */
    public int tick() {
        if (!started.get()) return 0;
        return scheduler.tick();
    }

    public boolean isStarted() {
        return started.get();
    }

    public void shutdown() {
        if (!started.compareAndSet(true, false)) return;
        scheduler.shutdown();
        pool.shutdown();
        executor.shutdown();
        log.info("Spotter engine stopped ({})", scheduler.stats());
    }
}
