package net.spotter.core.service;

import net.spotter.core.model.Account;
import net.spotter.core.model.VisitOutcome;
import net.spotter.core.model.VisitTask;
import net.spotter.core.model.Worker;
import net.spotter.core.spi.Clock;
import net.spotter.core.spi.HashingQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 방문 결과별 복구 정책. VisitOutcome.Kind 전부를 처리하며,
 * 한 워커의 처리 중 예외가 스케줄러로 새어 나가지 않는다.
 */
public final class FailureRecoveryController {
    private static final Logger log = LoggerFactory.getLogger(FailureRecoveryController.class);

    // 챌린지 해결을 기다리는 계정 → 워커
    private final Map<String, Integer> awaitingResolution = new ConcurrentHashMap<>();

    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong restarts = new AtomicLong();
    private final AtomicLong challenges = new AtomicLong();
    private final AtomicLong bans = new AtomicLong();
    private final AtomicLong throttles = new AtomicLong();

    private final WorkerPool pool;
    private final AccountManager accounts;
    private final Throttle throttle;
    private final HashingQuota quota;
    private final RetryPolicy retry;
    private final Clock clock;
    private final EngineSettings settings;

    private volatile Consumer<VisitTask> retryRunner = task ->
            log.warn("No retry runner installed; dropping retry of task {}", task.taskId());

    public FailureRecoveryController(WorkerPool pool, AccountManager accounts, Throttle throttle, HashingQuota quota,
                                     RetryPolicy retry, Clock clock, EngineSettings settings) {
        this.pool = pool;
        this.accounts = accounts;
        this.throttle = throttle;
        this.quota = quota;
        this.retry = retry;
        this.clock = clock;
        this.settings = settings;
        accounts.onResolved(this::resolved);
    }

    /** 재시도 태스크를 실제로 돌리는 쪽 (스케줄러) */
    public void setRetryRunner(Consumer<VisitTask> retryRunner) {
        this.retryRunner = retryRunner;
    }

    public void onOutcome(int workerId, VisitTask task, VisitOutcome outcome) {
        try {
            switch (outcome.kind()) {
                case VISITED -> visited(workerId, task, outcome);
                case TRANSIENT -> retryOrRestart(workerId, task, outcome, false);
                case PROTOCOL_ERROR -> retryOrRestart(workerId, task, outcome, true);
                case CHALLENGED -> challenged(workerId);
                case BANNED -> banned(workerId);
                case RATE_LIMITED -> rateLimited(workerId, outcome);
                case THROTTLED -> throttled(workerId, task);
                case CANCELLED -> pool.complete(workerId, null);
            }
        } catch (RuntimeException e) {
            log.error("Recovery failed for worker {} (task={}, outcome={})", workerId, task.taskId(), outcome.kind(), e);
        }
    }

    private void visited(int workerId, VisitTask task, VisitOutcome outcome) {
        Instant now = clock.now();
        boolean empty = task.kind() == VisitTask.Kind.SPAWN && outcome.seen() == 0;
        Worker w = pool.updateCounters(workerId, cur -> cur.withCounters(0, 0,
                empty ? cur.consecutiveEmpty() + 1 : 0,
                cur.visits() + 1, cur.seen() + outcome.seen(), now));

        int threshold = settings.getEmptyVisitSwapThreshold();
        if (threshold > 0 && w.consecutiveEmpty() >= threshold) {
            // 스폰 지점에서 연속으로 아무것도 안 보이면 계정이 가려졌을 가능성
            log.warn("Worker {} saw nothing on {} consecutive spawn visits; rotating account {}",
                    workerId, w.consecutiveEmpty(), w.account());
            restart(workerId, now.plus(settings.getAccountCooldown()));
            return;
        }
        pool.complete(workerId, null);
    }

    private void retryOrRestart(int workerId, VisitTask task, VisitOutcome outcome, boolean protocol) {
        Worker w = pool.updateCounters(workerId, cur -> cur.withCounters(
                protocol ? cur.consecutiveTransient() : cur.consecutiveTransient() + 1,
                protocol ? cur.consecutiveProtocol() + 1 : cur.consecutiveProtocol(),
                cur.consecutiveEmpty(), cur.visits(), cur.seen(), cur.lastVisitAt()));
        int count = protocol ? w.consecutiveProtocol() : w.consecutiveTransient();
        int ceiling = protocol ? settings.getProtocolRetryCeiling() : settings.getTransientRetryCeiling();

        if (protocol) {
            log.warn("Protocol error on worker {} ({}/{}): {}", workerId, count, ceiling, outcome.detail());
        } else {
            log.debug("Transient failure on worker {} ({}/{}): {}", workerId, count, ceiling, outcome.detail());
        }

        Instant now = clock.now();
        if (count >= ceiling) {
            log.warn("Worker {} reached {} consecutive {} failures; rotating account {}",
                    workerId, count, protocol ? "protocol" : "transient", w.account());
            restart(workerId, now.plus(settings.getAccountCooldown()));
            return;
        }

        Duration backoff = retry.nextBackoff(count);
        if (now.plus(backoff).isAfter(task.deadline())) {
            log.debug("No time left to retry task {} (deadline {}); worker {} back to idle", task.taskId(), task.deadline(), workerId);
            pool.complete(workerId, null);
            return;
        }

        pool.markRecovering(workerId, task);
        retries.incrementAndGet();
        pool.submit(() -> runRetry(workerId, task), backoff);
    }

    private void runRetry(int workerId, VisitTask task) {
        Instant now = clock.now();
        if (task.expired(now)) {
            pool.complete(workerId, null);
            return;
        }
        VisitTask next = task.nextAttempt(now);
        try {
            pool.resume(workerId, next);
        } catch (IllegalStateException e) {
            // 그 사이 계정 교체 등으로 상태가 바뀜
            log.debug("Retry of task {} abandoned: {}", task.taskId(), e.getMessage());
            return;
        }
        retryRunner.accept(next);
    }

    private void challenged(int workerId) {
        Worker w = pool.get(workerId).orElseThrow();
        String username = w.account();
        challenges.incrementAndGet();
        if (username == null) {
            pool.complete(workerId, null);
            return;
        }
        pool.markRecovering(workerId, null);
        awaitingResolution.put(username, workerId);
        try {
            accounts.markChallenged(username);
        } catch (IllegalStateException e) {
            awaitingResolution.remove(username, workerId);
            log.warn("Challenge on worker {} ignored ({}); rotating account", workerId, e.getMessage());
            restart(workerId, null);
            return;
        }

        Duration swapAfter = settings.getChallengeSwapAfter();
        if (swapAfter != null && !swapAfter.isZero() && !swapAfter.isNegative()) {
            pool.submit(() -> {
                if (awaitingResolution.remove(username, workerId)) {
                    log.info("Challenge for {} still pending after {}; moving worker {} to another account",
                            username, swapAfter, workerId);
                    restart(workerId, null);
                }
            }, swapAfter);
        }
    }

    private void resolved(Account account) {
        Integer workerId = awaitingResolution.remove(account.username());
        if (workerId == null) return;
        log.info("Challenge resolved for {}; rebinding worker {}", account.username(), workerId);
        restart(workerId, null);
    }

    private void banned(int workerId) {
        Worker w = pool.get(workerId).orElseThrow();
        bans.incrementAndGet();
        if (w.account() != null) accounts.markBanned(w.account());
        restart(workerId, null);
    }

    private void rateLimited(int workerId, VisitOutcome outcome) {
        Instant now = clock.now();
        Instant until = now.plus(settings.getRateLimitCooldown());
        try {
            Instant reset = quota.periodResetsAt();
            if (quota.remainingQuota() <= 0 && reset != null && reset.isAfter(now)) {
                until = reset.plusSeconds(1);
            }
        } catch (RuntimeException e) {
            log.warn("Hashing quota lookup failed: {}", e.toString());
        }
        Instant engaged = throttle.engage(until);
        throttles.incrementAndGet();
        log.warn("Rate limited ({}); pausing dispatch until {}", outcome.detail(), engaged);
        pool.complete(workerId, null);
    }

    /** 스로틀은 건드리지 않는다. 창이 풀린 뒤에도 마감 안이면 같은 태스크를 다시 돌린다 */
    private void throttled(int workerId, VisitTask task) {
        Instant now = clock.now();
        Duration wait = throttle.remaining();
        if (now.plus(wait).isAfter(task.deadline())) {
            log.debug("Task {} cannot wait out the throttle ({}); worker {} back to idle", task.taskId(), wait, workerId);
            pool.complete(workerId, null);
            return;
        }
        pool.markRecovering(workerId, task);
        pool.submit(() -> runRetry(workerId, task), wait);
    }

    private void restart(int workerId, Instant cooldownUntil) {
        restarts.incrementAndGet();
        pool.restart(workerId, cooldownUntil);
    }

    public boolean awaitingResolution(int workerId) {
        return awaitingResolution.containsValue(workerId);
    }

    public Map<String, Long> stats() {
        return Map.of(
                "retries", retries.get(),
                "restarts", restarts.get(),
                "challenges", challenges.get(),
                "bans", bans.get(),
                "throttles", throttles.get());
    }
}
